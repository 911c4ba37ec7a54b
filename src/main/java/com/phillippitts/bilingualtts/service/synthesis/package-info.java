/**
 * Speech synthesis of single segments.
 *
 * <p>{@link com.phillippitts.bilingualtts.service.synthesis.SynthesisClient} is the backend contract;
 * {@link com.phillippitts.bilingualtts.service.synthesis.SegmentSynthesizer} binds a segment to its
 * voice, bounds the call with a timeout and stores the result in the run's workspace.
 */
package com.phillippitts.bilingualtts.service.synthesis;
