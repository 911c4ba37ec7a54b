/**
 * Application services. {@link com.phillippitts.bilingualtts.service.SpeechSynthesisService} is the
 * single exposed operation; sub-packages hold the text, synthesis, pipeline and workspace layers.
 */
package com.phillippitts.bilingualtts.service;
