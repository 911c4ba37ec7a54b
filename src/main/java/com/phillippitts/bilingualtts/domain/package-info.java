/**
 * Domain models of a single synthesis request.
 *
 * <p>All types are immutable records that validate themselves on construction and live only
 * for the duration of one request:
 * <ul>
 *   <li>{@link com.phillippitts.bilingualtts.domain.TextSpan} - one input line with its position</li>
 *   <li>{@link com.phillippitts.bilingualtts.domain.Segment} - synthesis unit with one resolved
 *       {@link com.phillippitts.bilingualtts.domain.LanguageTag}; its index tuple defines reading order</li>
 *   <li>{@link com.phillippitts.bilingualtts.domain.VoiceProfile} - language to voice-id mapping</li>
 *   <li>{@link com.phillippitts.bilingualtts.domain.AudioArtifact} - encoded audio for one segment</li>
 *   <li>{@link com.phillippitts.bilingualtts.domain.PipelineResult} - final concatenated audio</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.bilingualtts.domain;
