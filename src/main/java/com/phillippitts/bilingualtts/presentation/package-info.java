/**
 * Presentation layer: the {@code POST /tts} adapter and HTTP error mapping.
 *
 * <p>Controllers are thin adapters; they delegate to
 * {@link com.phillippitts.bilingualtts.service.SpeechSynthesisService} and let domain exceptions
 * propagate to {@code GlobalExceptionHandler}.
 */
package com.phillippitts.bilingualtts.presentation;
