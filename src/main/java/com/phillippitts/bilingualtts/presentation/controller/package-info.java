/**
 * REST controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /tts} - synthesize mixed Chinese/English text into {@code audio/mpeg}</li>
 * </ul>
 */
package com.phillippitts.bilingualtts.presentation.controller;
