/**
 * Application-wide configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - segmentation, pipeline, voice, workspace and thread pool settings</li>
 *   <li>{@code config.synthesis} - synthesis backend settings</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.bilingualtts.config;
