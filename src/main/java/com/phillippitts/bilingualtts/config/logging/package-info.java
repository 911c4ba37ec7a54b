/**
 * Logging infrastructure: MDC population for request correlation.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by {@link com.phillippitts.bilingualtts.config.logging.MdcFilter}</li>
 *   <li>{@code sessionId} - per pipeline run, set by the orchestrator for the lifetime of a workspace</li>
 * </ul>
 *
 * <p>Both keys are carried into worker threads by the executors' task decorator.
 */
package com.phillippitts.bilingualtts.config.logging;
