/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.bilingualtts.exception.InvalidInputException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.NoSegmentsException} → 422 Unprocessable Entity</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.SynthesisException} and subtypes → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.AssemblyException},
 *       {@link com.phillippitts.bilingualtts.exception.WorkspaceException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidInputException",
 *   "message": "Invalid input",
 *   "details": "empty text provided",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.bilingualtts.presentation.exception;
