/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.bilingualtts.exception.BilingualTtsException}:
 * <ul>
 *   <li>{@link com.phillippitts.bilingualtts.exception.InvalidInputException} - blank text,
 *       unknown voice gender, empty segment</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.NoSegmentsException} - segmentation
 *       produced nothing to synthesize</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.SynthesisException} - one segment failed;
 *       subtypes for timeout, backend error, empty output and "all segments failed"</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.AssemblyException} - final concatenation
 *       failed or received no artifacts</li>
 *   <li>{@link com.phillippitts.bilingualtts.exception.WorkspaceException} - no scratch
 *       directory could be created</li>
 * </ul>
 *
 * <p>HTTP mapping lives in
 * {@link com.phillippitts.bilingualtts.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.bilingualtts.exception;
