/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so the action worker and the
 * REST boundary can handle them uniformly.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.radflow.exception.RadFlowException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.radflow.exception.ProbeException} - A read probe against an
 *       external application failed; the reading is treated as unknown for that cycle</li>
 *   <li>{@link com.phillippitts.radflow.exception.ActionExecutionException} - An action body
 *       failed; caught at the worker loop boundary and surfaced as a toast</li>
 *   <li>{@link com.phillippitts.radflow.exception.InvalidReferenceException} - A configured
 *       cross-reference points at a missing or disabled target; reported with a blocking notice</li>
 * </ul>
 *
 * <p>Nothing in this hierarchy is fatal to the process. REST mappings live in
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.radflow.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.radflow.exception;
