/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code bridge} - Name of the calling scraper or device bridge, when it identifies itself</li>
 *   <li>{@code action}, {@code source} - Set by the action worker while an action runs</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [action-worker] [requestId] [PROCESS_REPORT] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.radflow.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.radflow.config.logging;
