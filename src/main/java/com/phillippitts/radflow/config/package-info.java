/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.radflow.config.ThreadPoolConfig} - Task scheduler and cue executor</li>
 *   <li>{@link com.phillippitts.radflow.config.OrchestrationConfig} - Clock and pause beans</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed configuration properties, mutable at runtime by a settings surface</li>
 *   <li>{@code config.hotkey} - Startup validation of hotkey bindings</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.radflow.config;
