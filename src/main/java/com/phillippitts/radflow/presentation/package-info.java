/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - action intake, status, and the scraper/device bridge</li>
 *   <li>{@code presentation.dto} - request bodies</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they enqueue actions or publish events and never touch
 * the external applications themselves.
 *
 * @see com.phillippitts.radflow.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.radflow.presentation;
