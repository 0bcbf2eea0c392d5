/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/actions} - enqueue a bindable action</li>
 *   <li>{@code POST /api/pick-lists/selection} - insert a picked pick-list item</li>
 *   <li>{@code GET /api/status} - case, dictation and queue state</li>
 *   <li>{@code GET /api/study-events} - recent terminal case notifications</li>
 *   <li>{@code PUT /api/oracle/*} - scraper readings</li>
 *   <li>{@code POST /api/device/*} - microphone button events</li>
 * </ul>
 */
package com.phillippitts.radflow.presentation.controller;
