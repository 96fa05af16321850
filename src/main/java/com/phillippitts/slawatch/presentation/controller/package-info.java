/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/response-times} - record a response time (202 Accepted)</li>
 *   <li>{@code GET /api/response-times/averages} - mean response time per channel</li>
 *   <li>{@code GET /api/telemetry/health} - probe the ingestion backend</li>
 *   <li>{@code POST /api/telemetry/resync} - run a backlog resync cycle now</li>
 * </ul>
 *
 * @see com.phillippitts.slawatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.slawatch.presentation.controller;
