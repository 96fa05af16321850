/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Structured logging uses Log4j2 with MDC for request correlation across the asynchronous
 * telemetry pipeline: the telemetry executor and scheduler copy the submitting thread's
 * ThreadContext to their workers.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code userId} - Caller identity from {@code X-User-ID}, when present</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [telemetry-3] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.slawatch.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.slawatch.config.logging;
