/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.slawatch.config.TelemetryConfig} - Explicit wiring of the
 *       breaker, retry policy, backlog, ingestion client and telemetry client</li>
 *   <li>{@link com.phillippitts.slawatch.config.ThreadPoolConfig} - Delivery executor and
 *       backoff/resync scheduler</li>
 *   <li>{@link com.phillippitts.slawatch.config.ThreadPoolMetricsConfig} - Pool and backlog gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.slawatch.config;
