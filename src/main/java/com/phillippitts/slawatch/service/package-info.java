/**
 * Service layer containing response-time monitoring and telemetry shipping.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.metrics} - Response-time collection, SLA evaluation, Micrometer meters</li>
 *   <li>{@code service.telemetry} - Resilient shipping: client, circuit breaker, retry, resync</li>
 *   <li>{@code service.backlog} - Durable local fallback store</li>
 *   <li>{@code service.ingest} - Remote ingestion transport</li>
 *   <li>{@code service.alert} - Operator alert log</li>
 *   <li>{@code service.health} - Actuator health and startup verification</li>
 * </ul>
 *
 * <p>Data flows one way for writes (collector → client → remote or backlog) and one way for
 * recovery (backlog → client → remote).
 *
 * @since 1.0
 */
package com.phillippitts.slawatch.service;
