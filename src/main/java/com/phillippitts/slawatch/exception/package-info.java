/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.slawatch.exception.SlaWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.slawatch.exception.IngestException} - Remote ingestion
 *       failure, classified by kind (network, server, rate limit, auth, validation)</li>
 *   <li>{@link com.phillippitts.slawatch.exception.LocalStorageException} - Backlog file
 *       could not be written or read; always reported loudly</li>
 *   <li>{@link com.phillippitts.slawatch.exception.InvalidMeasurementException} - Rejected
 *       response-time input</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining and map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.slawatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.slawatch.exception;
