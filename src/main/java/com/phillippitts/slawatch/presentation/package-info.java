/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on services but not vice versa. Controllers are thin adapters;
 * exception handlers map domain exceptions to HTTP status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.slawatch.presentation;
