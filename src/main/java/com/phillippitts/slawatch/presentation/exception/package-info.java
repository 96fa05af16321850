/**
 * Translates domain exceptions into HTTP responses with a stable error body.
 */
package com.phillippitts.slawatch.presentation.exception;
