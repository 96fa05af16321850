/**
 * Immutable domain model: telemetry events, backlog records and delivery outcomes.
 */
package com.phillippitts.slawatch.domain;
