/**
 * System clock adapter implementing {@link ca.gc.cra.sentinel.application.port.ClockPort}.
 */
package ca.gc.cra.sentinel.infrastructure.time;
