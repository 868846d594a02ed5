/** Parsed capture documents. */
package ca.gc.cra.sentinel.domain.capture;
