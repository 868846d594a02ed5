/**
 * Ports implemented by infrastructure adapters: metrics, clock, event sinks, archival, and stream transports.
 */
package ca.gc.cra.sentinel.application.port;
