/**
 * Executor factories with named threads for SENTINEL workers, pumps and schedulers.
 */
package ca.gc.cra.sentinel.infrastructure.exec;
