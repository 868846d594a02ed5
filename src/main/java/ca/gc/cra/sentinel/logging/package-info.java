/**
 * Logging helpers for SENTINEL: verbosity control for CLI runs and payload hygiene for log lines.
 * <p><strong>Security:</strong> Callers truncate request fragments and redact secrets before logging.</p>
 */
package ca.gc.cra.sentinel.logging;
