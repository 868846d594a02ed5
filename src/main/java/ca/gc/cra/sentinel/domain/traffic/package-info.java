/**
 * Observed exchanges: raw input, normalized log entries, and analyzed entries carrying verdicts.
 * <p><strong>Security:</strong> Sensitive request headers are already redacted and bodies truncated by the time a
 * {@link ca.gc.cra.sentinel.domain.traffic.LogEntry} exists.</p>
 */
package ca.gc.cra.sentinel.domain.traffic;
