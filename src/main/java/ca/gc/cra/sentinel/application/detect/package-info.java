/**
 * Tunnel classification: per-IP activity tracking, weighted indicator checks, and confidence banding.
 * <p>Indicator rules are loaded from YAML and may be swapped atomically while the pipeline runs.</p>
 */
package ca.gc.cra.sentinel.application.detect;
