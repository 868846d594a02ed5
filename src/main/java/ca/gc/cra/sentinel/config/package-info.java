/**
 * Configuration loading and composition root wiring for the SENTINEL CLIs.
 * <p><strong>Role:</strong> Bootstrap layer turning flattened {@code key=value} settings into typed configs and
 * assembling pipeline, bus, query and delivery adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Values are validated through {@code ca.gc.cra.sentinel.validation}.</p>
 */
package ca.gc.cra.sentinel.config;
