/** Sliding-window traffic statistics fed from the event bus. */
package ca.gc.cra.sentinel.application.stats;
