/** Waterfall rows, sort orders, and the reconstructed waterfall. */
package ca.gc.cra.sentinel.domain.timeline;
