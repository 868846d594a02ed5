/** Statistics snapshots. */
package ca.gc.cra.sentinel.domain.stats;
