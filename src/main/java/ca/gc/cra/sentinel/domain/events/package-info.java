/** Events broadcast to live subscribers. */
package ca.gc.cra.sentinel.domain.events;
