/** HAR capture parsing into immutable capture entries. */
package ca.gc.cra.sentinel.infrastructure.capture;
