/** Filesystem watcher that hot-reloads indicator rules into the running classifier. */
package ca.gc.cra.sentinel.infrastructure.detect;
