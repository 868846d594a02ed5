/** Waterfall reconstruction from captures and the bounded store of uploaded captures. */
package ca.gc.cra.sentinel.application.timeline;
