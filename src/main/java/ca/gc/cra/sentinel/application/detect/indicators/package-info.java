/** Individual indicator checks and the catalog that builds them from rule definitions. */
package ca.gc.cra.sentinel.application.detect.indicators;
