/** Tunnel detection verdicts, confidence levels, and tunnel types. */
package ca.gc.cra.sentinel.domain.detect;
