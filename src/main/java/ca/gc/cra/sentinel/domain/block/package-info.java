/** Block rule types and enforcement decisions. */
package ca.gc.cra.sentinel.domain.block;
