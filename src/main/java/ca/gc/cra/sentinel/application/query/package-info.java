/**
 * Read and administrative operations behind the HTTP API, returning {@link ca.gc.cra.sentinel.application.query.QueryResult}
 * values instead of throwing for caller mistakes.
 */
package ca.gc.cra.sentinel.application.query;
