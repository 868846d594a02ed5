/**
 * CLI entry points that bootstrap the SENTINEL serve, replay, waterfall, and watch workflows.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes use cases.</p>
 * <p><strong>Concurrency:</strong> CLI commands run single-threaded during setup; pipelines spawn their own workers.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and network targets before anything is opened.</p>
 */
package ca.gc.cra.sentinel.api;
