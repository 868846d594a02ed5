package ca.gc.cra.sentinel.application.pipeline;

/**
 * Worker pool tuning for the live pipeline.
 *
 * @param workers number of partition workers; source addresses are hashed onto them
 * @param partitionQueueCapacity pending observations per partition before new ones are dropped
 * @since 0.1.0
 */
public record PipelineSettings(int workers, int partitionQueueCapacity) {
  public static final int DEFAULT_WORKERS = Math.max(1, Runtime.getRuntime().availableProcessors());
  public static final int DEFAULT_PARTITION_QUEUE_CAPACITY = 1_024;

  public PipelineSettings {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (partitionQueueCapacity <= 0) {
      throw new IllegalArgumentException("partitionQueueCapacity must be positive");
    }
  }

  public static PipelineSettings defaults() {
    return new PipelineSettings(DEFAULT_WORKERS, DEFAULT_PARTITION_QUEUE_CAPACITY);
  }
}
