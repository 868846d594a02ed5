package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;

/**
 * <strong>What:</strong> Hand-off to the external durable store that archives analyzed entries.
 * <p><strong>Why:</strong> SENTINEL keeps only a bounded recent window; long-term retention is an external
 * responsibility reached through this port.</p>
 * <p><strong>Thread-safety:</strong> Called concurrently from pipeline workers.</p>
 *
 * @since 0.1.0
 */
public interface ArchivePort extends AutoCloseable {
  /**
   * Hands one analyzed entry to the archive.
   *
   * @param entry entry to archive
   * @throws Exception when the archive rejects the entry
   */
  void archive(AnalyzedEntry entry) throws Exception;

  /** Flushes and releases resources. */
  @Override
  default void close() throws Exception {}

  /** Archive that discards entries; used when no external store is configured. */
  ArchivePort NONE = entry -> {};
}
