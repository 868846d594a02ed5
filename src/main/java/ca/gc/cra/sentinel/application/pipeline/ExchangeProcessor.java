package ca.gc.cra.sentinel.application.pipeline;

import ca.gc.cra.sentinel.application.block.BlockRuleStore;
import ca.gc.cra.sentinel.application.detect.IpActivityArena;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.ingest.IngestAdapter;
import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.port.EventPublisher;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.query.RecentEntryWindow;
import ca.gc.cra.sentinel.domain.block.BlockDecision;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one observation through ingest, block enforcement, classification, retention, archival and publishing.
 *
 * <p>Denied entries skip classification. A detection is published as {@code tunnel_alert} before the
 * {@code log} event of the same entry.</p>
 *
 * @since 0.1.0
 */
public final class ExchangeProcessor {
  private static final Logger log = LoggerFactory.getLogger(ExchangeProcessor.class);

  private final IngestAdapter ingest;
  private final BlockRuleStore blocks;
  private final TunnelClassifier classifier;
  private final RecentEntryWindow recent;
  private final ArchivePort archive;
  private final EventPublisher publisher;
  private final MetricsPort metrics;

  public ExchangeProcessor(
      IngestAdapter ingest,
      BlockRuleStore blocks,
      TunnelClassifier classifier,
      RecentEntryWindow recent,
      ArchivePort archive,
      EventPublisher publisher,
      MetricsPort metrics) {
    this.ingest = Objects.requireNonNull(ingest, "ingest");
    this.blocks = Objects.requireNonNull(blocks, "blocks");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.recent = Objects.requireNonNull(recent, "recent");
    this.archive = Objects.requireNonNull(archive, "archive");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Processes one observation.
   *
   * @param raw observation from the edge
   * @param arena per-IP state of the calling worker
   * @return analyzed entry as published
   */
  public AnalyzedEntry process(RawExchange raw, IpActivityArena arena) {
    LogEntry entry = ingest.normalize(raw);
    BlockDecision decision = blocks.evaluate(entry);
    TunnelDetection detection = decision.denied() ? null : classifier.classify(entry, arena).orElse(null);
    AnalyzedEntry analyzed = new AnalyzedEntry(entry, decision, detection);

    recent.add(analyzed);
    archive(analyzed);
    if (detection != null) {
      publisher.publish(new MonitorEvent.TunnelAlert(detection, entry));
    }
    publisher.publish(new MonitorEvent.Log(analyzed));
    return analyzed;
  }

  public String partitionKey(RawExchange raw) {
    return ingest.resolveSourceIp(raw);
  }

  private void archive(AnalyzedEntry analyzed) {
    try {
      archive.archive(analyzed);
    } catch (Exception ex) {
      metrics.increment("archive.failed");
      log.warn("Failed to archive entry {}", analyzed.entry().id(), ex);
    }
  }
}
