package ca.gc.cra.sentinel.application.query;

import ca.gc.cra.sentinel.application.block.BlockRuleStore;
import ca.gc.cra.sentinel.application.block.RuleStoreBusyException;
import ca.gc.cra.sentinel.application.detect.ClassifierStatistics;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.port.CaptureReader;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.EventPublisher;
import ca.gc.cra.sentinel.application.stats.StatsAggregator;
import ca.gc.cra.sentinel.application.timeline.TimelineReconstructor;
import ca.gc.cra.sentinel.application.timeline.WaterfallStore;
import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.block.RuleId;
import ca.gc.cra.sentinel.domain.block.RuleKind;
import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureFormatException;
import ca.gc.cra.sentinel.domain.detect.Confidence;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.domain.stats.StatsSnapshot;
import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import ca.gc.cra.sentinel.domain.timeline.WaterfallSort;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pull operations over the monitoring state: recent logs, detections, statistics, block
 * rules and captured waterfalls.
 * <p><strong>Why:</strong> Operator surfaces (HTTP adapter, CLI) share one validation and error mapping layer.</p>
 * <p><strong>Role:</strong> Application service; never throws for expected failures, returning
 * {@link QueryResult} with {@link ErrorCode} instead.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent callers; delegates to thread-safe collaborators.</p>
 *
 * @since 0.1.0
 */
public final class MonitoringQueryService {
  private static final Logger log = LoggerFactory.getLogger(MonitoringQueryService.class);

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 1_000;
  public static final Confidence DEFAULT_MIN_CONFIDENCE = Confidence.MEDIUM;

  private final RecentEntryWindow recent;
  private final BlockRuleStore blocks;
  private final StatsAggregator stats;
  private final TunnelClassifier classifier;
  private final CaptureReader captureReader;
  private final TimelineReconstructor reconstructor;
  private final WaterfallStore waterfalls;
  private final EventPublisher publisher;
  private final ClockPort clock;

  public MonitoringQueryService(
      RecentEntryWindow recent,
      BlockRuleStore blocks,
      StatsAggregator stats,
      TunnelClassifier classifier,
      CaptureReader captureReader,
      TimelineReconstructor reconstructor,
      WaterfallStore waterfalls,
      EventPublisher publisher,
      ClockPort clock) {
    this.recent = Objects.requireNonNull(recent, "recent");
    this.blocks = Objects.requireNonNull(blocks, "blocks");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.captureReader = Objects.requireNonNull(captureReader, "captureReader");
    this.reconstructor = Objects.requireNonNull(reconstructor, "reconstructor");
    this.waterfalls = Objects.requireNonNull(waterfalls, "waterfalls");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Lists recent entries newest first.
   *
   * @param limit page size in {@code [1, 1000]}; {@code null} means 100
   * @param offset entries to skip; {@code null} means 0
   * @return page of analyzed entries, or {@link ErrorCode#INVALID_INPUT}
   */
  public QueryResult<Page<AnalyzedEntry>> recentLogs(Integer limit, Integer offset) {
    Optional<String> invalid = checkPaging(limit, offset);
    if (invalid.isPresent()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, invalid.get());
    }
    return QueryResult.ok(Page.slice(recent.newestFirst(), limitOrDefault(limit), offsetOrDefault(offset)));
  }

  public QueryResult<AnalyzedEntry> logById(String id) {
    if (id == null || id.isBlank()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, "id must not be blank");
    }
    return recent.find(id.trim())
        .map(QueryResult::ok)
        .orElseGet(() -> QueryResult.failure(ErrorCode.NOT_FOUND, "no recent entry with id " + id));
  }

  /**
   * Case-insensitive substring search over path, query, source address and user agent of recent entries.
   *
   * @param term search text
   * @param limit page size; {@code null} means 100
   * @param offset matches to skip; {@code null} means 0
   * @return page of matching entries newest first
   */
  public QueryResult<Page<AnalyzedEntry>> searchLogs(String term, Integer limit, Integer offset) {
    if (term == null || term.isBlank()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, "search term must not be blank");
    }
    Optional<String> invalid = checkPaging(limit, offset);
    if (invalid.isPresent()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, invalid.get());
    }
    String needle = term.trim().toLowerCase(Locale.ROOT);
    List<AnalyzedEntry> matches = new ArrayList<>();
    for (AnalyzedEntry analyzed : recent.newestFirst()) {
      if (matchesSearch(analyzed.entry(), needle)) {
        matches.add(analyzed);
      }
    }
    return QueryResult.ok(Page.slice(matches, limitOrDefault(limit), offsetOrDefault(offset)));
  }

  /**
   * Lists detections of recent entries newest first.
   *
   * @param minConfidence lowest confidence to include; blank means {@code medium}
   * @param limit page size; {@code null} means 100
   * @param offset detections to skip; {@code null} means 0
   * @return page of detections
   */
  public QueryResult<Page<TunnelDetection>> tunnelDetections(String minConfidence, Integer limit, Integer offset) {
    Confidence floor;
    try {
      floor = minConfidence == null || minConfidence.isBlank()
          ? DEFAULT_MIN_CONFIDENCE
          : Confidence.fromWire(minConfidence);
    } catch (IllegalArgumentException ex) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, ex.getMessage());
    }
    Optional<String> invalid = checkPaging(limit, offset);
    if (invalid.isPresent()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, invalid.get());
    }
    List<TunnelDetection> detections = new ArrayList<>();
    for (AnalyzedEntry analyzed : recent.newestFirst()) {
      analyzed.detection()
          .filter(detection -> detection.confidence().atLeast(floor))
          .ifPresent(detections::add);
    }
    return QueryResult.ok(Page.slice(detections, limitOrDefault(limit), offsetOrDefault(offset)));
  }

  public QueryResult<StatsSnapshot> stats() {
    return QueryResult.ok(stats.snapshot());
  }

  public ClassifierStatistics classifierStatistics() {
    return classifier.statistics();
  }

  /** Lists active block rules grouped by kind, each kind in insertion order. */
  public QueryResult<Map<RuleKind, List<BlockRule>>> blockRules() {
    try {
      return QueryResult.ok(blocks.snapshot());
    } catch (IllegalStateException ex) {
      log.error("Block rule store inconsistent", ex);
      return QueryResult.failure(ErrorCode.TRANSIENT, ex.getMessage());
    }
  }

  /**
   * Validates and installs a rule, then announces it on the live stream.
   *
   * @param request untrusted rule request
   * @return installed rule, {@link ErrorCode#INVALID_INPUT} or {@link ErrorCode#TRANSIENT}
   */
  public QueryResult<BlockRule> addBlockRule(BlockRuleRequest request) {
    if (request == null) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, "rule request must not be empty");
    }
    BlockRule rule;
    try {
      rule = request.toRule(clock.now());
    } catch (IllegalArgumentException | NullPointerException ex) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, ex.getMessage());
    }
    try {
      blocks.add(rule);
    } catch (RuleStoreBusyException ex) {
      return QueryResult.failure(ErrorCode.TRANSIENT, ex.getMessage());
    } catch (IllegalStateException ex) {
      log.error("Block rule store inconsistent while adding {}", rule.id(), ex);
      return QueryResult.failure(ErrorCode.TRANSIENT, ex.getMessage());
    }
    publisher.publish(new MonitorEvent.BlockAdded(rule));
    return QueryResult.ok(rule);
  }

  /**
   * Removes the rule with the given discriminating key.
   *
   * @param kind {@code ip}, {@code endpoint} or {@code pattern}
   * @param key discriminating key as listed
   * @return removed rule id, or {@link ErrorCode#NOT_FOUND} when no such rule exists
   */
  public QueryResult<RuleId> removeBlockRule(String kind, String key) {
    RuleKind ruleKind;
    try {
      ruleKind = RuleKind.fromWire(kind);
    } catch (IllegalArgumentException ex) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, ex.getMessage());
    }
    if (key == null || key.isBlank()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, "rule key must not be blank");
    }
    RuleId id = new RuleId(ruleKind, key);
    try {
      if (!blocks.remove(ruleKind, key)) {
        return QueryResult.failure(ErrorCode.NOT_FOUND, "no " + ruleKind.wireName() + " rule " + key);
      }
    } catch (RuleStoreBusyException ex) {
      return QueryResult.failure(ErrorCode.TRANSIENT, ex.getMessage());
    }
    return QueryResult.ok(id);
  }

  /**
   * Parses a capture, reconstructs its waterfall and retains it for later retrieval.
   *
   * @param capture capture document
   * @return handle carrying the waterfall id
   */
  public QueryResult<CaptureHandle> submitCapture(InputStream capture) {
    if (capture == null) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, "capture must not be empty");
    }
    Capture parsed;
    try {
      parsed = captureReader.read(capture);
    } catch (CaptureFormatException ex) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, ex.getMessage());
    } catch (IOException ex) {
      log.warn("Failed to read submitted capture", ex);
      return QueryResult.failure(ErrorCode.TRANSIENT, "failed to read capture: " + ex.getMessage());
    }
    Waterfall waterfall = reconstructor.reconstruct(parsed);
    String id = waterfalls.put(waterfall);
    log.info("Stored waterfall {} with {} resources ({} warnings)",
        id, waterfall.entries().size(), waterfall.warnings().size());
    return QueryResult.ok(new CaptureHandle(id, waterfall));
  }

  /**
   * Retrieves a stored waterfall.
   *
   * @param id waterfall id from {@link #submitCapture(InputStream)}
   * @param mimeCategory optional category filter; blank or {@code all} keeps every row
   * @param sort optional order; blank means capture order
   * @return filtered and sorted view
   */
  public QueryResult<Waterfall> waterfall(String id, String mimeCategory, String sort) {
    if (id == null || id.isBlank()) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, "waterfall id must not be blank");
    }
    WaterfallSort order;
    try {
      order = WaterfallSort.fromWire(sort);
    } catch (IllegalArgumentException ex) {
      return QueryResult.failure(ErrorCode.INVALID_INPUT, ex.getMessage());
    }
    Optional<Waterfall> stored = waterfalls.get(id.trim());
    if (stored.isEmpty()) {
      return QueryResult.failure(ErrorCode.NOT_FOUND, "no waterfall with id " + id);
    }
    Waterfall view = stored.get();
    if (mimeCategory != null && !mimeCategory.isBlank() && !"all".equalsIgnoreCase(mimeCategory.trim())) {
      view = view.filterByCategory(mimeCategory);
    }
    return QueryResult.ok(view.sortedBy(order));
  }

  private static boolean matchesSearch(LogEntry entry, String needle) {
    return contains(entry.path(), needle)
        || contains(entry.query(), needle)
        || contains(entry.sourceIp(), needle)
        || contains(entry.userAgent(), needle);
  }

  private static boolean contains(String haystack, String needle) {
    return haystack.toLowerCase(Locale.ROOT).contains(needle);
  }

  private static Optional<String> checkPaging(Integer limit, Integer offset) {
    if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
      return Optional.of("limit must be between 1 and " + MAX_LIMIT + " (was " + limit + ")");
    }
    if (offset != null && offset < 0) {
      return Optional.of("offset must not be negative (was " + offset + ")");
    }
    return Optional.empty();
  }

  private static int limitOrDefault(Integer limit) {
    return limit == null ? DEFAULT_LIMIT : limit;
  }

  private static int offsetOrDefault(Integer offset) {
    return offset == null ? 0 : offset;
  }
}
