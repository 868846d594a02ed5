package ca.gc.cra.sentinel.application.block;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.block.BlockDecision;
import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.block.IpBlockRule;
import ca.gc.cra.sentinel.domain.block.RuleId;
import ca.gc.cra.sentinel.domain.block.RuleKind;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.validation.Net;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dynamic IP, endpoint and field-pattern blocklist with allow/deny evaluation.
 * <p><strong>Why:</strong> Operators block offending clients or endpoints at runtime without restarting the edge.</p>
 * <p><strong>Role:</strong> Pipeline stage that runs before classification; denied entries skip classification but
 * still reach the bus marked denied.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep at most one rule per kind and discriminating key; a re-add refreshes metadata in place. IP literals
 *   are stored in canonical form and pattern keys ignore case, so differently spelled duplicates collapse.</li>
 *   <li>Evaluate exempt paths first, then IP, endpoint and pattern rules; earliest inserted wins within a kind.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Guarded by a {@link ReentrantReadWriteLock}. Evaluations share the read lock;
 * mutations wait at most {@link BlockSettings#lockTimeoutMillis()} for the write lock.</p>
 * <p><strong>Observability:</strong> Emits {@code block.rule.added}, {@code block.rule.refreshed},
 * {@code block.rule.removed} and {@code block.denied}.</p>
 *
 * @since 0.1.0
 */
public final class BlockRuleStore {
  private static final Logger log = LoggerFactory.getLogger(BlockRuleStore.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<RuleKind, LinkedHashMap<String, RuleMatcher>> rules = new EnumMap<>(RuleKind.class);
  private final Set<String> exemptPaths;
  private final long lockTimeoutMillis;
  private final MetricsPort metrics;

  public BlockRuleStore(BlockSettings settings, MetricsPort metrics) {
    Objects.requireNonNull(settings, "settings");
    this.exemptPaths = Set.copyOf(settings.exemptPaths());
    this.lockTimeoutMillis = settings.lockTimeoutMillis();
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    for (RuleKind kind : RuleKind.values()) {
      rules.put(kind, new LinkedHashMap<>());
    }
  }

  /**
   * Adds a rule, or refreshes reason, creation time and actor of the existing rule with the same key.
   *
   * @param rule rule to add
   * @return identifier of the stored rule
   * @throws RuleStoreBusyException when the write lock is not acquired in time
   */
  public RuleId add(BlockRule rule) {
    rule = canonical(Objects.requireNonNull(rule, "rule"));
    RuleMatcher compiled = RuleMatcher.compile(rule);
    Lock write = acquireWrite();
    try {
      LinkedHashMap<String, RuleMatcher> byKey = rules.get(rule.kind());
      RuleMatcher existing = byKey.get(rule.key());
      if (existing != null) {
        BlockRule refreshed = existing.rule().refreshed(rule.reason(), rule.createdAt(), rule.createdBy());
        byKey.put(rule.key(), existing.withRule(refreshed));
        metrics.increment("block.rule.refreshed");
        log.info("Refreshed block rule {}", rule.id());
      } else {
        byKey.put(rule.key(), compiled);
        metrics.increment("block.rule.added");
        log.info("Added block rule {} by {}", rule.id(), rule.createdBy().isEmpty() ? "<anonymous>" : rule.createdBy());
      }
      return rule.id();
    } finally {
      write.unlock();
    }
  }

  /**
   * Removes a rule.
   *
   * @param kind rule kind
   * @param key discriminating key within {@code kind}
   * @return {@code false} when no such rule existed
   * @throws RuleStoreBusyException when the write lock is not acquired in time
   */
  public boolean remove(RuleKind kind, String key) {
    Objects.requireNonNull(kind, "kind");
    key = canonicalKey(kind, Objects.requireNonNull(key, "key"));
    Lock write = acquireWrite();
    try {
      boolean removed = rules.get(kind).remove(key) != null;
      if (removed) {
        metrics.increment("block.rule.removed");
        log.info("Removed block rule {}", new RuleId(kind, key));
      } else {
        log.debug("Block rule {} not present; nothing removed", new RuleId(kind, key));
      }
      return removed;
    } finally {
      write.unlock();
    }
  }

  /**
   * Decides whether {@code entry} is allowed.
   *
   * @param entry normalized entry
   * @return deny carrying the first matching rule, otherwise allow
   */
  public BlockDecision evaluate(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (exemptPaths.contains(entry.path())) {
      return BlockDecision.allow();
    }
    lock.readLock().lock();
    try {
      for (RuleKind kind : RuleKind.values()) {
        for (RuleMatcher matcher : rules.get(kind).values()) {
          if (matcher.matches(entry)) {
            metrics.increment("block.denied");
            return BlockDecision.deny(matcher.rule());
          }
        }
      }
      return BlockDecision.allow();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the rules of one kind in insertion order. */
  public List<BlockRule> list(RuleKind kind) {
    Objects.requireNonNull(kind, "kind");
    lock.readLock().lock();
    try {
      return rulesOf(kind);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns every rule grouped by kind, each group in insertion order.
   *
   * @throws IllegalStateException when a stored rule no longer matches the key it is indexed under
   */
  public Map<RuleKind, List<BlockRule>> snapshot() {
    lock.readLock().lock();
    try {
      Map<RuleKind, List<BlockRule>> snapshot = new EnumMap<>(RuleKind.class);
      for (RuleKind kind : RuleKind.values()) {
        snapshot.put(kind, rulesOf(kind));
      }
      return Collections.unmodifiableMap(snapshot);
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      int total = 0;
      for (LinkedHashMap<String, RuleMatcher> byKey : rules.values()) {
        total += byKey.size();
      }
      return total;
    } finally {
      lock.readLock().unlock();
    }
  }

  private List<BlockRule> rulesOf(RuleKind kind) {
    List<BlockRule> result = new ArrayList<>();
    for (Map.Entry<String, RuleMatcher> entry : rules.get(kind).entrySet()) {
      BlockRule rule = entry.getValue().rule();
      if (rule.kind() != kind || !rule.key().equals(entry.getKey())) {
        throw new IllegalStateException("Block rule index corrupted at " + kind.wireName() + ':' + entry.getKey());
      }
      result.add(rule);
    }
    return List.copyOf(result);
  }

  private Lock acquireWrite() {
    Lock write = lock.writeLock();
    try {
      if (!write.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
        metrics.increment("block.lock.timeout");
        throw new RuleStoreBusyException("Block rule store busy; write lock not acquired within "
            + lockTimeoutMillis + " ms");
      }
      return write;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RuleStoreBusyException("Interrupted while waiting for block rule store", ex);
    }
  }

  private static BlockRule canonical(BlockRule rule) {
    if (rule instanceof IpBlockRule ip) {
      String canonical = Net.tryCanonicalIp(ip.ip()).orElse(ip.ip());
      if (!canonical.equals(ip.ip())) {
        return new IpBlockRule(canonical, ip.reason(), ip.createdAt(), ip.createdBy());
      }
    }
    return rule;
  }

  private static String canonicalKey(RuleKind kind, String key) {
    return switch (kind) {
      case IP -> Net.tryCanonicalIp(key).orElse(key.trim());
      case ENDPOINT -> key;
      case PATTERN -> {
        int colon = key.indexOf(':');
        yield colon < 0 ? key : key.substring(0, colon + 1) + key.substring(colon + 1).toLowerCase(Locale.ROOT);
      }
    };
  }
}
