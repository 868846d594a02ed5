package ca.gc.cra.sentinel.application.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.block.BlockDecision;
import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.block.EndpointBlockRule;
import ca.gc.cra.sentinel.domain.block.IpBlockRule;
import ca.gc.cra.sentinel.domain.block.PatternBlockRule;
import ca.gc.cra.sentinel.domain.block.PatternField;
import ca.gc.cra.sentinel.domain.block.RuleKind;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ca.gc.cra.sentinel.testutil.TrafficFixtures;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BlockRuleStoreTest {
  private static final Instant NOW = Instant.ofEpochMilli(TrafficFixtures.T0);

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final BlockRuleStore store = new BlockRuleStore(BlockSettings.defaults(), metrics);

  @Test
  void deniesAdminGlobForAnyMethod() {
    store.add(new EndpointBlockRule("ALL", "/api/v1/admin/*", "admin lockdown", NOW, "ops"));

    BlockDecision decision = store.evaluate(TrafficFixtures.entry("e1", "10.0.0.1", "DELETE", "/api/v1/admin/users", 200));

    assertTrue(decision.denied());
    assertEquals(RuleKind.ENDPOINT, decision.matchedRule().orElseThrow().kind());
    assertFalse(store.evaluate(TrafficFixtures.entry("e2", "10.0.0.1", "GET", "/api/v1/public", 200)).denied());
    assertEquals(1, metrics.count("block.denied"));
  }

  @Test
  void ipRulesAreConsultedBeforeEndpointRules() {
    store.add(new EndpointBlockRule("GET", "/download", "", NOW, ""));
    store.add(new IpBlockRule("10.0.0.66", "scanner", NOW, "ops"));

    BlockDecision decision = store.evaluate(TrafficFixtures.entry("e1", "10.0.0.66", "GET", "/download/a.zip", 200));

    assertEquals(RuleKind.IP, decision.matchedRule().orElseThrow().kind());
  }

  @Test
  void exemptPathsBypassEveryRule() {
    store.add(new IpBlockRule("10.0.0.66", "", NOW, ""));

    assertFalse(store.evaluate(TrafficFixtures.entry("e1", "10.0.0.66", "GET", "/health", 200)).denied());
    assertTrue(store.evaluate(TrafficFixtures.entry("e2", "10.0.0.66", "GET", "/health/deep", 200)).denied());
  }

  @Test
  void patternRulesInspectSelectedField() {
    store.add(new PatternBlockRule(PatternField.USER_AGENT, "curl", "no scripts", NOW, ""));

    LogEntry entry = TrafficFixtures.entry("e1", "10.0.0.2", "GET", "/", 200);
    assertTrue(store.evaluate(entry).denied());
  }

  @Test
  void readdRefreshesInPlace() {
    store.add(new IpBlockRule("10.0.0.1", "first", NOW, "a"));
    store.add(new IpBlockRule("10.0.0.2", "", NOW, ""));
    store.add(new IpBlockRule("10.0.0.1", "second", NOW.plusSeconds(5), "b"));

    List<BlockRule> rules = store.list(RuleKind.IP);
    assertEquals(2, rules.size());
    assertEquals("10.0.0.1", rules.get(0).key());
    assertEquals("second", rules.get(0).reason());
    assertEquals(1, metrics.count("block.rule.refreshed"));
    assertEquals(2, store.size());
  }

  @Test
  void removeReportsMissingRule() {
    store.add(new IpBlockRule("10.0.0.1", "", NOW, ""));

    assertFalse(store.remove(RuleKind.IP, "10.0.0.9"));
    assertTrue(store.remove(RuleKind.IP, "10.0.0.1"));
    assertEquals(0, store.size());
    assertFalse(store.remove(RuleKind.ENDPOINT, EndpointBlockRule.keyOf("", "/x")));
  }

  @Test
  void snapshotGroupsEveryKind() {
    store.add(new PatternBlockRule(PatternField.QUERY, "union select", "", NOW, ""));

    Map<RuleKind, List<BlockRule>> snapshot = store.snapshot();
    assertEquals(3, snapshot.size());
    assertTrue(snapshot.get(RuleKind.IP).isEmpty());
    assertEquals(1, snapshot.get(RuleKind.PATTERN).size());
  }

  @Test
  void endpointRulesWinOverPatternRulesAndEarliestEndpointWins() {
    store.add(new PatternBlockRule(PatternField.PATH, "admin", "", NOW, ""));
    store.add(new EndpointBlockRule("ALL", "/api/v1/admin/*", "", NOW, ""));
    store.add(new EndpointBlockRule("GET", "/api/v1", "", NOW, ""));

    BlockDecision decision = store.evaluate(TrafficFixtures.entry("e1", "10.0.0.1", "GET", "/api/v1/admin/x", 200));

    assertEquals("ALL /api/v1/admin/*", decision.matchedRule().orElseThrow().key());
  }

  @Test
  void earliestInsertedRuleWinsWithinPatternKind() {
    store.add(new PatternBlockRule(PatternField.PATH, "secret", "first", NOW, ""));
    store.add(new PatternBlockRule(PatternField.PATH, "/vault/*", "second", NOW, ""));
    store.add(new PatternBlockRule(PatternField.PATH, "secret", "refreshed", NOW.plusSeconds(1), ""));

    BlockDecision decision = store.evaluate(TrafficFixtures.entry("e1", "10.0.0.1", "GET", "/vault/secret", 200));

    assertEquals("refreshed", decision.matchedRule().orElseThrow().reason());
    assertEquals("path:secret", decision.matchedRule().orElseThrow().key());
  }

  @Test
  void differentlySpelledDuplicatesCollapseToOneRule() {
    store.add(new PatternBlockRule(PatternField.USER_AGENT, "SQLMap", "", NOW, ""));
    store.add(new PatternBlockRule(PatternField.USER_AGENT, "sqlmap", "", NOW, ""));
    store.add(new IpBlockRule("2001:db8::1", "", NOW, ""));
    store.add(new IpBlockRule("2001:DB8:0:0:0:0:0:1", "", NOW, ""));
    store.add(new IpBlockRule("[2001:db8::1]", "", NOW, ""));

    assertEquals(1, store.list(RuleKind.PATTERN).size());
    assertEquals(List.of("2001:db8::1"), store.list(RuleKind.IP).stream().map(BlockRule::key).toList());
    assertTrue(store.evaluate(TrafficFixtures.entry("e1", "2001:db8::1", "GET", "/", 200)).denied());
    assertTrue(store.remove(RuleKind.PATTERN, "user_agent:SQLMAP"));
    assertTrue(store.remove(RuleKind.IP, "2001:0db8::0:1"));
    assertEquals(0, store.size());
  }

  @Test
  void randomAddRemoveSequenceNeverListsDuplicateKeys() {
    String[][] ipSpellings = {
        {"10.0.0.1", "010.0.0.1", " 10.0.0.1 "},
        {"2001:db8::1", "2001:DB8:0:0:0:0:0:1", "[2001:db8::1]"},
        {"192.0.2.7"}};
    String[] canonicalIps = {"10.0.0.1", "2001:db8::1", "192.0.2.7"};
    String[][] patternSpellings = {{"Curl", "curl", "CURL"}, {"nikto"}};
    Map<String, Boolean> expected = new LinkedHashMap<>();
    Random random = new Random(20241017L);

    for (int step = 0; step < 500; step++) {
      boolean ip = random.nextBoolean();
      int target = random.nextInt(ip ? ipSpellings.length : patternSpellings.length);
      String[] spellings = ip ? ipSpellings[target] : patternSpellings[target];
      String spelling = spellings[random.nextInt(spellings.length)];
      String canonical = ip
          ? "ip:" + canonicalIps[target]
          : "pattern:" + PatternBlockRule.keyOf(PatternField.USER_AGENT, spelling);
      if (random.nextInt(3) == 0) {
        String key = ip ? spelling : "user_agent:" + spelling.toUpperCase(Locale.ROOT);
        boolean removed = store.remove(ip ? RuleKind.IP : RuleKind.PATTERN, key);
        assertEquals(expected.remove(canonical) != null, removed, "step " + step);
      } else {
        store.add(ip
            ? new IpBlockRule(spelling, "", NOW, "")
            : new PatternBlockRule(PatternField.USER_AGENT, spelling, "", NOW, ""));
        expected.putIfAbsent(canonical, Boolean.TRUE);
      }

      List<String> listed = new ArrayList<>();
      for (BlockRule rule : store.list(RuleKind.IP)) {
        listed.add("ip:" + rule.key());
      }
      for (BlockRule rule : store.list(RuleKind.PATTERN)) {
        listed.add("pattern:" + rule.key());
      }
      assertEquals(new HashSet<>(listed).size(), listed.size(), "step " + step);
      assertEquals(expected.keySet(), new HashSet<>(listed), "step " + step);
    }
  }
}
