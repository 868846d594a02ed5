package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorCheck;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry of the built-in indicator checks in evaluation order.
 *
 * <p>Evaluation order is significant: when two firing checks carry the same weight the earlier one decides the
 * detection type.</p>
 *
 * @since 0.1.0
 */
public final class IndicatorCatalog {
  private static final Map<String, Function<IndicatorParams, IndicatorCheck>> FACTORIES = new LinkedHashMap<>();

  static {
    FACTORIES.put(TunnelHeaderCheck.NAME, TunnelHeaderCheck::new);
    FACTORIES.put(ContentTypeCheck.NAME, ContentTypeCheck::new);
    FACTORIES.put(ChunkedRelayCheck.NAME, ChunkedRelayCheck::new);
    FACTORIES.put(HeaderEntropyCheck.NAME, HeaderEntropyCheck::new);
    FACTORIES.put(SuspiciousPathCheck.NAME, SuspiciousPathCheck::new);
    FACTORIES.put(WebshellCheck.NAME, WebshellCheck::new);
    FACTORIES.put(TunnelToolkitCheck.NAME, TunnelToolkitCheck::new);
    FACTORIES.put(DnsOverHttpCheck.NAME, DnsOverHttpCheck::new);
    FACTORIES.put(WebSocketAbuseCheck.NAME, WebSocketAbuseCheck::new);
    FACTORIES.put(PayloadEntropyCheck.NAME, PayloadEntropyCheck::new);
    FACTORIES.put(AsymmetricTransferCheck.NAME, AsymmetricTransferCheck::new);
    FACTORIES.put(LongPollCheck.NAME, LongPollCheck::new);
    FACTORIES.put(RequestBurstCheck.NAME, RequestBurstCheck::new);
    FACTORIES.put(BeaconingCheck.NAME, BeaconingCheck::new);
  }

  private IndicatorCatalog() {}

  public static Set<String> names() {
    return FACTORIES.keySet();
  }

  /** Builds every check with its default parameters. */
  public static List<IndicatorCheck> defaults() {
    return build(Map.of());
  }

  /**
   * Builds the enabled checks in catalog order.
   *
   * @param params parameters keyed by check name; checks without an entry use their defaults
   * @return enabled checks
   * @throws IllegalArgumentException when {@code params} names an unknown check or carries invalid values
   */
  public static List<IndicatorCheck> build(Map<String, IndicatorParams> params) {
    for (String name : params.keySet()) {
      if (!FACTORIES.containsKey(name)) {
        throw new IllegalArgumentException("Unknown indicator '" + name + "'; expected one of " + FACTORIES.keySet());
      }
    }
    List<IndicatorCheck> checks = new ArrayList<>();
    for (Map.Entry<String, Function<IndicatorParams, IndicatorCheck>> factory : FACTORIES.entrySet()) {
      IndicatorParams p = params.getOrDefault(factory.getKey(), IndicatorParams.empty(factory.getKey()));
      if (p.enabled()) {
        checks.add(factory.getValue().apply(p));
      }
    }
    return List.copyOf(checks);
  }
}
