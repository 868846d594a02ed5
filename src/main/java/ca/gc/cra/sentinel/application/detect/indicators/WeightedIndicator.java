package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorCheck;
import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Base class carrying the configured weight and suggested type of an indicator.
 *
 * @since 0.1.0
 */
abstract class WeightedIndicator implements IndicatorCheck {
  private final String name;
  private final int weight;
  private final TunnelType type;

  WeightedIndicator(String name, IndicatorParams params, int defaultWeight, TunnelType defaultType) {
    this.name = name;
    this.weight = params.weight(defaultWeight);
    this.type = params.type(defaultType);
  }

  @Override
  public final String name() {
    return name;
  }

  public final int weight() {
    return weight;
  }

  public final TunnelType type() {
    return type;
  }

  final Optional<IndicatorHit> hit(List<String> evidence) {
    if (evidence.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new IndicatorHit(name, weight, evidence, type));
  }

  final Optional<IndicatorHit> hit(String evidence) {
    return Optional.of(new IndicatorHit(name, weight, List.of(evidence), type));
  }

  static List<String> lower(List<String> values) {
    return values.stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
  }

  static String twoDecimals(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
