package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.domain.detect.TunnelType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view over the parameter mapping of one indicator in a rule file.
 *
 * <p>Missing keys fall back to the supplied defaults; present keys of the wrong shape raise
 * {@link IllegalArgumentException} naming the indicator and key.</p>
 *
 * @since 0.1.0
 */
public final class IndicatorParams {
  private final String indicator;
  private final Map<String, Object> values;

  public IndicatorParams(String indicator, Map<String, Object> values) {
    this.indicator = Objects.requireNonNull(indicator, "indicator");
    this.values = values == null ? Map.of() : new LinkedHashMap<>(values);
  }

  public static IndicatorParams empty(String indicator) {
    return new IndicatorParams(indicator, Map.of());
  }

  public boolean enabled() {
    return bool("enabled", true);
  }

  public int weight(int fallback) {
    int weight = integer("weight", fallback);
    if (weight < 0 || weight > 100) {
      throw invalid("weight", "must be between 0 and 100");
    }
    return weight;
  }

  public TunnelType type(TunnelType fallback) {
    Object raw = values.get("type");
    if (raw == null) {
      return fallback;
    }
    try {
      return TunnelType.fromWire(raw.toString());
    } catch (IllegalArgumentException ex) {
      throw invalid("type", ex.getMessage());
    }
  }

  public int integer(String key, int fallback) {
    Object raw = values.get(key);
    if (raw == null) {
      return fallback;
    }
    if (raw instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(raw.toString().trim());
    } catch (NumberFormatException ex) {
      throw invalid(key, "expected integer but was '" + raw + "'");
    }
  }

  public double decimal(String key, double fallback) {
    Object raw = values.get(key);
    if (raw == null) {
      return fallback;
    }
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(raw.toString().trim());
    } catch (NumberFormatException ex) {
      throw invalid(key, "expected number but was '" + raw + "'");
    }
  }

  public boolean bool(String key, boolean fallback) {
    Object raw = values.get(key);
    if (raw == null) {
      return fallback;
    }
    if (raw instanceof Boolean value) {
      return value;
    }
    String text = raw.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw invalid(key, "expected boolean but was '" + raw + "'");
  }

  public List<String> strings(String key, List<String> fallback) {
    Object raw = values.get(key);
    if (raw == null) {
      return fallback;
    }
    List<String> result = new ArrayList<>();
    if (raw instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        if (value == null || value.toString().isBlank()) {
          throw invalid(key, "entries must not be blank");
        }
        result.add(value.toString());
      }
    } else if (raw instanceof String single && !single.isBlank()) {
      result.add(single);
    } else {
      throw invalid(key, "expected string or list");
    }
    return List.copyOf(result);
  }

  private IllegalArgumentException invalid(String key, String detail) {
    return new IllegalArgumentException("indicators." + indicator + "." + key + ": " + detail);
  }
}
