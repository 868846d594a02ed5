package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.application.detect.indicators.IndicatorCatalog;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads classifier rules from YAML.
 *
 * <pre>
 * version: 1
 * bands: {medium: 40, high: 70, confirmed: 90}
 * activity: {maxTrackedIps: 10000, historyPerIp: 100}
 * indicators:
 *   webshell: {weight: 60, type: webshell, patterns: [".php?cmd="]}
 *   long_poll: {enabled: false}
 * </pre>
 *
 * <p>Indicators absent from the document keep their defaults; {@code enabled: false} switches one off.</p>
 *
 * @since 0.1.0
 */
public final class IndicatorRulesLoader {
  /** Classpath location of the bundled rule file. */
  public static final String BUNDLED_RESOURCE = "/indicator-rules.yaml";

  /**
   * Loads rules from a file.
   *
   * @param path YAML rule file
   * @return compiled settings
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed
   */
  public ClassifierSettings load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Indicator rule file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Loads the rule file bundled on the classpath, falling back to built-in defaults when it is absent.
   *
   * @return compiled settings
   * @throws IOException when the resource cannot be read
   */
  public ClassifierSettings loadBundled() throws IOException {
    try (InputStream in = IndicatorRulesLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
      if (in == null) {
        return ClassifierSettings.defaults();
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + BUNDLED_RESOURCE);
    }
  }

  ClassifierSettings parse(Reader reader, String source) {
    Object rootObj;
    try {
      rootObj = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse indicator rules at " + source, ex);
    }
    if (rootObj == null) {
      return ClassifierSettings.defaults();
    }
    Map<String, Object> root = asMap(rootObj, "root");
    int version = new IndicatorParams("root", root).integer("version", -1);
    if (version != 1) {
      throw new IllegalArgumentException("Unsupported indicator rule version " + version + " in " + source);
    }

    ConfidenceBands bands = ConfidenceBands.defaults();
    Object bandsNode = root.get("bands");
    if (bandsNode != null) {
      IndicatorParams p = new IndicatorParams("bands", asMap(bandsNode, "bands"));
      bands = new ConfidenceBands(
          p.integer("medium", bands.medium()), p.integer("high", bands.high()), p.integer("confirmed", bands.confirmed()));
    }

    int maxTrackedIps = IpActivityArena.DEFAULT_MAX_TRACKED_IPS;
    int historyPerIp = IpActivityArena.DEFAULT_HISTORY_PER_IP;
    Object activityNode = root.get("activity");
    if (activityNode != null) {
      IndicatorParams p = new IndicatorParams("activity", asMap(activityNode, "activity"));
      maxTrackedIps = p.integer("maxTrackedIps", maxTrackedIps);
      historyPerIp = p.integer("historyPerIp", historyPerIp);
    }

    Map<String, IndicatorParams> params = new LinkedHashMap<>();
    Object indicatorsNode = root.get("indicators");
    if (indicatorsNode != null) {
      for (Map.Entry<String, Object> entry : asMap(indicatorsNode, "indicators").entrySet()) {
        Map<String, Object> values = entry.getValue() == null
            ? Map.of()
            : asMap(entry.getValue(), "indicators." + entry.getKey());
        params.put(entry.getKey(), new IndicatorParams(entry.getKey(), values));
      }
    }
    return new ClassifierSettings(bands, IndicatorCatalog.build(params), maxTrackedIps, historyPerIp);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (!(keyObj instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
