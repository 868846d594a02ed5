package ca.gc.cra.sentinel.application.timeline;

import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureEntry;
import ca.gc.cra.sentinel.domain.timeline.ResourceTiming;
import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Rebuilds a closed capture into a sequential waterfall of resource timings.
 * <p><strong>Why:</strong> Investigators read a capture faster as a timeline than as raw archive entries.</p>
 * <p><strong>Role:</strong> Pure function over a {@link Capture}; independent of the live pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Duration is the sum of timing phases greater than zero.</li>
 *   <li>Each entry starts where the previous one ended, in capture order.</li>
 *   <li>Derive MIME category, transfer size and domain for filtering and sorting.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TimelineReconstructor {
  static final String UNKNOWN_DOMAIN = "unknown";
  static final String OTHER_CATEGORY = "other";

  private static final Logger log = LoggerFactory.getLogger(TimelineReconstructor.class);

  /**
   * Reconstructs the waterfall.
   *
   * @param capture parsed capture; its warnings are carried over
   * @return one timing per capture entry; empty for an empty capture
   */
  public Waterfall reconstruct(Capture capture) {
    Objects.requireNonNull(capture, "capture");
    List<String> warnings = new ArrayList<>(capture.warnings());
    List<ResourceTiming> timings = new ArrayList<>(capture.entries().size());
    double cursor = 0d;
    for (CaptureEntry entry : capture.entries()) {
      double duration = entry.durationMs();
      double start = cursor;
      double end = start + duration;
      timings.add(new ResourceTiming(
          entry.index(),
          entry.url(),
          entry.method(),
          mimeCategory(entry.mimeType()),
          entry.status(),
          size(entry),
          duration,
          start,
          end,
          domain(entry, warnings)));
      cursor = end;
    }
    if (!warnings.isEmpty()) {
      log.debug("Reconstructed waterfall of {} entries with {} warnings", timings.size(), warnings.size());
    }
    return new Waterfall(timings, cursor, warnings);
  }

  static String mimeCategory(String mimeType) {
    if (mimeType == null) {
      return OTHER_CATEGORY;
    }
    int slash = mimeType.indexOf('/');
    String head = (slash >= 0 ? mimeType.substring(0, slash) : mimeType).trim().toLowerCase(Locale.ROOT);
    return head.isEmpty() ? OTHER_CATEGORY : head;
  }

  static long size(CaptureEntry entry) {
    if (entry.responseBodySize() > 0L) {
      return entry.responseBodySize();
    }
    return Math.max(0L, entry.contentSize());
  }

  private static String domain(CaptureEntry entry, List<String> warnings) {
    try {
      String host = new URI(entry.url().trim()).getHost();
      if (host != null && !host.isBlank()) {
        return host.toLowerCase(Locale.ROOT);
      }
    } catch (URISyntaxException ex) {
      log.debug("Unparsable url in capture entry {}", entry.index(), ex);
    }
    warnings.add("entry " + entry.index() + ": cannot determine domain of url '" + entry.url() + "'");
    return UNKNOWN_DOMAIN;
  }
}
