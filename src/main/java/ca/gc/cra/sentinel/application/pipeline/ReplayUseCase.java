package ca.gc.cra.sentinel.application.pipeline;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureEntry;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import ca.gc.cra.sentinel.logging.Logs;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Replays a closed capture through the live monitoring pipeline.
 * <p><strong>Why:</strong> Lets analysts evaluate indicator rules and block rules against recorded traffic
 * without a monitored edge.</p>
 * <p><strong>Role:</strong> Application-layer use case bridging {@link Capture} entries into {@link RawExchange}
 * observations.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded batch execution.</p>
 * <p><strong>Observability:</strong> Emits {@code replay.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class ReplayUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReplayUseCase.class);
  static final Duration SUBMIT_TIMEOUT = Duration.ofSeconds(30);

  private final MonitoringPipeline pipeline;
  private final MetricsPort metrics;
  private final String peerAddress;

  /**
   * @param pipeline started pipeline receiving the observations
   * @param metrics metrics sink
   * @param peerAddress peer address assigned to every replayed exchange; captures do not record the client
   */
  public ReplayUseCase(MonitoringPipeline pipeline, MetricsPort metrics, String peerAddress) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.peerAddress = Objects.requireNonNull(peerAddress, "peerAddress");
  }

  /**
   * Submits every capture entry in capture order.
   *
   * @param capture parsed capture
   * @return number of entries accepted by the pipeline
   * @throws InterruptedException when interrupted while waiting for queue space
   */
  public int replay(Capture capture) throws InterruptedException {
    Objects.requireNonNull(capture, "capture");
    for (String warning : capture.warnings()) {
      log.warn("Capture warning: {}", warning);
    }
    int accepted = 0;
    for (CaptureEntry entry : capture.entries()) {
      if (pipeline.submit(toRawExchange(entry, peerAddress), SUBMIT_TIMEOUT)) {
        accepted++;
        metrics.increment("replay.entry.submitted");
      } else {
        metrics.increment("replay.entry.dropped");
      }
    }
    log.info("Replayed {} of {} capture entries", accepted, capture.entries().size());
    return accepted;
  }

  /**
   * Converts a capture entry into an edge observation. Recorded bodies are carried over with the sizes the
   * capture declared, so an entry that kept no text still reports its original size.
   *
   * @param entry capture entry
   * @param peerAddress peer address to assign
   * @return observation
   */
  static RawExchange toRawExchange(CaptureEntry entry, String peerAddress) {
    String path = "/";
    String query = "";
    try {
      URI uri = new URI(entry.url());
      if (uri.getRawPath() != null && !uri.getRawPath().isEmpty()) {
        path = uri.getRawPath();
      }
      if (uri.getRawQuery() != null) {
        query = uri.getRawQuery();
      }
    } catch (URISyntaxException ex) {
      log.debug("Unparsable capture URL {}; replaying as /", Logs.printable(entry.url(), 256));
    }
    return RawExchange.builder()
        .timestampMillis(parseTimestamp(entry.startedDateTime()))
        .peerAddress(peerAddress)
        .method(entry.method())
        .path(path)
        .query(query)
        .requestHeaders(entry.requestHeaders())
        .requestBody(entry.requestBody())
        .requestBodySize(entry.requestBodySize())
        .responseStatus(entry.status())
        .responseHeaders(entry.responseHeaders())
        .responseBody(entry.responseBody())
        .responseBodySize(entry.declaredResponseSize())
        .responseTimeMs(entry.durationMs())
        .build();
  }

  private static long parseTimestamp(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0L;
    }
    try {
      return OffsetDateTime.parse(raw.trim()).toInstant().toEpochMilli();
    } catch (DateTimeParseException ex) {
      return 0L;
    }
  }
}
