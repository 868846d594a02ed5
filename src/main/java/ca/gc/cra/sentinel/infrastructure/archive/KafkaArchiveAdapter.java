package ca.gc.cra.sentinel.infrastructure.archive;

import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.infrastructure.json.MonitorJson;
import ca.gc.cra.sentinel.validation.Net;
import ca.gc.cra.sentinel.validation.Strings;
import java.io.IOException;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArchivePort} that publishes every analyzed entry to Kafka as JSON.
 * <p><strong>Why:</strong> The in-memory window is bounded; long-term retention and offline analysis read the
 * archive topic.</p>
 * <p><strong>Role:</strong> Infrastructure adapter; records are keyed by source address so one client's traffic
 * stays ordered within a partition.</p>
 * <p><strong>Thread-safety:</strong> Kafka producers are thread-safe; all workers share one instance.</p>
 *
 * @since 0.1.0
 */
public final class KafkaArchiveAdapter implements ArchivePort {
  private static final Logger log = LoggerFactory.getLogger(KafkaArchiveAdapter.class);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final MetricsPort metrics;

  /**
   * Creates an adapter connected to {@code bootstrapServers}.
   *
   * @param bootstrapServers comma separated {@code host:port} list
   * @param topic archive topic
   * @param metrics metrics sink
   */
  public KafkaArchiveAdapter(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  /**
   * Creates an adapter around an existing producer (primarily for tests).
   *
   * @param producer kafka producer
   * @param topic archive topic
   * @param metrics metrics sink
   */
  public KafkaArchiveAdapter(Producer<String, byte[]> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void archive(AnalyzedEntry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    byte[] payload = MonitorJson.render(gen -> MonitorJson.writeEntry(gen, entry));
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, entry.entry().sourceIp(), payload);
    producer.send(record, (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("archive.kafka.failed");
        log.error("Kafka archive failure for entry {} on topic {}", entry.entry().id(), topic, ex);
      } else {
        metrics.increment("archive.kafka.sent");
      }
    });
  }

  public String topic() {
    return topic;
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } catch (Exception ex) {
      log.warn("Kafka producer flush failed during shutdown", ex);
    } finally {
      producer.close();
    }
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, Net.validateHostPortList(bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, "sentinel-archive");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
