package ca.gc.cra.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import ca.gc.cra.sentinel.testutil.CaptureFixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ReplayCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(ReplayCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void replaysCaptureAndPrintsSummary() throws IOException {
    Path har = CaptureFixtures.writeSample(tempDir);

    ExitCode code = ReplayCli.run(new String[] {"in=" + har, "peerAddress=192.0.2.10", "workers=2"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Entries replayed : 2 of 2"), out);
    assertTrue(out.contains("Requests counted : 2"), out);
    assertTrue(out.contains("Denied           : 0"), out);
    assertTrue(out.contains("192.0.2.10"), out);
  }

  @Test
  void invalidPeerAddressIsRejected() throws IOException {
    Path har = CaptureFixtures.writeSample(tempDir);

    ExitCode code = ReplayCli.run(new String[] {"in=" + har, "peerAddress=not-an-ip"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: replay"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().startsWith("Invalid replay configuration")));
  }

  @Test
  void missingConfigFileIsInvalidArgs() throws IOException {
    Path har = CaptureFixtures.writeSample(tempDir);
    ExitCode code = ReplayCli.run(new String[] {"in=" + har, "config=" + tempDir.resolve("absent.yaml")});
    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedYamlIsConfigError() throws IOException {
    Path har = CaptureFixtures.writeSample(tempDir);
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), "replay: [unclosed\n");
    ExitCode code = ReplayCli.run(new String[] {"in=" + har, "config=" + yaml});
    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void yamlValuesApplyUnlessOverridden() throws IOException {
    Path har = CaptureFixtures.writeSample(tempDir);
    Path yaml = Files.writeString(tempDir.resolve("replay.yaml"), """
        replay:
          peerAddress: 198.51.100.1
          top: 5
        """);

    ExitCode code = ReplayCli.run(new String[] {"in=" + har, "config=" + yaml, "peerAddress=198.51.100.2"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("198.51.100.2"));
  }
}
