package ca.gc.cra.sentinel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final Logger app = context.getLogger(LoggingConfigurator.APPLICATION_LOGGER);
  private final Level original = app.getLevel();

  @AfterEach
  void restore() {
    app.setLevel(original);
  }

  @Test
  void verboseRaisesOnlyApplicationLoggers() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, context.getLogger("ca.gc.cra.sentinel.api.Main").getEffectiveLevel());
    assertNotEquals(Level.DEBUG, context.getLogger("org.apache.kafka.clients").getEffectiveLevel());
  }
}
