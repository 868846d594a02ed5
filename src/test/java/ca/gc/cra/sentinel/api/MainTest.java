package ca.gc.cra.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: sentinel"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String out = buffer.toString();
    assertTrue(out.contains("waterfall"));
    assertTrue(out.contains("watch"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"sniff"}));
    assertTrue(buffer.toString().contains("usage: sentinel"));
  }

  @Test
  void helpAfterCommandIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"Replay", "--help"}));
    assertTrue(buffer.toString().contains("SENTINEL replay"));
  }

  @Test
  void exitCodesMatchShellConventions() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
    assertTrue(ExitCode.IO_ERROR.failed());
    assertEquals("invalid arguments", ExitCode.INVALID_ARGS.description());
  }
}
