package dev.loxscan;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LexErrorTest {
  @Test
  void rendersWithoutPlace() {
    LexError error = new LexError(3, "Unexpected character.");

    assertEquals("[line 3] Error: Unexpected character.", error.toString());
  }

  @Test
  void placeIsAppendedWithoutSeparator() {
    assertEquals("[line 1] Error at 'x': oops",
                 new LexError(1, " at 'x'", "oops").toString());
    assertEquals("[line 1] Errorhere: oops",
                 new LexError(1, "here", "oops").toString());
  }

  @Test
  void missingPlaceDefaultsToEmpty() {
    assertEquals("", new LexError(1, null, "oops").where);
  }

  @Test
  void factoriesUseTheFixedMessages() {
    assertEquals("[line 2] Error: Unterminated string.",
                 LexError.unterminatedString(2).toString());
    assertEquals("[line 7] Error: Unexpected character.",
                 LexError.unexpectedCharacter(7).toString());
  }

  @Test
  void consoleReporterPrintsOneErrorPerLine() {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream stream = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    ErrorReporter reporter = new ConsoleErrorReporter(stream);

    reporter.report(LexError.unexpectedCharacter(1));
    reporter.report(LexError.unterminatedString(4));

    String expected = "[line 1] Error: Unexpected character."
        + System.lineSeparator() + "[line 4] Error: Unterminated string."
        + System.lineSeparator();
    assertEquals(expected, buffer.toString(StandardCharsets.UTF_8));
  }
}
