package dev.loxscan;

import java.io.PrintStream;

public class ConsoleErrorReporter implements ErrorReporter {
  private final PrintStream stream;

  public ConsoleErrorReporter() { this(System.err); }

  public ConsoleErrorReporter(PrintStream stream) { this.stream = stream; }

  @Override
  public void report(LexError error) {
    stream.println(error);
    stream.flush();
  }
}
