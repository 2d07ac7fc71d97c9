package dev.loxscan;

// Receives errors at the point they're detected. The scanner keeps going
// after reporting, so a reporter may see many errors per run.
@FunctionalInterface
public interface ErrorReporter {
  void report(LexError error);
}
