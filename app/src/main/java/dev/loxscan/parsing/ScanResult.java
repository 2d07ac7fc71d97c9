package dev.loxscan.parsing;

import dev.loxscan.LexError;
import java.util.Collections;
import java.util.List;

// What a single scan produced: the tokens (always terminated by exactly one
// EOF token) and every error that was reported along the way.
public final class ScanResult {
  private final List<Token> tokens;
  private final List<LexError> errors;

  ScanResult(List<Token> tokens, List<LexError> errors) {
    this.tokens = Collections.unmodifiableList(tokens);
    this.errors = Collections.unmodifiableList(errors);
  }

  public List<Token> tokens() { return tokens; }

  public List<LexError> errors() { return errors; }

  public boolean hadError() { return !errors.isEmpty(); }
}
