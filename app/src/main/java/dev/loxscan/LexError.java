package dev.loxscan;

// A lexical error found while scanning. Errors don't stop the scanner: each
// one is reported as soon as it's found and scanning resumes right after it.
public final class LexError {
  public static final String UNEXPECTED_CHARACTER = "Unexpected character.";
  public static final String UNTERMINATED_STRING = "Unterminated string.";

  public final int line;
  // appended verbatim after "Error", so callers supply any leading space
  // themselves (e.g. " at 'x'")
  public final String where;
  public final String message;

  public LexError(int line, String message) {
    this(line, /* where: */ "", message);
  }

  public LexError(int line, String where, String message) {
    this.line = line;
    this.where = (where == null) ? "" : where;
    this.message = message;
  }

  public static LexError unexpectedCharacter(int line) {
    return new LexError(line, UNEXPECTED_CHARACTER);
  }

  public static LexError unterminatedString(int line) {
    return new LexError(line, UNTERMINATED_STRING);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof LexError))
      return false;
    LexError that = (LexError)other;
    return line == that.line && where.equals(that.where) &&
        message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * line + where.hashCode()) + message.hashCode();
  }

  @Override
  public String toString() {
    return "[line " + line + "] Error" + where + ": " + message;
  }
}
