package dev.loxscan.parsing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  // null for every type but STRING and NUMBER
  public final LiteralValue literal;
  public final int line;

  public Token(TokenType type, String lexeme, LiteralValue literal, int line) {
    this.type = type;
    this.lexeme = lexeme;
    this.literal = literal;
    this.line = line;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /* literal: */ null, /* line: */ 1);
  }

  @Override
  public String toString() {
    String literalText = (literal == null) ? "" : literal.toString();
    return type + " " + lexeme + " " + literalText;
  }
}
