package dev.loxscan.parsing;

import static dev.loxscan.parsing.TokenType.*;

import dev.loxscan.ConsoleErrorReporter;
import dev.loxscan.ErrorReporter;
import dev.loxscan.LexError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Scanner {
  public static final Map<String, TokenType> keywords;
  static {
    Map<String, TokenType> table = new HashMap<>();
    table.put("and", AND);
    table.put("class", CLASS);
    table.put("else", ELSE);
    table.put("false", FALSE);
    table.put("for", FOR);
    table.put("fun", FUN);
    table.put("if", IF);
    table.put("nil", NIL);
    table.put("or", OR);
    table.put("print", PRINT);
    table.put("return", RETURN);
    table.put("super", SUPER);
    table.put("this", THIS);
    table.put("true", TRUE);
    table.put("var", VAR);
    table.put("while", WHILE);
    keywords = Collections.unmodifiableMap(table);
  }

  private final String sourceCode;
  private final ErrorReporter reporter;
  private final List<Token> tokens = new ArrayList<>();
  private final List<LexError> errors = new ArrayList<>();
  // `start` & `current` are meant to index `sourceCode` and they
  // represent the bounds of the token currently under examination.
  private int start = 0;
  private int current = 0;
  // `line` starts at 1 (and not 0) to be user friendly
  private int line = 1;
  private boolean scanned = false;

  public Scanner(String sourceCode) {
    this(sourceCode, new ConsoleErrorReporter());
  }

  public Scanner(String sourceCode, ErrorReporter reporter) {
    this.sourceCode = Objects.requireNonNull(sourceCode, "sourceCode");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
  }

  public static ScanResult scan(String sourceCode) {
    return new Scanner(sourceCode).scanTokens();
  }

  public static ScanResult scan(String sourceCode, ErrorReporter reporter) {
    return new Scanner(sourceCode, reporter).scanTokens();
  }

  // A scanner holds the cursor state of one pass over `sourceCode`, so it
  // can only be run once.
  public ScanResult scanTokens() {
    if (scanned)
      throw new IllegalStateException("scanner has already been run");
    scanned = true;

    while (!isAtEnd()) {
      start = current;
      scanToken();
    }
    tokens.add(new Token(EOF, /* lexeme: */ "", /* literal: */ null, line));
    return new ScanResult(tokens, errors);
  }

  private void scanToken() {
    char c = advance();
    switch (c) {
    case '(':
      addToken(LEFT_PAREN);
      break;
    case ')':
      addToken(RIGHT_PAREN);
      break;
    case '{':
      addToken(LEFT_BRACE);
      break;
    case '}':
      addToken(RIGHT_BRACE);
      break;
    case ',':
      addToken(COMMA);
      break;
    case '.':
      addToken(DOT);
      break;
    case '-':
      addToken(MINUS);
      break;
    case '+':
      addToken(PLUS);
      break;
    case ';':
      addToken(SEMICOLON);
      break;
    case '*':
      addToken(STAR);
      break;

    case '!':
      addToken(match('=') ? BANG_EQUAL : BANG);
      break;
    case '=':
      addToken(match('=') ? EQUAL_EQUAL : EQUAL);
      break;
    case '<':
      addToken(match('=') ? LESS_EQUAL : LESS);
      break;
    case '>':
      addToken(match('=') ? GREATER_EQUAL : GREATER);
      break;
    case '/':
      if (match('/')) {
        singleLineComment();
      } else {
        addToken(SLASH);
      }
      break;

    case ' ':
    case '\r':
    case '\t':
      // ignore whitespace;
      break;

    case '\n':
      line++;
      break;

    case '"':
      string();
      break;

    default:
      if (isDigit(c)) {
        number();
      } else if (isAlpha(c)) {
        identifier();
      } else {
        unexpectedCharacter(c);
      }
    }
  }

  // Scan (and ignore the contents of) a single-line comment.
  //
  // pre-condition: the opening delimiter (//) has just been consumed
  // post-condition: all characters up to a newline (or EOF) have been
  //    consumed; the newline itself is left for `scanToken` to count.
  private void singleLineComment() {
    while (peek() != '\n' && !isAtEnd())
      advance();
  }

  private void identifier() {
    while (isAlphaNumeric(peek()))
      advance();

    String text = sourceCode.substring(start, current);
    TokenType type = keywords.getOrDefault(text, IDENTIFIER);
    addToken(type);
  }

  private void string() {
    while (peek() != '"' && !isAtEnd()) {
      // strings in Lox are multi-line by default
      if (peek() == '\n')
        line++;
      advance();
    }
    if (isAtEnd()) {
      error(LexError.unterminatedString(line));
      return;
    }
    // the closing "
    advance();

    // trim the surrounding quotes; there are no escape sequences in Lox
    String value = sourceCode.substring(start + 1, current - 1);
    addToken(STRING, LiteralValue.text(value));
  }

  private void number() {
    // both integers and decimals start with digits...
    while (isDigit(peek()))
      advance();

    // we're looking at a decimal number...
    if (peek() == '.' && isDigit(peekAhead(1))) {
      // consume the "."
      advance();
      while (isDigit(peek()))
        advance();
    }
    // however, Lox uses floating point (i.e., double) to represent both:
    double value = Double.parseDouble(sourceCode.substring(start, current));
    addToken(NUMBER, LiteralValue.number(value));
  }

  private void unexpectedCharacter(char c) {
    // a character outside the BMP takes two chars in a Java string; consume
    // the low surrogate too so it's reported once
    if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek()))
      advance();
    error(LexError.unexpectedCharacter(line));
  }

  private void error(LexError error) {
    errors.add(error);
    reporter.report(error);
  }

  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (sourceCode.charAt(current) != expected)
      return false;
    current++;
    return true;
  }

  // returns the next character to be consumed
  private char peek() { return peekAhead(0); }

  // returns the character to be consumed `distance` chars ahead
  private char peekAhead(int distance) {
    if (current + distance >= sourceCode.length())
      return '\0';
    return sourceCode.charAt(current + distance);
  }

  private boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

  private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // returns the previously current character and advances one char forward
  private char advance() { return sourceCode.charAt(current++); }

  private void addToken(TokenType type) { addToken(type, /* literal: */ null); }

  private void addToken(TokenType type, LiteralValue literal) {
    String text = sourceCode.substring(start, current);
    tokens.add(new Token(type, text, literal, line));
  }
}
