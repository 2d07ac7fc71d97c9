package dev.loxscan.parsing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AstPrinterTest {
  private final AstPrinter printer = new AstPrinter();

  @Test
  void canPrintAST() {
    Expr expression = new Expr.Binary(
        new Expr.Unary(new Token(TokenType.MINUS, "-"),
                       new Expr.Literal(LiteralValue.number(123))),
        new Token(TokenType.STAR, "*"),
        new Expr.Grouping(new Expr.Literal(LiteralValue.number(45.67))));

    String ast = printer.print(expression);

    assertEquals("(* (- 123) (group 45.67))", ast);
  }

  @Test
  void missingLiteralValueIsNil() {
    assertEquals("nil", printer.print(new Expr.Literal(null)));
  }

  @Test
  void textLiteralsPrintWithoutQuotes() {
    Expr expression = new Expr.Binary(
        new Expr.Literal(LiteralValue.text("a b")),
        new Token(TokenType.PLUS, "+"),
        new Expr.Literal(LiteralValue.text("c")));

    assertEquals("(+ a b c)", printer.print(expression));
  }

  @Test
  void canPrintNestedGroupings() {
    Expr expression = new Expr.Unary(
        new Token(TokenType.BANG, "!"),
        new Expr.Grouping(new Expr.Grouping(new Expr.Literal(null))));

    assertEquals("(! (group (group nil)))", printer.print(expression));
  }

  @Test
  void canPrintTreeBuiltFromScannedTokens() {
    // 1 >= 2 == nil, as a parser would build it
    ScanResult result = Scanner.scan("1 >= 2 == nil", error -> fail(error.toString()));
    Token one = result.tokens().get(0);
    Token greaterEqual = result.tokens().get(1);
    Token two = result.tokens().get(2);
    Token equalEqual = result.tokens().get(3);

    Expr expression = new Expr.Binary(
        new Expr.Binary(new Expr.Literal(one.literal), greaterEqual,
                        new Expr.Literal(two.literal)),
        equalEqual, new Expr.Literal(null));

    assertThat(printer.print(expression), is("(== (>= 1 2) nil)"));
  }

  @Test
  void visitorsCanComputeNonTextResults() {
    // a traversal with a different result type: count the nodes in the tree
    Expr.Visitor<Integer> counter = new Expr.Visitor<Integer>() {
      @Override
      public Integer visitBinaryExpr(Expr.Binary expr) {
        return 1 + expr.left.accept(this) + expr.right.accept(this);
      }

      @Override
      public Integer visitGroupingExpr(Expr.Grouping expr) {
        return 1 + expr.expression.accept(this);
      }

      @Override
      public Integer visitLiteralExpr(Expr.Literal expr) {
        return 1;
      }

      @Override
      public Integer visitUnaryExpr(Expr.Unary expr) {
        return 1 + expr.right.accept(this);
      }
    };

    Expr expression = new Expr.Binary(
        new Expr.Unary(new Token(TokenType.MINUS, "-"), new Expr.Literal(null)),
        new Token(TokenType.STAR, "*"),
        new Expr.Grouping(new Expr.Literal(LiteralValue.number(2))));

    assertEquals(5, expression.accept(counter));
  }
}
