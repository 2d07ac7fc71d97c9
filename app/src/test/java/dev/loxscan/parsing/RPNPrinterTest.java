package dev.loxscan.parsing;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RPNPrinterTest {
  private static Expr.Literal number(double value) {
    return new Expr.Literal(LiteralValue.number(value));
  }

  @Test
  void canPrintInRPN() {
    // (1 + 2) * (4 - 3)
    Expr expression = new Expr.Binary(
        new Expr.Grouping(new Expr.Binary(
            number(1), new Token(TokenType.PLUS, "+"), number(2))),
        new Token(TokenType.STAR, "*"),
        new Expr.Grouping(new Expr.Binary(
            number(4), new Token(TokenType.MINUS, "-"), number(3))));

    RPNPrinter printer = new RPNPrinter();
    String rpn = printer.print(expression);

    assertEquals("1 2 + 4 3 - *", rpn);
  }

  @Test
  void unaryOperatorFollowsItsOperand() {
    Expr expression = new Expr.Unary(
        new Token(TokenType.BANG, "!"), new Expr.Literal(null));

    assertEquals("nil !", new RPNPrinter().print(expression));
  }
}
