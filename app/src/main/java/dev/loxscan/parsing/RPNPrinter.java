package dev.loxscan.parsing;

// RPN stands for Reverse Polish Notation
// See https://en.wikipedia.org/wiki/Reverse_Polish_notation
//
// Postfix needs no parentheses, so groupings print as their inner expression:
// `(1 + 2) * (4 - 3)` becomes `1 2 + 4 3 - *`.
public class RPNPrinter implements Expr.Visitor<String> {
  public String print(Expr expr) { return expr.accept(this); }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return toRPN(expr.operator.lexeme, expr.left, expr.right);
  }

  @Override
  public String visitGroupingExpr(Expr.Grouping expr) {
    return expr.expression.accept(this);
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    if (expr.value == null)
      return "nil";
    return expr.value.toString();
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    return toRPN(expr.operator.lexeme, expr.right);
  }

  private String toRPN(String operator, Expr... operands) {
    StringBuilder builder = new StringBuilder();
    for (Expr operand : operands) {
      builder.append(operand.accept(this));
      builder.append(" ");
    }
    builder.append(operator);
    return builder.toString();
  }
}
