package dev.loxscan.parsing;

// An expression tree node. Computations over the tree (printing, and later
// evaluation) are `Visitor` implementations rather than methods on the nodes.
public abstract class Expr {
  public interface Visitor<R> {
    R visitBinaryExpr(Binary expr);

    R visitGroupingExpr(Grouping expr);

    R visitLiteralExpr(Literal expr);

    R visitUnaryExpr(Unary expr);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  // left operator right, e.g. `1 + 2`
  public static class Binary extends Expr {
    public final Expr left;
    public final Token operator;
    public final Expr right;

    public Binary(Expr left, Token operator, Expr right) {
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryExpr(this);
    }
  }

  // a parenthesized sub-expression
  public static class Grouping extends Expr {
    public final Expr expression;

    public Grouping(Expr expression) { this.expression = expression; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGroupingExpr(this);
    }
  }

  public static class Literal extends Expr {
    // null stands for Lox's nil
    public final LiteralValue value;

    public Literal(LiteralValue value) { this.value = value; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteralExpr(this);
    }
  }

  // a prefix operator applied to one operand, e.g. `-x` or `!ok`
  public static class Unary extends Expr {
    public final Token operator;
    public final Expr right;

    public Unary(Token operator, Expr right) {
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryExpr(this);
    }
  }
}
