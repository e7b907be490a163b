package minipy;

abstract class Expr {
  interface Visitor<R> {
    R visitBinOpExpr(BinOp expr);
    R visitNumberLiteralExpr(NumberLiteral expr);
    R visitStringLiteralExpr(StringLiteral expr);
    R visitNameExpr(Name expr);
  }

  // Closed: every kind of expression is declared here.
  private Expr() {}

  abstract <R> R accept(Visitor<R> visitor);

  static final class BinOp extends Expr {
    BinOp(Expr left, Operator op, Expr right) {
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinOpExpr(this);
    }

    final Expr left;
    final Operator op;
    final Expr right;
  }

  static final class NumberLiteral extends Expr {
    NumberLiteral(long value) {
      this.value = value;
    }

    @Override
    <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumberLiteralExpr(this);
    }

    final long value;
  }

  static final class StringLiteral extends Expr {
    StringLiteral(String value) {
      this.value = value;
    }

    @Override
    <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringLiteralExpr(this);
    }

    final String value;
  }

  static final class Name extends Expr {
    Name(String id) {
      this.id = id;
    }

    @Override
    <R> R accept(Visitor<R> visitor) {
      return visitor.visitNameExpr(this);
    }

    final String id;
  }
}
