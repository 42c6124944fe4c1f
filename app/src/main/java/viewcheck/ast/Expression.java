package viewcheck.ast;

import java.util.Objects;

/** An untyped surface expression. Sorts are assigned by the modeller. */
public sealed interface Expression
    permits Expression.True, Expression.False, Expression.Int, Expression.Ident, Expression.BinOp {

  record True() implements Expression {
    @Override
    public String toString() {
      return "true";
    }
  }

  record False() implements Expression {
    @Override
    public String toString() {
      return "false";
    }
  }

  record Int(long value) implements Expression {
    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  record Ident(String name) implements Expression {
    public Ident {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record BinOp(Bop op, Expression lhs, Expression rhs) implements Expression {
    public BinOp {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
      return "(" + lhs + " " + op + " " + rhs + ")";
    }
  }

  static Expression ident(String name) {
    return new Ident(name);
  }

  static Expression num(long value) {
    return new Int(value);
  }

  static Expression bin(Bop op, Expression lhs, Expression rhs) {
    return new BinOp(op, lhs, rhs);
  }
}
