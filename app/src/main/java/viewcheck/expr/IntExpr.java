package viewcheck.expr;

import java.util.List;
import java.util.Objects;

/** Integer-sorted expressions. */
public sealed interface IntExpr<V> extends Expr<V>
    permits IntExpr.Const, IntExpr.Var, IntExpr.Add, IntExpr.Sub, IntExpr.Mul, IntExpr.Div {

  record Const<V>(long value) implements IntExpr<V> {
    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  record Var<V>(V var) implements IntExpr<V> {
    public Var {
      Objects.requireNonNull(var, "var");
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  record Add<V>(List<IntExpr<V>> operands) implements IntExpr<V> {
    public Add {
      operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
      return Exprs.nary("+", operands);
    }
  }

  record Sub<V>(List<IntExpr<V>> operands) implements IntExpr<V> {
    public Sub {
      operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
      return Exprs.nary("-", operands);
    }
  }

  record Mul<V>(List<IntExpr<V>> operands) implements IntExpr<V> {
    public Mul {
      operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
      return Exprs.nary("*", operands);
    }
  }

  record Div<V>(IntExpr<V> left, IntExpr<V> right) implements IntExpr<V> {
    public Div {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + " / " + right + ")";
    }
  }
}
