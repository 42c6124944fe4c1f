package viewcheck.expr;

import java.util.List;
import java.util.Objects;

/** Boolean-sorted expressions. */
public sealed interface BoolExpr<V> extends Expr<V>
    permits BoolExpr.True,
        BoolExpr.False,
        BoolExpr.Var,
        BoolExpr.And,
        BoolExpr.Or,
        BoolExpr.Implies,
        BoolExpr.Eq,
        BoolExpr.Gt,
        BoolExpr.Ge,
        BoolExpr.Le,
        BoolExpr.Lt,
        BoolExpr.Not {

  record True<V>() implements BoolExpr<V> {
    @Override
    public String toString() {
      return "true";
    }
  }

  record False<V>() implements BoolExpr<V> {
    @Override
    public String toString() {
      return "false";
    }
  }

  record Var<V>(V var) implements BoolExpr<V> {
    public Var {
      Objects.requireNonNull(var, "var");
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  record And<V>(List<BoolExpr<V>> operands) implements BoolExpr<V> {
    public And {
      operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
      return Exprs.nary("&&", operands);
    }
  }

  record Or<V>(List<BoolExpr<V>> operands) implements BoolExpr<V> {
    public Or {
      operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
      return Exprs.nary("||", operands);
    }
  }

  record Implies<V>(BoolExpr<V> lhs, BoolExpr<V> rhs) implements BoolExpr<V> {
    public Implies {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
      return "(" + lhs + " => " + rhs + ")";
    }
  }

  /** Equality between two expressions of the same sort. */
  record Eq<V>(Expr<V> lhs, Expr<V> rhs) implements BoolExpr<V> {
    public Eq {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
      if ((lhs instanceof IntExpr) != (rhs instanceof IntExpr)) {
        throw new IllegalArgumentException("equality between different sorts: " + lhs + ", " + rhs);
      }
    }

    @Override
    public String toString() {
      return "(" + lhs + " == " + rhs + ")";
    }
  }

  record Gt<V>(IntExpr<V> lhs, IntExpr<V> rhs) implements BoolExpr<V> {
    public Gt {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
      return "(" + lhs + " > " + rhs + ")";
    }
  }

  record Ge<V>(IntExpr<V> lhs, IntExpr<V> rhs) implements BoolExpr<V> {
    public Ge {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
      return "(" + lhs + " >= " + rhs + ")";
    }
  }

  record Le<V>(IntExpr<V> lhs, IntExpr<V> rhs) implements BoolExpr<V> {
    public Le {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
      return "(" + lhs + " <= " + rhs + ")";
    }
  }

  record Lt<V>(IntExpr<V> lhs, IntExpr<V> rhs) implements BoolExpr<V> {
    public Lt {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
      return "(" + lhs + " < " + rhs + ")";
    }
  }

  record Not<V>(BoolExpr<V> operand) implements BoolExpr<V> {
    public Not {
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }
}
