package viewcheck.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Leaf builders and simplifying constructors for {@link Expr} trees. */
public final class Exprs {
  private Exprs() {}

  public static <V> BoolExpr<V> bTrue() {
    return new BoolExpr.True<>();
  }

  public static <V> BoolExpr<V> bFalse() {
    return new BoolExpr.False<>();
  }

  public static <V> BoolExpr<V> bVar(V var) {
    return new BoolExpr.Var<>(var);
  }

  public static <V> IntExpr<V> aInt(long value) {
    return new IntExpr.Const<>(value);
  }

  public static <V> IntExpr<V> aVar(V var) {
    return new IntExpr.Var<>(var);
  }

  @SafeVarargs
  public static <V> IntExpr<V> aAdd(IntExpr<V>... operands) {
    return new IntExpr.Add<>(Arrays.asList(operands));
  }

  @SafeVarargs
  public static <V> IntExpr<V> aSub(IntExpr<V>... operands) {
    return new IntExpr.Sub<>(Arrays.asList(operands));
  }

  public static boolean isTrue(BoolExpr<?> expr) {
    return expr instanceof BoolExpr.True;
  }

  public static boolean isFalse(BoolExpr<?> expr) {
    return expr instanceof BoolExpr.False;
  }

  @SafeVarargs
  public static <V> BoolExpr<V> mkAnd(BoolExpr<V>... conjuncts) {
    return mkAnd(Arrays.asList(conjuncts));
  }

  /**
   * Conjunction that flattens nested conjunctions, drops {@code true} and collapses to {@code
   * false} as soon as one conjunct is {@code false}. The empty conjunction is {@code true}.
   */
  public static <V> BoolExpr<V> mkAnd(List<BoolExpr<V>> conjuncts) {
    List<BoolExpr<V>> flat = new ArrayList<>();
    for (BoolExpr<V> conjunct : conjuncts) {
      if (isFalse(conjunct)) {
        return bFalse();
      }
      if (conjunct instanceof BoolExpr.And<V> and) {
        BoolExpr<V> inner = mkAnd(and.operands());
        if (isFalse(inner)) {
          return inner;
        }
        if (inner instanceof BoolExpr.And<V> innerAnd) {
          flat.addAll(innerAnd.operands());
        } else if (!isTrue(inner)) {
          flat.add(inner);
        }
      } else if (!isTrue(conjunct)) {
        flat.add(conjunct);
      }
    }
    if (flat.isEmpty()) {
      return bTrue();
    }
    return flat.size() == 1 ? flat.get(0) : new BoolExpr.And<>(flat);
  }

  @SafeVarargs
  public static <V> BoolExpr<V> mkOr(BoolExpr<V>... disjuncts) {
    return mkOr(Arrays.asList(disjuncts));
  }

  /** Dual of {@link #mkAnd(List)}. The empty disjunction is {@code false}. */
  public static <V> BoolExpr<V> mkOr(List<BoolExpr<V>> disjuncts) {
    List<BoolExpr<V>> flat = new ArrayList<>();
    for (BoolExpr<V> disjunct : disjuncts) {
      if (isTrue(disjunct)) {
        return bTrue();
      }
      if (disjunct instanceof BoolExpr.Or<V> or) {
        flat.addAll(or.operands());
      } else if (!isFalse(disjunct)) {
        flat.add(disjunct);
      }
    }
    if (flat.isEmpty()) {
      return bFalse();
    }
    return flat.size() == 1 ? flat.get(0) : new BoolExpr.Or<>(flat);
  }

  public static <V> BoolExpr<V> mkNot(BoolExpr<V> operand) {
    if (isTrue(operand)) {
      return bFalse();
    }
    if (isFalse(operand)) {
      return bTrue();
    }
    if (operand instanceof BoolExpr.Not<V> not) {
      return not.operand();
    }
    return new BoolExpr.Not<>(operand);
  }

  public static <V> BoolExpr<V> mkImplies(BoolExpr<V> lhs, BoolExpr<V> rhs) {
    if (isTrue(lhs)) {
      return rhs;
    }
    if (isFalse(lhs) || isTrue(rhs)) {
      return bTrue();
    }
    return new BoolExpr.Implies<>(lhs, rhs);
  }

  public static <V> BoolExpr<V> mkEq(Expr<V> lhs, Expr<V> rhs) {
    return new BoolExpr.Eq<>(lhs, rhs);
  }

  static String nary(String op, List<?> operands) {
    if (operands.isEmpty()) {
      return "(" + op + ")";
    }
    return operands.stream()
        .map(Object::toString)
        .collect(Collectors.joining(" " + op + " ", "(", ")"));
  }
}
