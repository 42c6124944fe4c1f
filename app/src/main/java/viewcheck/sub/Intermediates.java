package viewcheck.sub;

import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.IntExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

/** Finds the next free intermediate stage of an expression. */
public final class Intermediates {
  private Intermediates() {}

  /**
   * One more than the highest {@link MarkedVar.Intermediate} stage anywhere in {@code expr},
   * including inside symbolic parameter lists; 0 if there is none.
   */
  public static long next(Expr<Sym<MarkedVar>> expr) {
    if (expr instanceof IntExpr<Sym<MarkedVar>> i) {
      return nextInt(i);
    }
    return nextBool((BoolExpr<Sym<MarkedVar>>) expr);
  }

  public static long nextInt(IntExpr<Sym<MarkedVar>> expr) {
    if (expr instanceof IntExpr.Var<Sym<MarkedVar>> v) {
      return ofVar(v.var());
    }
    if (expr instanceof IntExpr.Const) {
      return 0L;
    }
    if (expr instanceof IntExpr.Add<Sym<MarkedVar>> add) {
      return maxInts(add.operands());
    }
    if (expr instanceof IntExpr.Sub<Sym<MarkedVar>> sub) {
      return maxInts(sub.operands());
    }
    if (expr instanceof IntExpr.Mul<Sym<MarkedVar>> mul) {
      return maxInts(mul.operands());
    }
    IntExpr.Div<Sym<MarkedVar>> div = (IntExpr.Div<Sym<MarkedVar>>) expr;
    return Math.max(nextInt(div.left()), nextInt(div.right()));
  }

  public static long nextBool(BoolExpr<Sym<MarkedVar>> expr) {
    if (expr instanceof BoolExpr.Var<Sym<MarkedVar>> v) {
      return ofVar(v.var());
    }
    if (expr instanceof BoolExpr.And<Sym<MarkedVar>> and) {
      return maxBools(and.operands());
    }
    if (expr instanceof BoolExpr.Or<Sym<MarkedVar>> or) {
      return maxBools(or.operands());
    }
    if (expr instanceof BoolExpr.Implies<Sym<MarkedVar>> imp) {
      return Math.max(nextBool(imp.lhs()), nextBool(imp.rhs()));
    }
    if (expr instanceof BoolExpr.Not<Sym<MarkedVar>> not) {
      return nextBool(not.operand());
    }
    if (expr instanceof BoolExpr.Eq<Sym<MarkedVar>> eq) {
      return Math.max(next(eq.lhs()), next(eq.rhs()));
    }
    if (expr instanceof BoolExpr.Gt<Sym<MarkedVar>> gt) {
      return Math.max(nextInt(gt.lhs()), nextInt(gt.rhs()));
    }
    if (expr instanceof BoolExpr.Ge<Sym<MarkedVar>> ge) {
      return Math.max(nextInt(ge.lhs()), nextInt(ge.rhs()));
    }
    if (expr instanceof BoolExpr.Le<Sym<MarkedVar>> le) {
      return Math.max(nextInt(le.lhs()), nextInt(le.rhs()));
    }
    if (expr instanceof BoolExpr.Lt<Sym<MarkedVar>> lt) {
      return Math.max(nextInt(lt.lhs()), nextInt(lt.rhs()));
    }
    // true, false
    return 0L;
  }

  private static long ofVar(Sym<MarkedVar> var) {
    if (var instanceof Sym.Reg<MarkedVar> reg) {
      return reg.var() instanceof MarkedVar.Intermediate stage ? stage.stage() + 1 : 0L;
    }
    long max = 0L;
    for (Expr<Sym<MarkedVar>> param : ((Sym.Symbol<MarkedVar>) var).params()) {
      max = Math.max(max, next(param));
    }
    return max;
  }

  private static long maxInts(Iterable<IntExpr<Sym<MarkedVar>>> operands) {
    long max = 0L;
    for (IntExpr<Sym<MarkedVar>> operand : operands) {
      max = Math.max(max, nextInt(operand));
    }
    return max;
  }

  private static long maxBools(Iterable<BoolExpr<Sym<MarkedVar>>> operands) {
    long max = 0L;
    for (BoolExpr<Sym<MarkedVar>> operand : operands) {
      max = Math.max(max, nextBool(operand));
    }
    return max;
  }
}
