package viewcheck.command;

import java.util.ArrayList;
import java.util.List;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.var.Sym;

/**
 * Drops equations that only pin down the value of a symbolic leaf, leaving that value
 * unconstrained.
 *
 * <p>The rewrite distributes through conjunctions and into the consequent of an implication. It
 * never touches an antecedent: weakening an antecedent would strengthen the implication.
 */
public final class SymbolRemover {
  private SymbolRemover() {}

  public static <V> BoolExpr<Sym<V>> removeSym(BoolExpr<Sym<V>> expr) {
    if (expr instanceof BoolExpr.Eq<Sym<V>> eq && (isSymbol(eq.lhs()) || isSymbol(eq.rhs()))) {
      return Exprs.bTrue();
    }
    if (expr instanceof BoolExpr.And<Sym<V>> and) {
      List<BoolExpr<Sym<V>>> operands = new ArrayList<>(and.operands().size());
      for (BoolExpr<Sym<V>> operand : and.operands()) {
        operands.add(removeSym(operand));
      }
      return new BoolExpr.And<>(operands);
    }
    if (expr instanceof BoolExpr.Implies<Sym<V>> imp) {
      return new BoolExpr.Implies<>(imp.lhs(), removeSym(imp.rhs()));
    }
    return expr;
  }

  static <V> boolean isSymbol(Expr<Sym<V>> expr) {
    if (expr instanceof IntExpr.Var<Sym<V>> v) {
      return v.var() instanceof Sym.Symbol;
    }
    if (expr instanceof BoolExpr.Var<Sym<V>> v) {
      return v.var() instanceof Sym.Symbol;
    }
    return false;
  }
}
