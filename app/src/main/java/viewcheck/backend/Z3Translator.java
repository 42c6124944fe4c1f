package viewcheck.backend;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Sort;
import java.util.ArrayList;
import java.util.List;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.IntExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

/**
 * Translates marked expressions into terms of one Z3 {@link Context}. Variables become constants
 * named after their marked form; symbolic leaves become applications of uninterpreted functions.
 */
final class Z3Translator {
  private final Context ctx;

  Z3Translator(Context ctx) {
    this.ctx = ctx;
  }

  com.microsoft.z3.BoolExpr bool(BoolExpr<Sym<MarkedVar>> expr) {
    if (expr instanceof BoolExpr.True) {
      return ctx.mkTrue();
    }
    if (expr instanceof BoolExpr.False) {
      return ctx.mkFalse();
    }
    if (expr instanceof BoolExpr.Var<Sym<MarkedVar>> v) {
      if (v.var() instanceof Sym.Symbol<MarkedVar> symbol) {
        return (com.microsoft.z3.BoolExpr)
            ctx.mkApp(function(symbol, ctx.getBoolSort()), args(symbol));
      }
      return ctx.mkBoolConst(v.var().toString());
    }
    if (expr instanceof BoolExpr.And<Sym<MarkedVar>> and) {
      return ctx.mkAnd(bools(and.operands()));
    }
    if (expr instanceof BoolExpr.Or<Sym<MarkedVar>> or) {
      return ctx.mkOr(bools(or.operands()));
    }
    if (expr instanceof BoolExpr.Implies<Sym<MarkedVar>> imp) {
      return ctx.mkImplies(bool(imp.lhs()), bool(imp.rhs()));
    }
    if (expr instanceof BoolExpr.Eq<Sym<MarkedVar>> eq) {
      if (eq.lhs() instanceof IntExpr<Sym<MarkedVar>> l) {
        return ctx.mkEq(arith(l), arith((IntExpr<Sym<MarkedVar>>) eq.rhs()));
      }
      return ctx.mkEq(
          bool((BoolExpr<Sym<MarkedVar>>) eq.lhs()), bool((BoolExpr<Sym<MarkedVar>>) eq.rhs()));
    }
    if (expr instanceof BoolExpr.Gt<Sym<MarkedVar>> gt) {
      return ctx.mkGt(arith(gt.lhs()), arith(gt.rhs()));
    }
    if (expr instanceof BoolExpr.Ge<Sym<MarkedVar>> ge) {
      return ctx.mkGe(arith(ge.lhs()), arith(ge.rhs()));
    }
    if (expr instanceof BoolExpr.Le<Sym<MarkedVar>> le) {
      return ctx.mkLe(arith(le.lhs()), arith(le.rhs()));
    }
    if (expr instanceof BoolExpr.Lt<Sym<MarkedVar>> lt) {
      return ctx.mkLt(arith(lt.lhs()), arith(lt.rhs()));
    }
    BoolExpr.Not<Sym<MarkedVar>> not = (BoolExpr.Not<Sym<MarkedVar>>) expr;
    return ctx.mkNot(bool(not.operand()));
  }

  ArithExpr<IntSort> arith(IntExpr<Sym<MarkedVar>> expr) {
    if (expr instanceof IntExpr.Const<Sym<MarkedVar>> c) {
      return ctx.mkInt(c.value());
    }
    if (expr instanceof IntExpr.Var<Sym<MarkedVar>> v) {
      if (v.var() instanceof Sym.Symbol<MarkedVar> symbol) {
        return (com.microsoft.z3.IntExpr)
            ctx.mkApp(function(symbol, ctx.getIntSort()), args(symbol));
      }
      return ctx.mkIntConst(v.var().toString());
    }
    if (expr instanceof IntExpr.Add<Sym<MarkedVar>> add) {
      ArithExpr<IntSort> sum = ctx.mkInt(0);
      for (IntExpr<Sym<MarkedVar>> operand : add.operands()) {
        sum = ctx.mkAdd(sum, arith(operand));
      }
      return sum;
    }
    if (expr instanceof IntExpr.Sub<Sym<MarkedVar>> sub) {
      return fold(sub.operands(), true);
    }
    if (expr instanceof IntExpr.Mul<Sym<MarkedVar>> mul) {
      return fold(mul.operands(), false);
    }
    IntExpr.Div<Sym<MarkedVar>> div = (IntExpr.Div<Sym<MarkedVar>>) expr;
    return ctx.mkDiv(arith(div.left()), arith(div.right()));
  }

  /** Left fold of subtraction or multiplication; the empty fold is the unit. */
  private ArithExpr<IntSort> fold(List<IntExpr<Sym<MarkedVar>>> operands, boolean subtract) {
    if (operands.isEmpty()) {
      return ctx.mkInt(subtract ? 0 : 1);
    }
    ArithExpr<IntSort> acc = arith(operands.get(0));
    for (IntExpr<Sym<MarkedVar>> operand : operands.subList(1, operands.size())) {
      acc = subtract ? ctx.mkSub(acc, arith(operand)) : ctx.mkMul(acc, arith(operand));
    }
    return acc;
  }

  private com.microsoft.z3.BoolExpr[] bools(List<BoolExpr<Sym<MarkedVar>>> operands) {
    com.microsoft.z3.BoolExpr[] translated = new com.microsoft.z3.BoolExpr[operands.size()];
    for (int i = 0; i < translated.length; i++) {
      translated[i] = bool(operands.get(i));
    }
    return translated;
  }

  private <R extends Sort> FuncDecl<R> function(Sym.Symbol<MarkedVar> symbol, R range) {
    List<Sort> domain = new ArrayList<>(symbol.params().size());
    for (Expr<Sym<MarkedVar>> param : symbol.params()) {
      domain.add(param instanceof IntExpr ? ctx.getIntSort() : ctx.getBoolSort());
    }
    return ctx.mkFuncDecl(symbol.name(), domain.toArray(new Sort[0]), range);
  }

  private com.microsoft.z3.Expr<?>[] args(Sym.Symbol<MarkedVar> symbol) {
    com.microsoft.z3.Expr<?>[] args = new com.microsoft.z3.Expr<?>[symbol.params().size()];
    for (int i = 0; i < args.length; i++) {
      Expr<Sym<MarkedVar>> param = symbol.params().get(i);
      args[i] =
          param instanceof IntExpr<Sym<MarkedVar>> intParam
              ? arith(intParam)
              : bool((BoolExpr<Sym<MarkedVar>>) param);
    }
    return args;
  }
}
