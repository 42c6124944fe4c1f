package viewcheck.sub;

import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

/**
 * Homomorphic variable substitution over {@link Expr} trees.
 *
 * <p>A <em>variable mapper</em> has type {@code Mapper<V, V, IntExpr<W>, BoolExpr<W>>}: it is
 * handed the variable found at an integer or Boolean leaf and returns the expression of the same
 * sort replacing it. Structural nodes are rebuilt unchanged around the rewritten leaves.
 */
public final class Substitutions {
  private Substitutions() {}

  public static <V, W> IntExpr<W> subInt(
      Mapper<V, V, IntExpr<W>, BoolExpr<W>> vsub, IntExpr<V> expr) {
    if (expr instanceof IntExpr.Var<V> v) {
      return vsub.mapInt(v.var());
    }
    if (expr instanceof IntExpr.Const<V> c) {
      return Exprs.aInt(c.value());
    }
    if (expr instanceof IntExpr.Add<V> add) {
      return new IntExpr.Add<>(subInts(vsub, add.operands()));
    }
    if (expr instanceof IntExpr.Sub<V> sub) {
      return new IntExpr.Sub<>(subInts(vsub, sub.operands()));
    }
    if (expr instanceof IntExpr.Mul<V> mul) {
      return new IntExpr.Mul<>(subInts(vsub, mul.operands()));
    }
    IntExpr.Div<V> div = (IntExpr.Div<V>) expr;
    return new IntExpr.Div<>(subInt(vsub, div.left()), subInt(vsub, div.right()));
  }

  public static <V, W> BoolExpr<W> subBool(
      Mapper<V, V, IntExpr<W>, BoolExpr<W>> vsub, BoolExpr<V> expr) {
    if (expr instanceof BoolExpr.Var<V> v) {
      return vsub.mapBool(v.var());
    }
    if (expr instanceof BoolExpr.True) {
      return Exprs.bTrue();
    }
    if (expr instanceof BoolExpr.False) {
      return Exprs.bFalse();
    }
    if (expr instanceof BoolExpr.And<V> and) {
      return new BoolExpr.And<>(subBools(vsub, and.operands()));
    }
    if (expr instanceof BoolExpr.Or<V> or) {
      return new BoolExpr.Or<>(subBools(vsub, or.operands()));
    }
    if (expr instanceof BoolExpr.Implies<V> imp) {
      return new BoolExpr.Implies<>(subBool(vsub, imp.lhs()), subBool(vsub, imp.rhs()));
    }
    if (expr instanceof BoolExpr.Eq<V> eq) {
      return new BoolExpr.Eq<>(sub(vsub, eq.lhs()), sub(vsub, eq.rhs()));
    }
    if (expr instanceof BoolExpr.Gt<V> gt) {
      return new BoolExpr.Gt<>(subInt(vsub, gt.lhs()), subInt(vsub, gt.rhs()));
    }
    if (expr instanceof BoolExpr.Ge<V> ge) {
      return new BoolExpr.Ge<>(subInt(vsub, ge.lhs()), subInt(vsub, ge.rhs()));
    }
    if (expr instanceof BoolExpr.Le<V> le) {
      return new BoolExpr.Le<>(subInt(vsub, le.lhs()), subInt(vsub, le.rhs()));
    }
    if (expr instanceof BoolExpr.Lt<V> lt) {
      return new BoolExpr.Lt<>(subInt(vsub, lt.lhs()), subInt(vsub, lt.rhs()));
    }
    BoolExpr.Not<V> not = (BoolExpr.Not<V>) expr;
    return new BoolExpr.Not<>(subBool(vsub, not.operand()));
  }

  public static <V, W> Expr<W> sub(Mapper<V, V, IntExpr<W>, BoolExpr<W>> vsub, Expr<V> expr) {
    if (expr instanceof IntExpr<V> i) {
      return subInt(vsub, i);
    }
    return subBool(vsub, (BoolExpr<V>) expr);
  }

  /** Packages a variable mapper as a mapper over whole expressions. */
  public static <V, W> Mapper<IntExpr<V>, BoolExpr<V>, IntExpr<W>, BoolExpr<W>> onVars(
      Mapper<V, V, IntExpr<W>, BoolExpr<W>> vsub) {
    return Mapper.make(e -> subInt(vsub, e), e -> subBool(vsub, e));
  }

  /** Lifts a plain variable renaming into a variable mapper producing leaves. */
  public static <V, W> Mapper<V, V, IntExpr<W>, BoolExpr<W>> liftToVarSub(
      Mapper<V, V, W, W> renaming) {
    Mapper<W, W, IntExpr<W>, BoolExpr<W>> leaves = Mapper.make(Exprs::aVar, Exprs::bVar);
    return Mapper.compose(renaming, leaves);
  }

  /** Lifts a plain variable renaming into a full expression substitution. */
  public static <V, W> Mapper<IntExpr<V>, BoolExpr<V>, IntExpr<W>, BoolExpr<W>> liftToSub(
      Mapper<V, V, W, W> renaming) {
    return onVars(liftToVarSub(renaming));
  }

  /** Maps every variable of a non-symbolic expression into its pre-state. */
  public static Mapper<IntExpr<String>, BoolExpr<String>, IntExpr<MarkedVar>, BoolExpr<MarkedVar>>
      before() {
    return liftToSub(Mapper.<String, MarkedVar>cmake(MarkedVar.Before::new));
  }

  /** Maps every variable of a non-symbolic expression into its post-state. */
  public static Mapper<IntExpr<String>, BoolExpr<String>, IntExpr<MarkedVar>, BoolExpr<MarkedVar>>
      after() {
    return liftToSub(Mapper.<String, MarkedVar>cmake(MarkedVar.After::new));
  }

  /** Wraps every variable as a regular (non-symbolic) leaf. */
  public static <V> Mapper<IntExpr<V>, BoolExpr<V>, IntExpr<Sym<V>>, BoolExpr<Sym<V>>> regular() {
    return liftToSub(Mapper.<V, Sym<V>>cmake(Sym::reg));
  }

  /** Applies an expression mapper to an expression of either sort. */
  public static <V, W> Expr<W> apply(
      Mapper<IntExpr<V>, BoolExpr<V>, IntExpr<W>, BoolExpr<W>> mapper, Expr<V> expr) {
    if (expr instanceof IntExpr<V> i) {
      return mapper.mapInt(i);
    }
    return mapper.mapBool((BoolExpr<V>) expr);
  }

  /**
   * Rewrites the regular leaves of a symbolic expression, recursing into the parameter lists of
   * symbolic leaves so that variables nested inside a symbol are rewritten too.
   */
  public static <V, W> Mapper<Sym<V>, Sym<V>, IntExpr<Sym<W>>, BoolExpr<Sym<W>>> onRegs(
      Mapper<V, V, IntExpr<Sym<W>>, BoolExpr<Sym<W>>> regSub) {
    return new Mapper<>() {
      @Override
      public IntExpr<Sym<W>> mapInt(Sym<V> in) {
        if (in instanceof Sym.Reg<V> reg) {
          return regSub.mapInt(reg.var());
        }
        return Exprs.aVar(symbol((Sym.Symbol<V>) in));
      }

      @Override
      public BoolExpr<Sym<W>> mapBool(Sym<V> in) {
        if (in instanceof Sym.Reg<V> reg) {
          return regSub.mapBool(reg.var());
        }
        return Exprs.bVar(symbol((Sym.Symbol<V>) in));
      }

      private Sym<W> symbol(Sym.Symbol<V> symbol) {
        List<Expr<Sym<W>>> params = new ArrayList<>(symbol.params().size());
        for (Expr<Sym<V>> param : symbol.params()) {
          params.add(sub(this, param));
        }
        return new Sym.Symbol<>(symbol.name(), params);
      }
    };
  }

  /** Renames the regular variables of a symbolic expression. */
  public static <V, W> Expr<Sym<W>> renameRegs(
      Function<? super V, ? extends W> fn, Expr<Sym<V>> expr) {
    Mapper<V, V, IntExpr<Sym<W>>, BoolExpr<Sym<W>>> regSub =
        Mapper.make(
            v -> Exprs.<Sym<W>>aVar(Sym.<W>reg(fn.apply(v))),
            v -> Exprs.<Sym<W>>bVar(Sym.<W>reg(fn.apply(v))));
    return sub(onRegs(regSub), expr);
  }

  /** Boolean-sorted form of {@link #renameRegs(Function, Expr)}. */
  public static <V, W> BoolExpr<Sym<W>> renameRegs(
      Function<? super V, ? extends W> fn, BoolExpr<Sym<V>> expr) {
    return (BoolExpr<Sym<W>>) Substitutions.<V, W>renameRegs(fn, (Expr<Sym<V>>) expr);
  }

  // -------------------------------------------------------------------------
  // Fallible substitution: the first failing leaf fails the enclosing tree.
  // -------------------------------------------------------------------------

  public static <V, W, E> Either<E, IntExpr<W>> trySubInt(
      Mapper<V, V, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> vsub, IntExpr<V> expr) {
    if (expr instanceof IntExpr.Var<V> v) {
      return vsub.mapInt(v.var());
    }
    if (expr instanceof IntExpr.Const<V> c) {
      return Either.right(Exprs.aInt(c.value()));
    }
    if (expr instanceof IntExpr.Add<V> add) {
      return tryInts(vsub, add.operands()).map(IntExpr.Add::new);
    }
    if (expr instanceof IntExpr.Sub<V> sub) {
      return tryInts(vsub, sub.operands()).map(IntExpr.Sub::new);
    }
    if (expr instanceof IntExpr.Mul<V> mul) {
      return tryInts(vsub, mul.operands()).map(IntExpr.Mul::new);
    }
    IntExpr.Div<V> div = (IntExpr.Div<V>) expr;
    return both(trySubInt(vsub, div.left()), trySubInt(vsub, div.right()), IntExpr.Div::new);
  }

  public static <V, W, E> Either<E, BoolExpr<W>> trySubBool(
      Mapper<V, V, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> vsub, BoolExpr<V> expr) {
    if (expr instanceof BoolExpr.Var<V> v) {
      return vsub.mapBool(v.var());
    }
    if (expr instanceof BoolExpr.True) {
      return Either.right(Exprs.bTrue());
    }
    if (expr instanceof BoolExpr.False) {
      return Either.right(Exprs.bFalse());
    }
    if (expr instanceof BoolExpr.And<V> and) {
      return tryBools(vsub, and.operands()).map(BoolExpr.And::new);
    }
    if (expr instanceof BoolExpr.Or<V> or) {
      return tryBools(vsub, or.operands()).map(BoolExpr.Or::new);
    }
    if (expr instanceof BoolExpr.Implies<V> imp) {
      return both(
          trySubBool(vsub, imp.lhs()), trySubBool(vsub, imp.rhs()), BoolExpr.Implies::new);
    }
    if (expr instanceof BoolExpr.Eq<V> eq) {
      return both(trySub(vsub, eq.lhs()), trySub(vsub, eq.rhs()), BoolExpr.Eq::new);
    }
    if (expr instanceof BoolExpr.Gt<V> gt) {
      return both(trySubInt(vsub, gt.lhs()), trySubInt(vsub, gt.rhs()), BoolExpr.Gt::new);
    }
    if (expr instanceof BoolExpr.Ge<V> ge) {
      return both(trySubInt(vsub, ge.lhs()), trySubInt(vsub, ge.rhs()), BoolExpr.Ge::new);
    }
    if (expr instanceof BoolExpr.Le<V> le) {
      return both(trySubInt(vsub, le.lhs()), trySubInt(vsub, le.rhs()), BoolExpr.Le::new);
    }
    if (expr instanceof BoolExpr.Lt<V> lt) {
      return both(trySubInt(vsub, lt.lhs()), trySubInt(vsub, lt.rhs()), BoolExpr.Lt::new);
    }
    BoolExpr.Not<V> not = (BoolExpr.Not<V>) expr;
    return trySubBool(vsub, not.operand()).map(BoolExpr.Not::new);
  }

  public static <V, W, E> Either<E, Expr<W>> trySub(
      Mapper<V, V, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> vsub, Expr<V> expr) {
    if (expr instanceof IntExpr<V> i) {
      return trySubInt(vsub, i).map(x -> x);
    }
    return trySubBool(vsub, (BoolExpr<V>) expr).map(x -> x);
  }

  /** Fallible counterpart of {@link #onVars(Mapper)}. */
  public static <V, W, E>
      Mapper<IntExpr<V>, BoolExpr<V>, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> tryOnVars(
          Mapper<V, V, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> vsub) {
    return Mapper.make(e -> trySubInt(vsub, e), e -> trySubBool(vsub, e));
  }

  private static <V, W> List<IntExpr<W>> subInts(
      Mapper<V, V, IntExpr<W>, BoolExpr<W>> vsub, List<IntExpr<V>> operands) {
    List<IntExpr<W>> out = new ArrayList<>(operands.size());
    for (IntExpr<V> operand : operands) {
      out.add(subInt(vsub, operand));
    }
    return out;
  }

  private static <V, W> List<BoolExpr<W>> subBools(
      Mapper<V, V, IntExpr<W>, BoolExpr<W>> vsub, List<BoolExpr<V>> operands) {
    List<BoolExpr<W>> out = new ArrayList<>(operands.size());
    for (BoolExpr<V> operand : operands) {
      out.add(subBool(vsub, operand));
    }
    return out;
  }

  private static <V, W, E> Either<E, List<IntExpr<W>>> tryInts(
      Mapper<V, V, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> vsub, List<IntExpr<V>> operands) {
    List<IntExpr<W>> out = new ArrayList<>(operands.size());
    for (IntExpr<V> operand : operands) {
      Either<E, IntExpr<W>> result = trySubInt(vsub, operand);
      if (result.isLeft()) {
        return Either.left(result.getLeft());
      }
      out.add(result.get());
    }
    return Either.right(out);
  }

  private static <V, W, E> Either<E, List<BoolExpr<W>>> tryBools(
      Mapper<V, V, Either<E, IntExpr<W>>, Either<E, BoolExpr<W>>> vsub,
      List<BoolExpr<V>> operands) {
    List<BoolExpr<W>> out = new ArrayList<>(operands.size());
    for (BoolExpr<V> operand : operands) {
      Either<E, BoolExpr<W>> result = trySubBool(vsub, operand);
      if (result.isLeft()) {
        return Either.left(result.getLeft());
      }
      out.add(result.get());
    }
    return Either.right(out);
  }

  private static <E, A, B, R> Either<E, R> both(
      Either<E, A> left, Either<E, B> right, BiFunction<A, B, R> combine) {
    return left.flatMap(l -> right.map(r -> combine.apply(l, r)));
  }
}
