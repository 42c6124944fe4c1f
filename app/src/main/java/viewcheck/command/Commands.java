package viewcheck.command;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.sub.Substitutions;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;
import viewcheck.view.Func;

/** Queries and builders over {@link Command}s. */
public final class Commands {
  public static final String ASSUME = "Assume";
  public static final String ID = "Id";

  private Commands() {}

  /**
   * A command is a no-op if every parameter is a pre-state variable or a compound term. Any other
   * variable leaf, post-state or symbolic, means it may change the state: a symbol could mean
   * anything.
   */
  public static boolean isNop(Command command) {
    for (Func<Expr<Sym<MarkedVar>>> prim : command.prims()) {
      for (Expr<Sym<MarkedVar>> param : prim.params()) {
        if (!isNopParam(param)) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean isNopParam(Expr<Sym<MarkedVar>> param) {
    Sym<MarkedVar> leaf = null;
    if (param instanceof IntExpr.Var<Sym<MarkedVar>> v) {
      leaf = v.var();
    } else if (param instanceof BoolExpr.Var<Sym<MarkedVar>> v) {
      leaf = v.var();
    }
    if (leaf == null) {
      return true;
    }
    return leaf instanceof Sym.Reg<MarkedVar> reg && reg.var() instanceof MarkedVar.Before;
  }

  /** The condition of a command consisting of a single one-argument Boolean {@code Assume}. */
  public static Optional<BoolExpr<Sym<MarkedVar>>> assumption(Command command) {
    if (command.prims().size() != 1) {
      return Optional.empty();
    }
    Func<Expr<Sym<MarkedVar>>> prim = command.prims().get(0);
    if (!ASSUME.equals(prim.name()) || prim.arity() != 1) {
      return Optional.empty();
    }
    return prim.params().get(0) instanceof BoolExpr<Sym<MarkedVar>> condition
        ? Optional.of(condition)
        : Optional.empty();
  }

  public static Command assume(BoolExpr<Sym<MarkedVar>> condition) {
    return Command.of(Func.<Expr<Sym<MarkedVar>>>of(ASSUME, condition));
  }

  public static Command id() {
    return Command.of(new Func<Expr<Sym<MarkedVar>>>(ID, List.of()));
  }

  /** Names of the variables that occur in post-state form anywhere in {@code relation}. */
  public static Set<String> postStateVariables(Expr<Sym<MarkedVar>> relation) {
    Set<String> written = new LinkedHashSet<>();
    Substitutions.renameRegs(
        (MarkedVar v) -> {
          if (v instanceof MarkedVar.After) {
            written.add(v.name());
          }
          return v;
        },
        relation);
    return written;
  }

  /** Shorthand for a pre-state integer leaf. */
  public static IntExpr<Sym<MarkedVar>> intBefore(String name) {
    return Exprs.aVar(Sym.<MarkedVar>reg(new MarkedVar.Before(name)));
  }

  /** Shorthand for a post-state integer leaf. */
  public static IntExpr<Sym<MarkedVar>> intAfter(String name) {
    return Exprs.aVar(Sym.<MarkedVar>reg(new MarkedVar.After(name)));
  }

  public static BoolExpr<Sym<MarkedVar>> boolBefore(String name) {
    return Exprs.bVar(Sym.<MarkedVar>reg(new MarkedVar.Before(name)));
  }

  public static BoolExpr<Sym<MarkedVar>> boolAfter(String name) {
    return Exprs.bVar(Sym.<MarkedVar>reg(new MarkedVar.After(name)));
  }
}
