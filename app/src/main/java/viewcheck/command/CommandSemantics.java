package viewcheck.command;

import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.sub.Composition;
import viewcheck.sub.Mapper;
import viewcheck.sub.Substitutions;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;
import viewcheck.var.VarTable;
import viewcheck.var.VarType;
import viewcheck.view.Func;

/** Turns a {@link Command} into a single two-state Boolean relation. */
public final class CommandSemantics {
  private CommandSemantics() {}

  /**
   * Instantiates every primitive, frames the variables it leaves alone and composes the primitives
   * in order. The empty command is the identity on {@code vars}.
   */
  public static Either<VerificationError, BoolExpr<Sym<MarkedVar>>> semantics(
      Command command, PrimitiveTable table, VarTable vars) {
    BoolExpr<Sym<MarkedVar>> composed = null;
    for (Func<Expr<Sym<MarkedVar>>> prim : command.prims()) {
      Either<VerificationError, BoolExpr<Sym<MarkedVar>>> relation = instantiate(prim, table);
      if (relation.isLeft()) {
        return relation;
      }
      BoolExpr<Sym<MarkedVar>> framed = frame(relation.get(), vars);
      composed = composed == null ? framed : Composition.sequential(composed, framed);
    }
    return Either.right(composed == null ? frame(Exprs.bTrue(), vars) : composed);
  }

  /**
   * Substitutes the actual parameters of {@code prim} into its table entry. A primitive missing
   * from the table becomes a symbolic relation over its parameters.
   */
  public static Either<VerificationError, BoolExpr<Sym<MarkedVar>>> instantiate(
      Func<Expr<Sym<MarkedVar>>> prim, PrimitiveTable table) {
    Optional<PrimitiveDef> found = table.lookup(prim.name());
    if (found.isEmpty()) {
      return Either.right(Exprs.bVar(new Sym.Symbol<>(prim.name(), prim.params())));
    }
    PrimitiveDef def = found.get();
    if (def.formals().size() != prim.arity()) {
      return Either.left(
          VerificationError.arityMismatch(prim.name(), def.formals().size(), prim.arity()));
    }
    Map<String, Expr<Sym<MarkedVar>>> actuals = new HashMap<>();
    for (int i = 0; i < prim.arity(); i++) {
      actuals.put(def.formals().get(i).name(), prim.params().get(i));
    }
    Mapper<
            String,
            String,
            Either<VerificationError, IntExpr<Sym<MarkedVar>>>,
            Either<VerificationError, BoolExpr<Sym<MarkedVar>>>>
        vsub =
            Mapper.make(
                name -> intActual(prim, actuals, name), name -> boolActual(prim, actuals, name));
    return Substitutions.trySubBool(vsub, def.body());
  }

  /** Conjoins {@code after = before} for every variable {@code relation} does not write. */
  public static BoolExpr<Sym<MarkedVar>> frame(BoolExpr<Sym<MarkedVar>> relation, VarTable vars) {
    Set<String> written = Commands.postStateVariables(relation);
    List<BoolExpr<Sym<MarkedVar>>> conjuncts = new ArrayList<>();
    conjuncts.add(relation);
    vars.asMap()
        .forEach(
            (name, type) -> {
              if (!written.contains(name)) {
                conjuncts.add(
                    type == VarType.INT
                        ? Exprs.mkEq(Commands.intAfter(name), Commands.intBefore(name))
                        : Exprs.mkEq(Commands.boolAfter(name), Commands.boolBefore(name)));
              }
            });
    return Exprs.mkAnd(conjuncts);
  }

  private static Either<VerificationError, IntExpr<Sym<MarkedVar>>> intActual(
      Func<Expr<Sym<MarkedVar>>> prim, Map<String, Expr<Sym<MarkedVar>>> actuals, String formal) {
    Expr<Sym<MarkedVar>> actual = actuals.get(formal);
    if (actual == null) {
      return Either.left(VerificationError.notFound(prim.name() + "." + formal));
    }
    if (actual instanceof IntExpr<Sym<MarkedVar>> i) {
      return Either.right(i);
    }
    return Either.left(
        VerificationError.typeMismatch(prim.name() + "." + formal, VarType.INT, VarType.BOOL));
  }

  private static Either<VerificationError, BoolExpr<Sym<MarkedVar>>> boolActual(
      Func<Expr<Sym<MarkedVar>>> prim, Map<String, Expr<Sym<MarkedVar>>> actuals, String formal) {
    Expr<Sym<MarkedVar>> actual = actuals.get(formal);
    if (actual == null) {
      return Either.left(VerificationError.notFound(prim.name() + "." + formal));
    }
    if (actual instanceof BoolExpr<Sym<MarkedVar>> b) {
      return Either.right(b);
    }
    return Either.left(
        VerificationError.typeMismatch(prim.name() + "." + formal, VarType.BOOL, VarType.INT));
  }
}
