package viewcheck.model;

import com.google.common.collect.ImmutableMultiset;
import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import viewcheck.command.CommandSemantics;
import viewcheck.command.PrimitiveTable;
import viewcheck.command.SymbolRemover;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.graph.Axiom;
import viewcheck.sub.Mapper;
import viewcheck.sub.Substitutions;
import viewcheck.var.MarkedVar;
import viewcheck.var.Param;
import viewcheck.var.Sym;
import viewcheck.var.VarTable;
import viewcheck.var.VarType;
import viewcheck.view.Func;
import viewcheck.view.ReView;
import viewcheck.view.ViewDefinition;

/**
 * Builds the solver-ready {@link Term} of a reified axiom.
 *
 * <p>A reified view denotes the conjunction, over its matches, of {@code guard => definition},
 * using the definition each match was made against, with its pattern parameters replaced by the
 * matched arguments. Indefinite definitions contribute {@code true}. The precondition is read in
 * the pre-state, the postcondition in the post-state.
 */
public final class TermBuilder {
  private final PrimitiveTable primitives;
  private final VarTable vars;

  public TermBuilder(PrimitiveTable primitives, VarTable vars) {
    this.primitives = primitives;
    this.vars = vars;
  }

  public Either<VerificationError, Term> build(Axiom<ImmutableMultiset<ReView>> axiom) {
    return denote(axiom.pre(), Substitutions.before())
        .flatMap(
            pre ->
                CommandSemantics.semantics(axiom.command(), primitives, vars)
                    .flatMap(
                        command ->
                            denote(axiom.post(), Substitutions.after())
                                .map(
                                    post ->
                                        new Term(pre, SymbolRemover.removeSym(command), post))));
  }

  /** The meaning of a reified view under {@code marker}. */
  public Either<VerificationError, BoolExpr<Sym<MarkedVar>>> denote(
      ImmutableMultiset<ReView> views,
      Mapper<IntExpr<String>, BoolExpr<String>, IntExpr<MarkedVar>, BoolExpr<MarkedVar>> marker) {
    List<BoolExpr<Sym<MarkedVar>>> conjuncts = new ArrayList<>(views.size());
    for (ReView view : views) {
      ViewDefinition definition = view.definition();
      if (!definition.matches(view.items())) {
        return Either.left(VerificationError.viewNotFound(view.items().toString()));
      }
      if (definition.definition().isEmpty()) {
        continue;
      }
      Either<VerificationError, BoolExpr<String>> body = instantiate(definition, view.items());
      if (body.isLeft()) {
        return Either.left(body.getLeft());
      }
      conjuncts.add(mark(Exprs.mkImplies(view.guard(), body.get()), marker));
    }
    return Either.right(Exprs.mkAnd(conjuncts));
  }

  /** Replaces pattern parameters in the definition body by the matched view arguments. */
  private static Either<VerificationError, BoolExpr<String>> instantiate(
      ViewDefinition definition, List<Func<Expr<String>>> items) {
    Map<String, Expr<String>> arguments = new HashMap<>();
    for (int i = 0; i < items.size(); i++) {
      List<Param> formals = definition.pattern().get(i).params();
      for (int j = 0; j < formals.size(); j++) {
        arguments.put(formals.get(j).name(), items.get(i).params().get(j));
      }
    }
    Mapper<
            String,
            String,
            Either<VerificationError, IntExpr<String>>,
            Either<VerificationError, BoolExpr<String>>>
        vsub =
            Mapper.make(
                name -> intArgument(arguments, name), name -> boolArgument(arguments, name));
    return Substitutions.trySubBool(vsub, definition.definition().get());
  }

  private static Either<VerificationError, IntExpr<String>> intArgument(
      Map<String, Expr<String>> arguments, String name) {
    Expr<String> argument = arguments.get(name);
    if (argument == null) {
      return Either.right(Exprs.aVar(name));
    }
    if (argument instanceof IntExpr<String> i) {
      return Either.right(i);
    }
    return Either.left(VerificationError.typeMismatch(name, VarType.INT, VarType.BOOL));
  }

  private static Either<VerificationError, BoolExpr<String>> boolArgument(
      Map<String, Expr<String>> arguments, String name) {
    Expr<String> argument = arguments.get(name);
    if (argument == null) {
      return Either.right(Exprs.bVar(name));
    }
    if (argument instanceof BoolExpr<String> b) {
      return Either.right(b);
    }
    return Either.left(VerificationError.typeMismatch(name, VarType.BOOL, VarType.INT));
  }

  private static BoolExpr<Sym<MarkedVar>> mark(
      BoolExpr<String> expr,
      Mapper<IntExpr<String>, BoolExpr<String>, IntExpr<MarkedVar>, BoolExpr<MarkedVar>> marker) {
    return Substitutions.<MarkedVar>regular().mapBool(marker.mapBool(expr));
  }
}
