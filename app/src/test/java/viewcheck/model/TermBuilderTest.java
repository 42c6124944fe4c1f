package viewcheck.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMultiset;
import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import viewcheck.command.Commands;
import viewcheck.command.PrimitiveTable;
import viewcheck.diagnostics.ErrorKind;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.graph.Axiom;
import viewcheck.reify.Reifier;
import viewcheck.sub.Substitutions;
import viewcheck.var.MarkedVar;
import viewcheck.var.Param;
import viewcheck.var.Sym;
import viewcheck.var.VarTable;
import viewcheck.view.Func;
import viewcheck.view.GFunc;
import viewcheck.view.GuardedViews;
import viewcheck.view.ReView;
import viewcheck.view.ViewDefinition;

final class TermBuilderTest {
  private static final ViewDefinition HOLD_TICK =
      ViewDefinition.of(
          List.of(Func.of("holdTick", Param.intParam("t"))),
          new BoolExpr.Gt<>(Exprs.aVar("ticket"), Exprs.aVar("t")));
  private static final ViewDefinition MYSTERY =
      ViewDefinition.indefinite(List.of(Func.of("mystery")));
  private static final VarTable VARS =
      VarTable.build(List.of(Param.intParam("ticket"), Param.intParam("s")), new ArrayList<>());

  private final TermBuilder builder = new TermBuilder(PrimitiveTable.builtins(), VARS);

  @Test
  void patternParametersAreReplacedByTheHeldArguments() {
    ReView held =
        new ReView(
            HOLD_TICK,
            Exprs.bVar("guard"),
            List.of(Func.<Expr<String>>of("holdTick", Exprs.aVar("s"))));

    BoolExpr<Sym<MarkedVar>> denoted =
        builder.denote(ImmutableMultiset.of(held), Substitutions.before()).get();

    BoolExpr<Sym<MarkedVar>> expected =
        Exprs.mkImplies(
            Commands.boolBefore("guard"),
            new BoolExpr.Gt<>(Commands.intBefore("ticket"), Commands.intBefore("s")));
    assertEquals(expected, denoted, "guard => ticket > s, all in the pre-state");
  }

  @Test
  void indefiniteAndEmptyViewsDenoteTrue() {
    ReView mystery =
        new ReView(
            MYSTERY, Exprs.bTrue(), List.of(new Func<Expr<String>>("mystery", List.of())));

    assertEquals(
        Exprs.<Sym<MarkedVar>>bTrue(),
        builder.denote(ImmutableMultiset.of(mystery), Substitutions.after()).get(),
        "An indefinite definition says nothing");
    assertEquals(
        Exprs.<Sym<MarkedVar>>bTrue(),
        builder.denote(ImmutableMultiset.of(), Substitutions.after()).get(),
        "No matches, no obligations");
  }

  @Test
  void viewsThatDoNotFitTheirDefinitionAreReported() {
    ReView ghost =
        new ReView(
            HOLD_TICK, Exprs.bTrue(), List.of(new Func<Expr<String>>("ghost", List.of())));

    Either<VerificationError, BoolExpr<Sym<MarkedVar>>> denoted =
        builder.denote(ImmutableMultiset.of(ghost), Substitutions.before());

    assertEquals(
        ErrorKind.VIEW_NOT_FOUND, denoted.getLeft().kind(), "ghost is not a holdTick view");
  }

  @Test
  void buildReadsThePostconditionInThePostState() {
    ReView held =
        new ReView(
            HOLD_TICK,
            Exprs.bTrue(),
            List.of(Func.<Expr<String>>of("holdTick", Exprs.aVar("s"))));
    Axiom<ImmutableMultiset<ReView>> axiom =
        new Axiom<>(ImmutableMultiset.of(), Commands.id(), ImmutableMultiset.of(held));

    Term term = builder.build(axiom).get();

    assertEquals(Exprs.<Sym<MarkedVar>>bTrue(), term.pre(), "Nothing held before");
    assertEquals(
        new BoolExpr.Gt<>(Commands.intAfter("ticket"), Commands.intAfter("s")),
        term.post(),
        "ticket > s after the command");
    assertTrue(
        term.command().toString().contains("(ticket!after == ticket!before)"),
        "Id frames every variable");
  }

  @Test
  void everyDefinitionOfTheSameShapeConstrainsTheView() {
    ViewDefinition bounded =
        ViewDefinition.of(
            List.of(Func.of("holdTick", Param.intParam("u"))),
            new BoolExpr.Gt<>(Exprs.aVar("u"), Exprs.aInt(100)));
    ImmutableMultiset<GFunc> held =
        GuardedViews.unconditional(Func.<Expr<String>>of("holdTick", Exprs.aVar("s")));
    Axiom<ImmutableMultiset<ReView>> axiom =
        Reifier.reifyAxiom(
            List.of(HOLD_TICK, bounded),
            new Axiom<>(ImmutableMultiset.of(), Commands.id(), held));

    Term term = builder.build(axiom).get();

    assertEquals(2, axiom.post().size(), "One match per definition");
    assertEquals(
        Exprs.mkAnd(
            new BoolExpr.Gt<>(Commands.intAfter("ticket"), Commands.intAfter("s")),
            new BoolExpr.Gt<>(Commands.intAfter("s"), Exprs.<Sym<MarkedVar>>aInt(100))),
        term.post(),
        "Both bodies reach the postcondition");
  }
}
