package viewcheck.reify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMultiset;
import java.util.List;
import org.junit.jupiter.api.Test;
import viewcheck.command.Commands;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.graph.Axiom;
import viewcheck.var.Param;
import viewcheck.view.Func;
import viewcheck.view.GFunc;
import viewcheck.view.ReView;
import viewcheck.view.ViewDefinition;

final class ReifierTest {
  private static final ViewDefinition EMP = ViewDefinition.of(List.of(), Exprs.bTrue());
  private static final ViewDefinition ONE_TICK =
      ViewDefinition.of(List.of(Func.of("holdTick", Param.intParam("t"))), Exprs.bTrue());
  private static final ViewDefinition TWO_TICKS =
      ViewDefinition.of(
          List.of(
              Func.of("holdTick", Param.intParam("ta")), Func.of("holdTick", Param.intParam("tb"))),
          Exprs.bFalse());

  @Test
  void emptyPatternMatchesOnceWhateverIsHeld() {
    ImmutableMultiset<ReView> none = Reifier.reifySingleDef(List.of(), EMP);
    ImmutableMultiset<ReView> some = Reifier.reifySingleDef(List.of(tick("a"), tick("b")), EMP);

    assertEquals(
        ImmutableMultiset.of(new ReView(EMP, Exprs.bTrue(), List.of())),
        none,
        "emp matches the empty view");
    assertEquals(1, some.size(), "emp consumes nothing and matches once");
  }

  @Test
  void nothingHeldMatchesNoNonEmptyPattern() {
    assertTrue(Reifier.reifySingleDef(List.of(), ONE_TICK).isEmpty(), "No candidates");
    assertTrue(
        Reifier.reifySingleDef(List.of(lock()), ONE_TICK).isEmpty(), "Names must agree");
  }

  @Test
  void everyOrderedAssignmentIsAMatch() {
    List<GFunc> held = List.of(tick("a"), tick("b"), tick("c"));

    assertEquals(3, Reifier.reifySingleDef(held, ONE_TICK).size(), "One match per instance");
    assertEquals(
        6, Reifier.reifySingleDef(held, TWO_TICKS).size(), "3 * 2 ordered pairs of instances");
  }

  @Test
  void repeatedInstancesAreDistinctCandidates() {
    ImmutableMultiset<GFunc> held = ImmutableMultiset.of(tick("a"), tick("a"));

    ImmutableMultiset<ReView> single = Reifier.reifyView(List.of(ONE_TICK), held);
    ImmutableMultiset<ReView> pair = Reifier.reifyView(List.of(TWO_TICKS), held);

    assertEquals(2, single.size(), "Each copy matches a one-component pattern");
    assertEquals(2, pair.size(), "Both orderings of the two copies match");
    assertEquals(
        List.of(tick("a").item(), tick("a").item()),
        pair.iterator().next().items(),
        "Matched items are listed in pattern order");
  }

  @Test
  void guardsOfConsumedInstancesAreConjoined() {
    BoolExpr<String> ready = Exprs.bVar("ready");
    GFunc guarded = new GFunc(ready, tick("a").item());

    ImmutableMultiset<ReView> matches =
        Reifier.reifySingleDef(List.of(guarded, tick("b")), TWO_TICKS);

    assertEquals(2, matches.size(), "Two orderings");
    for (ReView match : matches) {
      assertEquals(ready, match.guard(), "true conjuncts vanish, leaving the one real guard");
    }
  }

  @Test
  void reifyViewUnionsAllDefinitions() {
    ImmutableMultiset<GFunc> held = ImmutableMultiset.of(tick("a"), tick("b"), lock());

    ImmutableMultiset<ReView> reified =
        Reifier.reifyView(List.of(EMP, ONE_TICK, TWO_TICKS), held);

    assertEquals(1 + 2 + 2, reified.size(), "emp once, each tick once, both tick orderings");
  }

  @Test
  void reifyAxiomKeepsTheCommand() {
    Axiom<ImmutableMultiset<GFunc>> axiom =
        new Axiom<>(ImmutableMultiset.of(tick("a")), Commands.id(), ImmutableMultiset.of());

    Axiom<ImmutableMultiset<ReView>> reified = Reifier.reifyAxiom(List.of(EMP, ONE_TICK), axiom);

    assertEquals(Commands.id(), reified.command(), "The command passes through");
    assertEquals(2, reified.pre().size(), "emp plus the single tick");
    assertEquals(1, reified.post().size(), "Only emp matches nothing held");
  }

  private static GFunc tick(String thread) {
    return new GFunc(Exprs.bTrue(), Func.<Expr<String>>of("holdTick", Exprs.aVar(thread)));
  }

  private static GFunc lock() {
    return new GFunc(Exprs.bTrue(), new Func<Expr<String>>("holdLock", List.of()));
  }
}
