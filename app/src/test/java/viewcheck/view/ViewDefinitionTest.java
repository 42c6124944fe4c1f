package viewcheck.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMultiset;
import java.util.List;
import org.junit.jupiter.api.Test;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.var.Param;

final class ViewDefinitionTest {
  private static final Func<Expr<String>> TICK =
      Func.<Expr<String>>of("holdTick", Exprs.aVar("t"));
  private static final Func<Expr<String>> LOCK = new Func<>("holdLock", List.of());

  @Test
  void matchesComparesNameAndArityInOrder() {
    ViewDefinition definition =
        ViewDefinition.indefinite(
            List.of(Func.<Param>of("holdLock"), Func.of("holdTick", Param.intParam("x"))));

    assertTrue(definition.matches(List.of(LOCK, TICK)), "Same order, same shapes");
    assertFalse(definition.matches(List.of(TICK, LOCK)), "Order matters");
    assertFalse(definition.matches(List.of(LOCK)), "Too few items");
    assertFalse(
        definition.matches(List.of(LOCK, new Func<Expr<String>>("holdTick", List.of()))),
        "Arity differs");
  }

  @Test
  void guardsAccumulateAndCountsSurvive() {
    ImmutableMultiset<GFunc> twice =
        GuardedViews.union(GuardedViews.unconditional(TICK), GuardedViews.unconditional(TICK));

    ImmutableMultiset<GFunc> guarded = GuardedViews.withGuard(twice, Exprs.bVar("c"));

    assertEquals(2, twice.size(), "Union adds counts");
    assertEquals(
        ImmutableMultiset.of(new GFunc(Exprs.bVar("c"), TICK), new GFunc(Exprs.bVar("c"), TICK)),
        guarded,
        "Both copies gain the guard");
  }
}
