package viewcheck.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMultiset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import viewcheck.command.Commands;
import viewcheck.diagnostics.ModelException;
import viewcheck.examples.Examples;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.model.Model;
import viewcheck.model.ModelBlock;
import viewcheck.model.ModelMethod;
import viewcheck.model.Modeller;
import viewcheck.model.PartCmd;
import viewcheck.model.ViewedPart;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;
import viewcheck.view.Func;
import viewcheck.view.GFunc;
import viewcheck.view.GuardedViews;

final class GrapherTest {
  private static final BoolExpr<Sym<MarkedVar>> COND = Commands.boolBefore("c");
  private static final ImmutableMultiset<GFunc> A = view("a");
  private static final ImmutableMultiset<GFunc> B = view("b");

  @Test
  void unlockIsASingleEdge() throws ModelException {
    Graph unlock = Grapher.graph(ticketLock().items().get("unlock")).get();

    assertEquals(
        List.of("unlock_V0", "unlock_V1"),
        List.copyOf(unlock.nodes().keySet()),
        "Precondition then postcondition");
    assertEquals(1, unlock.edges().size(), "One atomic command");
    Edge edge = unlock.edges().get("unlock_C0");
    assertEquals("unlock_V0", edge.src(), "From the precondition");
    assertEquals("unlock_V1", edge.dest(), "To the postcondition");
    assertEquals(GuardedViews.empty(), unlock.nodes().get("unlock_V1"), "unlock ends in emp");
  }

  @Test
  void doWhileIsEnteredUnconditionallyAndLeftOnTheNegatedCondition() throws ModelException {
    Graph lock = Grapher.graph(ticketLock().items().get("lock")).get();

    assertEquals(5, lock.nodes().size(), "pre, post, mid, loop entry and loop exit");
    Map<String, Edge> edges = lock.edges();
    assertEquals(5, edges.size(), "fetch, load, entry, repeat and exit");
    assertEquals(
        new Edge("lock_V2", Commands.id(), "lock_V3"),
        edges.get("lock_C2"),
        "A do-while is entered without a test");
    Edge again = edges.get("lock_C3");
    Edge leave = edges.get("lock_C4");
    assertEquals("lock_V4", again.src(), "The loop repeats from its exit node");
    assertEquals("lock_V3", again.dest(), "back to its entry");
    assertEquals("lock_V1", leave.dest(), "and leaves to the method postcondition");
    BoolExpr<Sym<MarkedVar>> stay = Commands.assumption(again.command()).orElseThrow();
    assertEquals(
        Exprs.mkNot(stay),
        Commands.assumption(leave.command()).orElseThrow(),
        "Leaving assumes the negated loop condition");
  }

  @Test
  void whileLoopChecksItsConditionBeforeTheFirstIteration() {
    ModelBlock body =
        new ModelBlock(B, List.of(new ViewedPart(new PartCmd.Prim(Commands.id()), B)));
    ModelMethod method = method(new ViewedPart(new PartCmd.While(false, COND, body), A));

    Graph graph = Grapher.graph(method).get();

    assertEquals(4, graph.nodes().size(), "pre, post, loop entry and loop exit");
    assertEquals(
        List.of(
            new Edge("m_V2", Commands.id(), "m_V3"),
            new Edge("m_V0", Commands.assume(COND), "m_V2"),
            new Edge("m_V0", Commands.assume(Exprs.mkNot(COND)), "m_V1"),
            new Edge("m_V3", Commands.assume(COND), "m_V2"),
            new Edge("m_V3", Commands.assume(Exprs.mkNot(COND)), "m_V1")),
        List.copyOf(graph.edges().values()),
        "Body first, then entry, skip, repeat and exit");
  }

  @Test
  void conditionalBranchesRejoinThroughIdEdges() {
    ModelMethod method =
        method(
            new ViewedPart(
                new PartCmd.Ite(COND, new ModelBlock(A, List.of()), new ModelBlock(B, List.of())),
                A));

    Graph graph = Grapher.graph(method).get();

    assertEquals(6, graph.nodes().size(), "Two nodes per branch plus pre and post");
    assertEquals(6, graph.edges().size(), "Entry, body and exit per branch");
    assertTrue(
        graph.edges().containsValue(new Edge("m_V0", Commands.assume(COND), "m_V2")),
        "The then branch assumes the condition");
    assertTrue(
        graph.edges().containsValue(new Edge("m_V0", Commands.assume(Exprs.mkNot(COND)), "m_V4")),
        "The else branch assumes its negation");
    assertTrue(
        graph.edges().containsValue(new Edge("m_V5", Commands.id(), "m_V1")),
        "The else branch rejoins the postcondition");
  }

  @Test
  void parallelBlocksAreEnteredAndLeftByIdEdges() {
    ModelMethod method =
        method(
            new ViewedPart(
                new PartCmd.Parallel(
                    List.of(new ModelBlock(A, List.of()), new ModelBlock(B, List.of()))),
                A));

    Graph graph = Grapher.graph(method).get();

    assertTrue(
        graph.edges().values().stream().allMatch(e -> e.command().equals(Commands.id())),
        "Parallel composition adds no assumptions");
    assertEquals(6, graph.edges().size(), "Entry, body and exit per block");
  }

  @Test
  void collapseNopsMergesEqualViewsAcrossIdEdges() throws ModelException {
    Graph lock = Grapher.graph(ticketLock().items().get("lock")).get();

    Graph collapsed = GraphOptimiser.collapseNops(lock);

    assertEquals(4, collapsed.nodes().size(), "The loop entry merged into the mid node");
    assertEquals(4, collapsed.edges().size(), "The Id self loop is gone");
    assertTrue(
        collapsed.edges().values().stream().noneMatch(Edge::isSelfLoop), "No self loops remain");
    assertEquals("lock_V2", collapsed.edges().get("lock_C3").dest(), "Loop edges retargeted");
  }

  @Test
  void collapseNopsKeepsEdgesThatWrite() throws ModelException {
    Graph unlock = Grapher.graph(ticketLock().items().get("unlock")).get();

    assertEquals(unlock, GraphOptimiser.collapseNops(unlock), "serving++ is not a no-op");
  }

  private static Model<ModelMethod> ticketLock() throws ModelException {
    return Modeller.model(Examples.ticketLock());
  }

  private static ModelMethod method(ViewedPart part) {
    return new ModelMethod("m", new ModelBlock(A, List.of(part)));
  }

  private static ImmutableMultiset<GFunc> view(String name) {
    return GuardedViews.unconditional(new Func<Expr<String>>(name, List.of()));
  }
}
