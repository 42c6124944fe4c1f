package viewcheck.graph;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.command.Commands;

/** Simplifications that shrink a graph without changing what it proves. */
public final class GraphOptimiser {
  private static final Logger LOG = LoggerFactory.getLogger(GraphOptimiser.class);

  private GraphOptimiser() {}

  /**
   * Unifies the endpoints of every no-op edge whose endpoints hold equal views, then drops the
   * no-op self loops this leaves behind.
   */
  public static Graph collapseNops(Graph graph) {
    Graph current = graph;
    int merged = 0;
    for (Optional<Edge> edge = collapsible(current);
        edge.isPresent();
        edge = collapsible(current)) {
      current = Graphs.unify(current, edge.get().src(), edge.get().dest());
      merged++;
    }
    Graph result =
        Graphs.removeEdges(current, e -> e.isSelfLoop() && Commands.isNop(e.command()));
    LOG.debug(
        "Collapsed {} node(s) and {} edge(s) in {}",
        merged,
        graph.edges().size() - result.edges().size(),
        graph.name());
    return result;
  }

  private static Optional<Edge> collapsible(Graph graph) {
    return graph.edges().values().stream()
        .filter(e -> !e.isSelfLoop() && Commands.isNop(e.command()))
        .filter(e -> graph.nodes().get(e.src()).equals(graph.nodes().get(e.dest())))
        .findFirst();
  }
}
