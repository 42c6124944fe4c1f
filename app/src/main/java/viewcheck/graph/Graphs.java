package viewcheck.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import viewcheck.view.GFunc;

/** Pure operations over {@link Graph}s and {@link Subgraph}s. */
public final class Graphs {
  private Graphs() {}

  /**
   * Merges node {@code t} into node {@code s}: {@code t} disappears, every edge endpoint naming
   * {@code t} is rewritten to {@code s}, and {@code s} takes over {@code t}'s views. The graph is
   * returned as is if either node is missing or {@code s} equals {@code t}.
   */
  public static Graph unify(Graph graph, String s, String t) {
    Map<String, ImmutableMultiset<GFunc>> nodes = graph.nodes();
    if (s.equals(t) || !nodes.containsKey(s) || !nodes.containsKey(t)) {
      return graph;
    }
    ImmutableMultiset<GFunc> absorbed = nodes.get(t);
    Map<String, ImmutableMultiset<GFunc>> newNodes = new LinkedHashMap<>();
    nodes.forEach(
        (name, views) -> {
          if (name.equals(s)) {
            newNodes.put(name, absorbed);
          } else if (!name.equals(t)) {
            newNodes.put(name, views);
          }
        });
    Map<String, Edge> newEdges = new LinkedHashMap<>();
    graph.edges().forEach((name, edge) -> newEdges.put(name, edge.retarget(t, s)));
    return new Graph(graph.name(), Subgraph.of(newNodes, newEdges));
  }

  /** Certifies {@code subgraph} as a graph, or returns empty if an edge dangles. */
  public static Optional<Graph> toGraph(String name, Subgraph subgraph) {
    if (danglingNode(subgraph).isPresent()) {
      return Optional.empty();
    }
    return Optional.of(new Graph(name, subgraph));
  }

  /** The first edge endpoint, in edge order, that names no node of {@code subgraph}. */
  public static Optional<String> danglingNode(Subgraph subgraph) {
    for (Edge edge : subgraph.edges().values()) {
      if (!subgraph.nodes().containsKey(edge.src())) {
        return Optional.of(edge.src());
      }
      if (!subgraph.nodes().containsKey(edge.dest())) {
        return Optional.of(edge.dest());
      }
    }
    return Optional.empty();
  }

  /** Copy of {@code graph} without the edges matching {@code drop}. Nodes are kept. */
  public static Graph removeEdges(Graph graph, Predicate<Edge> drop) {
    ImmutableMap.Builder<String, Edge> kept = ImmutableMap.builder();
    graph.edges()
        .forEach(
            (name, edge) -> {
              if (!drop.test(edge)) {
                kept.put(name, edge);
              }
            });
    return new Graph(graph.name(), new Subgraph(graph.nodes(), kept.build()));
  }

  /**
   * One axiom per edge, keyed by edge name: the source node's views, the edge command and the
   * destination node's views.
   */
  public static ImmutableMap<String, Axiom<ImmutableMultiset<GFunc>>> axiomatise(Graph graph) {
    ImmutableMap.Builder<String, Axiom<ImmutableMultiset<GFunc>>> axioms = ImmutableMap.builder();
    graph.edges()
        .forEach(
            (name, edge) ->
                axioms.put(
                    name,
                    new Axiom<>(
                        graph.nodes().get(edge.src()),
                        edge.command(),
                        graph.nodes().get(edge.dest()))));
    return axioms.build();
  }
}
