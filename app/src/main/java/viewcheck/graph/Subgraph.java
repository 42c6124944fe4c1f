package viewcheck.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import java.util.Map;
import java.util.Objects;
import viewcheck.view.GFunc;

/**
 * Provisional graph contents. Edges may name nodes that are not (yet) in {@code nodes}; {@link
 * Graphs#toGraph(String, Subgraph)} is the only way to certify that they do not.
 */
public record Subgraph(
    ImmutableMap<String, ImmutableMultiset<GFunc>> nodes, ImmutableMap<String, Edge> edges) {

  public Subgraph {
    Objects.requireNonNull(nodes, "nodes");
    Objects.requireNonNull(edges, "edges");
  }

  public static Subgraph of(
      Map<String, ImmutableMultiset<GFunc>> nodes, Map<String, Edge> edges) {
    return new Subgraph(ImmutableMap.copyOf(nodes), ImmutableMap.copyOf(edges));
  }

  public static Subgraph empty() {
    return new Subgraph(ImmutableMap.of(), ImmutableMap.of());
  }
}
