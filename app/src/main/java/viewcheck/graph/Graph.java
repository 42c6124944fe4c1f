package viewcheck.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import java.util.Objects;
import java.util.Optional;
import viewcheck.view.GFunc;

/**
 * A named subgraph whose edges only reference nodes it contains. Instances come from {@link
 * Graphs#toGraph(String, Subgraph)} and the operations in {@link Graphs} that preserve validity.
 */
public final class Graph {
  private final String name;
  private final Subgraph contents;

  Graph(String name, Subgraph contents) {
    this.name = Objects.requireNonNull(name, "name");
    this.contents = Objects.requireNonNull(contents, "contents");
  }

  public String name() {
    return name;
  }

  public Subgraph contents() {
    return contents;
  }

  public ImmutableMap<String, ImmutableMultiset<GFunc>> nodes() {
    return contents.nodes();
  }

  public ImmutableMap<String, Edge> edges() {
    return contents.edges();
  }

  public Optional<ImmutableMultiset<GFunc>> viewsAt(String node) {
    return Optional.ofNullable(contents.nodes().get(node));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Graph other && name.equals(other.name) && contents.equals(other.contents);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, contents);
  }

  @Override
  public String toString() {
    return "Graph[" + name + ", " + nodes().size() + " nodes, " + edges().size() + " edges]";
  }
}
