package viewcheck.graph;

import com.google.common.collect.ImmutableMultiset;
import io.vavr.control.Either;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.command.Command;
import viewcheck.command.Commands;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Exprs;
import viewcheck.model.ModelBlock;
import viewcheck.model.ModelMethod;
import viewcheck.model.PartCmd;
import viewcheck.model.ViewedPart;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;
import viewcheck.view.GFunc;

/**
 * Lays out the control flow of a modelled method as a graph.
 *
 * <p>Nodes are named {@code <method>_V<n>} and edges {@code <method>_C<n>}, numbered in creation
 * order. Every view assertion in the body becomes a node; branches and loops add edges labelled
 * with {@code Assume} of their condition, and joins add {@code Id} edges.
 */
public final class Grapher {
  private static final Logger LOG = LoggerFactory.getLogger(Grapher.class);

  private final String method;
  private final Map<String, ImmutableMultiset<GFunc>> nodes = new LinkedHashMap<>();
  private final Map<String, Edge> edges = new LinkedHashMap<>();

  private Grapher(String method) {
    this.method = method;
  }

  public static Either<VerificationError, Graph> graph(ModelMethod method) {
    Grapher grapher = new Grapher(method.name());
    ModelBlock body = method.body();
    String pre = grapher.node(body.pre());
    String post = grapher.node(body.post());
    grapher.block(body, pre, post);

    Subgraph subgraph = Subgraph.of(grapher.nodes, grapher.edges);
    Optional<Graph> graph = Graphs.toGraph(method.name(), subgraph);
    if (graph.isEmpty()) {
      String missing = Graphs.danglingNode(subgraph).orElse("?");
      return Either.left(VerificationError.noSuchNode(method.name(), missing));
    }
    LOG.debug(
        "Graphed method {}: {} node(s), {} edge(s)",
        method.name(),
        grapher.nodes.size(),
        grapher.edges.size());
    return Either.right(graph.get());
  }

  private String node(ImmutableMultiset<GFunc> views) {
    String name = method + "_V" + nodes.size();
    nodes.put(name, views);
    return name;
  }

  private void edge(String src, Command command, String dest) {
    edges.put(method + "_C" + edges.size(), new Edge(src, command, dest));
  }

  /** Graphs {@code block} between two existing nodes holding its pre- and postcondition. */
  private void block(ModelBlock block, String pre, String post) {
    List<ViewedPart> contents = block.contents();
    if (contents.isEmpty()) {
      edge(pre, Commands.id(), post);
      return;
    }
    String current = pre;
    for (int i = 0; i < contents.size(); i++) {
      ViewedPart part = contents.get(i);
      String next = i == contents.size() - 1 ? post : node(part.post());
      part(part.command(), current, next);
      current = next;
    }
  }

  private void part(PartCmd command, String src, String dest) {
    if (command instanceof PartCmd.Prim prim) {
      edge(src, prim.command(), dest);
    } else if (command instanceof PartCmd.Ite ite) {
      BoolExpr<Sym<MarkedVar>> condition = ite.condition();
      branch(ite.then(), src, Commands.assume(condition), dest);
      branch(ite.otherwise(), src, Commands.assume(Exprs.mkNot(condition)), dest);
    } else if (command instanceof PartCmd.While loop) {
      Command stay = Commands.assume(loop.condition());
      Command leave = Commands.assume(Exprs.mkNot(loop.condition()));
      String in = node(loop.body().pre());
      String out = node(loop.body().post());
      block(loop.body(), in, out);
      if (loop.isDo()) {
        edge(src, Commands.id(), in);
      } else {
        edge(src, stay, in);
        edge(src, leave, dest);
      }
      edge(out, stay, in);
      edge(out, leave, dest);
    } else {
      for (ModelBlock block : ((PartCmd.Parallel) command).blocks()) {
        branch(block, src, Commands.id(), dest);
      }
    }
  }

  /** Graphs {@code block} on its own nodes, entered from {@code src} and left to {@code dest}. */
  private void branch(ModelBlock block, String src, Command entry, String dest) {
    String in = node(block.pre());
    String out = node(block.post());
    block(block, in, out);
    edge(src, entry, in);
    edge(out, Commands.id(), dest);
  }
}
