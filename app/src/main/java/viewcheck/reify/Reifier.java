package viewcheck.reify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.graph.Axiom;
import viewcheck.var.Param;
import viewcheck.view.Func;
import viewcheck.view.GFunc;
import viewcheck.view.ReView;
import viewcheck.view.ViewDefinition;

/**
 * Matches the view instances held at a program point against the declared view definitions.
 *
 * <p>Matching is exhaustive backtracking: every assignment of held instances to the pattern
 * components of a definition, in pattern order, yields one {@link ReView}. Repeated instances in
 * the held multiset are distinct candidates, so two equal instances give two matches for a
 * one-component pattern. Each match remembers the definition it satisfies, so definitions of the
 * same shape stay apart.
 */
public final class Reifier {
  private static final Logger LOG = LoggerFactory.getLogger(Reifier.class);

  private Reifier() {}

  /** Every way {@code held} satisfies the pattern of {@code definition}. */
  public static ImmutableMultiset<ReView> reifySingleDef(
      List<GFunc> held, ViewDefinition definition) {
    ImmutableMultiset.Builder<ReView> results = ImmutableMultiset.builder();
    match(definition, 0, held, new ArrayList<>(), results);
    return results.build();
  }

  /** The union, over all definitions, of {@link #reifySingleDef(List, ViewDefinition)}. */
  public static ImmutableMultiset<ReView> reifyView(
      List<ViewDefinition> definitions, ImmutableMultiset<GFunc> held) {
    List<GFunc> flat = ImmutableList.copyOf(held);
    ImmutableMultiset.Builder<ReView> results = ImmutableMultiset.builder();
    for (ViewDefinition definition : definitions) {
      results.addAll(reifySingleDef(flat, definition));
    }
    ImmutableMultiset<ReView> viewSet = results.build();
    LOG.debug("Reified {} held view(s) into {} match(es)", flat.size(), viewSet.size());
    return viewSet;
  }

  /** Reifies both conditions of an axiom. */
  public static Axiom<ImmutableMultiset<ReView>> reifyAxiom(
      List<ViewDefinition> definitions, Axiom<ImmutableMultiset<GFunc>> axiom) {
    return new Axiom<>(
        reifyView(definitions, axiom.pre()),
        axiom.command(),
        reifyView(definitions, axiom.post()));
  }

  private static void match(
      ViewDefinition definition,
      int next,
      List<GFunc> remaining,
      List<GFunc> consumed,
      ImmutableMultiset.Builder<ReView> results) {
    List<Func<Param>> pattern = definition.pattern();
    if (next == pattern.size()) {
      List<BoolExpr<String>> guards = new ArrayList<>(consumed.size());
      List<Func<Expr<String>>> items = new ArrayList<>(consumed.size());
      for (GFunc view : consumed) {
        guards.add(view.guard());
        items.add(view.item());
      }
      results.add(new ReView(definition, Exprs.mkAnd(guards), items));
      return;
    }
    Func<Param> component = pattern.get(next);
    for (int i = 0; i < remaining.size(); i++) {
      GFunc candidate = remaining.get(i);
      if (!component.sameShape(candidate.item())) {
        continue;
      }
      List<GFunc> rest = new ArrayList<>(remaining.size() - 1);
      rest.addAll(remaining.subList(0, i));
      rest.addAll(remaining.subList(i + 1, remaining.size()));
      consumed.add(candidate);
      match(definition, next + 1, rest, consumed, results);
      consumed.remove(consumed.size() - 1);
    }
  }
}
