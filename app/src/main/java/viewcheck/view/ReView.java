package viewcheck.view;

import java.util.List;
import java.util.Objects;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;

/**
 * One way of satisfying a view definition: the definition matched, the conjunction of the guards
 * consumed and the consumed view instances in pattern order.
 */
public record ReView(
    ViewDefinition definition, BoolExpr<String> guard, List<Func<Expr<String>>> items) {

  public ReView {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(guard, "guard");
    items = List.copyOf(items);
  }

  @Override
  public String toString() {
    return guard + " -> " + items;
  }
}
