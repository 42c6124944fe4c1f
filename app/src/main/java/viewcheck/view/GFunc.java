package viewcheck.view;

import java.util.Objects;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;

/** A view instance held provided {@code guard} holds. */
public record GFunc(BoolExpr<String> guard, Func<Expr<String>> item) {

  public GFunc {
    Objects.requireNonNull(guard, "guard");
    Objects.requireNonNull(item, "item");
  }

  @Override
  public String toString() {
    return "(" + guard + " -> " + item + ")";
  }
}
