package viewcheck.view;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import viewcheck.expr.BoolExpr;
import viewcheck.var.Param;

/**
 * A declared view constraint: a join of named patterns, flattened to its components, and the
 * Boolean meaning of that join over the pattern parameters and the shared variables. A view
 * without a definition is indefinite.
 */
public record ViewDefinition(List<Func<Param>> pattern, Optional<BoolExpr<String>> definition) {

  public ViewDefinition {
    pattern = List.copyOf(pattern);
    Objects.requireNonNull(definition, "definition");
  }

  public static ViewDefinition of(List<Func<Param>> pattern, BoolExpr<String> definition) {
    return new ViewDefinition(pattern, Optional.of(definition));
  }

  public static ViewDefinition indefinite(List<Func<Param>> pattern) {
    return new ViewDefinition(pattern, Optional.empty());
  }

  /** True if {@code items} line up, name and arity, with this pattern. */
  public boolean matches(List<? extends Func<?>> items) {
    if (items.size() != pattern.size()) {
      return false;
    }
    for (int i = 0; i < items.size(); i++) {
      if (!pattern.get(i).sameShape(items.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    String view =
        pattern.isEmpty()
            ? "emp"
            : pattern.stream().map(Func::toString).collect(Collectors.joining(" * "));
    return view + " -> " + definition.map(Object::toString).orElse("?");
  }
}
