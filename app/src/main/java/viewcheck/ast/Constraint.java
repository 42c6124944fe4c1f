package viewcheck.ast;

import java.util.Objects;
import java.util.Optional;

/** {@code constraint view -> expression}, or {@code view -> ?} when left indefinite. */
public record Constraint(ViewDef view, Optional<Expression> definition) {

  public Constraint {
    Objects.requireNonNull(view, "view");
    Objects.requireNonNull(definition, "definition");
  }

  public static Constraint of(ViewDef view, Expression definition) {
    return new Constraint(view, Optional.of(definition));
  }
}
