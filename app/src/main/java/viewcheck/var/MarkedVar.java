package viewcheck.var;

import java.util.Objects;

/**
 * A variable name tagged with the program state it belongs to. The mark keeps one underlying
 * variable distinguishable across the pre-state, the post-state and the intermediate states of a
 * composed relation.
 */
public sealed interface MarkedVar
    permits MarkedVar.Before, MarkedVar.After, MarkedVar.Intermediate, MarkedVar.Goal {

  /** The unmarked variable name. */
  String name();

  record Before(String name) implements MarkedVar {
    public Before {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name + "!before";
    }
  }

  record After(String name) implements MarkedVar {
    public After {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name + "!after";
    }
  }

  /** Stage {@code n} of a sequential composition; stages are non-negative. */
  record Intermediate(long stage, String name) implements MarkedVar {
    public Intermediate {
      Objects.requireNonNull(name, "name");
      if (stage < 0) {
        throw new IllegalArgumentException("intermediate stage must be non-negative: " + stage);
      }
    }

    @Override
    public String toString() {
      return name + "!int" + stage;
    }
  }

  record Goal(long id, String name) implements MarkedVar {
    public Goal {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name + "!goal" + id;
    }
  }
}
