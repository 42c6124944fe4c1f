package viewcheck.ast;

import java.util.Objects;
import viewcheck.view.Func;

/** The shape of a constrained view: a join of patterns with bare parameter names. */
public sealed interface ViewDef permits ViewDef.Unit, ViewDef.Join, ViewDef.Apply {

  record Unit() implements ViewDef {
    @Override
    public String toString() {
      return "emp";
    }
  }

  record Join(ViewDef left, ViewDef right) implements ViewDef {
    public Join {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return left + " * " + right;
    }
  }

  record Apply(Func<String> func) implements ViewDef {
    public Apply {
      Objects.requireNonNull(func, "func");
    }

    @Override
    public String toString() {
      return func.toString();
    }
  }

  static ViewDef emp() {
    return new Unit();
  }

  static ViewDef apply(String name, String... params) {
    return new Apply(Func.of(name, params));
  }

  static ViewDef join(ViewDef left, ViewDef right) {
    return new Join(left, right);
  }
}
