package viewcheck.ast;

import java.util.Objects;
import viewcheck.view.Func;

/** A view assertion as written in a method body. */
public sealed interface View permits View.Unit, View.Apply, View.Join, View.If {

  /** {@code emp}. */
  record Unit() implements View {
    @Override
    public String toString() {
      return "emp";
    }
  }

  record Apply(Func<Expression> func) implements View {
    public Apply {
      Objects.requireNonNull(func, "func");
    }

    @Override
    public String toString() {
      return func.toString();
    }
  }

  record Join(View left, View right) implements View {
    public Join {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return left + " * " + right;
    }
  }

  record If(Expression condition, View then, View otherwise) implements View {
    public If {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(then, "then");
      Objects.requireNonNull(otherwise, "otherwise");
    }

    @Override
    public String toString() {
      return "if " + condition + " then " + then + " else " + otherwise;
    }
  }

  static View emp() {
    return new Unit();
  }

  static View apply(String name, Expression... params) {
    return new Apply(Func.of(name, params));
  }

  static View join(View left, View right) {
    return new Join(left, right);
  }
}
