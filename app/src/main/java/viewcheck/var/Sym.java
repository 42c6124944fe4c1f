package viewcheck.var;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import viewcheck.expr.Expr;

/**
 * Variable wrapper that also admits symbolic leaves: opaque relation applications whose meaning is
 * not known in closed form.
 *
 * @param <V> the regular variable type
 */
public sealed interface Sym<V> permits Sym.Reg, Sym.Symbol {

  static <V> Sym<V> reg(V var) {
    return new Reg<>(var);
  }

  record Reg<V>(V var) implements Sym<V> {
    public Reg {
      Objects.requireNonNull(var, "var");
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  record Symbol<V>(String name, List<Expr<Sym<V>>> params) implements Sym<V> {
    public Symbol {
      Objects.requireNonNull(name, "name");
      params = List.copyOf(params);
    }

    @Override
    public String toString() {
      return "%{"
          + name
          + "}("
          + params.stream().map(Object::toString).collect(Collectors.joining(", "))
          + ")";
    }
  }
}
