package viewcheck.command;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import viewcheck.expr.Expr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;
import viewcheck.view.Func;

/**
 * A sequential composition of primitive applications. Each primitive keys into a {@link
 * PrimitiveTable} that gives its two-state meaning.
 */
public record Command(List<Func<Expr<Sym<MarkedVar>>>> prims) {

  public Command {
    prims = List.copyOf(prims);
  }

  @SafeVarargs
  public static Command of(Func<Expr<Sym<MarkedVar>>>... prims) {
    return new Command(Arrays.asList(prims));
  }

  public boolean isEmpty() {
    return prims.isEmpty();
  }

  @Override
  public String toString() {
    return prims.isEmpty()
        ? "<>"
        : prims.stream().map(Func::toString).collect(Collectors.joining("; ", "<", ">"));
  }
}
