package viewcheck.command;

import java.util.List;
import java.util.Objects;
import viewcheck.expr.BoolExpr;
import viewcheck.var.Param;

/** Two-state meaning of a primitive, written over its formal parameter names. */
public record PrimitiveDef(List<Param> formals, BoolExpr<String> body) {

  public PrimitiveDef {
    formals = List.copyOf(formals);
    Objects.requireNonNull(body, "body");
  }
}
