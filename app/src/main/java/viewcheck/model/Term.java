package viewcheck.model;

import java.util.Objects;
import viewcheck.expr.BoolExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

/**
 * A proof obligation in solver-ready form: it holds iff {@code pre && command => post} is valid.
 * Pre-state variables are marked {@code Before}, post-state ones {@code After}.
 */
public record Term(
    BoolExpr<Sym<MarkedVar>> pre,
    BoolExpr<Sym<MarkedVar>> command,
    BoolExpr<Sym<MarkedVar>> post) {

  public Term {
    Objects.requireNonNull(pre, "pre");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(post, "post");
  }

  @Override
  public String toString() {
    return "(" + pre + ") && (" + command + ") => (" + post + ")";
  }
}
