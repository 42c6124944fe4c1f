package viewcheck.sub;

import viewcheck.expr.BoolExpr;
import viewcheck.expr.Exprs;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

/** Sequential composition of two-state relations. */
public final class Composition {
  private Composition() {}

  /**
   * Composes {@code first ; second}. The post-state of {@code first} and the pre-state of {@code
   * second} are both renamed to stage {@code k = Intermediates.next(first)}, and the intermediate
   * stages already inside {@code second} are shifted past {@code k}, so the stages of the two
   * relations never collide.
   */
  public static BoolExpr<Sym<MarkedVar>> sequential(
      BoolExpr<Sym<MarkedVar>> first, BoolExpr<Sym<MarkedVar>> second) {
    long k = Intermediates.next(first);
    BoolExpr<Sym<MarkedVar>> renamedFirst =
        Substitutions.renameRegs(
            (MarkedVar v) ->
                v instanceof MarkedVar.After ? new MarkedVar.Intermediate(k, v.name()) : v,
            first);
    BoolExpr<Sym<MarkedVar>> renamedSecond =
        Substitutions.renameRegs((MarkedVar v) -> shiftSecond(v, k), second);
    return Exprs.mkAnd(renamedFirst, renamedSecond);
  }

  private static MarkedVar shiftSecond(MarkedVar var, long k) {
    if (var instanceof MarkedVar.Before) {
      return new MarkedVar.Intermediate(k, var.name());
    }
    if (var instanceof MarkedVar.Intermediate stage) {
      return new MarkedVar.Intermediate(stage.stage() + k + 1, var.name());
    }
    return var;
  }
}
