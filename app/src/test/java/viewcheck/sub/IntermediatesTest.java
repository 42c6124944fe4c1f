package viewcheck.sub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import viewcheck.command.Commands;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

final class IntermediatesTest {

  @Test
  void noIntermediatesGivesStageZero() {
    BoolExpr<Sym<MarkedVar>> expr =
        Exprs.mkEq(Commands.intAfter("x"), Exprs.aAdd(Commands.intBefore("x"), Exprs.aInt(1)));

    assertEquals(0L, Intermediates.next(expr), "Only pre and post-state variables present");
    assertEquals(0L, Intermediates.next(Exprs.<Sym<MarkedVar>>bTrue()), "Constants have none");
  }

  @Test
  void nextStageIsOnePastTheHighest() {
    BoolExpr<Sym<MarkedVar>> expr =
        Exprs.mkAnd(
            Exprs.mkEq(intermediate(1, "x"), Commands.intBefore("y")),
            new BoolExpr.Gt<>(intermediate(3, "x"), Exprs.aInt(0)));

    assertEquals(4L, Intermediates.next(expr), "Stage 3 is the highest in use");
  }

  @Test
  void stagesInsideSymbolParametersCount() {
    Sym<MarkedVar> symbol = new Sym.Symbol<MarkedVar>("opaque", List.of(intermediate(3, "x")));
    BoolExpr<Sym<MarkedVar>> expr = Exprs.mkNot(Exprs.bVar(symbol));

    assertTrue(Intermediates.next(expr) >= 4L, "Symbol parameters are searched too");
  }

  private static IntExpr<Sym<MarkedVar>> intermediate(long stage, String name) {
    return Exprs.aVar(Sym.<MarkedVar>reg(new MarkedVar.Intermediate(stage, name)));
  }
}
