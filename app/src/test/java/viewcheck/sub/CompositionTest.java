package viewcheck.sub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import viewcheck.command.Commands;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

final class CompositionTest {

  @Test
  void sequentialLinksPostStateOfFirstToPreStateOfSecond() {
    BoolExpr<Sym<MarkedVar>> increment = increment("x");

    BoolExpr<Sym<MarkedVar>> composed = Composition.sequential(increment, increment);

    BoolExpr<Sym<MarkedVar>> expected =
        Exprs.mkAnd(
            Exprs.mkEq(stage(0, "x"), Exprs.aAdd(Commands.intBefore("x"), Exprs.aInt(1))),
            Exprs.mkEq(Commands.intAfter("x"), Exprs.aAdd(stage(0, "x"), Exprs.aInt(1))));
    assertEquals(expected, composed, "x!int0 should join the two increments");
  }

  @Test
  void repeatedCompositionNeverReusesAStage() {
    BoolExpr<Sym<MarkedVar>> twice = Composition.sequential(increment("x"), increment("x"));

    BoolExpr<Sym<MarkedVar>> four = Composition.sequential(twice, twice);

    assertEquals(3L, Intermediates.next(four), "Stages 0, 1 and 2 should all be in use");
    assertTrue(four.toString().contains("x!int1"), "The join of the halves is stage 1");
    assertTrue(four.toString().contains("x!int2"), "The inner stage of the second half moved");
  }

  private static BoolExpr<Sym<MarkedVar>> increment(String name) {
    return Exprs.mkEq(
        Commands.intAfter(name), Exprs.aAdd(Commands.intBefore(name), Exprs.aInt(1)));
  }

  private static IntExpr<Sym<MarkedVar>> stage(long n, String name) {
    return Exprs.aVar(Sym.<MarkedVar>reg(new MarkedVar.Intermediate(n, name)));
  }
}
