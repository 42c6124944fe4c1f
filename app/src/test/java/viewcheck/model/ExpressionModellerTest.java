package viewcheck.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static viewcheck.ast.Expression.bin;
import static viewcheck.ast.Expression.ident;
import static viewcheck.ast.Expression.num;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import viewcheck.ast.Bop;
import viewcheck.ast.Expression;
import viewcheck.diagnostics.ErrorKind;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.var.Param;
import viewcheck.var.VarTable;

final class ExpressionModellerTest {
  private static final VarTable ENV =
      VarTable.build(List.of(Param.intParam("n"), Param.boolParam("b")), new ArrayList<>());

  @Test
  void arithmeticAndComparisonsAreIntegerSorted() {
    BoolExpr<String> modelled =
        ExpressionModeller.modelBool(bin(Bop.LT, bin(Bop.ADD, ident("n"), num(1)), num(5)), ENV)
            .get();

    assertEquals(
        new BoolExpr.Lt<>(
            new IntExpr.Add<>(List.of(Exprs.aVar("n"), Exprs.aInt(1))), Exprs.<String>aInt(5)),
        modelled,
        "n + 1 < 5");
  }

  @Test
  void equalityFollowsTheLeftOperand() {
    assertEquals(
        Exprs.mkEq(Exprs.bVar("b"), Exprs.<String>bFalse()),
        ExpressionModeller.modelBool(bin(Bop.EQ, ident("b"), new Expression.False()), ENV).get(),
        "Boolean equality");
    assertEquals(
        Exprs.mkNot(Exprs.mkEq(Exprs.aVar("n"), Exprs.<String>aInt(2))),
        ExpressionModeller.modelBool(bin(Bop.NEQ, ident("n"), num(2)), ENV).get(),
        "!= is a negated equality");
    assertEquals(
        ErrorKind.TYPE_MISMATCH,
        ExpressionModeller.modelBool(bin(Bop.EQ, ident("n"), ident("b")), ENV).getLeft().kind(),
        "Sorts must agree");
  }

  @Test
  void unknownIdentifiersAndWrongSortsAreErrors() {
    assertEquals(
        ErrorKind.VAR_NOT_FOUND,
        ExpressionModeller.modelInt(ident("missing"), ENV).getLeft().kind(),
        "Undeclared variable");
    assertEquals(
        ErrorKind.TYPE_MISMATCH,
        ExpressionModeller.modelInt(bin(Bop.AND, ident("b"), ident("b")), ENV).getLeft().kind(),
        "A conjunction is not an integer");
    assertTrue(
        ExpressionModeller.modelBool(bin(Bop.ADD, ident("n"), ident("b")), ENV).isLeft(),
        "b cannot be added");
  }
}
