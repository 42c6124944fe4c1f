package viewcheck.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static viewcheck.ast.Expression.bin;
import static viewcheck.ast.Expression.ident;
import static viewcheck.ast.Expression.num;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import viewcheck.ast.Atomic;
import viewcheck.ast.Block;
import viewcheck.ast.Bop;
import viewcheck.ast.CollatedScript;
import viewcheck.ast.Constraint;
import viewcheck.ast.FetchMode;
import viewcheck.ast.Method;
import viewcheck.ast.PrimSet;
import viewcheck.ast.Statement;
import viewcheck.ast.View;
import viewcheck.ast.ViewDef;
import viewcheck.ast.ViewedStatement;
import viewcheck.command.Command;
import viewcheck.command.Commands;
import viewcheck.command.PrimitiveTable;
import viewcheck.diagnostics.ErrorKind;
import viewcheck.diagnostics.ModelException;
import viewcheck.diagnostics.VerificationError;
import viewcheck.examples.Examples;
import viewcheck.expr.Expr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Param;
import viewcheck.var.Sym;
import viewcheck.var.VarType;
import viewcheck.view.Func;
import viewcheck.view.ViewDefinition;

final class ModellerTest {

  @Test
  void ticketLockModelsCleanly() throws ModelException {
    Model<ModelMethod> model = Modeller.model(Examples.ticketLock());

    assertEquals(List.of("lock", "unlock"), List.copyOf(model.items().keySet()), "Both methods");
    assertTrue(model.failures().isEmpty(), "No method should fail");
    assertEquals(6, model.definitions().size(), "Every constraint becomes a definition");
    assertEquals(Optional.of(VarType.INT), model.globals().lookup("ticket"), "ticket is shared");
    assertEquals(Optional.of(VarType.INT), model.locals().lookup("t"), "t is thread-local");
  }

  @Test
  void definitionPatternsTakeTheirTypesFromThePrototypes() throws ModelException {
    Model<ModelMethod> model = Modeller.model(Examples.ticketLock());

    ViewDefinition pair = model.definitions().get(4);
    assertEquals(
        List.of(
            Func.of("holdTick", Param.intParam("ta")), Func.of("holdTick", Param.intParam("tb"))),
        pair.pattern(),
        "Joins flatten in order and keep the names used in the constraint");
    assertTrue(model.definitions().get(0).pattern().isEmpty(), "emp is the empty pattern");
  }

  @Test
  void fetchAndIncrementBecomesOneLoadIncrement() throws ModelException {
    Model<ModelMethod> model = Modeller.model(Examples.ticketLock());

    PartCmd first = model.items().get("lock").body().contents().get(0).command();

    Command expected =
        Command.of(
            new Func<Expr<Sym<MarkedVar>>>(
                PrimitiveTable.LOAD_INCREMENT,
                List.of(
                    Commands.intAfter("t"),
                    Commands.intBefore("ticket"),
                    Commands.intAfter("ticket"))));
    assertEquals(new PartCmd.Prim(expected), first, "t = ticket++ is a single primitive");
  }

  @Test
  void duplicateVariablesRejectTheScript() {
    CollatedScript script =
        script(
            List.of(Param.intParam("x")),
            List.of(Param.boolParam("x")),
            List.of(),
            List.of());

    ModelException ex = assertThrows(ModelException.class, () -> Modeller.model(script));

    assertEquals(ErrorKind.VAR_DUPLICATE, ex.errors().get(0).kind(), "x is declared twice");
  }

  @Test
  void badConstraintsRejectTheScript() {
    CollatedScript script =
        script(
            List.of(Param.intParam("x")),
            List.of(),
            List.of(
                Constraint.of(ViewDef.apply("held", "a", "b"), bin(Bop.GT, ident("a"), num(0))),
                Constraint.of(ViewDef.apply("ghost"), bin(Bop.GT, ident("x"), num(0))),
                Constraint.of(ViewDef.apply("held", "a"), bin(Bop.GT, ident("missing"), num(0)))),
            List.of());

    ModelException ex = assertThrows(ModelException.class, () -> Modeller.model(script));

    assertEquals(
        List.of(ErrorKind.ARITY_MISMATCH, ErrorKind.VIEW_NOT_FOUND, ErrorKind.VAR_NOT_FOUND),
        ex.errors().stream().map(VerificationError::kind).toList(),
        "Every constraint error is collected");
  }

  @Test
  void indefiniteConstraintHasNoDefinition() throws ModelException {
    CollatedScript script =
        script(
            List.of(),
            List.of(),
            List.of(new Constraint(ViewDef.apply("held", "a"), Optional.empty())),
            List.of());

    Model<ModelMethod> model = Modeller.model(script);

    assertEquals(Optional.empty(), model.definitions().get(0).definition(), "Left as ?");
  }

  @Test
  void aBrokenMethodDoesNotStopTheOthers() throws ModelException {
    Method broken =
        method("broken", atomic(new Atomic.Fetch("x", ident("nowhere"), FetchMode.DIRECT)));
    Method fine = method("fine", atomic(new Atomic.Postfix("x", FetchMode.INCREMENT)));
    CollatedScript script =
        script(List.of(Param.intParam("x")), List.of(), List.of(), List.of(broken, fine));

    Model<ModelMethod> model = Modeller.model(script);

    assertEquals(List.of("fine"), List.copyOf(model.items().keySet()), "fine is still modelled");
    assertEquals(
        ErrorKind.VAR_NOT_FOUND,
        model.failures().get("broken").get(0).kind(),
        "The unknown source is reported against its method");
  }

  @Test
  void viewArityIsCheckedInMethodBodies() throws ModelException {
    Method method =
        new Method(
            Func.of("m"),
            new Block(
                View.apply("held"),
                List.of(
                    new ViewedStatement(
                        atomic(new Atomic.Postfix("x", FetchMode.INCREMENT)), View.emp()))));
    CollatedScript script =
        script(List.of(Param.intParam("x")), List.of(), List.of(), List.of(method));

    Model<ModelMethod> model = Modeller.model(script);

    assertEquals(
        ErrorKind.ARITY_MISMATCH,
        model.failures().get("m").get(0).kind(),
        "held takes one argument");
  }

  @Test
  void incrementingABooleanIsUnsupported() throws ModelException {
    Method method = method("m", atomic(new Atomic.Postfix("flag", FetchMode.INCREMENT)));
    CollatedScript script =
        script(List.of(Param.boolParam("flag")), List.of(), List.of(), List.of(method));

    Model<ModelMethod> model = Modeller.model(script);

    assertEquals(ErrorKind.UNSUPPORTED, model.failures().get("m").get(0).kind(), "flag++");
  }

  private static CollatedScript script(
      List<Param> globals, List<Param> locals, List<Constraint> constraints, List<Method> methods) {
    return new CollatedScript(
        List.of(Func.of("held", Param.intParam("n"))), globals, locals, constraints, methods);
  }

  private static Method method(String name, Statement statement) {
    return new Method(
        Func.of(name),
        new Block(View.emp(), List.of(new ViewedStatement(statement, View.emp()))));
  }

  private static Statement atomic(Atomic atomic) {
    return new Statement.Prim(PrimSet.atomic(atomic));
  }
}
