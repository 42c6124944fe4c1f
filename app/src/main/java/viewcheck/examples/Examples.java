package viewcheck.examples;

import static viewcheck.ast.Expression.bin;
import static viewcheck.ast.Expression.ident;

import java.util.List;
import viewcheck.ast.Atomic;
import viewcheck.ast.Block;
import viewcheck.ast.Bop;
import viewcheck.ast.CollatedScript;
import viewcheck.ast.Constraint;
import viewcheck.ast.Expression;
import viewcheck.ast.FetchMode;
import viewcheck.ast.Method;
import viewcheck.ast.PrimSet;
import viewcheck.ast.Statement;
import viewcheck.ast.View;
import viewcheck.ast.ViewDef;
import viewcheck.ast.ViewedStatement;
import viewcheck.var.Param;
import viewcheck.view.Func;

/** Built-in scripts, already collated. */
public final class Examples {
  private Examples() {}

  /**
   * The ticket lock.
   *
   * <pre>
   * globals int ticket, serving;  locals int t, s;
   * view holdTick(int t);  view holdLock();
   *
   * method lock() {
   *   {| emp |} &lt;t = ticket++&gt; {| holdTick(t) |}
   *   do {
   *     {| holdTick(t) |} &lt;s = serving&gt; {| if s == t then holdLock() else holdTick(t) |}
   *   } while (s != t);
   *   {| holdLock() |}
   * }
   * method unlock() { {| holdLock() |} &lt;serving++&gt; {| emp |} }
   * </pre>
   */
  public static CollatedScript ticketLock() {
    View holdTick = View.apply("holdTick", ident("t"));
    View holdLock = View.apply("holdLock");

    Block spin =
        block(
            holdTick,
            viewed(
                atomic(new Atomic.Fetch("s", ident("serving"), FetchMode.DIRECT)),
                new View.If(bin(Bop.EQ, ident("s"), ident("t")), holdLock, holdTick)));

    Method lock =
        new Method(
            Func.of("lock"),
            block(
                View.emp(),
                viewed(
                    atomic(new Atomic.Fetch("t", ident("ticket"), FetchMode.INCREMENT)),
                    holdTick),
                viewed(
                    new Statement.DoWhile(spin, bin(Bop.NEQ, ident("s"), ident("t"))), holdLock)));
    Method unlock =
        new Method(
            Func.of("unlock"),
            block(
                holdLock,
                viewed(atomic(new Atomic.Postfix("serving", FetchMode.INCREMENT)), View.emp())));

    return new CollatedScript(
        List.of(Func.of("holdTick", Param.intParam("t")), Func.<Param>of("holdLock")),
        List.of(Param.intParam("ticket"), Param.intParam("serving")),
        List.of(Param.intParam("t"), Param.intParam("s")),
        List.of(
            Constraint.of(ViewDef.emp(), bin(Bop.GE, ident("ticket"), ident("serving"))),
            Constraint.of(
                ViewDef.apply("holdTick", "t"), bin(Bop.GT, ident("ticket"), ident("t"))),
            Constraint.of(
                ViewDef.apply("holdLock"), bin(Bop.NEQ, ident("ticket"), ident("serving"))),
            Constraint.of(
                ViewDef.join(ViewDef.apply("holdLock"), ViewDef.apply("holdTick", "t")),
                bin(Bop.NEQ, ident("serving"), ident("t"))),
            Constraint.of(
                ViewDef.join(ViewDef.apply("holdTick", "ta"), ViewDef.apply("holdTick", "tb")),
                bin(Bop.NEQ, ident("ta"), ident("tb"))),
            Constraint.of(
                ViewDef.join(ViewDef.apply("holdLock"), ViewDef.apply("holdLock")),
                new Expression.False())),
        List.of(lock, unlock));
  }

  /**
   * A test-and-set spinlock built on compare-and-swap.
   *
   * <pre>
   * globals bool lock;  locals bool test;
   * view holdLock();
   *
   * method lock() {
   *   {| emp |}
   *   do {
   *     {| emp |}
   *     &lt;test = false; CAS(lock, test, true)&gt;
   *     {| if test == false then holdLock() else emp |}
   *   } while (test == true);
   *   {| holdLock() |}
   * }
   * method unlock() { {| holdLock() |} &lt;lock = false&gt; {| emp |} }
   * </pre>
   */
  public static CollatedScript spinLock() {
    View holdLock = View.apply("holdLock");
    Block attempt =
        block(
            View.emp(),
            viewed(
                atomic(
                    new Atomic.Fetch("test", new Expression.False(), FetchMode.DIRECT),
                    new Atomic.CompareAndSwap("lock", "test", new Expression.True())),
                new View.If(
                    bin(Bop.EQ, ident("test"), new Expression.False()), holdLock, View.emp())));
    Method lock =
        new Method(
            Func.of("lock"),
            block(
                View.emp(),
                viewed(
                    new Statement.DoWhile(
                        attempt, bin(Bop.EQ, ident("test"), new Expression.True())),
                    holdLock)));
    Method unlock =
        new Method(
            Func.of("unlock"),
            block(
                holdLock,
                viewed(
                    atomic(new Atomic.Fetch("lock", new Expression.False(), FetchMode.DIRECT)),
                    View.emp())));

    return new CollatedScript(
        List.of(Func.<Param>of("holdLock")),
        List.of(Param.boolParam("lock")),
        List.of(Param.boolParam("test")),
        List.of(
            Constraint.of(
                ViewDef.apply("holdLock"), bin(Bop.EQ, ident("lock"), new Expression.True())),
            Constraint.of(
                ViewDef.join(ViewDef.apply("holdLock"), ViewDef.apply("holdLock")),
                new Expression.False())),
        List.of(lock, unlock));
  }

  static Block block(View pre, ViewedStatement... contents) {
    return new Block(pre, List.of(contents));
  }

  static ViewedStatement viewed(Statement statement, View post) {
    return new ViewedStatement(statement, post);
  }

  static Statement atomic(Atomic... atomics) {
    return new Statement.Prim(PrimSet.atomic(atomics));
  }
}
