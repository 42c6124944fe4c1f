package viewcheck.model;

import io.vavr.control.Either;
import java.util.List;
import viewcheck.ast.Bop;
import viewcheck.ast.Expression;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.expr.IntExpr;
import viewcheck.var.VarTable;
import viewcheck.var.VarType;

/** Assigns sorts to surface expressions, checking every identifier against a variable table. */
public final class ExpressionModeller {
  private ExpressionModeller() {}

  /** Models {@code expression} at whichever sort its shape and variables give it. */
  public static Either<VerificationError, Expr<String>> model(Expression expression, VarTable env) {
    if (expression instanceof Expression.True) {
      return Either.right(Exprs.<String>bTrue());
    }
    if (expression instanceof Expression.False) {
      return Either.right(Exprs.<String>bFalse());
    }
    if (expression instanceof Expression.Int i) {
      return Either.right(Exprs.<String>aInt(i.value()));
    }
    if (expression instanceof Expression.Ident ident) {
      return env.lookup(ident.name())
          .<Either<VerificationError, Expr<String>>>map(
              type ->
                  Either.right(
                      type == VarType.INT
                          ? Exprs.<String>aVar(ident.name())
                          : Exprs.<String>bVar(ident.name())))
          .orElseGet(() -> Either.left(VerificationError.notFound(ident.name())));
    }
    return modelBinOp((Expression.BinOp) expression, env);
  }

  public static Either<VerificationError, IntExpr<String>> modelInt(
      Expression expression, VarTable env) {
    return model(expression, env).flatMap(e -> asInt(expression, e));
  }

  public static Either<VerificationError, BoolExpr<String>> modelBool(
      Expression expression, VarTable env) {
    return model(expression, env).flatMap(e -> asBool(expression, e));
  }

  /** Models {@code expression} at a required sort. */
  public static Either<VerificationError, Expr<String>> modelAs(
      VarType type, Expression expression, VarTable env) {
    if (type == VarType.INT) {
      return modelInt(expression, env).map(e -> e);
    }
    return modelBool(expression, env).map(e -> e);
  }

  private static Either<VerificationError, Expr<String>> modelBinOp(
      Expression.BinOp binOp, VarTable env) {
    Bop op = binOp.op();
    if (op.isArithmetic()) {
      return modelInt(binOp.lhs(), env)
          .flatMap(l -> modelInt(binOp.rhs(), env).map(r -> arithmetic(op, l, r)));
    }
    if (op.isComparison()) {
      return modelInt(binOp.lhs(), env)
          .flatMap(l -> modelInt(binOp.rhs(), env).map(r -> comparison(op, l, r)));
    }
    if (op.isLogical()) {
      return modelBool(binOp.lhs(), env)
          .flatMap(
              l ->
                  modelBool(binOp.rhs(), env)
                      .map(r -> op == Bop.AND ? Exprs.mkAnd(l, r) : Exprs.mkOr(l, r)));
    }
    // == and != take the sort of their left operand.
    return model(binOp.lhs(), env)
        .flatMap(
            l -> {
              VarType sort = l instanceof IntExpr ? VarType.INT : VarType.BOOL;
              return modelAs(sort, binOp.rhs(), env)
                  .map(
                      r -> {
                        BoolExpr<String> eq = Exprs.mkEq(l, r);
                        return op == Bop.EQ ? eq : Exprs.mkNot(eq);
                      });
            });
  }

  private static Expr<String> arithmetic(Bop op, IntExpr<String> l, IntExpr<String> r) {
    switch (op) {
      case ADD:
        return new IntExpr.Add<>(List.of(l, r));
      case SUB:
        return new IntExpr.Sub<>(List.of(l, r));
      case MUL:
        return new IntExpr.Mul<>(List.of(l, r));
      default:
        return new IntExpr.Div<>(l, r);
    }
  }

  private static Expr<String> comparison(Bop op, IntExpr<String> l, IntExpr<String> r) {
    switch (op) {
      case GT:
        return new BoolExpr.Gt<>(l, r);
      case GE:
        return new BoolExpr.Ge<>(l, r);
      case LE:
        return new BoolExpr.Le<>(l, r);
      default:
        return new BoolExpr.Lt<>(l, r);
    }
  }

  private static Either<VerificationError, IntExpr<String>> asInt(
      Expression source, Expr<String> modelled) {
    if (modelled instanceof IntExpr<String> i) {
      return Either.right(i);
    }
    return Either.left(
        VerificationError.typeMismatch(source.toString(), VarType.INT, VarType.BOOL));
  }

  private static Either<VerificationError, BoolExpr<String>> asBool(
      Expression source, Expr<String> modelled) {
    if (modelled instanceof BoolExpr<String> b) {
      return Either.right(b);
    }
    return Either.left(
        VerificationError.typeMismatch(source.toString(), VarType.BOOL, VarType.INT));
  }
}
