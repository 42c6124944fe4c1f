package viewcheck.backend;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import io.vavr.control.Either;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.diagnostics.VerificationError;
import viewcheck.model.Term;

/**
 * {@link SolverBackend} on the Z3 Java API. Every call owns a fresh {@link Context}, so calls may
 * run concurrently.
 */
public final class Z3Backend implements SolverBackend {
  private static final Logger LOG = LoggerFactory.getLogger(Z3Backend.class);

  private final long timeoutMs;

  /** @param timeoutMs per-check solver timeout; zero or less means none */
  public Z3Backend(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  @Override
  public Either<VerificationError, BackendResult> process(
      String axiom, Term term, Request request) {
    try (Context ctx = new Context()) {
      Z3Translator translator = new Z3Translator(ctx);
      BoolExpr pre = translator.bool(term.pre());
      BoolExpr command = translator.bool(term.command());
      BoolExpr post = translator.bool(term.post());
      if (request == Request.TRANSLATE) {
        return Either.right(
            new BackendResult(
                request,
                pre.toString(),
                command.toString(),
                post.toString(),
                Optional.empty(),
                Optional.empty()));
      }

      BoolExpr combined = ctx.mkAnd(pre, command, ctx.mkNot(post));
      Optional<Verdict> verdict = Optional.empty();
      if (request == Request.SAT) {
        verdict = Optional.of(check(ctx, combined));
        LOG.debug("Axiom {}: {}", axiom, verdict.get());
      }
      return Either.right(
          new BackendResult(
              request,
              pre.toString(),
              command.toString(),
              post.toString(),
              Optional.of(combined.simplify().toString()),
              verdict));
    } catch (Z3Exception e) {
      LOG.warn("Z3 failed on axiom {}: {}", axiom, e.getMessage());
      return Either.left(VerificationError.translator(axiom, String.valueOf(e.getMessage())));
    }
  }

  private Verdict check(Context ctx, BoolExpr formula) {
    Solver solver = ctx.mkSolver();
    if (timeoutMs > 0) {
      Params params = ctx.mkParams();
      params.add("timeout", (int) Math.min(timeoutMs, Integer.MAX_VALUE));
      solver.setParameters(params);
    }
    solver.add(formula);
    Status status = solver.check();
    switch (status) {
      case SATISFIABLE:
        return Verdict.SATISFIABLE;
      case UNSATISFIABLE:
        return Verdict.UNSATISFIABLE;
      default:
        return Verdict.UNKNOWN;
    }
  }
}
