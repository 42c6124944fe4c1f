package viewcheck.backend;

import io.vavr.control.Either;
import viewcheck.diagnostics.VerificationError;
import viewcheck.model.Term;

/** The boundary to an external solver. Implementations must be safe to call concurrently. */
public interface SolverBackend {

  /** Processes one term as far as {@code request} asks; translation failures are returned. */
  Either<VerificationError, BackendResult> process(String axiom, Term term, Request request);
}
