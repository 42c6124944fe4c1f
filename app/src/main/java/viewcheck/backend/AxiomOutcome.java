package viewcheck.backend;

import io.vavr.control.Either;
import java.util.Objects;
import viewcheck.diagnostics.VerificationError;

/** The result, or the error, for one named axiom. */
public record AxiomOutcome(String axiom, Either<VerificationError, BackendResult> result) {

  public AxiomOutcome {
    Objects.requireNonNull(axiom, "axiom");
    Objects.requireNonNull(result, "result");
  }

  public static AxiomOutcome failed(String axiom, VerificationError error) {
    return new AxiomOutcome(axiom, Either.left(error));
  }

  public boolean isFailure() {
    return result.isLeft();
  }

  /** True only if the axiom was checked and found to hold. */
  public boolean proven() {
    return result.isRight() && result.get().verdict().map(Verdict::proven).orElse(false);
  }
}
