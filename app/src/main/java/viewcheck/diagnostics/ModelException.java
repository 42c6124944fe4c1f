package viewcheck.diagnostics;

import java.util.List;
import java.util.stream.Collectors;

/** Raised when a script cannot be modelled at all; carries every error found before giving up. */
public final class ModelException extends Exception {
  private static final long serialVersionUID = 1L;

  private final List<VerificationError> errors;

  public ModelException(List<VerificationError> errors) {
    super(describe(errors));
    this.errors = List.copyOf(errors);
  }

  public List<VerificationError> errors() {
    return errors;
  }

  private static String describe(List<VerificationError> errors) {
    return errors.size()
        + " model error(s): "
        + errors.stream().map(VerificationError::toString).collect(Collectors.joining("; "));
  }
}
