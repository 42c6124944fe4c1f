package viewcheck.diagnostics;

import java.util.Objects;

/**
 * Structured error entry. {@code subject} names the variable, view, method or axiom the error is
 * reported against.
 */
public record VerificationError(ErrorKind kind, String subject, String message) {

  public VerificationError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(message, "message");
  }

  public static VerificationError notFound(String variable) {
    return new VerificationError(
        ErrorKind.VAR_NOT_FOUND,
        variable,
        "variable " + variable + " referenced but not declared");
  }

  public static VerificationError duplicate(String variable) {
    return new VerificationError(
        ErrorKind.VAR_DUPLICATE,
        variable,
        "variable '" + variable + "' is defined multiple times");
  }

  public static VerificationError duplicateView(String view) {
    return new VerificationError(
        ErrorKind.VAR_DUPLICATE, view, "view '" + view + "' is declared multiple times");
  }

  public static VerificationError viewNotFound(String view) {
    return new VerificationError(
        ErrorKind.VIEW_NOT_FOUND, view, "view " + view + " used but not declared");
  }

  public static VerificationError typeMismatch(String variable, Object expected, Object got) {
    return new VerificationError(
        ErrorKind.TYPE_MISMATCH,
        variable,
        "type error: "
            + variable
            + " is of type "
            + got
            + ", but should be of type "
            + expected);
  }

  public static VerificationError arityMismatch(String view, int expected, int got) {
    return new VerificationError(
        ErrorKind.ARITY_MISMATCH,
        view,
        "view " + view + " expects " + expected + " parameter(s) but was given " + got);
  }

  public static VerificationError unsupported(String construct, String reason) {
    return new VerificationError(
        ErrorKind.UNSUPPORTED, construct, "cannot use " + construct + ": " + reason);
  }

  public static VerificationError translator(String axiom, String reason) {
    return new VerificationError(ErrorKind.TRANSLATOR, axiom, reason);
  }

  public static VerificationError noSuchNode(String graph, String node) {
    return new VerificationError(
        ErrorKind.NO_SUCH_NODE, graph, "graph " + graph + " references no such node " + node);
  }

  /** Copy of this error re-targeted at a new subject, keeping the original subject in the text. */
  public VerificationError in(String owner) {
    return new VerificationError(kind, owner, subject + ": " + message);
  }

  @Override
  public String toString() {
    return kind + " [" + subject + "] " + message;
  }
}
