package viewcheck.diagnostics;

/** Enumerates the kinds of failure the modeller, term builder and backends can report. */
public enum ErrorKind {
  VAR_NOT_FOUND,
  VAR_DUPLICATE,
  VIEW_NOT_FOUND,
  TYPE_MISMATCH,
  ARITY_MISMATCH,
  UNSUPPORTED,
  TRANSLATOR,
  NO_SUCH_NODE;
}
