package viewcheck.backend;

/**
 * Result of checking {@code pre && command && !post}. {@link #UNSATISFIABLE} means the axiom
 * holds.
 */
public enum Verdict {
  SATISFIABLE,
  UNSATISFIABLE,
  UNKNOWN;

  public boolean proven() {
    return this == UNSATISFIABLE;
  }
}
