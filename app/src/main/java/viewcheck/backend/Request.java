package viewcheck.backend;

/** How far the solver boundary should take each term. */
public enum Request {
  /** Translate each term's parts into solver terms. */
  TRANSLATE,
  /** Also combine the parts into the single formula whose satisfiability refutes the term. */
  COMBINE,
  /** Also check that formula and report a verdict. */
  SAT;
}
