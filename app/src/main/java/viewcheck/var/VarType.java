package viewcheck.var;

/** Sorts a declared variable or view parameter can take. */
public enum VarType {
  INT,
  BOOL;

  @Override
  public String toString() {
    return this == INT ? "int" : "bool";
  }
}
