package viewcheck.ast;

/** Binary operators of the surface expression language. */
public enum Bop {
  MUL("*"),
  DIV("/"),
  ADD("+"),
  SUB("-"),
  GT(">"),
  GE(">="),
  LE("<="),
  LT("<"),
  EQ("=="),
  NEQ("!="),
  AND("&&"),
  OR("||");

  private final String symbol;

  Bop(String symbol) {
    this.symbol = symbol;
  }

  /** True for operators whose operands are integers and whose result is Boolean. */
  public boolean isComparison() {
    return this == GT || this == GE || this == LE || this == LT;
  }

  public boolean isArithmetic() {
    return this == MUL || this == DIV || this == ADD || this == SUB;
  }

  public boolean isLogical() {
    return this == AND || this == OR;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
