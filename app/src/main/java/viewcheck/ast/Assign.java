package viewcheck.ast;

import java.util.Objects;

/** A thread-local assignment {@code lvalue = value} outside an atomic block. */
public record Assign(String lvalue, Expression value) {

  public Assign {
    Objects.requireNonNull(lvalue, "lvalue");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String toString() {
    return lvalue + " = " + value;
  }
}
