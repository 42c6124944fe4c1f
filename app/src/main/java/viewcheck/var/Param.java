package viewcheck.var;

import java.util.Objects;

/** A typed name: a variable declaration or a formal parameter. */
public record Param(VarType type, String name) {

  public Param {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(name, "name");
  }

  public static Param intParam(String name) {
    return new Param(VarType.INT, name);
  }

  public static Param boolParam(String name) {
    return new Param(VarType.BOOL, name);
  }

  @Override
  public String toString() {
    return type + " " + name;
  }
}
