package viewcheck.model;

import java.util.Objects;

public record ModelMethod(String name, ModelBlock body) {

  public ModelMethod {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(body, "body");
  }
}
