package viewcheck.ast;

import java.util.Objects;
import viewcheck.view.Func;

public record Method(Func<String> signature, Block body) {

  public Method {
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(body, "body");
  }

  public String name() {
    return signature.name();
  }
}
