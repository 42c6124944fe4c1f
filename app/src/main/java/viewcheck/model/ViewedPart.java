package viewcheck.model;

import com.google.common.collect.ImmutableMultiset;
import java.util.Objects;
import viewcheck.view.GFunc;

public record ViewedPart(PartCmd command, ImmutableMultiset<GFunc> post) {

  public ViewedPart {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(post, "post");
  }
}
