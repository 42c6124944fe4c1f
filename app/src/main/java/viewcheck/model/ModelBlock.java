package viewcheck.model;

import com.google.common.collect.ImmutableMultiset;
import java.util.List;
import java.util.Objects;
import viewcheck.view.GFunc;

/** A typed block: its precondition views and its statements with their postconditions. */
public record ModelBlock(ImmutableMultiset<GFunc> pre, List<ViewedPart> contents) {

  public ModelBlock {
    Objects.requireNonNull(pre, "pre");
    contents = List.copyOf(contents);
  }

  /** The views after the last statement, or {@link #pre()} for an empty block. */
  public ImmutableMultiset<GFunc> post() {
    return contents.isEmpty() ? pre : contents.get(contents.size() - 1).post();
  }
}
