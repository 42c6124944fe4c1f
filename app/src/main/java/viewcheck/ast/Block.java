package viewcheck.ast;

import java.util.List;
import java.util.Objects;

/**
 * A block opened by a precondition view. Its postcondition is the view of the last statement, or
 * {@code pre} if the block is empty.
 */
public record Block(View pre, List<ViewedStatement> contents) {

  public Block {
    Objects.requireNonNull(pre, "pre");
    contents = List.copyOf(contents);
  }
}
