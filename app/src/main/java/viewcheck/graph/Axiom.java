package viewcheck.graph;

import java.util.Objects;
import viewcheck.command.Command;

/**
 * A Hoare triple {@code {pre} command {post}}.
 *
 * @param <V> the representation of the pre- and postconditions
 */
public record Axiom<V>(V pre, Command command, V post) {

  public Axiom {
    Objects.requireNonNull(pre, "pre");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(post, "post");
  }

  @Override
  public String toString() {
    return "{" + pre + "} " + command + " {" + post + "}";
  }
}
