package viewcheck.graph;

import java.util.Objects;
import viewcheck.command.Command;

/** A command-labelled transition. Endpoints are node names, not nodes. */
public record Edge(String src, Command command, String dest) {

  public Edge {
    Objects.requireNonNull(src, "src");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(dest, "dest");
  }

  /** Copy of this edge with every endpoint named {@code from} renamed to {@code to}. */
  public Edge retarget(String from, String to) {
    return new Edge(src.equals(from) ? to : src, command, dest.equals(from) ? to : dest);
  }

  public boolean isSelfLoop() {
    return src.equals(dest);
  }

  @Override
  public String toString() {
    return src + " -" + command + "-> " + dest;
  }
}
