package viewcheck.ast;

import java.util.Objects;

/** An atomic action, executed indivisibly inside {@code < >}. */
public sealed interface Atomic
    permits Atomic.CompareAndSwap, Atomic.Fetch, Atomic.Postfix, Atomic.Id, Atomic.Assume {

  /** {@code CAS(dest, test, set)}. */
  record CompareAndSwap(String dest, String test, Expression set) implements Atomic {
    public CompareAndSwap {
      Objects.requireNonNull(dest, "dest");
      Objects.requireNonNull(test, "test");
      Objects.requireNonNull(set, "set");
    }

    @Override
    public String toString() {
      return "CAS(" + dest + ", " + test + ", " + set + ")";
    }
  }

  /** {@code dest = src}, optionally post-incrementing or post-decrementing {@code src}. */
  record Fetch(String dest, Expression src, FetchMode mode) implements Atomic {
    public Fetch {
      Objects.requireNonNull(dest, "dest");
      Objects.requireNonNull(src, "src");
      Objects.requireNonNull(mode, "mode");
    }

    @Override
    public String toString() {
      return dest + " = " + src + suffix(mode);
    }
  }

  /** {@code var++} or {@code var--}. */
  record Postfix(String var, FetchMode mode) implements Atomic {
    public Postfix {
      Objects.requireNonNull(var, "var");
      Objects.requireNonNull(mode, "mode");
    }

    @Override
    public String toString() {
      return var + suffix(mode);
    }
  }

  record Id() implements Atomic {
    @Override
    public String toString() {
      return "id";
    }
  }

  record Assume(Expression condition) implements Atomic {
    public Assume {
      Objects.requireNonNull(condition, "condition");
    }

    @Override
    public String toString() {
      return "assume(" + condition + ")";
    }
  }

  private static String suffix(FetchMode mode) {
    switch (mode) {
      case INCREMENT:
        return "++";
      case DECREMENT:
        return "--";
      default:
        return "";
    }
  }
}
