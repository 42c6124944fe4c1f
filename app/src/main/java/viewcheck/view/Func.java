package viewcheck.view;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A named application over parameters of type {@code P}: a view instance, a view pattern, a view
 * prototype or a command primitive depending on {@code P}.
 */
public record Func<P>(String name, List<P> params) {

  public Func {
    Objects.requireNonNull(name, "name");
    params = List.copyOf(params);
  }

  @SafeVarargs
  public static <P> Func<P> of(String name, P... params) {
    return new Func<>(name, Arrays.asList(params));
  }

  public int arity() {
    return params.size();
  }

  /** True if {@code other} has the same name and the same number of parameters. */
  public boolean sameShape(Func<?> other) {
    return name.equals(other.name) && params.size() == other.params.size();
  }

  @Override
  public String toString() {
    return params.stream().map(String::valueOf).collect(Collectors.joining(", ", name + "(", ")"));
  }
}
