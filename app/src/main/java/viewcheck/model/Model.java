package viewcheck.model;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import viewcheck.diagnostics.VerificationError;
import viewcheck.var.VarTable;
import viewcheck.view.ViewDefinition;

/**
 * The shared context of a script plus one item per method, graph or axiom, depending on the
 * pipeline stage. Items that could not be produced are listed in {@link #failures()} under the
 * name of the method or axiom they belong to.
 *
 * @param <A> the item type
 */
public record Model<A>(
    VarTable globals,
    VarTable locals,
    List<ViewDefinition> definitions,
    ImmutableMap<String, A> items,
    ImmutableMap<String, List<VerificationError>> failures) {

  public Model {
    Objects.requireNonNull(globals, "globals");
    Objects.requireNonNull(locals, "locals");
    definitions = List.copyOf(definitions);
    Objects.requireNonNull(items, "items");
    Objects.requireNonNull(failures, "failures");
  }

  /** Globals and locals together. Names never clash: the modeller rejects scripts where they do. */
  public VarTable allVars() {
    return globals.merge(locals, new ArrayList<>());
  }

  /** Replaces the items, keeping context and failures. */
  public <B> Model<B> withItems(Map<String, B> newItems) {
    return new Model<>(globals, locals, definitions, ImmutableMap.copyOf(newItems), failures);
  }

  /** Maps each item, keeping its name. */
  public <B> Model<B> map(Function<? super A, ? extends B> fn) {
    Map<String, B> mapped = new LinkedHashMap<>();
    items.forEach((name, item) -> mapped.put(name, fn.apply(item)));
    return withItems(mapped);
  }

  /** Copy of this model with extra failures appended. */
  public Model<A> withFailures(Map<String, List<VerificationError>> more) {
    Map<String, List<VerificationError>> merged = new LinkedHashMap<>(failures);
    more.forEach((name, errors) -> merged.put(name, List.copyOf(errors)));
    return new Model<>(globals, locals, definitions, items, ImmutableMap.copyOf(merged));
  }
}
