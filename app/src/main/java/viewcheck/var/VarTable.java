package viewcheck.var;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import viewcheck.diagnostics.VerificationError;

/** Immutable table of declared variables and their sorts. */
public final class VarTable {
  private static final VarTable EMPTY = new VarTable(ImmutableMap.of());

  private final ImmutableMap<String, VarType> types;

  private VarTable(ImmutableMap<String, VarType> types) {
    this.types = types;
  }

  public static VarTable empty() {
    return EMPTY;
  }

  /**
   * Builds a table from declarations. Repeated names are reported to {@code errors} and only the
   * first declaration is kept.
   */
  public static VarTable build(List<Param> declarations, List<VerificationError> errors) {
    Map<String, VarType> types = new LinkedHashMap<>();
    for (Param declaration : declarations) {
      if (types.containsKey(declaration.name())) {
        errors.add(VerificationError.duplicate(declaration.name()));
      } else {
        types.put(declaration.name(), declaration.type());
      }
    }
    return new VarTable(ImmutableMap.copyOf(types));
  }

  /** Union of two tables; names present in both are reported as duplicates. */
  public VarTable merge(VarTable other, List<VerificationError> errors) {
    Map<String, VarType> merged = new LinkedHashMap<>(types);
    other.types.forEach(
        (name, type) -> {
          if (merged.putIfAbsent(name, type) != null) {
            errors.add(VerificationError.duplicate(name));
          }
        });
    return new VarTable(ImmutableMap.copyOf(merged));
  }

  public Optional<VarType> lookup(String name) {
    return Optional.ofNullable(types.get(name));
  }

  public boolean contains(String name) {
    return types.containsKey(name);
  }

  public ImmutableMap<String, VarType> asMap() {
    return types;
  }

  public int size() {
    return types.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof VarTable other && types.equals(other.types);
  }

  @Override
  public int hashCode() {
    return types.hashCode();
  }

  @Override
  public String toString() {
    return types.toString();
  }
}
