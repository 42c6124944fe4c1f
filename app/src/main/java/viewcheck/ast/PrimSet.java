package viewcheck.ast;

import java.util.List;

/** Local assignments, then one atomic block, then more local assignments. */
public record PrimSet(List<Assign> preAssigns, List<Atomic> atomics, List<Assign> postAssigns) {

  public PrimSet {
    preAssigns = List.copyOf(preAssigns);
    atomics = List.copyOf(atomics);
    postAssigns = List.copyOf(postAssigns);
  }

  public static PrimSet atomic(Atomic... atomics) {
    return new PrimSet(List.of(), List.of(atomics), List.of());
  }

  public static PrimSet local(Assign... assigns) {
    return new PrimSet(List.of(assigns), List.of(), List.of());
  }
}
