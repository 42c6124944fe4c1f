package viewcheck.ast;

import java.util.List;
import viewcheck.var.Param;
import viewcheck.view.Func;

/**
 * A parsed script with its items grouped by kind. This is the only input the verifier core
 * accepts.
 */
public record CollatedScript(
    List<Func<Param>> viewProtos,
    List<Param> globals,
    List<Param> locals,
    List<Constraint> constraints,
    List<Method> methods) {

  public CollatedScript {
    viewProtos = List.copyOf(viewProtos);
    globals = List.copyOf(globals);
    locals = List.copyOf(locals);
    constraints = List.copyOf(constraints);
    methods = List.copyOf(methods);
  }
}
