package viewcheck.model;

import static viewcheck.command.Commands.boolAfter;
import static viewcheck.command.Commands.boolBefore;
import static viewcheck.command.Commands.intAfter;
import static viewcheck.command.Commands.intBefore;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.ast.Assign;
import viewcheck.ast.Atomic;
import viewcheck.ast.Block;
import viewcheck.ast.CollatedScript;
import viewcheck.ast.Constraint;
import viewcheck.ast.Expression;
import viewcheck.ast.FetchMode;
import viewcheck.ast.Method;
import viewcheck.ast.PrimSet;
import viewcheck.ast.Statement;
import viewcheck.ast.View;
import viewcheck.ast.ViewDef;
import viewcheck.ast.ViewedStatement;
import viewcheck.command.Command;
import viewcheck.command.Commands;
import viewcheck.command.PrimitiveTable;
import viewcheck.diagnostics.ModelException;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;
import viewcheck.sub.Substitutions;
import viewcheck.var.MarkedVar;
import viewcheck.var.Param;
import viewcheck.var.Sym;
import viewcheck.var.VarTable;
import viewcheck.var.VarType;
import viewcheck.view.Func;
import viewcheck.view.GFunc;
import viewcheck.view.GuardedViews;
import viewcheck.view.ViewDefinition;

/**
 * Turns a collated script into a typed {@link Model} with one {@link ModelMethod} per method.
 *
 * <p>Errors in declarations or constraints make the whole script unusable and are thrown together
 * as a {@link ModelException}. Errors inside a method body only fail that method; they are
 * recorded in {@link Model#failures()} and the other methods are still modelled.
 */
public final class Modeller {
  private static final Logger LOG = LoggerFactory.getLogger(Modeller.class);

  private final Map<String, Func<Param>> protos;
  private final VarTable vars;

  private Modeller(Map<String, Func<Param>> protos, VarTable vars) {
    this.protos = protos;
    this.vars = vars;
  }

  public static Model<ModelMethod> model(CollatedScript script) throws ModelException {
    List<VerificationError> errors = new ArrayList<>();
    VarTable globals = VarTable.build(script.globals(), errors);
    VarTable locals = VarTable.build(script.locals(), errors);
    VarTable vars = globals.merge(locals, errors);

    Map<String, Func<Param>> protos = new LinkedHashMap<>();
    for (Func<Param> proto : script.viewProtos()) {
      if (protos.putIfAbsent(proto.name(), proto) != null) {
        errors.add(VerificationError.duplicateView(proto.name()));
      }
    }

    Modeller modeller = new Modeller(protos, vars);
    List<ViewDefinition> definitions = new ArrayList<>();
    for (Constraint constraint : script.constraints()) {
      modeller.modelConstraint(constraint, globals, errors).ifPresent(definitions::add);
    }
    if (!errors.isEmpty()) {
      throw new ModelException(errors);
    }
    LOG.debug(
        "Modelled {} global(s), {} local(s), {} view definition(s)",
        globals.size(),
        locals.size(),
        definitions.size());

    Map<String, ModelMethod> methods = new LinkedHashMap<>();
    Map<String, List<VerificationError>> failures = new LinkedHashMap<>();
    for (Method method : script.methods()) {
      if (methods.containsKey(method.name()) || failures.containsKey(method.name())) {
        failures.put(
            method.name(),
            List.of(
                VerificationError.unsupported(method.name(), "method is defined multiple times")));
        methods.remove(method.name());
        continue;
      }
      List<VerificationError> methodErrors = new ArrayList<>();
      ModelBlock body = modeller.modelBlock(method.body(), methodErrors);
      if (methodErrors.isEmpty()) {
        methods.put(method.name(), new ModelMethod(method.name(), body));
      } else {
        LOG.warn("Method {} has {} error(s)", method.name(), methodErrors.size());
        failures.put(method.name(), List.copyOf(methodErrors));
      }
    }
    return new Model<>(
        globals,
        locals,
        definitions,
        ImmutableMap.copyOf(methods),
        ImmutableMap.copyOf(failures));
  }

  // ----- constraints -----

  private Optional<ViewDefinition> modelConstraint(
      Constraint constraint, VarTable globals, List<VerificationError> errors) {
    List<Func<Param>> pattern = new ArrayList<>();
    boolean ok = true;
    for (Func<String> component : flatten(constraint.view())) {
      Func<Param> proto = protos.get(component.name());
      if (proto == null) {
        errors.add(VerificationError.viewNotFound(component.name()));
        ok = false;
      } else if (proto.arity() != component.arity()) {
        errors.add(
            VerificationError.arityMismatch(component.name(), proto.arity(), component.arity()));
        ok = false;
      } else {
        List<Param> params = new ArrayList<>(component.arity());
        for (int i = 0; i < component.arity(); i++) {
          params.add(new Param(proto.params().get(i).type(), component.params().get(i)));
        }
        pattern.add(new Func<>(component.name(), params));
      }
    }
    if (!ok) {
      return Optional.empty();
    }
    if (constraint.definition().isEmpty()) {
      return Optional.of(ViewDefinition.indefinite(pattern));
    }

    int before = errors.size();
    List<Param> patternVars = new ArrayList<>();
    pattern.forEach(f -> patternVars.addAll(f.params()));
    VarTable env = globals.merge(VarTable.build(patternVars, errors), errors);
    if (errors.size() > before) {
      return Optional.empty();
    }
    Either<VerificationError, BoolExpr<String>> definition =
        ExpressionModeller.modelBool(constraint.definition().get(), env);
    if (definition.isLeft()) {
      errors.add(definition.getLeft());
      return Optional.empty();
    }
    return Optional.of(ViewDefinition.of(pattern, definition.get()));
  }

  private static List<Func<String>> flatten(ViewDef view) {
    if (view instanceof ViewDef.Apply apply) {
      return List.of(apply.func());
    }
    if (view instanceof ViewDef.Join join) {
      List<Func<String>> joined = new ArrayList<>(flatten(join.left()));
      joined.addAll(flatten(join.right()));
      return joined;
    }
    return List.of();
  }

  // ----- views -----

  private Either<VerificationError, ImmutableMultiset<GFunc>> modelView(View view) {
    if (view instanceof View.Apply apply) {
      return modelViewFunc(apply.func()).map(GuardedViews::unconditional);
    }
    if (view instanceof View.Join join) {
      return modelView(join.left())
          .flatMap(l -> modelView(join.right()).map(r -> GuardedViews.union(l, r)));
    }
    if (view instanceof View.If ite) {
      return ExpressionModeller.modelBool(ite.condition(), vars)
          .flatMap(
              c ->
                  modelView(ite.then())
                      .flatMap(
                          t ->
                              modelView(ite.otherwise())
                                  .map(
                                      o ->
                                          GuardedViews.union(
                                              GuardedViews.withGuard(t, c),
                                              GuardedViews.withGuard(o, Exprs.mkNot(c))))));
    }
    return Either.right(GuardedViews.empty());
  }

  private Either<VerificationError, Func<Expr<String>>> modelViewFunc(Func<Expression> func) {
    Func<Param> proto = protos.get(func.name());
    if (proto == null) {
      return Either.left(VerificationError.viewNotFound(func.name()));
    }
    if (proto.arity() != func.arity()) {
      return Either.left(
          VerificationError.arityMismatch(func.name(), proto.arity(), func.arity()));
    }
    List<Expr<String>> params = new ArrayList<>(func.arity());
    for (int i = 0; i < func.arity(); i++) {
      Either<VerificationError, Expr<String>> param =
          ExpressionModeller.modelAs(proto.params().get(i).type(), func.params().get(i), vars);
      if (param.isLeft()) {
        return Either.left(param.getLeft());
      }
      params.add(param.get());
    }
    return Either.right(new Func<>(func.name(), params));
  }

  private ImmutableMultiset<GFunc> views(View view, List<VerificationError> errors) {
    return modelView(view)
        .getOrElseGet(
            error -> {
              errors.add(error);
              return GuardedViews.empty();
            });
  }

  // ----- statements -----

  private ModelBlock modelBlock(Block block, List<VerificationError> errors) {
    ImmutableMultiset<GFunc> pre = views(block.pre(), errors);
    List<ViewedPart> parts = new ArrayList<>(block.contents().size());
    for (ViewedStatement viewed : block.contents()) {
      Optional<PartCmd> command = modelStatement(viewed.statement(), errors);
      ImmutableMultiset<GFunc> post = views(viewed.post(), errors);
      command.ifPresent(c -> parts.add(new ViewedPart(c, post)));
    }
    return new ModelBlock(pre, parts);
  }

  private Optional<PartCmd> modelStatement(Statement statement, List<VerificationError> errors) {
    if (statement instanceof Statement.Prim prim) {
      return modelPrimSet(prim.prims(), errors).map(PartCmd.Prim::new);
    }
    if (statement instanceof Statement.If ite) {
      Optional<BoolExpr<Sym<MarkedVar>>> condition = condition(ite.condition(), errors);
      ModelBlock then = modelBlock(ite.then(), errors);
      ModelBlock otherwise = modelBlock(ite.otherwise(), errors);
      return condition.map(c -> new PartCmd.Ite(c, then, otherwise));
    }
    if (statement instanceof Statement.While loop) {
      Optional<BoolExpr<Sym<MarkedVar>>> condition = condition(loop.condition(), errors);
      ModelBlock body = modelBlock(loop.body(), errors);
      return condition.map(c -> new PartCmd.While(false, c, body));
    }
    if (statement instanceof Statement.DoWhile loop) {
      ModelBlock body = modelBlock(loop.body(), errors);
      Optional<BoolExpr<Sym<MarkedVar>>> condition = condition(loop.condition(), errors);
      return condition.map(c -> new PartCmd.While(true, c, body));
    }
    Statement.Blocks blocks = (Statement.Blocks) statement;
    List<ModelBlock> modelled = new ArrayList<>(blocks.blocks().size());
    for (Block block : blocks.blocks()) {
      modelled.add(modelBlock(block, errors));
    }
    return Optional.of(new PartCmd.Parallel(modelled));
  }

  private Optional<BoolExpr<Sym<MarkedVar>>> condition(
      Expression expression, List<VerificationError> errors) {
    Either<VerificationError, BoolExpr<String>> condition =
        ExpressionModeller.modelBool(expression, vars);
    if (condition.isLeft()) {
      errors.add(condition.getLeft());
      return Optional.empty();
    }
    return Optional.of(inPre(condition.get()));
  }

  // ----- primitives -----

  private Optional<Command> modelPrimSet(PrimSet prims, List<VerificationError> errors) {
    List<Either<VerificationError, Func<Expr<Sym<MarkedVar>>>>> modelled = new ArrayList<>();
    prims.preAssigns().forEach(a -> modelled.add(modelAssign(a)));
    prims.atomics().forEach(a -> modelled.add(modelAtomic(a)));
    prims.postAssigns().forEach(a -> modelled.add(modelAssign(a)));

    List<Func<Expr<Sym<MarkedVar>>>> funcs = new ArrayList<>(modelled.size());
    boolean ok = true;
    for (Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> prim : modelled) {
      if (prim.isLeft()) {
        errors.add(prim.getLeft());
        ok = false;
      } else {
        funcs.add(prim.get());
      }
    }
    return ok ? Optional.of(new Command(funcs)) : Optional.empty();
  }

  private Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> modelAtomic(Atomic atomic) {
    if (atomic instanceof Atomic.Fetch fetch) {
      return modelFetch(fetch);
    }
    if (atomic instanceof Atomic.Postfix postfix) {
      return modelPostfix(postfix);
    }
    if (atomic instanceof Atomic.CompareAndSwap cas) {
      return modelCas(cas);
    }
    if (atomic instanceof Atomic.Assume assume) {
      return ExpressionModeller.modelBool(assume.condition(), vars)
          .map(c -> prim(Commands.ASSUME, inPre(c)));
    }
    return Either.right(prim(Commands.ID));
  }

  private Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> modelFetch(Atomic.Fetch fetch) {
    Optional<VarType> destType = vars.lookup(fetch.dest());
    if (destType.isEmpty()) {
      return Either.left(VerificationError.notFound(fetch.dest()));
    }
    VarType type = destType.get();
    if (!(fetch.src() instanceof Expression.Ident src)) {
      if (fetch.mode() != FetchMode.DIRECT) {
        return Either.left(
            VerificationError.unsupported(
                fetch.toString(), "only a variable can be fetched and modified"));
      }
      return assignment(fetch.dest(), type, fetch.src());
    }
    Optional<VarType> srcType = vars.lookup(src.name());
    if (srcType.isEmpty()) {
      return Either.left(VerificationError.notFound(src.name()));
    }
    if (srcType.get() != type) {
      return Either.left(VerificationError.typeMismatch(src.name(), type, srcType.get()));
    }
    if (type == VarType.BOOL) {
      if (fetch.mode() != FetchMode.DIRECT) {
        return Either.left(
            VerificationError.unsupported(
                fetch.toString(), "Boolean variables cannot be incremented or decremented"));
      }
      return Either.right(
          prim(PrimitiveTable.BOOL_LOAD, boolAfter(fetch.dest()), boolBefore(src.name())));
    }
    switch (fetch.mode()) {
      case INCREMENT:
        return Either.right(
            prim(
                PrimitiveTable.LOAD_INCREMENT,
                intAfter(fetch.dest()),
                intBefore(src.name()),
                intAfter(src.name())));
      case DECREMENT:
        return Either.right(
            prim(
                PrimitiveTable.LOAD_DECREMENT,
                intAfter(fetch.dest()),
                intBefore(src.name()),
                intAfter(src.name())));
      default:
        return Either.right(
            prim(PrimitiveTable.LOAD, intAfter(fetch.dest()), intBefore(src.name())));
    }
  }

  private Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> modelPostfix(
      Atomic.Postfix postfix) {
    Optional<VarType> type = vars.lookup(postfix.var());
    if (type.isEmpty()) {
      return Either.left(VerificationError.notFound(postfix.var()));
    }
    if (type.get() == VarType.BOOL) {
      return Either.left(
          VerificationError.unsupported(
              postfix.toString(), "Boolean variables cannot be incremented or decremented"));
    }
    if (postfix.mode() == FetchMode.DIRECT) {
      return Either.left(
          VerificationError.unsupported(postfix.toString(), "a postfix action needs ++ or --"));
    }
    String name =
        postfix.mode() == FetchMode.INCREMENT ? PrimitiveTable.INCREMENT : PrimitiveTable.DECREMENT;
    return Either.right(prim(name, intBefore(postfix.var()), intAfter(postfix.var())));
  }

  private Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> modelCas(
      Atomic.CompareAndSwap cas) {
    Optional<VarType> destType = vars.lookup(cas.dest());
    if (destType.isEmpty()) {
      return Either.left(VerificationError.notFound(cas.dest()));
    }
    Optional<VarType> testType = vars.lookup(cas.test());
    if (testType.isEmpty()) {
      return Either.left(VerificationError.notFound(cas.test()));
    }
    VarType type = destType.get();
    if (testType.get() != type) {
      return Either.left(VerificationError.typeMismatch(cas.test(), type, testType.get()));
    }
    return ExpressionModeller.modelAs(type, cas.set(), vars)
        .map(
            set ->
                type == VarType.INT
                    ? prim(
                        PrimitiveTable.INT_CAS,
                        intBefore(cas.dest()),
                        intAfter(cas.dest()),
                        intBefore(cas.test()),
                        intAfter(cas.test()),
                        inPre(set))
                    : prim(
                        PrimitiveTable.BOOL_CAS,
                        boolBefore(cas.dest()),
                        boolAfter(cas.dest()),
                        boolBefore(cas.test()),
                        boolAfter(cas.test()),
                        inPre(set)));
  }

  private Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> modelAssign(Assign assign) {
    Optional<VarType> type = vars.lookup(assign.lvalue());
    if (type.isEmpty()) {
      return Either.left(VerificationError.notFound(assign.lvalue()));
    }
    return assignment(assign.lvalue(), type.get(), assign.value());
  }

  private Either<VerificationError, Func<Expr<Sym<MarkedVar>>>> assignment(
      String dest, VarType type, Expression value) {
    return ExpressionModeller.modelAs(type, value, vars)
        .map(
            v ->
                type == VarType.INT
                    ? prim(PrimitiveTable.INT_SET, intAfter(dest), inPre(v))
                    : prim(PrimitiveTable.BOOL_SET, boolAfter(dest), inPre(v)));
  }

  // ----- marking -----

  private static Expr<Sym<MarkedVar>> inPre(Expr<String> expr) {
    return Substitutions.apply(
        Substitutions.<MarkedVar>regular(), Substitutions.apply(Substitutions.before(), expr));
  }

  private static BoolExpr<Sym<MarkedVar>> inPre(BoolExpr<String> expr) {
    return Substitutions.<MarkedVar>regular().mapBool(Substitutions.before().mapBool(expr));
  }

  @SafeVarargs
  private static Func<Expr<Sym<MarkedVar>>> prim(String name, Expr<Sym<MarkedVar>>... params) {
    return new Func<>(name, Arrays.asList(params));
  }
}
