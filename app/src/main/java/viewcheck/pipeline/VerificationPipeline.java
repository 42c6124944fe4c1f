package viewcheck.pipeline;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.ast.CollatedScript;
import viewcheck.backend.AxiomOutcome;
import viewcheck.backend.SolverBackend;
import viewcheck.backend.SolverDispatcher;
import viewcheck.backend.Z3Backend;
import viewcheck.command.PrimitiveTable;
import viewcheck.diagnostics.ModelException;
import viewcheck.diagnostics.VerificationError;
import viewcheck.graph.Axiom;
import viewcheck.graph.Graph;
import viewcheck.graph.GraphOptimiser;
import viewcheck.graph.Grapher;
import viewcheck.graph.Graphs;
import viewcheck.model.Model;
import viewcheck.model.ModelMethod;
import viewcheck.model.Modeller;
import viewcheck.model.Term;
import viewcheck.model.TermBuilder;
import viewcheck.reify.Reifier;
import viewcheck.util.Timing;
import viewcheck.view.GFunc;
import viewcheck.view.ReView;

/**
 * Runs a script through every stage: model, graph, optimise, axiomatise, reify, build terms, and
 * hand the terms to the solver boundary.
 *
 * <p>Each stage is also exposed on its own. A failure is recorded against the method or axiom it
 * belongs to and never stops the others.
 */
public final class VerificationPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(VerificationPipeline.class);

  private final PrimitiveTable primitives;
  private final SolverBackend backend;

  public VerificationPipeline(PrimitiveTable primitives, SolverBackend backend) {
    this.primitives = primitives;
    this.backend = backend;
  }

  /** A pipeline over the built-in primitives and a Z3 backend with the given timeout. */
  public static VerificationPipeline withZ3(long timeoutMs) {
    return new VerificationPipeline(PrimitiveTable.builtins(), new Z3Backend(timeoutMs));
  }

  public VerificationReport verify(CollatedScript script, VerifierOptions options)
      throws ModelException {
    VerifierOptions effective = VerifierOptions.normalize(options);
    LOG.info(
        "Verifying script (request: {}, threads: {})", effective.request(), effective.threads());
    Timing timer = Timing.start();

    Model<ModelMethod> methods = Modeller.model(script);
    timer.mark("model");
    Model<Graph> graphs = graphs(methods, effective.collapseNops());
    timer.mark("graph");
    Model<Axiom<ImmutableMultiset<ReView>>> axioms = reify(axiomatise(graphs));
    timer.mark("reify");
    Map<String, List<VerificationError>> termFailures = new LinkedHashMap<>();
    Model<Term> terms = axioms.withItems(buildTerms(axioms, termFailures));
    timer.mark("terms");

    List<AxiomOutcome> outcomes = new ArrayList<>();
    termFailures.forEach(
        (name, errors) -> errors.forEach(e -> outcomes.add(AxiomOutcome.failed(name, e))));
    outcomes.addAll(
        new SolverDispatcher(backend, effective.threads())
            .dispatch(terms.items(), effective.request()));
    timer.mark("solve");

    Map<String, List<VerificationError>> methodFailures = graphs.failures();
    outcomes.stream()
        .filter(AxiomOutcome::isFailure)
        .forEach(o -> LOG.warn("Axiom {} failed: {}", o.axiom(), o.result().getLeft()));
    methodFailures.forEach((name, errors) -> LOG.warn("Method {} failed: {}", name, errors));

    VerificationReport report =
        new VerificationReport(
            effective.request(),
            terms,
            outcomes,
            ImmutableMap.copyOf(methodFailures),
            timer.stages(),
            timer.elapsedMillis());
    LOG.info(
        "Verified {} axiom(s): {} proven, {} failed, {} method(s) rejected in {} ms",
        outcomes.size(),
        report.provenCount(),
        report.failedCount(),
        methodFailures.size(),
        report.elapsedMillis());
    return report;
  }

  /** Graphs every modelled method, optionally collapsing no-op edges. */
  public Model<Graph> graphs(Model<ModelMethod> methods, boolean collapseNops) {
    Map<String, Graph> graphs = new LinkedHashMap<>();
    Map<String, List<VerificationError>> failures = new LinkedHashMap<>();
    methods
        .items()
        .forEach(
            (name, method) -> {
              Either<VerificationError, Graph> graph = Grapher.graph(method);
              if (graph.isLeft()) {
                failures.put(name, List.of(graph.getLeft()));
              } else {
                graphs.put(
                    name, collapseNops ? GraphOptimiser.collapseNops(graph.get()) : graph.get());
              }
            });
    return methods.withItems(graphs).withFailures(failures);
  }

  /** One axiom per edge across all graphs, keyed by edge name. */
  public Model<Axiom<ImmutableMultiset<GFunc>>> axiomatise(Model<Graph> graphs) {
    Map<String, Axiom<ImmutableMultiset<GFunc>>> axioms = new LinkedHashMap<>();
    graphs.items().values().forEach(g -> axioms.putAll(Graphs.axiomatise(g)));
    return graphs.withItems(axioms);
  }

  public Model<Axiom<ImmutableMultiset<ReView>>> reify(
      Model<Axiom<ImmutableMultiset<GFunc>>> axioms) {
    return axioms.map(axiom -> Reifier.reifyAxiom(axioms.definitions(), axiom));
  }

  /** Builds the term of each axiom; axioms whose term cannot be built become failures. */
  public Model<Term> terms(Model<Axiom<ImmutableMultiset<ReView>>> axioms) {
    Map<String, List<VerificationError>> failures = new LinkedHashMap<>();
    Map<String, Term> terms = buildTerms(axioms, failures);
    return axioms.withItems(terms).withFailures(failures);
  }

  /** Terms by axiom name; axioms whose term cannot be built go to {@code failures}. */
  private Map<String, Term> buildTerms(
      Model<Axiom<ImmutableMultiset<ReView>>> axioms,
      Map<String, List<VerificationError>> failures) {
    TermBuilder builder = new TermBuilder(primitives, axioms.allVars());
    Map<String, Term> terms = new LinkedHashMap<>();
    axioms
        .items()
        .forEach(
            (name, axiom) -> {
              Either<VerificationError, Term> term = builder.build(axiom);
              if (term.isLeft()) {
                failures.put(name, List.of(term.getLeft().in(name)));
              } else {
                terms.put(name, term.get());
              }
            });
    return terms;
  }
}
