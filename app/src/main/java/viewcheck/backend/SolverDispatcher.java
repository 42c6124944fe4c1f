package viewcheck.backend;

import io.vavr.control.Either;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.diagnostics.VerificationError;
import viewcheck.model.Term;

/**
 * Hands independent terms to a {@link SolverBackend}, optionally in parallel. Outcomes come back
 * in the iteration order of the input map whatever order the solver finished in.
 */
public final class SolverDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(SolverDispatcher.class);

  private final SolverBackend backend;
  private final int threads;

  public SolverDispatcher(SolverBackend backend, int threads) {
    this.backend = backend;
    this.threads = Math.max(1, threads);
  }

  public List<AxiomOutcome> dispatch(Map<String, Term> terms, Request request) {
    Map<String, Either<VerificationError, BackendResult>> results;
    if (threads == 1 || terms.size() < 2) {
      results = new ConcurrentHashMap<>();
      terms.forEach((name, term) -> results.put(name, backend.process(name, term, request)));
    } else {
      results = parallel(terms, request);
    }

    List<AxiomOutcome> outcomes = new ArrayList<>(terms.size());
    for (String name : terms.keySet()) {
      Either<VerificationError, BackendResult> result = results.get(name);
      outcomes.add(
          result == null
              ? AxiomOutcome.failed(
                  name, VerificationError.translator(name, "solver produced no result"))
              : new AxiomOutcome(name, result));
    }
    return outcomes;
  }

  private Map<String, Either<VerificationError, BackendResult>> parallel(
      Map<String, Term> terms, Request request) {
    Map<String, Either<VerificationError, BackendResult>> results = new ConcurrentHashMap<>();
    ForkJoinPool pool = new ForkJoinPool(threads);
    try {
      LOG.debug("Dispatching {} term(s) on {} thread(s)", terms.size(), threads);
      pool.submit(
              () ->
                  terms.entrySet().parallelStream()
                      .forEach(
                          entry ->
                              results.put(
                                  entry.getKey(),
                                  backend.process(entry.getKey(), entry.getValue(), request))))
          .get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn(
          "Interrupted while waiting for the solver; {} result(s) missing",
          terms.size() - results.size());
    } catch (ExecutionException e) {
      LOG.warn("Solver dispatch failed", e.getCause());
    } finally {
      pool.shutdown();
    }
    return results;
  }
}
