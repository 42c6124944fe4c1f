package viewcheck.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vavr.control.Either;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import viewcheck.diagnostics.VerificationError;
import viewcheck.expr.Exprs;
import viewcheck.model.Term;

final class SolverDispatcherTest {
  private static final Term TRIVIAL = new Term(Exprs.bTrue(), Exprs.bTrue(), Exprs.bTrue());

  @Test
  void outcomesFollowInputOrderWhateverFinishesFirst() {
    Map<String, Term> terms = new LinkedHashMap<>();
    for (int i = 0; i < 20; i++) {
      terms.put("axiom" + i, TRIVIAL);
    }
    AtomicInteger calls = new AtomicInteger();
    SolverBackend slowFirst =
        (axiom, term, request) -> {
          calls.incrementAndGet();
          if (axiom.equals("axiom0")) {
            sleep(50);
          }
          return Either.right(proven(request));
        };

    List<AxiomOutcome> outcomes = new SolverDispatcher(slowFirst, 4).dispatch(terms, Request.SAT);

    assertEquals(20, calls.get(), "Every term is handed over once");
    assertEquals(
        List.copyOf(terms.keySet()),
        outcomes.stream().map(AxiomOutcome::axiom).toList(),
        "Outcomes are reported in input order");
    assertTrue(outcomes.stream().allMatch(AxiomOutcome::proven), "Every fake verdict is UNSAT");
  }

  @Test
  void backendErrorsStayWithTheirAxiom() {
    Map<String, Term> terms = new LinkedHashMap<>();
    terms.put("good", TRIVIAL);
    terms.put("bad", TRIVIAL);
    SolverBackend picky =
        (axiom, term, request) ->
            axiom.equals("bad")
                ? Either.left(VerificationError.translator(axiom, "unsupported"))
                : Either.right(proven(request));

    List<AxiomOutcome> outcomes = new SolverDispatcher(picky, 1).dispatch(terms, Request.SAT);

    assertFalse(outcomes.get(0).isFailure(), "good succeeds");
    assertTrue(outcomes.get(1).isFailure(), "bad fails");
    assertFalse(outcomes.get(1).proven(), "A failure is never proven");
  }

  @Test
  void translationAloneProvesNothing() {
    SolverBackend translateOnly =
        (axiom, term, request) ->
            Either.right(
                new BackendResult(
                    request, "true", "true", "true", Optional.empty(), Optional.empty()));

    List<AxiomOutcome> outcomes =
        new SolverDispatcher(translateOnly, 2).dispatch(Map.of("a", TRIVIAL), Request.TRANSLATE);

    assertFalse(outcomes.get(0).isFailure(), "Translation succeeded");
    assertFalse(outcomes.get(0).proven(), "No verdict without a satisfiability check");
  }

  private static BackendResult proven(Request request) {
    return new BackendResult(
        request,
        "true",
        "true",
        "true",
        Optional.of("false"),
        Optional.of(Verdict.UNSATISFIABLE));
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
