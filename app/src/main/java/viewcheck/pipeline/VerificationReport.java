package viewcheck.pipeline;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import viewcheck.backend.AxiomOutcome;
import viewcheck.backend.Request;
import viewcheck.diagnostics.VerificationError;
import viewcheck.model.Model;

/**
 * Everything a run produced: the script context, one outcome per axiom, and the methods that
 * failed before producing axioms.
 */
public record VerificationReport(
    Request request,
    Model<?> model,
    List<AxiomOutcome> outcomes,
    ImmutableMap<String, List<VerificationError>> failures,
    Map<String, Long> stageMillis,
    long elapsedMillis) {

  public VerificationReport {
    outcomes = List.copyOf(outcomes);
    stageMillis = ImmutableMap.copyOf(stageMillis);
  }

  public long provenCount() {
    return outcomes.stream().filter(AxiomOutcome::proven).count();
  }

  public long failedCount() {
    return outcomes.stream().filter(AxiomOutcome::isFailure).count();
  }

  /** True if nothing failed and, when verdicts were asked for, every axiom was proven. */
  public boolean success() {
    if (!failures.isEmpty() || failedCount() > 0) {
      return false;
    }
    return request != Request.SAT || provenCount() == outcomes.size();
  }
}
