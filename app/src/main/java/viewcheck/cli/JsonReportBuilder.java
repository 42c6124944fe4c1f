package viewcheck.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import viewcheck.backend.AxiomOutcome;
import viewcheck.backend.BackendResult;
import viewcheck.diagnostics.VerificationError;
import viewcheck.pipeline.VerificationReport;
import viewcheck.view.ViewDefinition;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String build(Map<String, VerificationReport> reports) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    List<Map<String, Object>> scripts = new ArrayList<>();
    reports.forEach((name, report) -> scripts.add(script(name, report)));
    root.put("scripts", scripts);
    return gson.toJson(root);
  }

  private Map<String, Object> script(String name, VerificationReport report) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", name);
    map.put("request", report.request().name().toLowerCase(Locale.ROOT));
    map.put("time_ms", report.elapsedMillis());
    map.put("stages_ms", new LinkedHashMap<>(report.stageMillis()));
    map.put("globals", new LinkedHashMap<>(report.model().globals().asMap()));
    map.put("locals", new LinkedHashMap<>(report.model().locals().asMap()));
    map.put("definitions", definitions(report.model().definitions()));
    map.put("proven", report.provenCount());
    map.put("failed", report.failedCount());
    map.put("success", report.success());
    map.put("axioms", axioms(report.outcomes()));
    if (!report.failures().isEmpty()) {
      Map<String, Object> failures = new LinkedHashMap<>();
      report.failures().forEach((method, errors) -> failures.put(method, errors(errors)));
      map.put("method_failures", failures);
    }
    return map;
  }

  private List<String> definitions(List<ViewDefinition> definitions) {
    List<String> list = new ArrayList<>(definitions.size());
    definitions.forEach(d -> list.add(d.toString()));
    return list;
  }

  private List<Map<String, Object>> axioms(List<AxiomOutcome> outcomes) {
    List<Map<String, Object>> list = new ArrayList<>(outcomes.size());
    for (AxiomOutcome outcome : outcomes) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("name", outcome.axiom());
      if (outcome.isFailure()) {
        map.put("error", error(outcome.result().getLeft()));
      } else {
        BackendResult result = outcome.result().get();
        map.put("pre", result.pre());
        map.put("command", result.command());
        map.put("post", result.post());
        result.combined().ifPresent(c -> map.put("combined", c));
        result.verdict().ifPresent(v -> map.put("verdict", v.name().toLowerCase(Locale.ROOT)));
      }
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> errors(List<VerificationError> errors) {
    List<Map<String, Object>> list = new ArrayList<>(errors.size());
    errors.forEach(e -> list.add(error(e)));
    return list;
  }

  private Map<String, Object> error(VerificationError error) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", error.kind().name());
    map.put("subject", error.subject());
    map.put("message", error.message());
    return map;
  }
}
