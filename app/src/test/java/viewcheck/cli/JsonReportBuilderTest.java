package viewcheck.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.vavr.control.Either;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import viewcheck.backend.BackendResult;
import viewcheck.backend.SolverBackend;
import viewcheck.backend.Verdict;
import viewcheck.command.PrimitiveTable;
import viewcheck.diagnostics.ModelException;
import viewcheck.examples.Examples;
import viewcheck.pipeline.VerificationPipeline;
import viewcheck.pipeline.VerificationReport;
import viewcheck.pipeline.VerifierOptions;

final class JsonReportBuilderTest {

  @Test
  void reportListsEveryAxiomWithItsVerdict() throws ModelException {
    SolverBackend sat =
        (axiom, term, request) ->
            Either.right(
                new BackendResult(
                    request,
                    "pre",
                    "cmd",
                    "post",
                    Optional.of("pre && cmd && !post"),
                    Optional.of(Verdict.SATISFIABLE)));
    VerificationReport report =
        new VerificationPipeline(PrimitiveTable.builtins(), sat)
            .verify(Examples.ticketLock(), VerifierOptions.defaults());

    String json = new JsonReportBuilder().build(Map.of("ticketlock", report));

    JsonArray scripts = JsonParser.parseString(json).getAsJsonObject().getAsJsonArray("scripts");
    JsonObject script = scripts.get(0).getAsJsonObject();
    assertEquals("ticketlock", script.get("name").getAsString());
    assertEquals("sat", script.get("request").getAsString());
    assertFalse(script.get("success").getAsBoolean(), "A satisfiable axiom is unproven");
    assertEquals("INT", script.getAsJsonObject("globals").get("ticket").getAsString());
    JsonArray axioms = script.getAsJsonArray("axioms");
    assertEquals(report.outcomes().size(), axioms.size(), "One entry per axiom");
    JsonObject first = axioms.get(0).getAsJsonObject();
    assertEquals("satisfiable", first.get("verdict").getAsString());
    assertTrue(first.has("combined"), "The combined formula is included");
  }
}
