package viewcheck.cli;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import viewcheck.ast.CollatedScript;
import viewcheck.backend.AxiomOutcome;
import viewcheck.diagnostics.ModelException;
import viewcheck.diagnostics.VerificationError;
import viewcheck.pipeline.VerificationPipeline;
import viewcheck.pipeline.VerificationReport;

/**
 * Command line entry point. Verifies built-in example scripts.
 *
 * <p>Usage: {@code Main --example ticketlock[,spinlock] [--mode translate|combine|sat]
 * [--threads N] [--timeout MS] [--no-collapse] [--json]}
 *
 * <p>Exit codes: 0 when every script verified, 1 when an axiom failed or was not proven, 2 on bad
 * arguments or an unusable script.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    CliOptions options;
    try {
      options = parse(args);
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return 2;
    }

    VerificationPipeline pipeline = VerificationPipeline.withZ3(options.timeoutMs());
    Map<String, VerificationReport> reports = new LinkedHashMap<>();
    for (String name : options.examples()) {
      try {
        CollatedScript script = CliParsers.loadExampleByName(name);
        reports.put(name, pipeline.verify(script, options.verifierOptions()));
      } catch (IllegalArgumentException ex) {
        LOG.error("{}", ex.getMessage());
        return 2;
      } catch (ModelException ex) {
        LOG.error("Script {} could not be modelled:", name);
        for (VerificationError error : ex.errors()) {
          LOG.error("  {}", error);
        }
        return 2;
      }
    }

    reports.forEach(Main::logSummary);
    if (options.json()) {
      System.out.println(new JsonReportBuilder().build(reports));
    }
    return reports.values().stream().allMatch(VerificationReport::success) ? 0 : 1;
  }

  private static void logSummary(String name, VerificationReport report) {
    LOG.info(
        "Script {}: {} axiom(s) in {} ms", name, report.outcomes().size(), report.elapsedMillis());
    for (AxiomOutcome outcome : report.outcomes()) {
      if (outcome.isFailure()) {
        LOG.info("  {}: error {}", outcome.axiom(), outcome.result().getLeft());
      } else {
        LOG.info(
            "  {}: {}",
            outcome.axiom(),
            outcome.result().get().verdict().map(Enum::name).orElse("translated"));
      }
    }
    report.failures().forEach((method, errors) -> LOG.info("  method {}: {}", method, errors));
  }

  static CliOptions parse(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();
    String[] effectiveArgs = args == null ? new String[0] : args;

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--example",
        OptionSpec.withValue((b, raw) -> b.examples(CliParsers.parseExampleNames(raw))));
    specs.put("--mode", OptionSpec.withValue((b, raw) -> b.request(CliParsers.parseRequest(raw))));
    specs.put(
        "--threads",
        OptionSpec.withValue((b, raw) -> b.threads(CliParsers.parseInt(raw, 1, "--threads"))));
    specs.put(
        "--timeout",
        OptionSpec.withValue((b, raw) -> b.timeoutMs(CliParsers.parseLong(raw, 0, "--timeout"))));
    specs.put("--no-collapse", OptionSpec.flag(b -> b.collapseNops(false)));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(
      boolean requiresValue, BiConsumer<CliOptions.Builder, String> consumer) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      consumer.accept(builder, value);
    }
  }
}
