package viewcheck.cli;

import com.google.common.base.Splitter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import viewcheck.ast.CollatedScript;
import viewcheck.backend.Request;
import viewcheck.examples.Examples;

/** Shared helpers for CLI argument parsing and example loading. */
final class CliParsers {
  private static final Map<String, Supplier<CollatedScript>> EXAMPLE_LOADERS =
      buildExampleLoaders();

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static List<String> parseExampleNames(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return Splitter.on(',')
        .trimResults()
        .omitEmptyStrings()
        .splitToStream(raw)
        .map(name -> name.toLowerCase(Locale.ROOT))
        .toList();
  }

  static Request parseRequest(String raw) {
    if (raw == null || raw.isBlank()) {
      return Request.SAT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "translate" -> Request.TRANSLATE;
      case "combine" -> Request.COMBINE;
      case "sat", "check" -> Request.SAT;
      default -> throw new IllegalArgumentException("Invalid mode: " + raw);
    };
  }

  static CollatedScript loadExampleByName(String exampleName) {
    if (exampleName == null || exampleName.isBlank()) {
      throw new IllegalArgumentException("Unknown example: " + exampleName);
    }
    Supplier<CollatedScript> supplier =
        EXAMPLE_LOADERS.get(exampleName.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new IllegalArgumentException(
          "Unknown example: " + exampleName + " (known: " + EXAMPLE_LOADERS.keySet() + ")");
    }
    return supplier.get();
  }

  private static Map<String, Supplier<CollatedScript>> buildExampleLoaders() {
    Map<String, Supplier<CollatedScript>> loaders = new LinkedHashMap<>();
    loaders.put("ticketlock", Examples::ticketLock);
    loaders.put("spinlock", Examples::spinLock);
    return Collections.unmodifiableMap(loaders);
  }
}
