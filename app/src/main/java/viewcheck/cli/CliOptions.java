package viewcheck.cli;

import java.util.List;
import java.util.Objects;
import viewcheck.backend.Request;
import viewcheck.pipeline.VerifierOptions;

record CliOptions(
    List<String> examples,
    Request request,
    int threads,
    boolean collapseNops,
    long timeoutMs,
    boolean json) {

  CliOptions {
    examples = List.copyOf(examples);
    Objects.requireNonNull(request, "request");
    if (threads < 1) {
      throw new IllegalArgumentException("--threads must be at least 1");
    }
    if (timeoutMs < 0) {
      throw new IllegalArgumentException("--timeout must be non-negative");
    }
  }

  VerifierOptions verifierOptions() {
    return new VerifierOptions(request, threads, collapseNops, timeoutMs);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private List<String> examples = List.of();
    private Request request = VerifierOptions.defaults().request();
    private int threads = VerifierOptions.defaults().threads();
    private boolean collapseNops = VerifierOptions.defaults().collapseNops();
    private long timeoutMs = VerifierOptions.defaults().timeoutMs();
    private boolean json;

    Builder examples(List<String> examples) {
      if (examples != null) {
        this.examples = List.copyOf(examples);
      }
      return this;
    }

    Builder request(Request request) {
      this.request = request;
      return this;
    }

    Builder threads(int threads) {
      this.threads = threads;
      return this;
    }

    Builder collapseNops(boolean collapseNops) {
      this.collapseNops = collapseNops;
      return this;
    }

    Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    CliOptions build() {
      if (examples.isEmpty()) {
        throw new IllegalArgumentException("Provide at least one --example");
      }
      return new CliOptions(examples, request, threads, collapseNops, timeoutMs, json);
    }
  }
}
