package viewcheck.pipeline;

import viewcheck.backend.Request;

/**
 * Configuration of a verification run.
 *
 * @param request how far to take each term at the solver boundary
 * @param threads solver threads; 1 checks terms one after another
 * @param collapseNops whether to merge nodes joined by no-op edges before axiomatising
 * @param timeoutMs per-term solver timeout, 0 for none
 */
public record VerifierOptions(Request request, int threads, boolean collapseNops, long timeoutMs) {

  public static VerifierOptions defaults() {
    return new VerifierOptions(Request.SAT, 1, true, 0);
  }

  public static VerifierOptions normalize(VerifierOptions options) {
    if (options == null) {
      return defaults();
    }
    Request request = options.request() != null ? options.request() : defaults().request();
    int threads = Math.max(1, options.threads());
    long timeoutMs = Math.max(0, options.timeoutMs());
    return new VerifierOptions(request, threads, options.collapseNops(), timeoutMs);
  }
}
