package viewcheck.backend;

import java.util.Objects;
import java.util.Optional;

/**
 * What the solver boundary produced for one term. {@code pre}, {@code command} and {@code post}
 * are the translated parts in solver syntax; {@code combined} is present from {@link
 * Request#COMBINE} on and {@code verdict} for {@link Request#SAT}.
 */
public record BackendResult(
    Request request,
    String pre,
    String command,
    String post,
    Optional<String> combined,
    Optional<Verdict> verdict) {

  public BackendResult {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(pre, "pre");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(post, "post");
    Objects.requireNonNull(combined, "combined");
    Objects.requireNonNull(verdict, "verdict");
  }
}
