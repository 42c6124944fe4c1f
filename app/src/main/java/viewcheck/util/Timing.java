package viewcheck.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Wall-clock timer that records how long each named stage took. */
public final class Timing {
  private final long startedAt;
  private final Map<String, Long> stages = new LinkedHashMap<>();
  private long lastMark;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
    this.lastMark = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  /** Records the time since the previous mark (or the start) under {@code stage}. */
  public void mark(String stage) {
    long now = System.nanoTime();
    stages.merge(stage, (now - lastMark) / 1_000_000L, Long::sum);
    lastMark = now;
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** Stage durations in milliseconds, in the order the stages were first marked. */
  public Map<String, Long> stages() {
    return Collections.unmodifiableMap(stages);
  }
}
