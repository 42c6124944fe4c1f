package viewcheck.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import viewcheck.backend.Request;

final class MainTest {

  @Test
  void parsesEveryOption() {
    CliOptions options =
        Main.parse(
            new String[] {
              "--example=ticketlock,spinlock",
              "--mode",
              "combine",
              "--threads",
              "4",
              "--timeout=500",
              "--no-collapse",
              "--json"
            });

    assertEquals(List.of("ticketlock", "spinlock"), options.examples());
    assertEquals(Request.COMBINE, options.request());
    assertEquals(4, options.threads());
    assertEquals(500L, options.timeoutMs());
    assertFalse(options.collapseNops(), "--no-collapse turns collapsing off");
    assertTrue(options.json(), "--json asks for the report");
  }

  @Test
  void defaultsApplyWhenOnlyAnExampleIsGiven() {
    CliOptions options = Main.parse(new String[] {"--example", "spinlock"});

    assertEquals(Request.SAT, options.request(), "Checking is the default");
    assertEquals(1, options.threads());
    assertTrue(options.collapseNops(), "Collapsing is on by default");
    assertFalse(options.json());
  }

  @Test
  void badArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Main.parse(new String[0]), "No example");
    assertThrows(
        IllegalArgumentException.class,
        () -> Main.parse(new String[] {"--example", "ticketlock", "--frobnicate"}),
        "Unknown option");
    assertThrows(
        IllegalArgumentException.class,
        () -> Main.parse(new String[] {"--example", "ticketlock", "--threads", "0"}),
        "Threads must be positive");
    assertThrows(
        IllegalArgumentException.class,
        () -> Main.parse(new String[] {"--example"}),
        "Missing value");
  }

  @Test
  void runReturnsTwoOnBadArguments() {
    assertEquals(2, Main.run(new String[] {"--mode", "prove", "--example", "ticketlock"}));
    assertEquals(2, Main.run(new String[] {"--example", "nosuchlock"}));
  }

  @Test
  void runReturnsZeroWhenEveryExampleIsProven() {
    assertEquals(0, Main.run(new String[] {"--example", "ticketlock,spinlock"}));
  }
}
