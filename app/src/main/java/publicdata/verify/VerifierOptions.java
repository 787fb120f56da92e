package publicdata.verify;

import java.time.Duration;
import java.util.Objects;

/**
 * Verifier settings. {@code parallelism} bounds the worker threads checking one function's paths;
 * {@code checkDefinitions} also queries every defined value, not only transmitter operands.
 */
public record VerifierOptions(
    Duration solverTimeout,
    int parallelism,
    int pointerWidth,
    boolean propagateControlDivergence,
    boolean checkDefinitions) {

  public static final Duration DEFAULT_SOLVER_TIMEOUT = Duration.ofSeconds(5);

  public VerifierOptions {
    Objects.requireNonNull(solverTimeout, "solverTimeout");
    if (solverTimeout.isNegative()) {
      throw new IllegalArgumentException("solverTimeout must not be negative");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1");
    }
    if (pointerWidth < 1 || pointerWidth > 64) {
      throw new IllegalArgumentException("pointerWidth must be within 1..64");
    }
  }

  public static VerifierOptions defaults() {
    return new VerifierOptions(DEFAULT_SOLVER_TIMEOUT, 1, 64, true, false);
  }

  public VerifierOptions withParallelism(int workers) {
    return new VerifierOptions(
        solverTimeout, workers, pointerWidth, propagateControlDivergence, checkDefinitions);
  }

  public VerifierOptions withCheckDefinitions(boolean enabled) {
    return new VerifierOptions(
        solverTimeout, parallelism, pointerWidth, propagateControlDivergence, enabled);
  }

  public VerifierOptions withControlDivergence(boolean enabled) {
    return new VerifierOptions(solverTimeout, parallelism, pointerWidth, enabled, checkDefinitions);
  }
}
