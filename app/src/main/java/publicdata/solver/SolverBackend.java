package publicdata.solver;

import java.time.Duration;

/** Decision procedure behind the verifier. Implementations must be thread-safe. */
public interface SolverBackend {

  String name();

  /**
   * Decides whether the query's terms can differ. Must return {@link Verdict#UNKNOWN} rather than
   * block past {@code timeout}.
   */
  Verdict checkDivergence(EquivalenceQuery query, Duration timeout);
}
