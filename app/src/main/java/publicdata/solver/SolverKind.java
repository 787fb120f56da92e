package publicdata.solver;

import java.util.Locale;
import java.util.function.Supplier;

/** Selectable decision procedures, by their command-line name. */
public enum SolverKind {
  Z3(Z3Solver::new),
  BOUNDED(BoundedModelSolver::new);

  private final Supplier<SolverBackend> factory;

  SolverKind(Supplier<SolverBackend> factory) {
    this.factory = factory;
  }

  public SolverBackend create() {
    return factory.get();
  }

  public static SolverKind parse(String raw) {
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Unknown solver '" + raw + "' (expected z3 or bounded)", ex);
    }
  }
}
