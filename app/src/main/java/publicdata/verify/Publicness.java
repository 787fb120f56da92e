package publicdata.verify;

import publicdata.solver.Verdict;

/** Three-valued publicness; serialized as {@code true}, {@code false} or {@code null}. */
public enum Publicness {
  PUBLIC(Boolean.TRUE),
  SECRET(Boolean.FALSE),
  UNKNOWN(null);

  private final Boolean wire;

  Publicness(Boolean wire) {
    this.wire = wire;
  }

  public Boolean toWire() {
    return wire;
  }

  public static Publicness fromWire(Boolean value) {
    if (value == null) {
      return UNKNOWN;
    }
    return value ? PUBLIC : SECRET;
  }

  public static Publicness fromVerdict(Verdict verdict) {
    switch (verdict) {
      case UNSAT:
        return PUBLIC;
      case SAT:
        return SECRET;
      default:
        return UNKNOWN;
    }
  }

  /** Conjunction: {@code false} dominates, then unknown. */
  public Publicness and(Publicness other) {
    if (this == SECRET || other == SECRET) {
      return SECRET;
    }
    if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    return PUBLIC;
  }
}
