package publicdata.solver;

import java.util.concurrent.atomic.AtomicLong;

/** Thread-safe query counters. */
public final class SolverStats {
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong sat = new AtomicLong();
  private final AtomicLong unsat = new AtomicLong();
  private final AtomicLong unknown = new AtomicLong();
  private final AtomicLong solverNanos = new AtomicLong();

  public void recordHit() {
    hits.incrementAndGet();
  }

  public void recordMiss() {
    misses.incrementAndGet();
  }

  public void recordSolved(Verdict verdict, long nanos) {
    solverNanos.addAndGet(nanos);
    switch (verdict) {
      case SAT -> sat.incrementAndGet();
      case UNSAT -> unsat.incrementAndGet();
      case UNKNOWN -> unknown.incrementAndGet();
    }
  }

  public Snapshot snapshot() {
    return new Snapshot(
        hits.get(), misses.get(), sat.get(), unsat.get(), unknown.get(), solverNanos.get());
  }

  /** Point-in-time copy of the counters. */
  public record Snapshot(
      long hits, long misses, long sat, long unsat, long unknown, long solverNanos) {

    public long lookups() {
      return hits + misses;
    }

    public double hitRate() {
      long total = lookups();
      return total == 0 ? 0.0 : hits / (double) total;
    }

    public long solverMillis() {
      return solverNanos / 1_000_000L;
    }

    /** Counter growth since {@code earlier}. */
    public Snapshot minus(Snapshot earlier) {
      return new Snapshot(
          hits - earlier.hits,
          misses - earlier.misses,
          sat - earlier.sat,
          unsat - earlier.unsat,
          unknown - earlier.unknown,
          solverNanos - earlier.solverNanos);
    }
  }
}
