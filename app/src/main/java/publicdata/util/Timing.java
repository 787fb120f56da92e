package publicdata.util;

import java.time.Duration;

/** Monotonic stopwatch, optionally bounded by a budget. */
public final class Timing {
  private final long startedAt;
  private final long budgetNanos;

  private Timing(long startedAt, long budgetNanos) {
    this.startedAt = startedAt;
    this.budgetNanos = budgetNanos;
  }

  public static Timing start() {
    return new Timing(System.nanoTime(), 0);
  }

  /** Stopwatch that {@linkplain #expired() expires} after {@code budget}; zero means never. */
  public static Timing withBudget(Duration budget) {
    return new Timing(System.nanoTime(), Math.max(0, budget.toNanos()));
  }

  public long elapsedMillis() {
    return elapsedNanos() / 1_000_000L;
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  public boolean expired() {
    return budgetNanos > 0 && elapsedNanos() >= budgetNanos;
  }
}
