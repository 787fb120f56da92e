package publicdata.solver;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.util.Timing;

/**
 * Shared verdict cache with single-flight semantics: concurrent requests for one key wait for the
 * first caller's solver run instead of issuing their own.
 */
public final class QueryCache {

  private static final Logger LOG = LoggerFactory.getLogger(QueryCache.class);

  private final SolverBackend backend;
  private final ConcurrentMap<String, CompletableFuture<Verdict>> verdicts =
      new ConcurrentHashMap<>();
  private final SolverStats stats = new SolverStats();

  public QueryCache(SolverBackend backend) {
    this.backend = Objects.requireNonNull(backend, "backend");
  }

  public SolverBackend backend() {
    return backend;
  }

  public SolverStats stats() {
    return stats;
  }

  public int size() {
    return verdicts.size();
  }

  /** Result of one cache lookup; {@code hit} is true when no solver run was started for it. */
  public record Lookup(Verdict verdict, boolean hit, long solverNanos) {}

  public Lookup check(EquivalenceQuery query, Duration timeout) {
    String key = query.canonicalKey();
    CompletableFuture<Verdict> pending = new CompletableFuture<>();
    CompletableFuture<Verdict> existing = verdicts.putIfAbsent(key, pending);
    if (existing != null) {
      stats.recordHit();
      return new Lookup(existing.join(), true, 0);
    }
    stats.recordMiss();
    Timing timing = Timing.start();
    try {
      Verdict verdict = backend.checkDivergence(query, timeout);
      long nanos = timing.elapsedNanos();
      stats.recordSolved(verdict, nanos);
      pending.complete(verdict);
      LOG.debug("{} -> {} in {} ms", backend.name(), verdict, timing.elapsedMillis());
      return new Lookup(verdict, false, nanos);
    } catch (RuntimeException ex) {
      verdicts.remove(key, pending);
      pending.completeExceptionally(ex);
      throw ex;
    }
  }
}
