package publicdata.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import publicdata.symbolic.Term;

final class QueryCacheTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(1);

  private static EquivalenceQuery query(String name) {
    return new EquivalenceQuery(
        List.of(), new Term.Var(name + "#A", 8), new Term.Var(name + "#B", 8));
  }

  /** Backend that counts runs and can hold the first one until released. */
  private static final class GatedBackend implements SolverBackend {
    final AtomicInteger runs = new AtomicInteger();
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);

    @Override
    public String name() {
      return "gated";
    }

    @Override
    public Verdict checkDivergence(EquivalenceQuery query, Duration timeout) {
      runs.incrementAndGet();
      entered.countDown();
      try {
        release.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return Verdict.SAT;
    }
  }

  @Test
  void repeatedQueryIsServedFromCache() {
    GatedBackend backend = new GatedBackend();
    backend.release.countDown();
    QueryCache cache = new QueryCache(backend);

    QueryCache.Lookup first = cache.check(query("k"), TIMEOUT);
    QueryCache.Lookup second = cache.check(query("k"), TIMEOUT);

    assertFalse(first.hit());
    assertTrue(second.hit());
    assertEquals(Verdict.SAT, second.verdict());
    assertEquals(1, backend.runs.get());
    SolverStats.Snapshot stats = cache.stats().snapshot();
    assertEquals(1, stats.hits());
    assertEquals(1, stats.misses());
    assertEquals(1, stats.sat());
    assertEquals(0.5, stats.hitRate());
  }

  @Test
  void concurrentIdenticalQueriesRunTheSolverOnce() throws Exception {
    GatedBackend backend = new GatedBackend();
    QueryCache cache = new QueryCache(backend);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      Future<QueryCache.Lookup> leader = executor.submit(() -> cache.check(query("k"), TIMEOUT));
      assertTrue(backend.entered.await(10, TimeUnit.SECONDS), "Solver run should have started");
      Future<QueryCache.Lookup> f1 = executor.submit(() -> cache.check(query("k"), TIMEOUT));
      Future<QueryCache.Lookup> f2 = executor.submit(() -> cache.check(query("k"), TIMEOUT));
      backend.release.countDown();

      assertEquals(Verdict.SAT, leader.get(10, TimeUnit.SECONDS).verdict());
      assertTrue(f1.get(10, TimeUnit.SECONDS).hit());
      assertTrue(f2.get(10, TimeUnit.SECONDS).hit());
      assertEquals(1, backend.runs.get(), "Followers must wait for the leader's verdict");
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void failedRunIsNotCached() {
    AtomicInteger runs = new AtomicInteger();
    SolverBackend flaky =
        new SolverBackend() {
          @Override
          public String name() {
            return "flaky";
          }

          @Override
          public Verdict checkDivergence(EquivalenceQuery query, Duration timeout) {
            if (runs.getAndIncrement() == 0) {
              throw new IllegalStateException("backend crashed");
            }
            return Verdict.UNSAT;
          }
        };
    QueryCache cache = new QueryCache(flaky);

    assertThrows(IllegalStateException.class, () -> cache.check(query("k"), TIMEOUT));
    assertEquals(0, cache.size());
    assertEquals(Verdict.UNSAT, cache.check(query("k"), TIMEOUT).verdict());
    assertEquals(2, runs.get());
  }
}
