package publicdata.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import publicdata.model.FunctionModel;
import publicdata.solver.BoundedModelSolver;
import publicdata.solver.EquivalenceQuery;
import publicdata.solver.QueryCache;
import publicdata.solver.SolverBackend;
import publicdata.solver.Verdict;
import publicdata.testing.FunctionModels;

final class BatchAnalyzerTest {

  /** Delegates to the built-in solver but fails every query mentioning {@code boom}. */
  private static final class TrippingBackend implements SolverBackend {
    private final BoundedModelSolver delegate = new BoundedModelSolver();

    @Override
    public String name() {
      return "tripping";
    }

    @Override
    public Verdict checkDivergence(EquivalenceQuery query, Duration timeout) {
      if (query.canonicalKey().contains("boom")) {
        throw new IllegalStateException("solver crashed on " + query.canonicalKey());
      }
      return delegate.checkDivergence(query, timeout);
    }
  }

  private static FunctionModel lookup(String name, String base) {
    return FunctionModels.function(name)
        .block("entry")
        .gep("p", base, "idx", "i64")
        .load("v", "i32", "p")
        .ret()
        .build();
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3})
  void failingFunctionDoesNotStopTheBatch(int jobs) {
    List<FunctionModel> models =
        List.of(lookup("first", "table"), lookup("broken", "boom"), lookup("third", "table"));
    BatchAnalyzer batch =
        new BatchAnalyzer(
            AnalysisOptions.defaults().withJobs(jobs), new QueryCache(new TrippingBackend()));

    BatchAnalyzer.BatchResult result = batch.analyzeAll(models);

    assertEquals(
        List.of("first", "third"),
        result.analyses().stream().map(FunctionAnalysis::function).collect(Collectors.toList()));
    assertEquals(1, result.failures().size());
    assertEquals("broken", result.failures().get(0).function());
    assertTrue(result.failures().get(0).message().contains("solver crashed"));
  }

  @Test
  void sharedCacheServesRepeatedFunctions() {
    QueryCache cache = new QueryCache(new BoundedModelSolver());
    BatchAnalyzer batch = new BatchAnalyzer(AnalysisOptions.defaults(), cache);
    batch.analyzeAll(List.of(lookup("a", "table"), lookup("b", "table")));
    assertTrue(cache.stats().snapshot().hits() > 0, "identical queries across functions hit");
  }
}
