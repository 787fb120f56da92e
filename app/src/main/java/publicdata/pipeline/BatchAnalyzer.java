package publicdata.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.model.FunctionModel;
import publicdata.solver.QueryCache;
import publicdata.solver.SolverStats;
import publicdata.util.Timing;

/**
 * Analyses many functions on a bounded worker pool. Each function gets its own enumerator and
 * verifier state; the query cache is shared. A function that fails is logged and reported without
 * affecting the others. Results come back in input order regardless of completion order.
 */
public final class BatchAnalyzer {

  private static final Logger LOG = LoggerFactory.getLogger(BatchAnalyzer.class);

  private final Analyzer analyzer;
  private final QueryCache cache;
  private final int jobs;

  public BatchAnalyzer(AnalysisOptions options, QueryCache cache) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.analyzer = new Analyzer(options, cache);
    this.jobs = options.jobs();
  }

  /** Outcome of a batch: successful analyses and failures, both in input order. */
  public record BatchResult(
      List<FunctionAnalysis> analyses, List<FunctionFailure> failures, long elapsedMillis) {
    public BatchResult {
      analyses = List.copyOf(analyses);
      failures = List.copyOf(failures);
    }
  }

  public BatchResult analyzeAll(List<FunctionModel> models) {
    Timing timer = Timing.start();
    SolverStats.Snapshot before = cache.stats().snapshot();
    List<Outcome> outcomes;
    if (jobs <= 1 || models.size() <= 1) {
      outcomes = new ArrayList<>(models.size());
      for (FunctionModel model : models) {
        outcomes.add(run(model));
      }
    } else {
      ForkJoinPool pool = new ForkJoinPool(jobs);
      try {
        outcomes =
            pool.submit(
                    () -> models.parallelStream().map(this::run).collect(Collectors.toList()))
                .join();
      } finally {
        pool.shutdown();
      }
    }
    List<FunctionAnalysis> analyses = new ArrayList<>();
    List<FunctionFailure> failures = new ArrayList<>();
    for (Outcome o : outcomes) {
      if (o.analysis() != null) {
        analyses.add(o.analysis());
      } else {
        failures.add(o.failure());
      }
    }
    SolverStats.Snapshot delta = cache.stats().snapshot().minus(before);
    long elapsed = timer.elapsedMillis();
    LOG.info(
        "Analysed {} functions ({} failed) in {} ms; {} solver lookups, hit rate {}, solver {} ms",
        analyses.size(),
        failures.size(),
        elapsed,
        delta.lookups(),
        String.format("%.2f", delta.hitRate()),
        delta.solverMillis());
    return new BatchResult(analyses, failures, elapsed);
  }

  private Outcome run(FunctionModel model) {
    try {
      return new Outcome(analyzer.analyze(model), null);
    } catch (RuntimeException ex) {
      LOG.error("Analysis failed for {}: {}", model.name(), ex.getMessage(), ex);
      return new Outcome(null, new FunctionFailure(model.name(), ex.getMessage()));
    }
  }

  private record Outcome(FunctionAnalysis analysis, FunctionFailure failure) {}
}
