package publicdata.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.aggregate.AggregationReport;
import publicdata.aggregate.Aggregator;
import publicdata.model.FunctionModel;
import publicdata.model.Path;
import publicdata.paths.EnumerationResult;
import publicdata.paths.PathEnumerator;
import publicdata.solver.QueryCache;
import publicdata.util.Timing;
import publicdata.verify.DualExecutionVerifier;
import publicdata.verify.FunctionVerification;
import publicdata.verify.Publicness;
import publicdata.verify.PublicnessResult;

/**
 * Library entry point: enumerates the paths of one function model, verifies every transmitter on
 * every path and reduces the results per program point. Output records reach the caller through
 * the sinks it passes in; nothing is written anywhere else.
 */
public final class Analyzer {

  private static final Logger LOG = LoggerFactory.getLogger(Analyzer.class);

  private final AnalysisOptions options;
  private final QueryCache cache;

  public Analyzer(AnalysisOptions options, QueryCache cache) {
    this.options = Objects.requireNonNull(options, "options");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public AnalysisOptions options() {
    return options;
  }

  public FunctionAnalysis analyze(FunctionModel model) {
    return analyze(model, path -> {}, result -> {});
  }

  public FunctionAnalysis analyze(
      FunctionModel model, Consumer<Path> pathSink, Consumer<PublicnessResult> resultSink) {
    Objects.requireNonNull(model, "model");
    Timing timer = Timing.start();

    PathEnumerator enumerator = new PathEnumerator(options.enumeration());
    EnumerationResult enumeration = enumerator.enumerate(model, pathSink);
    List<Path> paths = enumeration.paths();
    if (enumeration.summary().truncated()) {
      LOG.warn("{}: path enumeration truncated after {} paths", model.name(), paths.size());
    }

    DualExecutionVerifier verifier =
        new DualExecutionVerifier(options.verifier(), options.classification(), cache);
    FunctionVerification verification = verifier.verifyAll(model, paths, resultSink);

    AggregationReport aggregation =
        new Aggregator(options.aggregation())
            .aggregate(verification.results(), enumeration.coverage(), paths);

    long elapsed = timer.elapsedMillis();
    LOG.info(
        "{}: {} paths, {} results ({} public, {} secret, {} unknown), {} points in {} ms",
        model.name(),
        paths.size(),
        verification.results().size(),
        verification.count(Publicness.PUBLIC),
        verification.count(Publicness.SECRET),
        verification.count(Publicness.UNKNOWN),
        aggregation.entries().size(),
        elapsed);
    return new FunctionAnalysis(model, enumeration, verification, aggregation, elapsed);
  }
}
