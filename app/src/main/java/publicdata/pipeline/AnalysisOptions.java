package publicdata.pipeline;

import java.util.Objects;
import publicdata.aggregate.AggregationOptions;
import publicdata.io.TraceOptions;
import publicdata.paths.EnumerationOptions;
import publicdata.symbolic.InputClassification;
import publicdata.verify.VerifierOptions;

/** Settings for one analysis run; {@code jobs} bounds how many functions are analysed at once. */
public record AnalysisOptions(
    EnumerationOptions enumeration,
    VerifierOptions verifier,
    InputClassification classification,
    AggregationOptions aggregation,
    TraceOptions trace,
    int jobs) {

  public AnalysisOptions {
    Objects.requireNonNull(enumeration, "enumeration");
    Objects.requireNonNull(verifier, "verifier");
    Objects.requireNonNull(classification, "classification");
    Objects.requireNonNull(aggregation, "aggregation");
    Objects.requireNonNull(trace, "trace");
    if (jobs < 1) {
      throw new IllegalArgumentException("jobs must be at least 1");
    }
  }

  public static AnalysisOptions defaults() {
    return new AnalysisOptions(
        EnumerationOptions.defaults(),
        VerifierOptions.defaults(),
        InputClassification.allPublic(),
        AggregationOptions.defaults(),
        TraceOptions.unlimited(),
        1);
  }

  public AnalysisOptions withEnumeration(EnumerationOptions options) {
    return new AnalysisOptions(options, verifier, classification, aggregation, trace, jobs);
  }

  public AnalysisOptions withVerifier(VerifierOptions options) {
    return new AnalysisOptions(enumeration, options, classification, aggregation, trace, jobs);
  }

  public AnalysisOptions withClassification(InputClassification secrets) {
    return new AnalysisOptions(enumeration, verifier, secrets, aggregation, trace, jobs);
  }

  public AnalysisOptions withJobs(int workers) {
    return new AnalysisOptions(enumeration, verifier, classification, aggregation, trace, workers);
  }
}
