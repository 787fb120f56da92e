package publicdata.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import publicdata.aggregate.AggregatedPublicness;
import publicdata.aggregate.AggregationReport;
import publicdata.diagnostics.AnalysisDiagnostic;
import publicdata.model.FunctionModel;
import publicdata.paths.EnumerationResult;
import publicdata.verify.FunctionVerification;
import publicdata.verify.PublicnessResult;

/** Everything one function's analysis produced. */
public record FunctionAnalysis(
    FunctionModel model,
    EnumerationResult enumeration,
    FunctionVerification verification,
    AggregationReport aggregation,
    long elapsedMillis) {

  public FunctionAnalysis {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(enumeration, "enumeration");
    Objects.requireNonNull(verification, "verification");
    Objects.requireNonNull(aggregation, "aggregation");
  }

  public String function() {
    return model.name();
  }

  public List<PublicnessResult> results() {
    return verification.results();
  }

  public List<AggregatedPublicness> publicAtPoint() {
    return aggregation.entries();
  }

  /** Verifier diagnostics followed by aggregation integrity issues. */
  public List<AnalysisDiagnostic> diagnostics() {
    List<AnalysisDiagnostic> all = new ArrayList<>(verification.diagnostics());
    all.addAll(aggregation.integrityIssues());
    return List.copyOf(all);
  }
}
