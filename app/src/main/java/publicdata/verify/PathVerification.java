package publicdata.verify;

import java.util.List;
import publicdata.diagnostics.AnalysisDiagnostic;

/** Results and counters for one path. */
public record PathVerification(
    int pathId,
    List<PublicnessResult> results,
    List<AnalysisDiagnostic> diagnostics,
    int queries,
    int cacheHits,
    int cacheMisses,
    long solverNanos) {

  public PathVerification {
    results = List.copyOf(results);
    diagnostics = List.copyOf(diagnostics);
  }
}
