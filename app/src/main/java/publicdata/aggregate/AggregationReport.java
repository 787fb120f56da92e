package publicdata.aggregate;

import java.util.List;
import publicdata.diagnostics.AnalysisDiagnostic;

/** Aggregated verdicts plus the data-integrity conditions found on the way. */
public record AggregationReport(
    List<AggregatedPublicness> entries, List<AnalysisDiagnostic> integrityIssues) {

  public AggregationReport {
    entries = List.copyOf(entries);
    integrityIssues = List.copyOf(integrityIssues);
  }
}
