package publicdata.paths;

import java.util.List;
import java.util.Objects;
import publicdata.model.Path;
import publicdata.model.PathSummary;
import publicdata.model.PpCoverage;

/** Output of one function's enumeration. Coverage is empty unless it was requested. */
public record EnumerationResult(List<Path> paths, List<PpCoverage> coverage, PathSummary summary) {

  public EnumerationResult {
    paths = List.copyOf(paths);
    coverage = List.copyOf(coverage);
    Objects.requireNonNull(summary, "summary");
  }
}
