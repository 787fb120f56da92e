package publicdata.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import publicdata.diagnostics.AnalysisDiagnostic;

/** Per-path verifications of one function, in path order, with summed counters. */
public record FunctionVerification(String function, List<PathVerification> paths) {

  public FunctionVerification {
    Objects.requireNonNull(function, "function");
    paths = List.copyOf(paths);
  }

  public List<PublicnessResult> results() {
    List<PublicnessResult> out = new ArrayList<>();
    for (PathVerification p : paths) {
      out.addAll(p.results());
    }
    return out;
  }

  public List<AnalysisDiagnostic> diagnostics() {
    List<AnalysisDiagnostic> out = new ArrayList<>();
    for (PathVerification p : paths) {
      out.addAll(p.diagnostics());
    }
    return out;
  }

  public int queries() {
    return paths.stream().mapToInt(PathVerification::queries).sum();
  }

  public int cacheHits() {
    return paths.stream().mapToInt(PathVerification::cacheHits).sum();
  }

  public int cacheMisses() {
    return paths.stream().mapToInt(PathVerification::cacheMisses).sum();
  }

  public long solverNanos() {
    return paths.stream().mapToLong(PathVerification::solverNanos).sum();
  }

  public long count(Publicness publicness) {
    return paths.stream()
        .flatMap(p -> p.results().stream())
        .filter(r -> r.publicness() == publicness)
        .count();
  }
}
