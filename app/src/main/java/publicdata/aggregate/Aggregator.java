package publicdata.aggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.diagnostics.AnalysisDiagnostic;
import publicdata.model.Path;
import publicdata.model.PpCoverage;
import publicdata.model.ProgramPoint;
import publicdata.model.ValueId;
import publicdata.verify.Publicness;
import publicdata.verify.PublicnessResult;

/**
 * AND-reduces per-path results to one verdict per (function, program point, value).
 *
 * <p>Coverage tells which paths pass a program point. It comes from {@code pp_coverage} records
 * when present, else from the paths' program-point sequences, else from the results themselves.
 * A covering path without a result for a value is reported and counted according to the {@link
 * MissingResultPolicy}; it never silently counts as public.
 */
public final class Aggregator {

  private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

  private static final Comparator<Key> KEY_ORDER =
      Comparator.comparing(Key::function)
          .thenComparing(Key::pp)
          .thenComparing(k -> k.value().render());

  private final AggregationOptions options;

  public Aggregator(AggregationOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public AggregationReport aggregate(List<PublicnessResult> results) {
    return aggregate(results, List.of(), List.of());
  }

  public AggregationReport aggregate(
      List<PublicnessResult> results, List<PpCoverage> coverage, List<Path> paths) {
    Map<Key, Map<Integer, Publicness>> byKey = new TreeMap<>(KEY_ORDER);
    for (PublicnessResult r : results) {
      byKey
          .computeIfAbsent(new Key(r.function(), r.pp(), r.value()), k -> new LinkedHashMap<>())
          .merge(r.pathId(), r.publicness(), Publicness::and);
    }
    Map<ProgramPoint, Covering> covering = coveringPaths(coverage, paths);

    List<AggregatedPublicness> entries = new ArrayList<>(byKey.size());
    List<AnalysisDiagnostic> issues = new ArrayList<>();
    for (Map.Entry<Key, Map<Integer, Publicness>> e : byKey.entrySet()) {
      Key key = e.getKey();
      Map<Integer, Publicness> perPath = e.getValue();
      Publicness verdict = Publicness.PUBLIC;
      for (Publicness p : perPath.values()) {
        verdict = verdict.and(p);
      }
      Covering cover = covering.get(key.pp());
      int total = perPath.size();
      int missing = 0;
      boolean truncated = false;
      if (cover != null) {
        Set<Integer> ids = new LinkedHashSet<>(cover.pathIds);
        ids.removeAll(perPath.keySet());
        missing = ids.size();
        total = Math.max(cover.pathCount, perPath.size());
        truncated = cover.truncated;
        if (missing > 0) {
          AnalysisDiagnostic issue =
              AnalysisDiagnostic.missingPathResult(
                  key.function(), key.pp(), key.value().render(), missing);
          LOG.warn("{} (paths {})", issue.describe(), ids);
          issues.add(issue);
          verdict = verdict.and(options.missingPolicy().contribution());
        }
      }
      entries.add(
          new AggregatedPublicness(
              key.function(), key.pp(), key.value(), verdict, total, missing, truncated));
    }
    return new AggregationReport(entries, issues);
  }

  private static Map<ProgramPoint, Covering> coveringPaths(
      List<PpCoverage> coverage, List<Path> paths) {
    Map<ProgramPoint, Covering> out = new HashMap<>();
    if (!coverage.isEmpty()) {
      for (PpCoverage c : coverage) {
        out.put(c.pp(), new Covering(c.pathIds(), c.pathCount(), c.truncated()));
      }
      return out;
    }
    Map<ProgramPoint, Set<Integer>> fromSeq = new HashMap<>();
    for (Path path : paths) {
      for (ProgramPoint pp : path.ppSeq()) {
        fromSeq.computeIfAbsent(pp, k -> new LinkedHashSet<>()).add(path.id());
      }
    }
    for (Map.Entry<ProgramPoint, Set<Integer>> e : fromSeq.entrySet()) {
      out.put(e.getKey(), new Covering(List.copyOf(e.getValue()), e.getValue().size(), false));
    }
    return out;
  }

  private record Key(String function, ProgramPoint pp, ValueId value) {}

  private record Covering(List<Integer> pathIds, int pathCount, boolean truncated) {}
}
