package publicdata.model;

import java.util.Objects;

/** Per-function enumeration report. Budget exhaustion shows up here, never as an exception. */
public record PathSummary(
    String function,
    boolean disabled,
    int pathsEmitted,
    boolean truncated,
    int maxPaths,
    int maxDepth,
    int maxLoopIters,
    boolean cutoffDepth,
    boolean cutoffLoop,
    long constPrunedBranch,
    long constPrunedSwitch,
    long constPrunedIndirect,
    long dfsCalls,
    long dfsLeaves,
    long pruneMaxPaths,
    long pruneMaxDepth,
    long pruneLoop) {

  public PathSummary {
    Objects.requireNonNull(function, "function");
  }

  public static PathSummary disabled(String function, int maxPaths, int maxDepth, int maxLoopIters) {
    return new PathSummary(
        function, true, 0, false, maxPaths, maxDepth, maxLoopIters, false, false, 0, 0, 0, 0, 0, 0,
        0, 0);
  }

  public boolean anyCutoff() {
    return truncated || cutoffDepth || cutoffLoop;
  }
}
