package publicdata.paths;

import java.util.Objects;
import publicdata.cond.PathCondFormat;

/** Budgets and output toggles for path enumeration. */
public record EnumerationOptions(
    int maxPaths,
    int maxPathDepth,
    int maxLoopIters,
    PathCondFormat pathCondFormat,
    boolean includePpSeq,
    boolean emitPpCoverage,
    int maxPpPathIds) {

  public static final int DEFAULT_MAX_PATHS = 200;
  public static final int DEFAULT_MAX_PATH_DEPTH = 256;
  public static final int DEFAULT_MAX_PP_PATH_IDS = 64;

  public EnumerationOptions {
    Objects.requireNonNull(pathCondFormat, "pathCondFormat");
    if (maxPaths < 0 || maxPathDepth < 0 || maxLoopIters < 0 || maxPpPathIds < 0) {
      throw new IllegalArgumentException("enumeration budgets must be non-negative");
    }
  }

  public static EnumerationOptions defaults() {
    return new EnumerationOptions(
        DEFAULT_MAX_PATHS,
        DEFAULT_MAX_PATH_DEPTH,
        0,
        PathCondFormat.STRING,
        false,
        false,
        DEFAULT_MAX_PP_PATH_IDS);
  }

  public boolean disabled() {
    return maxPaths == 0;
  }

  public EnumerationOptions withBudgets(int maxPaths, int maxPathDepth, int maxLoopIters) {
    return new EnumerationOptions(
        maxPaths, maxPathDepth, maxLoopIters, pathCondFormat, includePpSeq, emitPpCoverage,
        maxPpPathIds);
  }

  public EnumerationOptions withCoverage(boolean emit) {
    return new EnumerationOptions(
        maxPaths, maxPathDepth, maxLoopIters, pathCondFormat, includePpSeq, emit, maxPpPathIds);
  }

  public EnumerationOptions withFormat(PathCondFormat format) {
    return new EnumerationOptions(
        maxPaths, maxPathDepth, maxLoopIters, format, includePpSeq, emitPpCoverage, maxPpPathIds);
  }

  public EnumerationOptions withPpSeq(boolean include) {
    return new EnumerationOptions(
        maxPaths, maxPathDepth, maxLoopIters, pathCondFormat, include, emitPpCoverage,
        maxPpPathIds);
  }
}
