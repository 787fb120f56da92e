package publicdata.model;

import java.util.List;
import java.util.Objects;

/**
 * Paths passing through one program point. {@code pathCount} is exact; {@code pathIds} is capped
 * and {@code truncated} says whether ids were dropped.
 */
public record PpCoverage(
    String function, ProgramPoint pp, int pathCount, List<Integer> pathIds, boolean truncated) {

  public PpCoverage {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(pp, "pp");
    pathIds = List.copyOf(pathIds);
  }
}
