package publicdata.aggregate;

import java.util.Objects;
import publicdata.model.ProgramPoint;
import publicdata.model.ValueId;
import publicdata.verify.Publicness;

/**
 * Conjunction of the per-path verdicts for one value at one program point. {@code totalPaths}
 * counts the covering paths, {@code missingPaths} those that produced no result, and {@code
 * truncated} is set when the coverage id list was capped.
 */
public record AggregatedPublicness(
    String function,
    ProgramPoint pp,
    ValueId value,
    Publicness publicness,
    int totalPaths,
    int missingPaths,
    boolean truncated) {

  public AggregatedPublicness {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(pp, "pp");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(publicness, "publicness");
  }
}
