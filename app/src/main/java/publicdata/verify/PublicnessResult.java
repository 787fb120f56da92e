package publicdata.verify;

import java.util.Objects;
import publicdata.model.ProgramPoint;
import publicdata.model.ValueId;

/** Verdict for one value at one program point on one path. */
public record PublicnessResult(
    String function, int pathId, ProgramPoint pp, ValueId value, Publicness publicness) {

  public PublicnessResult {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(pp, "pp");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(publicness, "publicness");
  }
}
