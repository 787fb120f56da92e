package publicdata.aggregate;

import java.util.Locale;
import publicdata.verify.Publicness;

/** How a covering path that produced no result for a value counts in the conjunction. */
public enum MissingResultPolicy {
  UNKNOWN(Publicness.UNKNOWN),
  PUBLIC(Publicness.PUBLIC),
  SECRET(Publicness.SECRET);

  private final Publicness contribution;

  MissingResultPolicy(Publicness contribution) {
    this.contribution = contribution;
  }

  public Publicness contribution() {
    return contribution;
  }

  public static MissingResultPolicy parse(String raw) {
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Unknown missing-result policy '" + raw + "' (expected unknown, public or secret)", ex);
    }
  }
}
