package publicdata.cond;

import java.util.Locale;

/** Which path-condition forms accompany a path. */
public enum PathCondFormat {
  STRING,
  JSON,
  BOTH;

  public boolean includesString() {
    return this != JSON;
  }

  public boolean includesJson() {
    return this != STRING;
  }

  public static PathCondFormat parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("path condition format is null");
    }
    switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "string":
        return STRING;
      case "json":
        return JSON;
      case "both":
        return BOTH;
      default:
        throw new IllegalArgumentException(
            "Unknown path condition format '" + raw + "' (expected string, json or both)");
    }
  }
}
