package publicdata.io;

import com.google.gson.JsonObject;
import java.util.Objects;

/** CFG edge record; the payload fields present depend on {@code branch}. */
public record EdgeRecord(
    String function,
    String from,
    String to,
    String terminatorPp,
    String branch,
    String condition,
    Boolean sense,
    String caseValue,
    boolean isDefault,
    String target,
    int line) {

  public static final String COND = "cond";
  public static final String UNCOND = "uncond";
  public static final String SWITCH = "switch";
  public static final String INDIRECT = "indirect";

  public EdgeRecord {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }

  public static EdgeRecord fromJson(JsonObject obj, int line) {
    return new EdgeRecord(
        JsonFields.requireString(obj, "fn", line),
        JsonFields.requireString(obj, "from", line),
        JsonFields.requireString(obj, "to", line),
        JsonFields.optString(obj, "term_pp", line),
        JsonFields.optString(obj, "branch", line),
        JsonFields.optString(obj, "cond", line),
        JsonFields.optBoolean(obj, "sense", line),
        JsonFields.optString(obj, "case", line),
        JsonFields.flag(obj, "default", line),
        JsonFields.optString(obj, "target", line),
        line);
  }
}
