package publicdata.io;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/** Values of the {@code kind} discriminator on boundary records. */
public final class RecordKinds {
  public static final String BLOCK = "block";
  public static final String EDGE = "edge";
  public static final String PATH = "path";
  public static final String PP_COVERAGE = "pp_coverage";
  public static final String PATH_SUMMARY = "path_summary";
  public static final String FUNC_SUMMARY = "func_summary";
  public static final String TRACE_INDEX = "trace_index";
  public static final String PATH_PUBLICNESS = "path_publicness";
  public static final String PUBLIC_AT_POINT = "public_at_point";

  private RecordKinds() {}

  /** Discriminator of {@code obj}, or null for untagged (instruction-trace) records. */
  public static String of(JsonObject obj) {
    JsonElement kind = obj.get("kind");
    return kind == null || kind.isJsonNull() || !kind.isJsonPrimitive() ? null : kind.getAsString();
  }
}
