package publicdata.io;

import com.google.gson.JsonObject;

/** Maps a program point to its line in the instruction trace. */
public record TraceIndexRecord(
    String function, String block, String pp, String opcode, String def, int traceLine) {

  public static TraceIndexRecord fromJson(JsonObject obj, int line) {
    return new TraceIndexRecord(
        JsonFields.requireString(obj, "fn", line),
        JsonFields.optString(obj, "bb", line),
        JsonFields.requireString(obj, "pp", line),
        JsonFields.optString(obj, "op", line),
        JsonFields.optString(obj, "def", line),
        JsonFields.requireInt(obj, "line", line));
  }
}
