package publicdata.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;

/** Typed field access that reports schema violations as {@link MalformedRecordException}. */
final class JsonFields {

  private JsonFields() {}

  static String requireString(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      throw new MalformedRecordException("Missing required field", line, field);
    }
    if (!e.isJsonPrimitive()) {
      throw new MalformedRecordException("Expected a string", line, field);
    }
    return e.getAsString();
  }

  static String optString(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonPrimitive()) {
      throw new MalformedRecordException("Expected a string", line, field);
    }
    return e.getAsString();
  }

  static int requireInt(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      throw new MalformedRecordException("Missing required field", line, field);
    }
    return asInt(e, field, line);
  }

  static int optInt(JsonObject obj, String field, int fallback, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      return fallback;
    }
    return asInt(e, field, line);
  }

  static long optLong(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      return 0;
    }
    try {
      return e.getAsLong();
    } catch (RuntimeException ex) {
      throw new MalformedRecordException("Expected an integer", line, field, ex);
    }
  }

  /** Accepts JSON booleans as well as the strings {@code "true"} / {@code "false"}. */
  static Boolean optBoolean(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (e.isJsonPrimitive()) {
      if (e.getAsJsonPrimitive().isBoolean()) {
        return e.getAsBoolean();
      }
      String s = e.getAsString();
      if (s.equals("true") || s.equals("false")) {
        return Boolean.valueOf(s);
      }
    }
    throw new MalformedRecordException("Expected a boolean", line, field);
  }

  static boolean flag(JsonObject obj, String field, int line) {
    Boolean b = optBoolean(obj, field, line);
    return b != null && b;
  }

  static List<String> stringList(JsonObject obj, String field, int line) {
    JsonArray array = optArray(obj, field, line);
    List<String> out = new ArrayList<>(array == null ? 0 : array.size());
    if (array != null) {
      for (JsonElement e : array) {
        if (e.isJsonNull() || !e.isJsonPrimitive()) {
          throw new MalformedRecordException("Expected an array of strings", line, field);
        }
        out.add(e.getAsString());
      }
    }
    return out;
  }

  static List<Integer> intList(JsonObject obj, String field, int line) {
    JsonArray array = optArray(obj, field, line);
    List<Integer> out = new ArrayList<>(array == null ? 0 : array.size());
    if (array != null) {
      for (JsonElement e : array) {
        out.add(asInt(e, field, line));
      }
    }
    return out;
  }

  static JsonArray optArray(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonArray()) {
      throw new MalformedRecordException("Expected an array", line, field);
    }
    return e.getAsJsonArray();
  }

  static JsonObject optObject(JsonObject obj, String field, int line) {
    JsonElement e = obj.get(field);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonObject()) {
      throw new MalformedRecordException("Expected an object", line, field);
    }
    return e.getAsJsonObject();
  }

  static JsonArray strings(List<String> values) {
    JsonArray array = new JsonArray(values.size());
    values.forEach(array::add);
    return array;
  }

  static JsonArray ints(List<Integer> values) {
    JsonArray array = new JsonArray(values.size());
    values.forEach(array::add);
    return array;
  }

  private static int asInt(JsonElement e, String field, int line) {
    try {
      if (!e.isJsonPrimitive()) {
        throw new MalformedRecordException("Expected an integer", line, field);
      }
      return e.getAsInt();
    } catch (NumberFormatException ex) {
      throw new MalformedRecordException("Expected an integer", line, field, ex);
    }
  }
}
