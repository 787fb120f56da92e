package publicdata.io;

import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;

/** CFG block record: successors plus the terminator's operands. */
public record BlockRecord(
    String function,
    String block,
    List<String> successors,
    String terminatorPp,
    String terminatorOp,
    String condition,
    String target,
    int line) {

  public BlockRecord {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(block, "block");
    successors = List.copyOf(successors);
  }

  public static BlockRecord fromJson(JsonObject obj, int line) {
    return new BlockRecord(
        JsonFields.requireString(obj, "fn", line),
        JsonFields.requireString(obj, "bb", line),
        JsonFields.stringList(obj, "succs", line),
        JsonFields.optString(obj, "term_pp", line),
        JsonFields.optString(obj, "term_op", line),
        JsonFields.optString(obj, "cond", line),
        JsonFields.optString(obj, "target", line),
        line);
  }
}
