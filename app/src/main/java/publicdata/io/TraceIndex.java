package publicdata.io;

import com.google.gson.JsonObject;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Program-point lookup over {@code trace_index} records, used to annotate result records. */
public final class TraceIndex {

  private final Map<String, TraceIndexRecord> byPoint = new HashMap<>();

  public TraceIndex(List<TraceIndexRecord> records) {
    for (TraceIndexRecord r : records) {
      byPoint.putIfAbsent(key(r.function(), r.pp()), r);
    }
  }

  public int size() {
    return byPoint.size();
  }

  public TraceIndexRecord lookup(String function, String pp) {
    return byPoint.get(key(function, pp));
  }

  /**
   * Copies {@code record} and adds {@code trace_line}, {@code trace_op} and {@code trace_def} when
   * its {@code fn}/{@code pp} pair is indexed. Returns {@code null} for an unindexed point.
   */
  public JsonObject annotate(JsonObject record, int line) {
    Objects.requireNonNull(record, "record");
    String fn = JsonFields.requireString(record, "fn", line);
    String pp = JsonFields.requireString(record, "pp", line);
    TraceIndexRecord hit = lookup(fn, pp);
    if (hit == null) {
      return null;
    }
    JsonObject out = record.deepCopy();
    out.addProperty("trace_line", hit.traceLine());
    if (hit.opcode() != null) {
      out.addProperty("trace_op", hit.opcode());
    }
    if (hit.def() != null) {
      out.addProperty("trace_def", hit.def());
    }
    return out;
  }

  private static String key(String function, String pp) {
    return function + '\u0000' + pp;
  }
}
