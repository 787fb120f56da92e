package publicdata.io;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Contents of an instruction-trace file, grouped by function in first-seen order. */
public final class TraceBundle {

  private final Map<String, List<TraceRecord>> instructions = new LinkedHashMap<>();
  private final List<TraceIndexRecord> index = new ArrayList<>();

  public static TraceBundle read(Path file) throws IOException {
    TraceBundle bundle = new TraceBundle();
    NdjsonReader.read(file, bundle::accept);
    return bundle;
  }

  /** Routes one record; kinds that do not belong in a trace are ignored. */
  void accept(JsonObject obj, int line) {
    String kind = RecordKinds.of(obj);
    if (kind == null) {
      TraceRecord r = TraceRecord.fromJson(obj, line);
      instructions.computeIfAbsent(r.function(), k -> new ArrayList<>()).add(r);
    } else if (kind.equals(RecordKinds.TRACE_INDEX)) {
      index.add(TraceIndexRecord.fromJson(obj, line));
    }
  }

  public List<String> functions() {
    return List.copyOf(instructions.keySet());
  }

  public List<TraceRecord> instructions(String function) {
    List<TraceRecord> records = instructions.get(function);
    return records == null ? List.of() : Collections.unmodifiableList(records);
  }

  public int instructionCount() {
    int n = 0;
    for (List<TraceRecord> records : instructions.values()) {
      n += records.size();
    }
    return n;
  }

  public List<TraceIndexRecord> index() {
    return Collections.unmodifiableList(index);
  }
}
