package publicdata.io;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import publicdata.model.FuncSummary;
import publicdata.model.PathSummary;
import publicdata.model.PpCoverage;

/** Contents of a CFG/path file, grouped by function. */
public final class CfgBundle {

  private final Set<String> functions = new LinkedHashSet<>();
  private final Map<String, List<BlockRecord>> blocks = new LinkedHashMap<>();
  private final Map<String, List<EdgeRecord>> edges = new LinkedHashMap<>();
  private final Map<String, List<publicdata.model.Path>> paths = new LinkedHashMap<>();
  private final Map<String, List<PpCoverage>> coverage = new LinkedHashMap<>();
  private final List<PathSummary> summaries = new ArrayList<>();
  private final List<FuncSummary> funcSummaries = new ArrayList<>();

  public static CfgBundle read(Path file) throws IOException {
    CfgBundle bundle = new CfgBundle();
    NdjsonReader.read(file, bundle::accept);
    return bundle;
  }

  void accept(JsonObject obj, int line) {
    String kind = RecordKinds.of(obj);
    if (kind == null) {
      return;
    }
    switch (kind) {
      case RecordKinds.BLOCK:
        {
          BlockRecord b = BlockRecord.fromJson(obj, line);
          add(blocks, b.function(), b);
          break;
        }
      case RecordKinds.EDGE:
        {
          EdgeRecord e = EdgeRecord.fromJson(obj, line);
          add(edges, e.function(), e);
          break;
        }
      case RecordKinds.PATH:
        {
          publicdata.model.Path p = RecordCodec.parsePath(obj, line);
          add(paths, p.function(), p);
          break;
        }
      case RecordKinds.PP_COVERAGE:
        {
          PpCoverage c = RecordCodec.parseCoverage(obj, line);
          add(coverage, c.function(), c);
          break;
        }
      case RecordKinds.PATH_SUMMARY:
        {
          PathSummary s = RecordCodec.parsePathSummary(obj, line);
          functions.add(s.function());
          summaries.add(s);
          break;
        }
      case RecordKinds.FUNC_SUMMARY:
        {
          FuncSummary s = RecordCodec.parseFuncSummary(obj, line);
          functions.add(s.function());
          funcSummaries.add(s);
          break;
        }
      default:
        break;
    }
  }

  private <T> void add(Map<String, List<T>> index, String function, T record) {
    functions.add(function);
    index.computeIfAbsent(function, k -> new ArrayList<>()).add(record);
  }

  public List<String> functions() {
    return List.copyOf(functions);
  }

  public List<BlockRecord> blocks(String function) {
    return view(blocks, function);
  }

  public List<EdgeRecord> edges(String function) {
    return view(edges, function);
  }

  public List<publicdata.model.Path> paths(String function) {
    return view(paths, function);
  }

  public List<PpCoverage> coverage(String function) {
    return view(coverage, function);
  }

  public List<PathSummary> summaries() {
    return Collections.unmodifiableList(summaries);
  }

  public List<FuncSummary> funcSummaries() {
    return Collections.unmodifiableList(funcSummaries);
  }

  public int blockCount() {
    return count(blocks);
  }

  public int edgeCount() {
    return count(edges);
  }

  public int pathCount() {
    return count(paths);
  }

  public int coverageCount() {
    return count(coverage);
  }

  private static <T> List<T> view(Map<String, List<T>> index, String function) {
    List<T> list = index.get(function);
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }

  private static <T> int count(Map<String, List<T>> index) {
    int n = 0;
    for (List<T> list : index.values()) {
      n += list.size();
    }
    return n;
  }
}
