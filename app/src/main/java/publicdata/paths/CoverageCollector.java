package publicdata.paths;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import publicdata.model.Block;
import publicdata.model.Instruction;
import publicdata.model.ProgramPoint;
import publicdata.model.PpCoverage;

/** Records, per program point, the ids of the paths visiting it. */
final class CoverageCollector {

  private final String function;
  private final int maxIds;
  private final Map<ProgramPoint, Entry> byPp = new LinkedHashMap<>();

  CoverageCollector(String function, int maxIds) {
    this.function = function;
    this.maxIds = maxIds;
  }

  void record(int pathId, List<ProgramPoint> visited) {
    Set<ProgramPoint> unique = new LinkedHashSet<>(visited);
    for (ProgramPoint pp : unique) {
      byPp.computeIfAbsent(pp, k -> new Entry()).add(pathId, maxIds);
    }
  }

  List<PpCoverage> snapshot() {
    List<PpCoverage> out = new ArrayList<>(byPp.size());
    for (Map.Entry<ProgramPoint, Entry> e : byPp.entrySet()) {
      Entry entry = e.getValue();
      out.add(new PpCoverage(function, e.getKey(), entry.count, entry.ids, entry.truncated));
    }
    return out;
  }

  /** Program points of the given blocks in visiting order, terminators included. */
  static List<ProgramPoint> programPoints(List<Block> blocks) {
    List<ProgramPoint> out = new ArrayList<>();
    for (Block block : blocks) {
      boolean terminatorSeen = false;
      for (Instruction inst : block.instructions()) {
        out.add(inst.pp());
        terminatorSeen |= inst.pp().equals(block.terminator().pp());
      }
      if (!terminatorSeen && block.terminator().pp() != null) {
        out.add(block.terminator().pp());
      }
    }
    return out;
  }

  private static final class Entry {
    private final List<Integer> ids = new ArrayList<>();
    private int count;
    private boolean truncated;

    void add(int pathId, int cap) {
      count++;
      if (ids.size() < cap) {
        ids.add(pathId);
      } else {
        truncated = true;
      }
    }
  }
}
