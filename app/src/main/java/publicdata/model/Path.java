package publicdata.model;

import java.util.List;
import java.util.Objects;
import publicdata.cond.CondExpr;

/**
 * One root-to-leaf walk. {@code conditionText} and {@code conditionExprs} hold one entry per
 * constrained decision, in decision order; either may be empty depending on the selected format.
 */
public record Path(
    String function,
    int id,
    List<String> blocks,
    List<Decision> decisions,
    List<ProgramPoint> ppSeq,
    List<String> conditionText,
    List<CondExpr> conditionExprs) {

  public Path {
    Objects.requireNonNull(function, "function");
    blocks = List.copyOf(blocks);
    decisions = List.copyOf(decisions);
    ppSeq = ppSeq == null ? List.of() : List.copyOf(ppSeq);
    conditionText = conditionText == null ? List.of() : List.copyOf(conditionText);
    conditionExprs = conditionExprs == null ? List.of() : List.copyOf(conditionExprs);
    if (blocks.isEmpty()) {
      throw new IllegalArgumentException("path " + id + " of " + function + " has no blocks");
    }
  }

  public String entry() {
    return blocks.get(0);
  }

  public String leaf() {
    return blocks.get(blocks.size() - 1);
  }
}
