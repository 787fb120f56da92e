package publicdata.model;

import java.util.Objects;

/** Trace statistics for one function, {@code traceMaxInst == 0} meaning no budget. */
public record FuncSummary(
    String function,
    int instCount,
    int blockCount,
    int transmitterCount,
    int traceEmitted,
    boolean traceTruncated,
    int traceMaxInst) {

  public FuncSummary {
    Objects.requireNonNull(function, "function");
  }

  public static FuncSummary of(FunctionModel model, int instCount, int traceMaxInst) {
    return new FuncSummary(
        model.name(),
        instCount,
        model.blockCount(),
        model.transmitterCount(),
        model.instructionCount(),
        model.traceTruncated(),
        traceMaxInst);
  }
}
