package publicdata.pipeline;

import java.util.List;
import java.util.Objects;
import publicdata.model.FuncSummary;
import publicdata.model.FunctionModel;
import publicdata.model.Path;
import publicdata.model.PpCoverage;

/** An assembled function plus any paths and coverage already present in the CFG input. */
public record LoadedFunction(
    FunctionModel model, FuncSummary summary, List<Path> paths, List<PpCoverage> coverage) {

  public LoadedFunction {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(summary, "summary");
    paths = List.copyOf(paths);
    coverage = List.copyOf(coverage);
  }

  public String function() {
    return model.name();
  }
}
