package publicdata.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.io.CfgBundle;
import publicdata.io.FunctionModelAssembler;
import publicdata.io.FunctionModelAssembler.Assembly;
import publicdata.io.MalformedRecordException;
import publicdata.io.TraceBundle;
import publicdata.io.TraceOptions;

/**
 * Turns a trace bundle and a CFG bundle into function models. A function whose records are
 * malformed is reported and skipped; the others still load.
 */
public final class ModelLoader {

  private static final Logger LOG = LoggerFactory.getLogger(ModelLoader.class);

  private final FunctionModelAssembler assembler;

  public ModelLoader(TraceOptions traceOptions) {
    this.assembler = new FunctionModelAssembler(traceOptions);
  }

  /** Result of loading: functions in input order plus those that failed. */
  public record Loaded(List<LoadedFunction> functions, List<FunctionFailure> failures) {
    public Loaded {
      functions = List.copyOf(functions);
      failures = List.copyOf(failures);
    }
  }

  public Loaded load(TraceBundle trace, CfgBundle cfg, Predicate<String> functionFilter) {
    Objects.requireNonNull(trace, "trace");
    Objects.requireNonNull(cfg, "cfg");
    Set<String> names = new LinkedHashSet<>(trace.functions());
    names.addAll(cfg.functions());
    List<LoadedFunction> loaded = new ArrayList<>();
    List<FunctionFailure> failures = new ArrayList<>();
    for (String fn : names) {
      if (!functionFilter.test(fn)) {
        continue;
      }
      try {
        Assembly assembly =
            assembler.assemble(fn, trace.instructions(fn), cfg.blocks(fn), cfg.edges(fn));
        loaded.add(
            new LoadedFunction(assembly.model(), assembly.summary(), cfg.paths(fn), cfg.coverage(fn)));
      } catch (MalformedRecordException ex) {
        LOG.error("{}: rejected malformed input: {}", fn, ex.getMessage());
        failures.add(new FunctionFailure(fn, ex.getMessage()));
      }
    }
    LOG.info("Loaded {} functions ({} rejected)", loaded.size(), failures.size());
    return new Loaded(loaded, failures);
  }
}
