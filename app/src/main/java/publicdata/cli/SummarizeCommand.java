package publicdata.cli;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import publicdata.io.CfgBundle;
import publicdata.io.TraceBundle;
import publicdata.io.TraceRecord;
import publicdata.model.PathSummary;
import publicdata.pipeline.LoadedFunction;
import publicdata.pipeline.ModelLoader;
import publicdata.solver.SolverKind;
import publicdata.solver.Verdict;
import publicdata.verify.PathFeasibilityChecker;

/**
 * {@code summarize}: prints trace and CFG statistics. With {@code --check-paths} every recorded
 * path condition is checked for satisfiability.
 */
final class SummarizeCommand {
  private static final int TOP_OPCODES = 15;

  private final PrintStream out;

  SummarizeCommand(PrintStream out) {
    this.out = out;
  }

  static OptionTable options() {
    return new OptionTable()
        .withValue("--trace", (b, raw) -> b.trace(Path.of(raw)))
        .withValue("--cfg", (b, raw) -> b.cfg(Path.of(raw)))
        .withValue("--function", (b, raw) -> b.function(raw))
        .withValue(
            "--solver-timeout-ms",
            (b, raw) -> b.solverTimeoutMs(CliParsers.parseLong(raw, "--solver-timeout-ms")))
        .withValue(
            "--pointer-width",
            (b, raw) -> b.pointerWidth(CliParsers.parseInt(raw, "--pointer-width")))
        .withValue("--solver", (b, raw) -> b.solver(SolverKind.parse(raw)))
        .flag("--check-paths", b -> b.checkPaths(true));
  }

  int execute(String[] args) throws IOException {
    CliOptions options = options().parse(args);
    if (options.trace() == null && options.cfg() == null) {
      throw new IllegalArgumentException("Provide --trace, --cfg or both");
    }
    TraceBundle trace =
        options.trace() == null
            ? new TraceBundle()
            : TraceBundle.read(CliParsers.existingFile(options.trace(), "--trace"));
    CfgBundle cfg = options.cfg() == null ? new CfgBundle() : CommandSupport.readCfg(options.cfg());
    if (options.trace() != null) {
      printTrace(trace);
    }
    if (options.cfg() != null) {
      printCfg(cfg);
    }
    if (options.checkPaths()) {
      if (options.trace() == null) {
        throw new IllegalArgumentException("--check-paths needs --trace");
      }
      return checkPaths(options, trace, cfg);
    }
    return 0;
  }

  private void printTrace(TraceBundle trace) {
    Multiset<String> opcodes = HashMultiset.create();
    int transmitters = 0;
    for (String fn : trace.functions()) {
      for (TraceRecord r : trace.instructions(fn)) {
        opcodes.add(r.opcode());
        if (r.transmitter() != null) {
          transmitters++;
        }
      }
    }
    out.println("Trace");
    out.println("-".repeat(40));
    out.printf("  Functions:     %d%n", trace.functions().size());
    out.printf("  Instructions:  %d%n", trace.instructionCount());
    out.printf("  Transmitters:  %d%n", transmitters);
    out.printf("  Index records: %d%n", trace.index().size());
    out.println("  Top opcodes:");
    int shown = 0;
    for (Multiset.Entry<String> e : Multisets.copyHighestCountFirst(opcodes).entrySet()) {
      if (shown++ == TOP_OPCODES) {
        break;
      }
      out.printf("    %-16s %8d%n", e.getElement(), e.getCount());
    }
  }

  private void printCfg(CfgBundle cfg) {
    out.println("CFG");
    out.println("-".repeat(40));
    out.printf("  Functions: %d%n", cfg.functions().size());
    out.printf("  Blocks:    %d%n", cfg.blockCount());
    out.printf("  Edges:     %d%n", cfg.edgeCount());
    out.printf("  Paths:     %d%n", cfg.pathCount());
    out.printf("  Coverage:  %d%n", cfg.coverageCount());
    for (PathSummary s : cfg.summaries()) {
      if (s.disabled()) {
        out.printf("  %-24s disabled%n", s.function());
        continue;
      }
      out.printf(
          "  %-24s paths=%d truncated=%s cutoff_depth=%s cutoff_loop=%s pruned(br/switch/ind)=%d/%d/%d%n",
          s.function(),
          s.pathsEmitted(),
          s.truncated(),
          s.cutoffDepth(),
          s.cutoffLoop(),
          s.constPrunedBranch(),
          s.constPrunedSwitch(),
          s.constPrunedIndirect());
    }
  }

  private int checkPaths(CliOptions options, TraceBundle trace, CfgBundle cfg) {
    ModelLoader.Loaded loaded =
        new ModelLoader(options.traceOptions()).load(trace, cfg, options.functionFilter());
    PathFeasibilityChecker checker =
        new PathFeasibilityChecker(
            options.queryCache(),
            Duration.ofMillis(options.solverTimeoutMs()),
            options.pointerWidth());
    Map<Verdict, Integer> counts = new EnumMap<>(Verdict.class);
    out.println("Path feasibility");
    out.println("-".repeat(40));
    for (LoadedFunction fn : loaded.functions()) {
      for (publicdata.model.Path path : fn.paths()) {
        Verdict verdict = checker.check(fn.model(), path);
        counts.merge(verdict, 1, Integer::sum);
        if (verdict != Verdict.SAT) {
          out.printf("  %s path %d: %s%n", fn.function(), path.id(), describe(verdict));
        }
      }
    }
    out.printf(
        "  feasible=%d infeasible=%d unknown=%d%n",
        counts.getOrDefault(Verdict.SAT, 0),
        counts.getOrDefault(Verdict.UNSAT, 0),
        counts.getOrDefault(Verdict.UNKNOWN, 0));
    return loaded.failures().isEmpty() ? 0 : 1;
  }

  private static String describe(Verdict verdict) {
    return verdict == Verdict.UNSAT ? "infeasible" : "undecided";
  }
}
