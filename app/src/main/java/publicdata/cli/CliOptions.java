package publicdata.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import publicdata.aggregate.AggregationOptions;
import publicdata.aggregate.MissingResultPolicy;
import publicdata.cond.PathCondFormat;
import publicdata.io.TraceOptions;
import publicdata.paths.EnumerationOptions;
import publicdata.pipeline.AnalysisOptions;
import publicdata.solver.QueryCache;
import publicdata.solver.SolverKind;
import publicdata.symbolic.InputClassification;
import publicdata.verify.VerifierOptions;

/** Parsed command line shared by all commands; each command only registers the flags it reads. */
record CliOptions(
    Path trace,
    Path cfg,
    Path results,
    Path index,
    Path out,
    Path outDir,
    String function,
    int maxPaths,
    int maxPathDepth,
    int maxLoopIters,
    PathCondFormat pathCondFormat,
    boolean ppSeq,
    boolean ppCoverage,
    int maxPpPathIds,
    int maxInst,
    String secretInputs,
    String secretMemory,
    long solverTimeoutMs,
    int parallelism,
    int jobs,
    int pointerWidth,
    boolean checkDefinitions,
    boolean controlDivergence,
    MissingResultPolicy missingPolicy,
    boolean checkPaths,
    SolverKind solver) {

  CliOptions {
    Objects.requireNonNull(pathCondFormat, "pathCondFormat");
    Objects.requireNonNull(missingPolicy, "missingPolicy");
    Objects.requireNonNull(solver, "solver");
    if (solverTimeoutMs < 0) {
      throw new IllegalArgumentException("--solver-timeout-ms must be non-negative");
    }
  }

  EnumerationOptions enumerationOptions() {
    return new EnumerationOptions(
        maxPaths, maxPathDepth, maxLoopIters, pathCondFormat, ppSeq, ppCoverage, maxPpPathIds);
  }

  VerifierOptions verifierOptions() {
    return new VerifierOptions(
        Duration.ofMillis(solverTimeoutMs),
        parallelism,
        pointerWidth,
        controlDivergence,
        checkDefinitions);
  }

  InputClassification classification() {
    return InputClassification.parse(secretInputs, secretMemory);
  }

  AggregationOptions aggregationOptions() {
    return new AggregationOptions(missingPolicy);
  }

  TraceOptions traceOptions() {
    return new TraceOptions(maxInst);
  }

  AnalysisOptions analysisOptions() {
    return new AnalysisOptions(
        enumerationOptions(),
        verifierOptions(),
        classification(),
        aggregationOptions(),
        traceOptions(),
        jobs);
  }

  /** Fresh query cache over the selected backend. */
  QueryCache queryCache() {
    return new QueryCache(solver.create());
  }

  Predicate<String> functionFilter() {
    return function == null ? fn -> true : function::equals;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path trace;
    private Path cfg;
    private Path results;
    private Path index;
    private Path out;
    private Path outDir;
    private String function;
    private int maxPaths = EnumerationOptions.DEFAULT_MAX_PATHS;
    private int maxPathDepth = EnumerationOptions.DEFAULT_MAX_PATH_DEPTH;
    private int maxLoopIters;
    private PathCondFormat pathCondFormat = PathCondFormat.STRING;
    private boolean ppSeq;
    private boolean ppCoverage;
    private int maxPpPathIds = EnumerationOptions.DEFAULT_MAX_PP_PATH_IDS;
    private int maxInst;
    private String secretInputs;
    private String secretMemory;
    private long solverTimeoutMs = VerifierOptions.DEFAULT_SOLVER_TIMEOUT.toMillis();
    private int parallelism = 1;
    private int jobs = 1;
    private int pointerWidth = 64;
    private boolean checkDefinitions;
    private boolean controlDivergence = true;
    private MissingResultPolicy missingPolicy = MissingResultPolicy.UNKNOWN;
    private boolean checkPaths;
    private SolverKind solver = SolverKind.Z3;

    Builder trace(Path trace) {
      this.trace = trace;
      return this;
    }

    Builder cfg(Path cfg) {
      this.cfg = cfg;
      return this;
    }

    Builder results(Path results) {
      this.results = results;
      return this;
    }

    Builder index(Path index) {
      this.index = index;
      return this;
    }

    Builder out(Path out) {
      this.out = out;
      return this;
    }

    Builder outDir(Path outDir) {
      this.outDir = outDir;
      return this;
    }

    Builder function(String function) {
      this.function = function;
      return this;
    }

    Builder maxPaths(int maxPaths) {
      this.maxPaths = maxPaths;
      return this;
    }

    Builder maxPathDepth(int maxPathDepth) {
      this.maxPathDepth = maxPathDepth;
      return this;
    }

    Builder maxLoopIters(int maxLoopIters) {
      this.maxLoopIters = maxLoopIters;
      return this;
    }

    Builder pathCondFormat(PathCondFormat format) {
      this.pathCondFormat = format;
      return this;
    }

    Builder ppSeq(boolean ppSeq) {
      this.ppSeq = ppSeq;
      return this;
    }

    Builder ppCoverage(boolean ppCoverage) {
      this.ppCoverage = ppCoverage;
      return this;
    }

    Builder maxPpPathIds(int maxPpPathIds) {
      this.maxPpPathIds = maxPpPathIds;
      return this;
    }

    Builder maxInst(int maxInst) {
      this.maxInst = maxInst;
      return this;
    }

    Builder secretInputs(String secretInputs) {
      this.secretInputs = secretInputs;
      return this;
    }

    Builder secretMemory(String secretMemory) {
      this.secretMemory = secretMemory;
      return this;
    }

    Builder solverTimeoutMs(long solverTimeoutMs) {
      this.solverTimeoutMs = solverTimeoutMs;
      return this;
    }

    Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    Builder jobs(int jobs) {
      this.jobs = jobs;
      return this;
    }

    Builder pointerWidth(int pointerWidth) {
      this.pointerWidth = pointerWidth;
      return this;
    }

    Builder checkDefinitions(boolean checkDefinitions) {
      this.checkDefinitions = checkDefinitions;
      return this;
    }

    Builder controlDivergence(boolean controlDivergence) {
      this.controlDivergence = controlDivergence;
      return this;
    }

    Builder missingPolicy(MissingResultPolicy missingPolicy) {
      this.missingPolicy = missingPolicy;
      return this;
    }

    Builder checkPaths(boolean checkPaths) {
      this.checkPaths = checkPaths;
      return this;
    }

    Builder solver(SolverKind solver) {
      this.solver = solver;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          trace,
          cfg,
          results,
          index,
          out,
          outDir,
          function,
          maxPaths,
          maxPathDepth,
          maxLoopIters,
          pathCondFormat,
          ppSeq,
          ppCoverage,
          maxPpPathIds,
          maxInst,
          secretInputs,
          secretMemory,
          solverTimeoutMs,
          parallelism,
          jobs,
          pointerWidth,
          checkDefinitions,
          controlDivergence,
          missingPolicy,
          checkPaths,
          solver);
    }
  }
}
