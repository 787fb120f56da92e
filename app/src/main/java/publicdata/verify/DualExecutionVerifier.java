package publicdata.verify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.cond.CondExpr;
import publicdata.cond.ConstraintBuilder;
import publicdata.diagnostics.AnalysisDiagnostic;
import publicdata.model.Block;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.Path;
import publicdata.model.ProgramPoint;
import publicdata.model.TransmitterKind;
import publicdata.model.ValueId;
import publicdata.solver.EquivalenceQuery;
import publicdata.solver.QueryCache;
import publicdata.symbolic.BitWidths;
import publicdata.symbolic.Execution;
import publicdata.symbolic.InputClassification;
import publicdata.symbolic.SymbolicEnv;
import publicdata.symbolic.SymbolicInterpreter;
import publicdata.symbolic.SymbolicInterpreter.StepContext;
import publicdata.symbolic.Term;
import publicdata.symbolic.Terms;

/**
 * Checks transmitter publicness by running every path twice, in executions A and B that agree on
 * public inputs only, and asking the solver whether a transmitted value can differ between them.
 *
 * <p>Decision constraints are asserted incrementally: the constraint of the transfer out of block
 * {@code k} is added once block {@code k} has been executed, so a branch condition is checked
 * before its own outcome is assumed. When a control-flow transmitter is not provably public, the
 * two executions may follow different paths from there on, and every later result on the path is
 * degraded accordingly (unless divergence propagation is switched off).
 */
public final class DualExecutionVerifier {

  private static final Logger LOG = LoggerFactory.getLogger(DualExecutionVerifier.class);

  private final VerifierOptions options;
  private final InputClassification classification;
  private final QueryCache cache;

  public DualExecutionVerifier(
      VerifierOptions options, InputClassification classification, QueryCache cache) {
    this.options = Objects.requireNonNull(options, "options");
    this.classification = Objects.requireNonNull(classification, "classification");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public QueryCache cache() {
    return cache;
  }

  /**
   * Verifies every path of one function. Paths are checked on up to {@code parallelism} workers;
   * results reach {@code sink} in path order either way.
   */
  public FunctionVerification verifyAll(
      FunctionModel model, List<Path> paths, Consumer<PublicnessResult> sink) {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(sink, "sink");
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, classification, options.pointerWidth());
    List<PathVerification> verified;
    if (options.parallelism() <= 1 || paths.size() <= 1) {
      verified = new ArrayList<>(paths.size());
      for (Path path : paths) {
        PathVerification pv = new PathRun(model, interpreter, path).run();
        pv.results().forEach(sink);
        verified.add(pv);
      }
    } else {
      ForkJoinPool pool = new ForkJoinPool(options.parallelism());
      try {
        verified =
            pool.submit(
                    () ->
                        paths.parallelStream()
                            .map(path -> new PathRun(model, interpreter, path).run())
                            .collect(Collectors.toList()))
                .join();
      } finally {
        pool.shutdown();
      }
      for (PathVerification pv : verified) {
        pv.results().forEach(sink);
      }
    }
    FunctionVerification result = new FunctionVerification(model.name(), verified);
    LOG.debug(
        "{}: {} results over {} paths, {} queries ({} cached)",
        model.name(),
        result.results().size(),
        paths.size(),
        result.queries(),
        result.cacheHits());
    return result;
  }

  public PathVerification verifyPath(FunctionModel model, Path path) {
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, classification, options.pointerWidth());
    return new PathRun(model, interpreter, path).run();
  }

  /** State of one dual execution. Never shared between threads. */
  private final class PathRun {
    private final FunctionModel model;
    private final SymbolicInterpreter interpreter;
    private final Path path;
    private final SymbolicEnv envA;
    private final SymbolicEnv envB;
    private final StepContext ctxA;
    private final StepContext ctxB;
    private final List<Term> assumptions = new ArrayList<>();
    private final Map<ResultKey, Publicness> results = new LinkedHashMap<>();
    private final List<AnalysisDiagnostic> diagnostics = new ArrayList<>();
    private Publicness divergence = Publicness.PUBLIC;
    private int queries;
    private int hits;
    private int misses;
    private long solverNanos;

    PathRun(FunctionModel model, SymbolicInterpreter interpreter, Path path) {
      this.model = model;
      this.interpreter = interpreter;
      this.path = path;
      this.envA = interpreter.newEnv(Execution.A);
      this.envB = interpreter.newEnv(Execution.B);
      this.ctxA = new StepContext(path.id(), this::report);
      this.ctxB = StepContext.silent(path.id());
    }

    PathVerification run() {
      List<String> labels = path.blocks();
      for (int k = 0; k < labels.size(); k++) {
        Block block = model.block(labels.get(k));
        if (block == null) {
          throw new IllegalArgumentException(
              "Path " + path.id() + " of " + model.name() + " names unknown block " + labels.get(k));
        }
        executeBlock(block, k == 0 ? null : labels.get(k - 1));
        if (k < path.decisions().size()) {
          Optional<CondExpr> constraint = ConstraintBuilder.expressionFor(path.decisions().get(k));
          if (constraint.isPresent()) {
            assumptions.addAll(interpreter.assume(envA, constraint.get()));
            assumptions.addAll(interpreter.assume(envB, constraint.get()));
          }
        }
      }
      List<PublicnessResult> out = new ArrayList<>(results.size());
      for (Map.Entry<ResultKey, Publicness> e : results.entrySet()) {
        out.add(
            new PublicnessResult(
                model.name(), path.id(), e.getKey().pp(), e.getKey().value(), e.getValue()));
      }
      return new PathVerification(
          path.id(), out, diagnostics, queries, hits, misses, solverNanos);
    }

    private void executeBlock(Block block, String predecessor) {
      List<Instruction> instructions = block.instructions();
      int i = 0;
      List<Instruction> merges = new ArrayList<>();
      while (i < instructions.size() && instructions.get(i).isMerge()) {
        merges.add(instructions.get(i++));
      }
      if (!merges.isEmpty()) {
        List<Term> incomingA = new ArrayList<>(merges.size());
        List<Term> incomingB = new ArrayList<>(merges.size());
        for (Instruction phi : merges) {
          incomingA.add(interpreter.resolveMerge(envA, phi, predecessor, ctxA));
          incomingB.add(interpreter.resolveMerge(envB, phi, predecessor, ctxB));
        }
        for (int m = 0; m < merges.size(); m++) {
          Instruction phi = merges.get(m);
          if (phi.hasDef()) {
            interpreter.bind(envA, phi.def(), incomingA.get(m));
            interpreter.bind(envB, phi.def(), incomingB.get(m));
            if (options.checkDefinitions()) {
              record(phi.pp(), phi.def(), compare(incomingA.get(m), incomingB.get(m)));
            }
          }
        }
      }
      for (; i < instructions.size(); i++) {
        Instruction inst = instructions.get(i);
        Term a = interpreter.step(envA, inst, ctxA);
        Term b = interpreter.step(envB, inst, ctxB);
        if (inst.isTransmitter()) {
          checkTransmitter(inst);
        }
        if (options.checkDefinitions() && inst.hasDef() && a != null && b != null) {
          record(inst.pp(), inst.def(), compare(a, b));
        }
      }
    }

    private void checkTransmitter(Instruction inst) {
      ValueId operand = inst.transmittedOperand();
      TransmitterKind kind = inst.transmitter().kind();
      int typed =
          BitWidths.parse(inst.operandType(inst.transmitter().operandIndex()), options.pointerWidth());
      int hint =
          typed > 0
              ? typed
              : (kind == TransmitterKind.BRANCH_CONDITION ? 1 : options.pointerWidth());
      Term a = interpreter.operand(envA, operand, hint);
      Term b = interpreter.operand(envB, operand, hint);
      Publicness own = compare(a, b);
      record(inst.pp(), operand, own);
      if (kind.controlFlow() && own != Publicness.PUBLIC) {
        divergence = divergence.and(own);
      }
    }

    private Publicness compare(Term a, Term b) {
      Term right = Terms.resize(b, a.width());
      queries++;
      QueryCache.Lookup lookup =
          cache.check(new EquivalenceQuery(assumptions, a, right), options.solverTimeout());
      if (lookup.hit()) {
        hits++;
      } else {
        misses++;
        solverNanos += lookup.solverNanos();
      }
      return Publicness.fromVerdict(lookup.verdict());
    }

    private void record(ProgramPoint pp, ValueId value, Publicness own) {
      Publicness effective =
          options.propagateControlDivergence() ? own.and(divergence) : own;
      results.merge(new ResultKey(pp, value), effective, Publicness::and);
    }

    private void report(AnalysisDiagnostic diagnostic) {
      LOG.warn("{}", diagnostic.describe());
      diagnostics.add(diagnostic);
    }
  }

  private record ResultKey(ProgramPoint pp, ValueId value) {}
}
