package publicdata.paths;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.cond.ConstraintBuilder;
import publicdata.cond.PathCondition;
import publicdata.model.Block;
import publicdata.model.Decision;
import publicdata.model.FunctionModel;
import publicdata.model.Path;
import publicdata.model.PathSummary;
import publicdata.model.PpCoverage;
import publicdata.model.ProgramPoint;
import publicdata.model.Terminator;
import publicdata.model.ValueId;

/**
 * Bounded depth-first enumeration of root-to-leaf paths.
 *
 * <p>The visit counts are scoped to the current prefix: a block is counted on entry and released
 * on backtrack, so sibling paths may reuse it and one path may revisit it up to {@code
 * maxLoopIters} times. Successors are explored in declaration order (true before false, switch
 * cases as declared with the default last). Budgets never throw; they only set summary flags.
 */
public final class PathEnumerator {

  private static final Logger LOG = LoggerFactory.getLogger(PathEnumerator.class);

  private final EnumerationOptions options;

  public PathEnumerator(EnumerationOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public EnumerationOptions options() {
    return options;
  }

  public EnumerationResult enumerate(FunctionModel model) {
    return enumerate(model, path -> {});
  }

  /** Enumerates {@code model}, handing every path to {@code sink} as soon as it is discovered. */
  public EnumerationResult enumerate(FunctionModel model, Consumer<Path> sink) {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(sink, "sink");
    if (options.disabled()) {
      LOG.debug("Path enumeration disabled for {}", model.name());
      return new EnumerationResult(
          List.of(),
          List.of(),
          PathSummary.disabled(
              model.name(), options.maxPaths(), options.maxPathDepth(), options.maxLoopIters()));
    }
    if (model.blockCount() == 0) {
      LOG.warn("Function {} has no blocks, nothing to enumerate", model.name());
      return new EnumerationResult(List.of(), List.of(), new Traversal(model, sink).summary());
    }
    Traversal traversal = new Traversal(model, sink);
    traversal.visit(model.entry().index());
    PathSummary summary = traversal.summary();
    if (summary.anyCutoff()) {
      LOG.debug(
          "{}: {} paths, truncated={} depthCutoff={} loopCutoff={}",
          model.name(),
          summary.pathsEmitted(),
          summary.truncated(),
          summary.cutoffDepth(),
          summary.cutoffLoop());
    }
    return new EnumerationResult(traversal.paths, traversal.coverage(), summary);
  }

  /** Mutable DFS state for one function. */
  private final class Traversal {
    private final FunctionModel model;
    private final Consumer<Path> sink;
    private final int[] visits;
    private final List<Block> prefix = new ArrayList<>();
    private final List<Decision> decisions = new ArrayList<>();
    private final List<Path> paths = new ArrayList<>();
    private final CoverageCollector coverage;

    private int nextPathId;
    private boolean truncated;
    private boolean cutoffDepth;
    private boolean cutoffLoop;
    private long constPrunedBranch;
    private long constPrunedSwitch;
    private long constPrunedIndirect;
    private long dfsCalls;
    private long dfsLeaves;
    private long pruneMaxPaths;
    private long pruneMaxDepth;
    private long pruneLoop;

    Traversal(FunctionModel model, Consumer<Path> sink) {
      this.model = model;
      this.sink = sink;
      this.visits = new int[model.blockCount()];
      this.coverage =
          options.emitPpCoverage()
              ? new CoverageCollector(model.name(), options.maxPpPathIds())
              : null;
    }

    void visit(int blockIndex) {
      dfsCalls++;
      if (paths.size() >= options.maxPaths()) {
        truncated = true;
        pruneMaxPaths++;
        return;
      }
      if (prefix.size() >= options.maxPathDepth()) {
        cutoffDepth = true;
        pruneMaxDepth++;
        return;
      }
      if (visits[blockIndex] >= options.maxLoopIters() + 1) {
        cutoffLoop = true;
        pruneLoop++;
        return;
      }
      Block block = model.block(blockIndex);
      visits[blockIndex]++;
      prefix.add(block);
      try {
        if (block.isLeaf()) {
          emit();
        } else {
          expand(block);
        }
      } finally {
        prefix.remove(prefix.size() - 1);
        visits[blockIndex]--;
      }
    }

    private void expand(Block block) {
      Terminator terminator = block.terminator();
      ProgramPoint pp = terminator.pp();
      if (terminator instanceof Terminator.ConditionalBranch br) {
        if (br.condition() instanceof ValueId.IntConstant constant) {
          constPrunedBranch++;
          boolean sense = !constant.isZero();
          String taken = sense ? br.trueSuccessor() : br.falseSuccessor();
          follow(new Decision.Branch(pp, taken, br.condition(), sense));
          return;
        }
        follow(new Decision.Branch(pp, br.trueSuccessor(), br.condition(), true));
        follow(new Decision.Branch(pp, br.falseSuccessor(), br.condition(), false));
      } else if (terminator instanceof Terminator.Switch sw) {
        expandSwitch(pp, sw);
      } else if (terminator instanceof Terminator.Indirect ind) {
        Optional<String> known = ind.target().blockAddressLabel();
        if (known.isPresent() && model.block(known.get()) != null) {
          constPrunedIndirect++;
          follow(new Decision.Indirect(pp, known.get(), ind.target()));
          return;
        }
        for (String succ : ind.successors()) {
          follow(new Decision.Indirect(pp, succ, ind.target()));
        }
      } else {
        for (String succ : terminator.successors()) {
          follow(new Decision.Unconditional(pp, succ));
        }
      }
    }

    private void expandSwitch(ProgramPoint pp, Terminator.Switch sw) {
      if (sw.condition() instanceof ValueId.IntConstant constant) {
        constPrunedSwitch++;
        for (Terminator.SwitchCase c : sw.cases()) {
          if (c.value() instanceof ValueId.IntConstant caseValue
              && caseValue.value().equals(constant.value())) {
            follow(new Decision.SwitchCase(pp, c.successor(), sw.condition(), c.value()));
            return;
          }
        }
        if (sw.defaultSuccessor() != null) {
          follow(
              new Decision.SwitchDefault(
                  pp, sw.defaultSuccessor(), sw.condition(), sw.caseValues()));
        } else {
          // No successor can be taken: the prefix ends here.
          LOG.debug(
              "{}: constant switch at {} matches no case and has no default",
              model.name(),
              pp.key());
          emit();
        }
        return;
      }
      for (Terminator.SwitchCase c : sw.cases()) {
        follow(new Decision.SwitchCase(pp, c.successor(), sw.condition(), c.value()));
      }
      if (sw.defaultSuccessor() != null) {
        follow(
            new Decision.SwitchDefault(pp, sw.defaultSuccessor(), sw.condition(), sw.caseValues()));
      }
    }

    private void follow(Decision decision) {
      decisions.add(decision);
      try {
        visit(model.blockIndex(decision.successor()));
      } finally {
        decisions.remove(decisions.size() - 1);
      }
    }

    private void emit() {
      dfsLeaves++;
      int id = nextPathId++;
      List<String> labels = new ArrayList<>(prefix.size());
      for (Block b : prefix) {
        labels.add(b.label());
      }
      List<ProgramPoint> visited =
          options.includePpSeq() || coverage != null
              ? CoverageCollector.programPoints(prefix)
              : List.of();
      PathCondition condition = ConstraintBuilder.build(decisions, options.pathCondFormat());
      Path path =
          new Path(
              model.name(),
              id,
              labels,
              decisions,
              options.includePpSeq() ? visited : List.of(),
              condition.text(),
              condition.exprs());
      if (coverage != null) {
        coverage.record(id, visited);
      }
      paths.add(path);
      LOG.debug("{}: path {} through {} blocks", model.name(), id, labels.size());
      sink.accept(path);
    }

    List<PpCoverage> coverage() {
      return coverage == null ? List.of() : coverage.snapshot();
    }

    PathSummary summary() {
      return new PathSummary(
          model.name(),
          false,
          paths.size(),
          truncated,
          options.maxPaths(),
          options.maxPathDepth(),
          options.maxLoopIters(),
          cutoffDepth,
          cutoffLoop,
          constPrunedBranch,
          constPrunedSwitch,
          constPrunedIndirect,
          dfsCalls,
          dfsLeaves,
          pruneMaxPaths,
          pruneMaxDepth,
          pruneLoop);
    }
  }
}
