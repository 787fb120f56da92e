package publicdata.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import publicdata.cond.CondExpr;
import publicdata.cond.ConstraintBuilder;
import publicdata.model.Block;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.Path;
import publicdata.solver.EquivalenceQuery;
import publicdata.solver.QueryCache;
import publicdata.solver.Verdict;
import publicdata.symbolic.BinaryOp;
import publicdata.symbolic.Execution;
import publicdata.symbolic.InputClassification;
import publicdata.symbolic.SymbolicEnv;
import publicdata.symbolic.SymbolicInterpreter;
import publicdata.symbolic.SymbolicInterpreter.StepContext;
import publicdata.symbolic.Term;
import publicdata.symbolic.Terms;

/**
 * Single-execution check that a path condition is satisfiable. {@link Verdict#SAT} means some
 * input reaches the path, {@link Verdict#UNSAT} that none does.
 */
public final class PathFeasibilityChecker {

  private final QueryCache cache;
  private final Duration timeout;
  private final int pointerWidth;

  public PathFeasibilityChecker(QueryCache cache, Duration timeout, int pointerWidth) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.pointerWidth = pointerWidth;
  }

  public Verdict check(FunctionModel model, Path path) {
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), pointerWidth);
    SymbolicEnv env = interpreter.newEnv(Execution.A);
    StepContext ctx = StepContext.silent(path.id());
    List<Term> assumptions = new ArrayList<>();
    List<String> labels = path.blocks();
    for (int k = 0; k < labels.size(); k++) {
      Block block = model.block(labels.get(k));
      if (block == null) {
        throw new IllegalArgumentException(
            "Path " + path.id() + " of " + model.name() + " names unknown block " + labels.get(k));
      }
      String predecessor = k == 0 ? null : labels.get(k - 1);
      List<Instruction> instructions = block.instructions();
      int i = 0;
      List<Instruction> merges = new ArrayList<>();
      List<Term> incoming = new ArrayList<>();
      for (; i < instructions.size() && instructions.get(i).isMerge(); i++) {
        merges.add(instructions.get(i));
        incoming.add(interpreter.resolveMerge(env, instructions.get(i), predecessor, ctx));
      }
      for (int m = 0; m < merges.size(); m++) {
        if (merges.get(m).hasDef()) {
          interpreter.bind(env, merges.get(m).def(), incoming.get(m));
        }
      }
      for (; i < instructions.size(); i++) {
        interpreter.step(env, instructions.get(i), ctx);
      }
      if (k < path.decisions().size()) {
        Optional<CondExpr> constraint = ConstraintBuilder.expressionFor(path.decisions().get(k));
        if (constraint.isPresent()) {
          assumptions.addAll(interpreter.assume(env, constraint.get()));
        }
      }
    }
    // The conjunction can differ from false exactly when the path condition is satisfiable.
    Term conjunction = Terms.bool(true);
    for (Term assumption : assumptions) {
      conjunction = Terms.binary(BinaryOp.AND, conjunction, assumption);
    }
    EquivalenceQuery query = new EquivalenceQuery(List.of(), conjunction, Terms.bool(false));
    return cache.check(query, timeout).verdict();
  }
}
