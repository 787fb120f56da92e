package publicdata.cond;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import publicdata.model.Decision;
import publicdata.model.ValueId;

/** Maps decisions to their path-condition terms. */
public final class ConstraintBuilder {

  public static final ValueId TRUE = ValueId.bool(true);
  public static final ValueId FALSE = ValueId.bool(false);

  private ConstraintBuilder() {}

  /** Constraint a decision contributes; empty for unconditional transfers. */
  public static Optional<CondExpr> expressionFor(Decision decision) {
    if (decision instanceof Decision.Branch br) {
      return Optional.of(new CondExpr.Equals(br.condition(), br.sense() ? TRUE : FALSE));
    }
    if (decision instanceof Decision.SwitchCase sc) {
      return Optional.of(new CondExpr.Equals(sc.condition(), sc.caseValue()));
    }
    if (decision instanceof Decision.SwitchDefault sd) {
      return Optional.of(defaultConstraint(sd.condition(), sd.cases()));
    }
    if (decision instanceof Decision.Indirect ind) {
      return Optional.of(
          new CondExpr.Equals(ind.target(), new ValueId.BlockLabel(ind.successor())));
    }
    return Optional.empty();
  }

  public static CondExpr defaultConstraint(ValueId condition, List<ValueId> cases) {
    if (cases.isEmpty()) {
      return new CondExpr.NotEquals(condition, ValueId.Wildcard.INSTANCE);
    }
    List<CondExpr> terms = new ArrayList<>(cases.size());
    for (ValueId c : cases) {
      terms.add(new CondExpr.NotEquals(condition, c));
    }
    return CondExpr.all(terms);
  }

  /** Builds the condition of a whole decision sequence in the requested forms. */
  public static PathCondition build(List<Decision> decisions, PathCondFormat format) {
    List<String> text = new ArrayList<>();
    List<CondExpr> exprs = new ArrayList<>();
    for (Decision decision : decisions) {
      Optional<CondExpr> expr = expressionFor(decision);
      if (expr.isEmpty()) {
        continue;
      }
      if (format.includesString()) {
        text.add(expr.get().render());
      }
      if (format.includesJson()) {
        exprs.add(expr.get());
      }
    }
    return new PathCondition(text, exprs);
  }

  /** Ordered conjunction of all constraints, or empty for an unconstrained path. */
  public static Optional<CondExpr> conjunction(List<Decision> decisions) {
    List<CondExpr> terms = new ArrayList<>();
    for (Decision decision : decisions) {
      expressionFor(decision).ifPresent(terms::add);
    }
    return terms.isEmpty() ? Optional.empty() : Optional.of(CondExpr.all(terms));
  }
}
