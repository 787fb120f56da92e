package publicdata.cond;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import publicdata.model.ValueId;

/**
 * Concrete evaluation of path conditions. Non-constant ids are looked up in an assignment;
 * integer constants evaluate to their value, every other constant to its rendering.
 */
public final class CondEvaluator {

  private final Map<ValueId, Object> assignment;

  public CondEvaluator(Map<ValueId, ?> assignment) {
    this.assignment = Map.copyOf(Objects.requireNonNull(assignment, "assignment"));
  }

  public boolean evaluate(CondExpr expr) {
    if (expr instanceof CondExpr.Equals eq) {
      if (eq.rhs() instanceof ValueId.Wildcard) {
        return false;
      }
      return value(eq.lhs()).equals(value(eq.rhs()));
    }
    if (expr instanceof CondExpr.NotEquals ne) {
      if (ne.rhs() instanceof ValueId.Wildcard) {
        return true;
      }
      return !value(ne.lhs()).equals(value(ne.rhs()));
    }
    for (CondExpr term : ((CondExpr.And) expr).terms()) {
      if (!evaluate(term)) {
        return false;
      }
    }
    return true;
  }

  /** True when every entry holds. */
  public boolean evaluateAll(Iterable<CondExpr> conjuncts) {
    for (CondExpr c : conjuncts) {
      if (!evaluate(c)) {
        return false;
      }
    }
    return true;
  }

  private Object value(ValueId id) {
    if (id instanceof ValueId.IntConstant ic) {
      return ic.value();
    }
    if (id instanceof ValueId.BlockLabel label) {
      return label.render();
    }
    if (id.isConstant()) {
      return id.blockAddressLabel().map(l -> (Object) new ValueId.BlockLabel(l).render())
          .orElse(id.render());
    }
    Object bound = assignment.get(id);
    if (bound == null) {
      throw new IllegalArgumentException("No value assigned to " + id.render());
    }
    if (bound instanceof Number n && !(bound instanceof BigInteger)) {
      return BigInteger.valueOf(n.longValue());
    }
    return bound;
  }
}
