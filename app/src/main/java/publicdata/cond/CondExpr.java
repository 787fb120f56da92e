package publicdata.cond;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import publicdata.model.ValueId;

/** Structured path-condition term. */
public sealed interface CondExpr permits CondExpr.Equals, CondExpr.NotEquals, CondExpr.And {

  String AND_SEPARATOR = " && ";

  /** Canonical string form, byte-identical for equal trees. */
  String render();

  record Equals(ValueId lhs, ValueId rhs) implements CondExpr {
    public Equals {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String render() {
      return lhs.render() + "==" + rhs.render();
    }
  }

  record NotEquals(ValueId lhs, ValueId rhs) implements CondExpr {
    public NotEquals {
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String render() {
      return lhs.render() + "!=" + rhs.render();
    }
  }

  /** Ordered conjunction; always holds at least two terms. */
  record And(List<CondExpr> terms) implements CondExpr {
    public And {
      terms = List.copyOf(terms);
      if (terms.size() < 2) {
        throw new IllegalArgumentException("conjunction needs at least two terms");
      }
    }

    @Override
    public String render() {
      return terms.stream().map(CondExpr::render).collect(Collectors.joining(AND_SEPARATOR));
    }
  }

  /** Conjunction of {@code terms}, collapsing the one-term case to the term itself. */
  static CondExpr all(List<? extends CondExpr> terms) {
    if (terms.isEmpty()) {
      throw new IllegalArgumentException("no terms");
    }
    if (terms.size() == 1) {
      return terms.get(0);
    }
    return new And(List.copyOf(terms));
  }
}
