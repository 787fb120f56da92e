package publicdata.solver;

import java.util.List;
import java.util.Objects;
import publicdata.symbolic.Term;

/** "Under {@code assumptions}, can {@code left} differ from {@code right}?" */
public record EquivalenceQuery(List<Term> assumptions, Term left, Term right) {

  public EquivalenceQuery {
    assumptions = List.copyOf(assumptions);
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    if (left.width() != right.width()) {
      throw new IllegalArgumentException(
          "compared terms differ in width: " + left.width() + " vs " + right.width());
    }
  }

  /** Cache key; identical for queries built from identical paths and expressions. */
  public String canonicalKey() {
    StringBuilder sb = new StringBuilder();
    for (Term a : assumptions) {
      sb.append(a.render()).append(" && ");
    }
    return sb.append("|- ").append(left.render()).append(" != ").append(right.render()).toString();
  }
}
