package publicdata.cond;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import publicdata.model.ValueId;

/** Parses the string path-condition form back into {@link CondExpr} trees. */
public final class ConditionParser {

  private static final Splitter AND_SPLITTER =
      Splitter.on(CondExpr.AND_SEPARATOR.trim()).trimResults().omitEmptyStrings();

  private ConditionParser() {}

  public static CondExpr parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Empty condition");
    }
    List<CondExpr> terms = new ArrayList<>();
    for (String part : AND_SPLITTER.split(text)) {
      terms.add(parseComparison(part));
    }
    return CondExpr.all(terms);
  }

  /** Conjunction of every entry of a path's {@code path_cond} list. */
  public static List<CondExpr> parseAll(List<String> conditions) {
    List<CondExpr> out = new ArrayList<>(conditions.size());
    for (String c : conditions) {
      out.add(parse(c));
    }
    return out;
  }

  private static CondExpr parseComparison(String term) {
    int eq = term.indexOf("==");
    int ne = term.indexOf("!=");
    if (eq < 0 && ne < 0) {
      throw new IllegalArgumentException("Not a comparison: " + term);
    }
    boolean equals = ne < 0 || (eq >= 0 && eq < ne);
    int at = equals ? eq : ne;
    ValueId lhs = ValueId.parse(term.substring(0, at).trim());
    ValueId rhs = ValueId.parse(term.substring(at + 2).trim());
    return equals ? new CondExpr.Equals(lhs, rhs) : new CondExpr.NotEquals(lhs, rhs);
  }
}
