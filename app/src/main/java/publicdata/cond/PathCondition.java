package publicdata.cond;

import java.util.List;

/** Path condition in both forms; a form that was not requested is empty. */
public record PathCondition(List<String> text, List<CondExpr> exprs) {

  public PathCondition {
    text = List.copyOf(text);
    exprs = List.copyOf(exprs);
  }
}
