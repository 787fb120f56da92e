package publicdata.solver;

/** Outcome of asking whether the two executions can disagree. */
public enum Verdict {
  /** No assignment makes the values differ. */
  UNSAT,
  /** A witness exists where the values differ. */
  SAT,
  /** Undecided: timeout, opaque values, or an incomplete search. */
  UNKNOWN
}
