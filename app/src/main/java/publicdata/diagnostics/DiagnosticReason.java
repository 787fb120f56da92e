package publicdata.diagnostics;

/** Why a result was degraded or a record flagged. */
public enum DiagnosticReason {
  UNSUPPORTED_OPCODE("Opcode has no evaluation rule; its value is opaque"),
  UNSUPPORTED_TYPE("Value type is not an integer or pointer of at most 64 bits"),
  UNRESOLVED_MERGE("Merge operand has no incoming value for the path's predecessor"),
  AMBIGUOUS_MERGE("Merge has several different incoming values for the same predecessor"),
  MISSING_OPERAND("Instruction lacks an operand required by its evaluation rule"),
  MISSING_PATH_RESULT("Covering path produced no result for this value");

  private final String description;

  DiagnosticReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
