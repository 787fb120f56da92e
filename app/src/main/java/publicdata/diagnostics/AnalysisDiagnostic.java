package publicdata.diagnostics;

import java.util.Map;
import java.util.Objects;
import publicdata.model.ProgramPoint;

/**
 * Structured diagnostic attached to a function's analysis. {@code pathId} and {@code pp} are
 * {@code null} when the condition is not tied to one path or instruction.
 */
public record AnalysisDiagnostic(
    String function,
    Integer pathId,
    ProgramPoint pp,
    DiagnosticReason reason,
    Map<String, Object> attributes) {

  public static final String ATTR_OPCODE = "opcode";
  public static final String ATTR_TYPE = "type";
  public static final String ATTR_PREDECESSOR = "predecessor";
  public static final String ATTR_VALUE = "value";
  public static final String ATTR_MISSING_PATHS = "missingPaths";

  public AnalysisDiagnostic {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(reason, "reason");
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static AnalysisDiagnostic unsupportedOpcode(
      String function, int pathId, ProgramPoint pp, String opcode) {
    return new AnalysisDiagnostic(
        function, pathId, pp, DiagnosticReason.UNSUPPORTED_OPCODE, Map.of(ATTR_OPCODE, opcode));
  }

  public static AnalysisDiagnostic unsupportedType(
      String function, int pathId, ProgramPoint pp, String type) {
    return new AnalysisDiagnostic(
        function,
        pathId,
        pp,
        DiagnosticReason.UNSUPPORTED_TYPE,
        Map.of(ATTR_TYPE, type == null ? "<none>" : type));
  }

  public static AnalysisDiagnostic unresolvedMerge(
      String function, int pathId, ProgramPoint pp, String predecessor) {
    return new AnalysisDiagnostic(
        function,
        pathId,
        pp,
        DiagnosticReason.UNRESOLVED_MERGE,
        Map.of(ATTR_PREDECESSOR, predecessor == null ? "<entry>" : predecessor));
  }

  public static AnalysisDiagnostic ambiguousMerge(
      String function, int pathId, ProgramPoint pp, String predecessor) {
    return new AnalysisDiagnostic(
        function, pathId, pp, DiagnosticReason.AMBIGUOUS_MERGE, Map.of(ATTR_PREDECESSOR, predecessor));
  }

  public static AnalysisDiagnostic missingOperand(
      String function, int pathId, ProgramPoint pp, String opcode) {
    return new AnalysisDiagnostic(
        function, pathId, pp, DiagnosticReason.MISSING_OPERAND, Map.of(ATTR_OPCODE, opcode));
  }

  public static AnalysisDiagnostic missingPathResult(
      String function, ProgramPoint pp, String value, int missingPaths) {
    return new AnalysisDiagnostic(
        function,
        null,
        pp,
        DiagnosticReason.MISSING_PATH_RESULT,
        Map.of(ATTR_VALUE, value, ATTR_MISSING_PATHS, missingPaths));
  }

  public String describe() {
    StringBuilder sb = new StringBuilder(function);
    if (pathId != null) {
      sb.append(" path ").append(pathId);
    }
    if (pp != null) {
      sb.append(" at ").append(pp.key());
    }
    sb.append(": ").append(reason.description());
    if (!attributes.isEmpty()) {
      sb.append(' ').append(attributes);
    }
    return sb.toString();
  }
}
