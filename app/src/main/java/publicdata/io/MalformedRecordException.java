package publicdata.io;

/**
 * A boundary record violates the record schema. Carries the 1-based line number (0 when the record
 * did not come from a file) and the offending field, if any.
 */
public final class MalformedRecordException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int line;
  private final String field;

  public MalformedRecordException(String message, int line, String field) {
    super(format(message, line, field));
    this.line = line;
    this.field = field;
  }

  public MalformedRecordException(String message, int line, String field, Throwable cause) {
    super(format(message, line, field), cause);
    this.line = line;
    this.field = field;
  }

  public int line() {
    return line;
  }

  public String field() {
    return field;
  }

  private static String format(String message, int line, String field) {
    StringBuilder sb = new StringBuilder(message);
    if (field != null) {
      sb.append(" (field '").append(field).append("')");
    }
    if (line > 0) {
      sb.append(" at line ").append(line);
    }
    return sb.toString();
  }
}
