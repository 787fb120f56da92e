package publicdata.symbolic;

/** Maps IR type names to bit widths. */
public final class BitWidths {

  /** Type absent or {@code void}. */
  public static final int UNKNOWN = 0;

  /** Type present but not representable as a bit-vector of at most 64 bits. */
  public static final int UNSUPPORTED = -1;

  private BitWidths() {}

  public static int parse(String type, int pointerWidth) {
    if (type == null || type.isBlank() || type.equals("void")) {
      return UNKNOWN;
    }
    String t = type.trim();
    if (t.length() > 1 && t.charAt(0) == 'i' && t.substring(1).chars().allMatch(Character::isDigit)) {
      int width = Integer.parseInt(t.substring(1));
      return width >= 1 && width <= Term.MAX_WIDTH ? width : UNSUPPORTED;
    }
    if (t.equals("ptr") || t.startsWith("ptr ") || t.endsWith("*")) {
      return pointerWidth;
    }
    switch (t) {
      case "half":
      case "bfloat":
        return 16;
      case "float":
        return 32;
      case "double":
        return 64;
      default:
        return UNSUPPORTED;
    }
  }
}
