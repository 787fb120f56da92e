package publicdata.symbolic;

/** The two executions compared by the verifier. */
public enum Execution {
  A,
  B;

  /** Per-execution copy of a variable name. */
  public String tag(String name) {
    return name + "#" + name();
  }

  /** Strips the execution suffix added by {@link #tag(String)}. */
  public static String untag(String name) {
    int at = name.lastIndexOf('#');
    if (at > 0 && at == name.length() - 2) {
      char c = name.charAt(at + 1);
      if (c == 'A' || c == 'B') {
        return name.substring(0, at);
      }
    }
    return name;
  }
}
