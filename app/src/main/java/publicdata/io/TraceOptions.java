package publicdata.io;

/** Trace size budget per function; {@code maxInst == 0} keeps every instruction. */
public record TraceOptions(int maxInst) {

  public TraceOptions {
    if (maxInst < 0) {
      throw new IllegalArgumentException("maxInst must be non-negative");
    }
  }

  public static TraceOptions unlimited() {
    return new TraceOptions(0);
  }
}
