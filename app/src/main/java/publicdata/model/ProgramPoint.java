package publicdata.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Stable address of one instruction inside a function, rendered as {@code fn:bb:iN}. Program points
 * are the join key between trace records, path records and publicness results.
 */
public record ProgramPoint(String function, String block, int instructionIndex)
    implements Comparable<ProgramPoint> {

  private static final Comparator<ProgramPoint> ORDER =
      Comparator.comparing(ProgramPoint::function)
          .thenComparing(ProgramPoint::block)
          .thenComparingInt(ProgramPoint::instructionIndex);

  public ProgramPoint {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(block, "block");
    if (instructionIndex < 0) {
      throw new IllegalArgumentException("instructionIndex must be non-negative");
    }
  }

  public static ProgramPoint of(String function, String block, int instructionIndex) {
    return new ProgramPoint(function, block, instructionIndex);
  }

  /**
   * Parses the {@code fn:bb:iN} rendering. The instruction index is taken from the last
   * {@code :i} separator and the block label from the segment before it, so function names may
   * themselves contain colons.
   */
  public static ProgramPoint parse(String key) {
    Objects.requireNonNull(key, "key");
    int indexSep = key.lastIndexOf(":i");
    if (indexSep <= 0) {
      throw new IllegalArgumentException("Invalid program point: " + key);
    }
    int blockSep = key.lastIndexOf(':', indexSep - 1);
    if (blockSep <= 0) {
      throw new IllegalArgumentException("Invalid program point: " + key);
    }
    try {
      int index = Integer.parseInt(key.substring(indexSep + 2));
      return new ProgramPoint(
          key.substring(0, blockSep), key.substring(blockSep + 1, indexSep), index);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid program point index: " + key, ex);
    }
  }

  public String key() {
    return function + ":" + block + ":i" + instructionIndex;
  }

  @Override
  public int compareTo(ProgramPoint other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return key();
  }
}
