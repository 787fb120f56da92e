package publicdata.model;

import java.util.Objects;

/** Designates which operand of an instruction is a transmitter. */
public record Transmitter(TransmitterKind kind, int operandIndex) {

  public Transmitter {
    Objects.requireNonNull(kind, "kind");
    if (operandIndex < 0) {
      throw new IllegalArgumentException("operandIndex must be non-negative");
    }
  }

  public static Transmitter of(TransmitterKind kind) {
    return new Transmitter(kind, kind.defaultOperand());
  }
}
