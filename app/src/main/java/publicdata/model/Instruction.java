package publicdata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One traced instruction. Merge ({@code phi}) instructions keep their incoming values in
 * {@link #operands()} and the originating block of each value, position by position, in
 * {@link #incomingBlocks()}; an entry is {@code null} when the front end did not tag it.
 */
public record Instruction(
    ProgramPoint pp,
    String opcode,
    ValueId def,
    List<ValueId> operands,
    List<String> incomingBlocks,
    String defType,
    List<String> operandTypes,
    String predicate,
    Transmitter transmitter) {

  public static final String PHI = "phi";

  public Instruction {
    Objects.requireNonNull(pp, "pp");
    Objects.requireNonNull(opcode, "opcode");
    operands = List.copyOf(operands);
    incomingBlocks =
        incomingBlocks == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(incomingBlocks));
    operandTypes = operandTypes == null ? List.of() : List.copyOf(operandTypes);
    if (!incomingBlocks.isEmpty() && incomingBlocks.size() != operands.size()) {
      throw new IllegalArgumentException(
          "incomingBlocks must parallel operands at " + pp.key());
    }
    if (transmitter != null && transmitter.operandIndex() >= operands.size()) {
      throw new IllegalArgumentException(
          "transmitter operand " + transmitter.operandIndex() + " out of range at " + pp.key());
    }
  }

  public boolean isMerge() {
    return PHI.equals(opcode);
  }

  public boolean hasDef() {
    return def != null;
  }

  public boolean isTransmitter() {
    return transmitter != null;
  }

  /** Operand designated as transmitter, or {@code null} for other instructions. */
  public ValueId transmittedOperand() {
    return transmitter == null ? null : operands.get(transmitter.operandIndex());
  }

  /** Declared type of operand {@code i}, or {@code null} if the trace omitted it. */
  public String operandType(int i) {
    return i < operandTypes.size() ? operandTypes.get(i) : null;
  }
}
