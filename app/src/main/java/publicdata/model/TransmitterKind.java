package publicdata.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Operand roles whose value can leak through timing. */
public enum TransmitterKind {
  LOAD_ADDRESS("load.addr", 0, false),
  STORE_ADDRESS("store.addr", 1, false),
  BRANCH_CONDITION("br.cond", 0, true),
  SWITCH_CONDITION("switch.cond", 0, true),
  INDIRECT_TARGET("indirectbr.target", 0, true);

  private static final Map<String, TransmitterKind> BY_WIRE =
      Arrays.stream(values()).collect(Collectors.toMap(TransmitterKind::wireName, Function.identity()));

  private final String wireName;
  private final int defaultOperand;
  private final boolean controlFlow;

  TransmitterKind(String wireName, int defaultOperand, boolean controlFlow) {
    this.wireName = wireName;
    this.defaultOperand = defaultOperand;
    this.controlFlow = controlFlow;
  }

  public String wireName() {
    return wireName;
  }

  /** Operand position the front end reports for this kind. */
  public int defaultOperand() {
    return defaultOperand;
  }

  /** True for transmitters that select the next block. */
  public boolean controlFlow() {
    return controlFlow;
  }

  public static Optional<TransmitterKind> fromWire(String wireName) {
    return Optional.ofNullable(BY_WIRE.get(wireName));
  }
}
