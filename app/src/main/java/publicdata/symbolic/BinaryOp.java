package publicdata.symbolic;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Integer arithmetic and bitwise operators, named after their IR opcodes. */
public enum BinaryOp {
  ADD("add", true),
  SUB("sub", false),
  MUL("mul", true),
  UDIV("udiv", false),
  SDIV("sdiv", false),
  UREM("urem", false),
  SREM("srem", false),
  SHL("shl", false),
  LSHR("lshr", false),
  ASHR("ashr", false),
  AND("and", true),
  OR("or", true),
  XOR("xor", true);

  private static final Map<String, BinaryOp> BY_OPCODE =
      Arrays.stream(values()).collect(Collectors.toMap(BinaryOp::symbol, Function.identity()));

  private final String symbol;
  private final boolean commutative;

  BinaryOp(String symbol, boolean commutative) {
    this.symbol = symbol;
    this.commutative = commutative;
  }

  public String symbol() {
    return symbol;
  }

  public boolean commutative() {
    return commutative;
  }

  public static Optional<BinaryOp> fromOpcode(String opcode) {
    return Optional.ofNullable(BY_OPCODE.get(opcode));
  }
}
