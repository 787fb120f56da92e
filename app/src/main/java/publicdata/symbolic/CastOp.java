package publicdata.symbolic;

/** Width-changing conversions. */
public enum CastOp {
  ZEXT("zext"),
  SEXT("sext"),
  TRUNC("trunc");

  private final String symbol;

  CastOp(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }
}
