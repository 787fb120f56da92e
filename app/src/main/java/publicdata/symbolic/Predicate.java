package publicdata.symbolic;

import java.util.Optional;

/** Integer comparison predicates. */
public enum Predicate {
  EQ("eq"),
  NE("ne"),
  UGT("ugt"),
  UGE("uge"),
  ULT("ult"),
  ULE("ule"),
  SGT("sgt"),
  SGE("sge"),
  SLT("slt"),
  SLE("sle");

  private final String symbol;

  Predicate(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean signed() {
    return symbol.charAt(0) == 's';
  }

  /** Parses an {@code icmp} predicate name. */
  public static Optional<Predicate> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (Predicate p : values()) {
      if (p.symbol.equals(name)) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }
}
