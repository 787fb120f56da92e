package publicdata.model;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of a value inside one function, in the encoding used by the trace front end.
 *
 * <p>Constants compare by value. Every other variant is unique per function scope.
 */
public sealed interface ValueId
    permits ValueId.Argument,
        ValueId.Named,
        ValueId.Generated,
        ValueId.IntConstant,
        ValueId.FloatConstant,
        ValueId.SpecialConstant,
        ValueId.OpaqueConstant,
        ValueId.BlockLabel,
        ValueId.Wildcard {

  String CONST_PREFIX = "const:";
  String LABEL_PREFIX = "label:";

  /** Wire form, identical to what the front end emits. */
  String render();

  default boolean isConstant() {
    return false;
  }

  /** Target block label when this value is a statically known block address. */
  default Optional<String> blockAddressLabel() {
    return Optional.empty();
  }

  static ValueId parse(String raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw.isEmpty()) {
      throw new IllegalArgumentException("Empty value id");
    }
    if (raw.equals(Wildcard.TEXT)) {
      return Wildcard.INSTANCE;
    }
    if (raw.startsWith(LABEL_PREFIX)) {
      return new BlockLabel(raw.substring(LABEL_PREFIX.length()));
    }
    if (raw.startsWith(CONST_PREFIX)) {
      return parseConstant(raw.substring(CONST_PREFIX.length()));
    }
    Matcher arg = Patterns.ARGUMENT.matcher(raw);
    if (arg.matches()) {
      return new Argument(Integer.parseInt(arg.group(1)));
    }
    Matcher gen = Patterns.GENERATED.matcher(raw);
    if (gen.matches()) {
      return new Generated(Integer.parseInt(gen.group(1)));
    }
    return new Named(raw);
  }

  private static ValueId parseConstant(String body) {
    if (body.startsWith("i")) {
      int sep = body.indexOf(':');
      if (sep > 1) {
        try {
          int width = Integer.parseInt(body.substring(1, sep));
          return new IntConstant(width, new BigInteger(body.substring(sep + 1)));
        } catch (NumberFormatException ignored) {
          // printed constant that merely starts with "i", kept opaque below
        }
      }
    }
    if (body.startsWith("fp:")) {
      return new FloatConstant(body.substring(3));
    }
    for (SpecialConstant.Kind kind : SpecialConstant.Kind.values()) {
      if (kind.text().equals(body)) {
        return new SpecialConstant(kind);
      }
    }
    return new OpaqueConstant(body);
  }

  static IntConstant bool(boolean value) {
    return new IntConstant(1, value ? BigInteger.ONE : BigInteger.ZERO);
  }

  /** Unnamed function argument, {@code argN}. */
  record Argument(int index) implements ValueId {
    public Argument {
      if (index < 0) {
        throw new IllegalArgumentException("argument index must be non-negative");
      }
    }

    @Override
    public String render() {
      return "arg" + index;
    }
  }

  /** Value carrying a source-level name (named arguments included). */
  record Named(String name) implements ValueId {
    public Named {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String render() {
      return name;
    }
  }

  /** Unnamed value numbered by the front end, {@code vN}. */
  record Generated(int sequence) implements ValueId {
    @Override
    public String render() {
      return "v" + sequence;
    }
  }

  record IntConstant(int width, BigInteger value) implements ValueId {
    public IntConstant {
      if (width <= 0) {
        throw new IllegalArgumentException("integer width must be positive");
      }
      Objects.requireNonNull(value, "value");
    }

    public boolean isZero() {
      return value.signum() == 0;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String render() {
      return CONST_PREFIX + "i" + width + ":" + value;
    }
  }

  record FloatConstant(String literal) implements ValueId {
    public FloatConstant {
      Objects.requireNonNull(literal, "literal");
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String render() {
      return CONST_PREFIX + "fp:" + literal;
    }
  }

  record SpecialConstant(Kind kind) implements ValueId {
    public enum Kind {
      NULL,
      UNDEF,
      POISON;

      String text() {
        return name().toLowerCase(Locale.ROOT);
      }
    }

    public SpecialConstant {
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String render() {
      return CONST_PREFIX + kind.text();
    }
  }

  /** Constant the front end could only print, e.g. a global or a block address. */
  record OpaqueConstant(String printed) implements ValueId {
    public OpaqueConstant {
      Objects.requireNonNull(printed, "printed");
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Optional<String> blockAddressLabel() {
      Matcher m = Patterns.BLOCK_ADDRESS.matcher(printed);
      return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    @Override
    public String render() {
      return CONST_PREFIX + printed;
    }
  }

  /** Block label used on the right-hand side of indirect-transfer constraints. */
  record BlockLabel(String label) implements ValueId {
    public BlockLabel {
      Objects.requireNonNull(label, "label");
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Optional<String> blockAddressLabel() {
      return Optional.of(label);
    }

    @Override
    public String render() {
      return LABEL_PREFIX + label;
    }
  }

  /** Sentinel for a switch default without enumerated cases. */
  final class Wildcard implements ValueId {
    static final String TEXT = "<any>";
    public static final Wildcard INSTANCE = new Wildcard();

    private Wildcard() {}

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String render() {
      return TEXT;
    }

    @Override
    public String toString() {
      return TEXT;
    }
  }

  final class Patterns {
    static final Pattern ARGUMENT = Pattern.compile("arg(\\d+)");
    static final Pattern GENERATED = Pattern.compile("v(\\d+)");
    static final Pattern BLOCK_ADDRESS = Pattern.compile("blockaddress\\(@[^,]+,\\s*%([^)\\s]+)\\)");

    private Patterns() {}
  }
}
