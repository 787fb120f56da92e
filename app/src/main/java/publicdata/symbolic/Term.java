package publicdata.symbolic;

import java.util.Objects;

/**
 * Bit-vector expression over at most 64 bits. Build terms through {@link Terms}, which folds
 * constants and normalizes commutative operands; records compare structurally.
 */
public sealed interface Term
    permits Term.Const, Term.Var, Term.Binary, Term.Compare, Term.Cast, Term.Ite, Term.Opaque {

  int MAX_WIDTH = 64;

  int width();

  /** Canonical rendering, used as cache and memory key. */
  String render();

  record Const(int width, long bits) implements Term {
    public Const {
      checkWidth(width);
      bits &= Terms.mask(width);
    }

    @Override
    public String render() {
      return "#" + Long.toUnsignedString(bits) + ":" + width;
    }
  }

  record Var(String name, int width) implements Term {
    public Var {
      Objects.requireNonNull(name, "name");
      checkWidth(width);
    }

    @Override
    public String render() {
      return name + ":" + width;
    }
  }

  record Binary(BinaryOp op, Term left, Term right) implements Term {
    public Binary {
      Objects.requireNonNull(op, "op");
      if (left.width() != right.width()) {
        throw new IllegalArgumentException(
            op + " over mismatched widths " + left.width() + "/" + right.width());
      }
    }

    @Override
    public int width() {
      return left.width();
    }

    @Override
    public String render() {
      return "(" + op.symbol() + " " + left.render() + " " + right.render() + ")";
    }
  }

  record Compare(Predicate predicate, Term left, Term right) implements Term {
    public Compare {
      Objects.requireNonNull(predicate, "predicate");
      if (left.width() != right.width()) {
        throw new IllegalArgumentException(
            predicate + " over mismatched widths " + left.width() + "/" + right.width());
      }
    }

    @Override
    public int width() {
      return 1;
    }

    @Override
    public String render() {
      return "(" + predicate.symbol() + " " + left.render() + " " + right.render() + ")";
    }
  }

  record Cast(CastOp op, Term operand, int width) implements Term {
    public Cast {
      Objects.requireNonNull(op, "op");
      checkWidth(width);
    }

    @Override
    public String render() {
      return "(" + op.symbol() + width + " " + operand.render() + ")";
    }
  }

  record Ite(Term condition, Term whenTrue, Term whenFalse) implements Term {
    public Ite {
      if (condition.width() != 1) {
        throw new IllegalArgumentException("ite condition must be one bit wide");
      }
      if (whenTrue.width() != whenFalse.width()) {
        throw new IllegalArgumentException("ite branches differ in width");
      }
    }

    @Override
    public int width() {
      return whenTrue.width();
    }

    @Override
    public String render() {
      return "(ite " + condition.render() + " " + whenTrue.render() + " " + whenFalse.render() + ")";
    }
  }

  /** Value the interpreter cannot model. Every opaque term is distinct. */
  record Opaque(String reason, String id, int width) implements Term {
    public Opaque {
      Objects.requireNonNull(reason, "reason");
      Objects.requireNonNull(id, "id");
      checkWidth(width);
    }

    @Override
    public String render() {
      return "?" + id + ":" + width;
    }
  }

  private static void checkWidth(int width) {
    if (width < 1 || width > MAX_WIDTH) {
      throw new IllegalArgumentException("unsupported bit width " + width);
    }
  }
}
