package publicdata.symbolic;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/** Evaluates terms under a concrete assignment of their variables. */
public final class TermEvaluator {

  private final Map<Term.Var, Long> assignment;
  private final Map<Term, Long> memo = new IdentityHashMap<>();

  public TermEvaluator(Map<Term.Var, Long> assignment) {
    this.assignment = Objects.requireNonNull(assignment, "assignment");
  }

  /** Value of {@code term}, masked to its width. */
  public long evaluate(Term term) {
    Long cached = memo.get(term);
    if (cached != null) {
      return cached;
    }
    long value = compute(term);
    memo.put(term, value);
    return value;
  }

  public boolean holds(Term condition) {
    return evaluate(condition) != 0;
  }

  private long compute(Term term) {
    if (term instanceof Term.Const c) {
      return c.bits();
    }
    if (term instanceof Term.Var v) {
      Long bits = assignment.get(v);
      if (bits == null) {
        throw new IllegalArgumentException("Unassigned variable " + v.render());
      }
      return bits & Terms.mask(v.width());
    }
    if (term instanceof Term.Binary b) {
      return apply(b.op(), evaluate(b.left()), evaluate(b.right()), b.width());
    }
    if (term instanceof Term.Compare c) {
      return compare(c.predicate(), evaluate(c.left()), evaluate(c.right()), c.left().width())
          ? 1
          : 0;
    }
    if (term instanceof Term.Cast c) {
      long bits = evaluate(c.operand());
      if (c.op() == CastOp.SEXT) {
        bits = Terms.signed(bits, c.operand().width());
      }
      return bits & Terms.mask(c.width());
    }
    if (term instanceof Term.Ite ite) {
      return evaluate(ite.condition()) != 0
          ? evaluate(ite.whenTrue())
          : evaluate(ite.whenFalse());
    }
    throw new IllegalStateException("Cannot evaluate " + term.render());
  }

  /** Fixed-width operator semantics; division by zero follows the SMT-LIB convention. */
  static long apply(BinaryOp op, long a, long b, int width) {
    long mask = Terms.mask(width);
    a &= mask;
    b &= mask;
    long result;
    switch (op) {
      case ADD:
        result = a + b;
        break;
      case SUB:
        result = a - b;
        break;
      case MUL:
        result = a * b;
        break;
      case UDIV:
        result = b == 0 ? mask : Long.divideUnsigned(a, b);
        break;
      case UREM:
        result = b == 0 ? a : Long.remainderUnsigned(a, b);
        break;
      case SDIV:
        {
          long sa = Terms.signed(a, width);
          long sb = Terms.signed(b, width);
          result = sb == 0 ? (sa < 0 ? 1 : mask) : sa / sb;
          break;
        }
      case SREM:
        {
          long sa = Terms.signed(a, width);
          long sb = Terms.signed(b, width);
          result = sb == 0 ? a : sa % sb;
          break;
        }
      case SHL:
        result = Long.compareUnsigned(b, width) >= 0 ? 0 : a << b;
        break;
      case LSHR:
        result = Long.compareUnsigned(b, width) >= 0 ? 0 : a >>> b;
        break;
      case ASHR:
        {
          long sa = Terms.signed(a, width);
          result = Long.compareUnsigned(b, width) >= 0 ? (sa < 0 ? -1 : 0) : sa >> b;
          break;
        }
      case AND:
        result = a & b;
        break;
      case OR:
        result = a | b;
        break;
      case XOR:
        result = a ^ b;
        break;
      default:
        throw new IllegalArgumentException("Unknown operator " + op);
    }
    return result & mask;
  }

  static boolean compare(Predicate predicate, long a, long b, int width) {
    long mask = Terms.mask(width);
    a &= mask;
    b &= mask;
    switch (predicate) {
      case EQ:
        return a == b;
      case NE:
        return a != b;
      case UGT:
        return Long.compareUnsigned(a, b) > 0;
      case UGE:
        return Long.compareUnsigned(a, b) >= 0;
      case ULT:
        return Long.compareUnsigned(a, b) < 0;
      case ULE:
        return Long.compareUnsigned(a, b) <= 0;
      case SGT:
        return Terms.signed(a, width) > Terms.signed(b, width);
      case SGE:
        return Terms.signed(a, width) >= Terms.signed(b, width);
      case SLT:
        return Terms.signed(a, width) < Terms.signed(b, width);
      case SLE:
        return Terms.signed(a, width) <= Terms.signed(b, width);
      default:
        throw new IllegalArgumentException("Unknown predicate " + predicate);
    }
  }
}
