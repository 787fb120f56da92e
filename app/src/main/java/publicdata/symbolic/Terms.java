package publicdata.symbolic;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Smart constructors for {@link Term}. Constant operands are folded, identities such as {@code x ^
 * x} and {@code x & 0} are applied, and commutative operands are ordered so that equal values
 * tend to get equal trees.
 */
public final class Terms {

  private Terms() {}

  public static long mask(int width) {
    return width >= 64 ? -1L : (1L << width) - 1;
  }

  /** Interprets the low {@code width} bits of {@code bits} as a two's-complement number. */
  public static long signed(long bits, int width) {
    if (width >= 64) {
      return bits;
    }
    int shift = 64 - width;
    return (bits << shift) >> shift;
  }

  public static Term.Const constant(int width, long value) {
    return new Term.Const(width, value);
  }

  public static Term.Const bool(boolean value) {
    return new Term.Const(1, value ? 1 : 0);
  }

  public static Term binary(BinaryOp op, Term left, Term right) {
    if (left instanceof Term.Const a && right instanceof Term.Const b) {
      return constant(left.width(), TermEvaluator.apply(op, a.bits(), b.bits(), left.width()));
    }
    if (op.commutative() && shouldSwap(left, right)) {
      Term tmp = left;
      left = right;
      right = tmp;
    }
    int width = left.width();
    long all = mask(width);
    if (right instanceof Term.Const c) {
      long k = c.bits();
      switch (op) {
        case ADD:
        case SUB:
        case OR:
        case XOR:
        case SHL:
        case LSHR:
        case ASHR:
          if (k == 0) {
            return left;
          }
          break;
        case MUL:
          if (k == 0) {
            return right;
          }
          if (k == 1) {
            return left;
          }
          break;
        case AND:
          if (k == 0) {
            return right;
          }
          if (k == all) {
            return left;
          }
          break;
        case UDIV:
        case SDIV:
          if (k == 1) {
            return left;
          }
          break;
        default:
          break;
      }
    }
    if (left.equals(right) && !(left instanceof Term.Opaque)) {
      switch (op) {
        case XOR:
        case SUB:
          return constant(width, 0);
        case AND:
        case OR:
          return left;
        default:
          break;
      }
    }
    return new Term.Binary(op, left, right);
  }

  public static Term compare(Predicate predicate, Term left, Term right) {
    if (left instanceof Term.Const a && right instanceof Term.Const b) {
      return bool(TermEvaluator.compare(predicate, a.bits(), b.bits(), left.width()));
    }
    if (left.equals(right) && !(left instanceof Term.Opaque)) {
      switch (predicate) {
        case EQ:
        case UGE:
        case ULE:
        case SGE:
        case SLE:
          return bool(true);
        default:
          return bool(false);
      }
    }
    if ((predicate == Predicate.EQ || predicate == Predicate.NE) && shouldSwap(left, right)) {
      Term tmp = left;
      left = right;
      right = tmp;
    }
    return new Term.Compare(predicate, left, right);
  }

  public static Term cast(CastOp op, Term operand, int width) {
    if (operand.width() == width) {
      return operand;
    }
    if (operand instanceof Term.Const c) {
      long bits = op == CastOp.SEXT ? signed(c.bits(), c.width()) : c.bits();
      return constant(width, bits);
    }
    if (op == CastOp.TRUNC && width > operand.width()) {
      throw new IllegalArgumentException("trunc cannot widen " + operand.width() + " to " + width);
    }
    if (op != CastOp.TRUNC && width < operand.width()) {
      throw new IllegalArgumentException(op.symbol() + " cannot narrow to " + width);
    }
    return new Term.Cast(op, operand, width);
  }

  /** Zero-extends or truncates {@code term} to {@code width}. */
  public static Term resize(Term term, int width) {
    if (term.width() == width) {
      return term;
    }
    return cast(term.width() < width ? CastOp.ZEXT : CastOp.TRUNC, term, width);
  }

  /** Sign-extends or truncates {@code term} to {@code width}. */
  public static Term resizeSigned(Term term, int width) {
    if (term.width() == width) {
      return term;
    }
    return cast(term.width() < width ? CastOp.SEXT : CastOp.TRUNC, term, width);
  }

  public static Term ite(Term condition, Term whenTrue, Term whenFalse) {
    if (condition instanceof Term.Const c) {
      return c.bits() != 0 ? whenTrue : whenFalse;
    }
    if (whenTrue.equals(whenFalse) && !(whenTrue instanceof Term.Opaque)) {
      return whenTrue;
    }
    return new Term.Ite(condition, whenTrue, whenFalse);
  }

  /** Free variables of {@code term} in first-occurrence order. */
  public static Set<Term.Var> variables(Term term) {
    Set<Term.Var> out = new LinkedHashSet<>();
    walk(term, t -> {
      if (t instanceof Term.Var v) {
        out.add(v);
      }
      return false;
    });
    return out;
  }

  public static boolean containsOpaque(Term term) {
    return walk(term, t -> t instanceof Term.Opaque);
  }

  private interface Visitor {
    /** Returns true to stop the walk. */
    boolean visit(Term term);
  }

  /** Iterative pre-order walk visiting every shared subterm once. */
  private static boolean walk(Term root, Visitor visitor) {
    Set<Term> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Term> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Term t = stack.pop();
      if (!seen.add(t)) {
        continue;
      }
      if (visitor.visit(t)) {
        return true;
      }
      if (t instanceof Term.Binary b) {
        stack.push(b.right());
        stack.push(b.left());
      } else if (t instanceof Term.Compare c) {
        stack.push(c.right());
        stack.push(c.left());
      } else if (t instanceof Term.Cast c) {
        stack.push(c.operand());
      } else if (t instanceof Term.Ite ite) {
        stack.push(ite.whenFalse());
        stack.push(ite.whenTrue());
        stack.push(ite.condition());
      }
    }
    return false;
  }

  /** Constants go right; otherwise operands are ordered by rendering. */
  private static boolean shouldSwap(Term left, Term right) {
    if (left instanceof Term.Const) {
      return !(right instanceof Term.Const);
    }
    if (right instanceof Term.Const) {
      return false;
    }
    return left.render().compareTo(right.render()) > 0;
  }
}
