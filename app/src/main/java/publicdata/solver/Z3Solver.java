package publicdata.solver;

import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.symbolic.Predicate;
import publicdata.symbolic.Term;
import publicdata.symbolic.Terms;

/**
 * Z3 bit-vector backend. Each query gets its own {@link Context}, so concurrent checks never share
 * native state.
 *
 * <p>Opaque values become fresh unconstrained constants. A difference that mentions one is never
 * sent to the solver, and a witness that relies on an opaque assumption is reported as {@link
 * Verdict#UNKNOWN}.
 */
public final class Z3Solver implements SolverBackend {
  private static final Logger LOG = LoggerFactory.getLogger(Z3Solver.class);

  @Override
  public String name() {
    return "z3";
  }

  @Override
  public Verdict checkDivergence(EquivalenceQuery query, Duration timeout) {
    Term difference = Terms.compare(Predicate.NE, query.left(), query.right());
    if (difference instanceof Term.Const c && c.bits() == 0) {
      return Verdict.UNSAT;
    }
    if (Terms.containsOpaque(difference)) {
      return Verdict.UNKNOWN;
    }
    try (Context ctx = new Context()) {
      Solver solver = ctx.mkSolver();
      long millis = timeout.toMillis();
      if (millis > 0) {
        Params params = ctx.mkParams();
        params.add("timeout", (int) Math.min(Integer.MAX_VALUE, millis));
        solver.setParameters(params);
      }
      Translator translator = new Translator(ctx);
      for (Term assumption : query.assumptions()) {
        solver.add(translator.holds(assumption));
      }
      solver.add(translator.holds(difference));
      Status status = solver.check();
      if (status == Status.UNSATISFIABLE) {
        return Verdict.UNSAT;
      }
      if (status == Status.SATISFIABLE) {
        return translator.sawOpaque() ? Verdict.UNKNOWN : Verdict.SAT;
      }
      LOG.debug("z3 gave up on {}: {}", query.canonicalKey(), solver.getReasonUnknown());
      return Verdict.UNKNOWN;
    } catch (Z3Exception ex) {
      LOG.warn("z3 failed on a query: {}", ex.getMessage());
      return Verdict.UNKNOWN;
    }
  }

  /** Term to bit-vector formula. One-bit terms double as booleans. */
  static final class Translator {
    private final Context ctx;
    private final Map<Term, Expr<BitVecSort>> memo = new IdentityHashMap<>();
    private boolean opaque;

    Translator(Context ctx) {
      this.ctx = ctx;
    }

    boolean sawOpaque() {
      return opaque;
    }

    BoolExpr holds(Term condition) {
      if (condition instanceof Term.Compare c) {
        return compare(c);
      }
      return ctx.mkNot(ctx.mkEq(bitVector(condition), ctx.mkBV(0, condition.width())));
    }

    Expr<BitVecSort> bitVector(Term term) {
      Expr<BitVecSort> cached = memo.get(term);
      if (cached != null) {
        return cached;
      }
      Expr<BitVecSort> expr = translate(term);
      memo.put(term, expr);
      return expr;
    }

    private Expr<BitVecSort> translate(Term term) {
      if (term instanceof Term.Const c) {
        return ctx.mkBV(Long.toUnsignedString(c.bits()), c.width());
      }
      if (term instanceof Term.Var v) {
        return ctx.mkBVConst(v.name(), v.width());
      }
      if (term instanceof Term.Opaque o) {
        opaque = true;
        return ctx.mkBVConst("?" + o.id(), o.width());
      }
      if (term instanceof Term.Binary b) {
        return binary(b);
      }
      if (term instanceof Term.Compare c) {
        return ctx.mkITE(compare(c), ctx.mkBV(1, 1), ctx.mkBV(0, 1));
      }
      if (term instanceof Term.Cast c) {
        return cast(c);
      }
      if (term instanceof Term.Ite ite) {
        return ctx.mkITE(
            holds(ite.condition()), bitVector(ite.whenTrue()), bitVector(ite.whenFalse()));
      }
      throw new IllegalArgumentException("Cannot translate " + term.render());
    }

    private Expr<BitVecSort> binary(Term.Binary b) {
      Expr<BitVecSort> l = bitVector(b.left());
      Expr<BitVecSort> r = bitVector(b.right());
      switch (b.op()) {
        case ADD:
          return ctx.mkBVAdd(l, r);
        case SUB:
          return ctx.mkBVSub(l, r);
        case MUL:
          return ctx.mkBVMul(l, r);
        case UDIV:
          return ctx.mkBVUDiv(l, r);
        case SDIV:
          return ctx.mkBVSDiv(l, r);
        case UREM:
          return ctx.mkBVURem(l, r);
        case SREM:
          return ctx.mkBVSRem(l, r);
        case SHL:
          return ctx.mkBVSHL(l, r);
        case LSHR:
          return ctx.mkBVLSHR(l, r);
        case ASHR:
          return ctx.mkBVASHR(l, r);
        case AND:
          return ctx.mkBVAND(l, r);
        case OR:
          return ctx.mkBVOR(l, r);
        case XOR:
          return ctx.mkBVXOR(l, r);
        default:
          throw new IllegalArgumentException("Unknown operator " + b.op());
      }
    }

    private BoolExpr compare(Term.Compare c) {
      Expr<BitVecSort> l = bitVector(c.left());
      Expr<BitVecSort> r = bitVector(c.right());
      switch (c.predicate()) {
        case EQ:
          return ctx.mkEq(l, r);
        case NE:
          return ctx.mkNot(ctx.mkEq(l, r));
        case UGT:
          return ctx.mkBVUGT(l, r);
        case UGE:
          return ctx.mkBVUGE(l, r);
        case ULT:
          return ctx.mkBVULT(l, r);
        case ULE:
          return ctx.mkBVULE(l, r);
        case SGT:
          return ctx.mkBVSGT(l, r);
        case SGE:
          return ctx.mkBVSGE(l, r);
        case SLT:
          return ctx.mkBVSLT(l, r);
        case SLE:
          return ctx.mkBVSLE(l, r);
        default:
          throw new IllegalArgumentException("Unknown predicate " + c.predicate());
      }
    }

    private Expr<BitVecSort> cast(Term.Cast c) {
      Expr<BitVecSort> operand = bitVector(c.operand());
      int from = c.operand().width();
      int to = c.width();
      if (from == to) {
        return operand;
      }
      if (to < from) {
        return ctx.mkExtract(to - 1, 0, operand);
      }
      switch (c.op()) {
        case SEXT:
          return ctx.mkSignExt(to - from, operand);
        case ZEXT:
        case TRUNC:
          return ctx.mkZeroExt(to - from, operand);
        default:
          throw new IllegalArgumentException("Unknown cast " + c.op());
      }
    }
  }
}
