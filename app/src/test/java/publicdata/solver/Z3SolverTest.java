package publicdata.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import publicdata.symbolic.BinaryOp;
import publicdata.symbolic.CastOp;
import publicdata.symbolic.Predicate;
import publicdata.symbolic.Term;
import publicdata.symbolic.Terms;

final class Z3SolverTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final Z3Solver solver = new Z3Solver();

  private Verdict check(List<Term> assumptions, Term left, Term right) {
    return solver.checkDivergence(new EquivalenceQuery(assumptions, left, right), TIMEOUT);
  }

  @Test
  void independentSecretCopiesCanDiffer() {
    assertEquals(
        Verdict.SAT, check(List.of(), new Term.Var("key#A", 64), new Term.Var("key#B", 64)));
  }

  @Test
  void pinnedWideValuesAreProvedEqual() {
    Term a = new Term.Var("key#A", 64);
    Term b = new Term.Var("key#B", 64);
    List<Term> pinned =
        List.of(
            Terms.compare(Predicate.EQ, a, Terms.constant(64, 0)),
            Terms.compare(Predicate.EQ, b, Terms.constant(64, 0)));
    Term base = new Term.Var("base", 64);
    Term scale = Terms.constant(64, 8);
    Term addrA = Terms.binary(BinaryOp.ADD, base, Terms.binary(BinaryOp.MUL, a, scale));
    Term addrB = Terms.binary(BinaryOp.ADD, base, Terms.binary(BinaryOp.MUL, b, scale));
    assertEquals(Verdict.UNSAT, check(pinned, addrA, addrB));
  }

  @Test
  void maskedBitsOfThirtyTwoBitSecretNeverDiffer() {
    Term a = new Term.Var("key#A", 32);
    Term b = new Term.Var("key#B", 32);
    Term highA = Terms.binary(BinaryOp.LSHR, a, Terms.constant(32, 16));
    Term highB = Terms.binary(BinaryOp.LSHR, b, Terms.constant(32, 16));
    List<Term> highEqual = List.of(Terms.compare(Predicate.EQ, highA, highB));
    Term maskA = Terms.binary(BinaryOp.AND, a, Terms.constant(32, 0xffff0000L));
    Term maskB = Terms.binary(BinaryOp.AND, b, Terms.constant(32, 0xffff0000L));
    assertEquals(Verdict.UNSAT, check(highEqual, maskA, maskB));
    assertEquals(Verdict.SAT, check(highEqual, a, b));
  }

  @Test
  void contradictoryAssumptionsMakeEveryPairEqual() {
    Term x = new Term.Var("x", 32);
    List<Term> contradiction =
        List.of(
            Terms.compare(Predicate.ULT, x, Terms.constant(32, 4)),
            Terms.compare(Predicate.UGT, x, Terms.constant(32, 10)));
    assertEquals(
        Verdict.UNSAT, check(contradiction, new Term.Var("k#A", 32), new Term.Var("k#B", 32)));
  }

  @Test
  void divisionByZeroMatchesTheConcreteSemantics() {
    Term x = new Term.Var("x", 32);
    Term zero = Terms.constant(32, 0);
    Term quotient = new Term.Binary(BinaryOp.UDIV, x, zero);
    Term remainder = new Term.Binary(BinaryOp.UREM, x, zero);
    assertEquals(Verdict.UNSAT, check(List.of(), quotient, Terms.constant(32, 0xffffffffL)));
    assertEquals(Verdict.UNSAT, check(List.of(), remainder, x));
  }

  @Test
  void castsAndSelectsTranslate() {
    Term x = new Term.Var("x", 8);
    Term widened = new Term.Cast(CastOp.SEXT, x, 32);
    Term back = new Term.Cast(CastOp.TRUNC, widened, 8);
    assertEquals(Verdict.UNSAT, check(List.of(), back, x));

    Term negative = Terms.compare(Predicate.SLT, x, Terms.constant(8, 0));
    Term high = new Term.Ite(negative, Terms.constant(32, 0xffffff00L), Terms.constant(32, 0));
    Term masked = new Term.Binary(BinaryOp.AND, widened, Terms.constant(32, 0xffffff00L));
    assertEquals(Verdict.UNSAT, check(List.of(), masked, high));
  }

  @Test
  void opaqueDifferenceIsUnknown() {
    Term opaque = new Term.Opaque("call", "c1", 32);
    assertEquals(Verdict.UNKNOWN, check(List.of(), opaque, new Term.Var("x", 32)));
  }

  @Test
  void witnessThroughOpaqueAssumptionIsUnknown() {
    Term a = new Term.Var("key#A", 32);
    Term b = new Term.Var("key#B", 32);
    List<Term> unknownGuard =
        List.of(Terms.compare(Predicate.EQ, new Term.Opaque("call", "c2", 32), a));
    assertEquals(Verdict.UNKNOWN, check(unknownGuard, a, b));
  }

  @Test
  void selectableByName() {
    assertEquals("z3", SolverKind.parse(" Z3 ").create().name());
    assertEquals("bounded-model", SolverKind.parse("bounded").create().name());
  }
}
