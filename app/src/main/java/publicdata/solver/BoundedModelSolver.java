package publicdata.solver;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import publicdata.symbolic.Predicate;
import publicdata.symbolic.Term;
import publicdata.symbolic.TermEvaluator;
import publicdata.symbolic.Terms;
import publicdata.util.Timing;

/**
 * Built-in decision procedure. Structurally equal terms are proved equal outright; otherwise it
 * searches for a witness assignment over the variables the difference depends on. The search is
 * exhaustive when those variables fit in {@code exhaustiveBits} bits, and a deterministic sample
 * otherwise, in which case failing to find a witness yields {@link Verdict#UNKNOWN}.
 *
 * <p>Assumptions sharing no variable with the compared terms are not consulted, so a witness may
 * come from an infeasible path; such paths are reported as not public rather than public.
 */
public final class BoundedModelSolver implements SolverBackend {

  public static final int DEFAULT_EXHAUSTIVE_BITS = 16;
  public static final int DEFAULT_SAMPLES = 4096;
  private static final long DEFAULT_SEED = 0x5eed_c0deL;
  private static final int DEADLINE_STRIDE = 256;
  private static final int MAX_LITERALS = 32;

  private final int exhaustiveBits;
  private final int samples;
  private final long seed;

  public BoundedModelSolver() {
    this(DEFAULT_EXHAUSTIVE_BITS, DEFAULT_SAMPLES, DEFAULT_SEED);
  }

  public BoundedModelSolver(int exhaustiveBits, int samples, long seed) {
    if (exhaustiveBits < 0 || exhaustiveBits > 30) {
      throw new IllegalArgumentException("exhaustiveBits must be within 0..30");
    }
    if (samples < 0) {
      throw new IllegalArgumentException("samples must be non-negative");
    }
    this.exhaustiveBits = exhaustiveBits;
    this.samples = samples;
    this.seed = seed;
  }

  @Override
  public String name() {
    return "bounded-model";
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
    for (Term assumption : query.assumptions()) {
      if (assumption instanceof Term.Const c && c.bits() == 0) {
        return Verdict.UNSAT;
      }
    }
    Search search = new Search(difference, query.assumptions());
    Timing deadline = Timing.withBudget(timeout);
    if (search.totalBits() <= exhaustiveBits) {
      return search.exhaustive(deadline);
    }
    return search.sample(deadline, new SplittableRandom(seed ^ query.canonicalKey().hashCode()));
  }

  /** Witness search restricted to the assumptions connected to the difference. */
  private final class Search {
    private final Term difference;
    private final List<Term> constraints = new ArrayList<>();
    private final List<Term.Var> vars;
    private final Set<Long> literals = new LinkedHashSet<>();
    private boolean droppedOpaque;

    Search(Term difference, List<Term> assumptions) {
      this.difference = difference;
      Set<Term.Var> cone = new LinkedHashSet<>(Terms.variables(difference));
      List<Term> pending = new ArrayList<>(assumptions);
      boolean grew = true;
      while (grew) {
        grew = false;
        for (int i = 0; i < pending.size(); i++) {
          Term a = pending.get(i);
          Set<Term.Var> aVars = Terms.variables(a);
          if (disjoint(cone, aVars)) {
            continue;
          }
          pending.remove(i--);
          if (Terms.containsOpaque(a)) {
            droppedOpaque = true;
            continue;
          }
          constraints.add(a);
          if (cone.addAll(aVars)) {
            grew = true;
          }
        }
      }
      this.vars = new ArrayList<>(cone);
      collectLiterals(difference);
      constraints.forEach(this::collectLiterals);
    }

    int totalBits() {
      long bits = 0;
      for (Term.Var v : vars) {
        bits += v.width();
      }
      return (int) Math.min(Integer.MAX_VALUE, bits);
    }

    Verdict exhaustive(Timing deadline) {
      int bits = totalBits();
      long limit = 1L << bits;
      for (long code = 0; code < limit; code++) {
        if (code % DEADLINE_STRIDE == 0 && deadline.expired()) {
          return Verdict.UNKNOWN;
        }
        Map<Term.Var, Long> assignment = new HashMap<>();
        long rest = code;
        for (Term.Var v : vars) {
          assignment.put(v, rest & Terms.mask(v.width()));
          rest >>>= v.width();
        }
        if (isWitness(assignment)) {
          return witnessVerdict();
        }
      }
      return Verdict.UNSAT;
    }

    Verdict sample(Timing deadline, SplittableRandom random) {
      List<long[]> pools = new ArrayList<>(vars.size());
      long combinations = 1;
      for (Term.Var v : vars) {
        long[] pool = candidates(v.width());
        pools.add(pool);
        combinations = Math.min((long) samples, combinations * pool.length);
      }
      long structured = Math.min(combinations, samples / 2L);
      for (long i = 0; i < samples; i++) {
        if (i % DEADLINE_STRIDE == 0 && deadline.expired()) {
          return Verdict.UNKNOWN;
        }
        Map<Term.Var, Long> assignment = new HashMap<>();
        long rest = i;
        for (int k = 0; k < vars.size(); k++) {
          Term.Var v = vars.get(k);
          long value;
          if (i < structured) {
            long[] pool = pools.get(k);
            value = pool[(int) (rest % pool.length)];
            rest /= pool.length;
          } else if (random.nextInt(4) == 0) {
            long[] pool = pools.get(k);
            value = pool[random.nextInt(pool.length)];
          } else {
            value = random.nextLong();
          }
          assignment.put(v, value & Terms.mask(v.width()));
        }
        if (isWitness(assignment)) {
          return witnessVerdict();
        }
      }
      return Verdict.UNKNOWN;
    }

    private boolean isWitness(Map<Term.Var, Long> assignment) {
      TermEvaluator evaluator = new TermEvaluator(assignment);
      for (Term c : constraints) {
        if (!evaluator.holds(c)) {
          return false;
        }
      }
      return evaluator.holds(difference);
    }

    private Verdict witnessVerdict() {
      return droppedOpaque ? Verdict.UNKNOWN : Verdict.SAT;
    }

    /** Boundary values plus the literals of the query and their neighbours. */
    private long[] candidates(int width) {
      long mask = Terms.mask(width);
      Set<Long> pool = new LinkedHashSet<>();
      pool.add(0L);
      pool.add(1L & mask);
      pool.add(mask);
      pool.add((mask >>> 1) & mask);
      pool.add((1L << (width - 1)) & mask);
      pool.add(2L & mask);
      for (long lit : literals) {
        pool.add(lit & mask);
        pool.add((lit + 1) & mask);
        pool.add((lit - 1) & mask);
      }
      long[] out = new long[pool.size()];
      int i = 0;
      for (long v : pool) {
        out[i++] = v;
      }
      return out;
    }

    private void collectLiterals(Term term) {
      Set<Term> seen = Collections.newSetFromMap(new IdentityHashMap<>());
      Deque<Term> stack = new ArrayDeque<>();
      stack.push(term);
      while (!stack.isEmpty() && literals.size() < MAX_LITERALS) {
        Term t = stack.pop();
        if (!seen.add(t)) {
          continue;
        }
        if (t instanceof Term.Const c) {
          literals.add(c.bits());
        } else if (t instanceof Term.Binary b) {
          stack.push(b.left());
          stack.push(b.right());
        } else if (t instanceof Term.Compare c) {
          stack.push(c.left());
          stack.push(c.right());
        } else if (t instanceof Term.Cast c) {
          stack.push(c.operand());
        } else if (t instanceof Term.Ite ite) {
          stack.push(ite.condition());
          stack.push(ite.whenTrue());
          stack.push(ite.whenFalse());
        }
      }
    }
  }

  private static boolean disjoint(Set<Term.Var> a, Set<Term.Var> b) {
    for (Term.Var v : b) {
      if (a.contains(v)) {
        return false;
      }
    }
    return true;
  }
}
