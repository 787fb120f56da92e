package publicdata.symbolic;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import publicdata.cond.CondExpr;
import publicdata.diagnostics.AnalysisDiagnostic;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.ValueId;

/**
 * Evaluation rules for traced instructions over one {@link SymbolicEnv}.
 *
 * <p>Inputs are seeded on first use: public inputs share one variable across both executions,
 * secret inputs get one variable per execution. Memory is keyed by the rendered address term;
 * reading unwritten memory yields a variable named after the address, per execution only for
 * secret regions. Opcodes without a rule yield opaque values, which the solver never decides.
 */
public final class SymbolicInterpreter {

  private static final int MAX_INT_CONSTANT_BITS = Term.MAX_WIDTH;
  private static final BigInteger MASK_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  private final FunctionModel model;
  private final InputClassification classification;
  private final int pointerWidth;

  public SymbolicInterpreter(
      FunctionModel model, InputClassification classification, int pointerWidth) {
    this.model = Objects.requireNonNull(model, "model");
    this.classification = Objects.requireNonNull(classification, "classification");
    if (pointerWidth < 1 || pointerWidth > Term.MAX_WIDTH) {
      throw new IllegalArgumentException("pointerWidth must be within 1.." + Term.MAX_WIDTH);
    }
    this.pointerWidth = pointerWidth;
  }

  public SymbolicEnv newEnv(Execution execution) {
    return new SymbolicEnv(execution, model.valueCount());
  }

  /** Diagnostic destination for one path. */
  public record StepContext(int pathId, Consumer<AnalysisDiagnostic> diagnostics) {
    public StepContext {
      Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public static StepContext silent(int pathId) {
      return new StepContext(pathId, d -> {});
    }
  }

  /** Evaluates a non-merge instruction and binds its result. Returns the defined term or null. */
  public Term step(SymbolicEnv env, Instruction inst, StepContext ctx) {
    Term value = evaluate(env, inst, ctx);
    if (value != null && inst.hasDef()) {
      env.bind(model.valueHandle(inst.def()), value);
    }
    return value;
  }

  /**
   * Value a merge takes when control arrives from {@code predecessor}. The caller binds it, so all
   * merges at the head of a block can read their incoming values before any of them is updated.
   */
  public Term resolveMerge(
      SymbolicEnv env, Instruction phi, String predecessor, StepContext ctx) {
    int width = defWidth(phi);
    if (width < 0) {
      ctx.diagnostics()
          .accept(
              AnalysisDiagnostic.unsupportedType(
                  model.name(), ctx.pathId(), phi.pp(), phi.defType()));
      return opaque(env, phi, "unsupported type", Term.MAX_WIDTH);
    }
    List<String> incoming = phi.incomingBlocks();
    if (predecessor == null || incoming.isEmpty() || incoming.contains(null)) {
      ctx.diagnostics()
          .accept(
              AnalysisDiagnostic.unresolvedMerge(model.name(), ctx.pathId(), phi.pp(), predecessor));
      return opaque(env, phi, "unresolved merge", width);
    }
    ValueId chosen = null;
    for (int i = 0; i < incoming.size(); i++) {
      if (!predecessor.equals(incoming.get(i))) {
        continue;
      }
      ValueId candidate = phi.operands().get(i);
      if (chosen != null && !chosen.equals(candidate)) {
        ctx.diagnostics()
            .accept(
                AnalysisDiagnostic.ambiguousMerge(
                    model.name(), ctx.pathId(), phi.pp(), predecessor));
        return opaque(env, phi, "ambiguous merge", width);
      }
      chosen = candidate;
    }
    if (chosen == null) {
      ctx.diagnostics()
          .accept(
              AnalysisDiagnostic.unresolvedMerge(model.name(), ctx.pathId(), phi.pp(), predecessor));
      return opaque(env, phi, "unresolved merge", width);
    }
    return Terms.resize(operand(env, chosen, width), width);
  }

  public void bind(SymbolicEnv env, ValueId value, Term term) {
    env.bind(model.valueHandle(value), term);
  }

  /**
   * Term for {@code id} in {@code env}. Unbound non-constant values are function inputs and are
   * seeded here with width {@code width}.
   */
  public Term operand(SymbolicEnv env, ValueId id, int width) {
    int w = width > 0 ? width : pointerWidth;
    if (id instanceof ValueId.IntConstant ic) {
      if (ic.width() > MAX_INT_CONSTANT_BITS) {
        return new Term.Opaque("wide constant", env.nextOpaqueId(id.render()), Term.MAX_WIDTH);
      }
      return Terms.constant(ic.width(), ic.value().and(MASK_64).longValue());
    }
    if (id instanceof ValueId.Wildcard) {
      throw new IllegalArgumentException("<any> is not a value");
    }
    Optional<String> label = id.blockAddressLabel();
    if (label.isPresent()) {
      return Terms.constant(pointerWidth, labelCode(label.get()));
    }
    if (id instanceof ValueId.SpecialConstant) {
      return Terms.constant(w, 0);
    }
    if (id.isConstant()) {
      return new Term.Var(id.render(), w);
    }
    int handle = model.valueHandle(id);
    Term bound = env.binding(handle);
    if (bound != null) {
      return bound;
    }
    String name = id.render();
    Term seeded =
        new Term.Var(
            classification.isSecretInput(model.name(), id) ? env.execution().tag(name) : name, w);
    env.bind(handle, seeded);
    return seeded;
  }

  /** Boolean terms asserting {@code expr} in {@code env}; the sentinel default yields nothing. */
  public List<Term> assume(SymbolicEnv env, CondExpr expr) {
    List<Term> out = new ArrayList<>();
    collectAssumptions(env, expr, out);
    return out;
  }

  private void collectAssumptions(SymbolicEnv env, CondExpr expr, List<Term> out) {
    if (expr instanceof CondExpr.And and) {
      for (CondExpr term : and.terms()) {
        collectAssumptions(env, term, out);
      }
      return;
    }
    ValueId lhs;
    ValueId rhs;
    Predicate predicate;
    if (expr instanceof CondExpr.Equals eq) {
      lhs = eq.lhs();
      rhs = eq.rhs();
      predicate = Predicate.EQ;
    } else {
      CondExpr.NotEquals ne = (CondExpr.NotEquals) expr;
      lhs = ne.lhs();
      rhs = ne.rhs();
      predicate = Predicate.NE;
    }
    if (rhs instanceof ValueId.Wildcard) {
      return;
    }
    int hint = rhs instanceof ValueId.IntConstant ic ? ic.width() : pointerWidth;
    Term left = operand(env, lhs, hint);
    Term right = Terms.resize(operand(env, rhs, left.width()), left.width());
    out.add(Terms.compare(predicate, left, right));
  }

  private Term evaluate(SymbolicEnv env, Instruction inst, StepContext ctx) {
    String op = inst.opcode();
    int width = defWidth(inst);
    if (inst.hasDef() && width < 0) {
      ctx.diagnostics()
          .accept(
              AnalysisDiagnostic.unsupportedType(
                  model.name(), ctx.pathId(), inst.pp(), inst.defType()));
      return opaque(env, inst, "unsupported type", Term.MAX_WIDTH);
    }
    switch (op) {
      case "alloca":
        return new Term.Var("alloca:" + inst.pp().key(), pointerWidth);
      case "load":
        if (inst.operands().isEmpty()) {
          return missingOperand(env, inst, ctx, width);
        }
        return load(env, address(env, inst, 0), width, inst);
      case "store":
        if (inst.operands().size() < 2) {
          missingOperand(env, inst, ctx, width);
          return null;
        }
        storeValue(env, inst);
        return null;
      case "icmp":
        return compare(env, inst, ctx);
      case "select":
        if (inst.operands().size() < 3) {
          return missingOperand(env, inst, ctx, width);
        }
        return Terms.ite(
            Terms.resize(operandAt(env, inst, 0, 1), 1),
            Terms.resize(operandAt(env, inst, 1, width), width),
            Terms.resize(operandAt(env, inst, 2, width), width));
      case "sext":
        if (inst.operands().isEmpty()) {
          return missingOperand(env, inst, ctx, width);
        }
        return Terms.resizeSigned(operandAt(env, inst, 0, width), width);
      case "zext":
      case "trunc":
      case "ptrtoint":
      case "inttoptr":
      case "bitcast":
      case "addrspacecast":
      case "freeze":
        if (inst.operands().isEmpty()) {
          return missingOperand(env, inst, ctx, width);
        }
        return Terms.resize(operandAt(env, inst, 0, width), width);
      case "getelementptr":
        if (inst.operands().isEmpty()) {
          return missingOperand(env, inst, ctx, width);
        }
        return elementAddress(env, inst);
      case "br":
      case "switch":
      case "indirectbr":
      case "ret":
      case "unreachable":
        return null;
      default:
        break;
    }
    Optional<BinaryOp> binary = BinaryOp.fromOpcode(op);
    if (binary.isPresent()) {
      if (inst.operands().size() < 2) {
        return missingOperand(env, inst, ctx, width);
      }
      return Terms.binary(
          binary.get(),
          Terms.resize(operandAt(env, inst, 0, width), width),
          Terms.resize(operandAt(env, inst, 1, width), width));
    }
    if (!inst.hasDef()) {
      return null;
    }
    ctx.diagnostics()
        .accept(AnalysisDiagnostic.unsupportedOpcode(model.name(), ctx.pathId(), inst.pp(), op));
    return opaque(env, inst, op, width);
  }

  private Term compare(SymbolicEnv env, Instruction inst, StepContext ctx) {
    Optional<Predicate> predicate = Predicate.fromName(inst.predicate());
    if (predicate.isEmpty()) {
      ctx.diagnostics()
          .accept(
              AnalysisDiagnostic.unsupportedOpcode(
                  model.name(), ctx.pathId(), inst.pp(), "icmp " + inst.predicate()));
      return opaque(env, inst, "icmp", 1);
    }
    if (inst.operands().size() < 2) {
      return missingOperand(env, inst, ctx, 1);
    }
    int typed = BitWidths.parse(inst.operandType(0), pointerWidth);
    Term a = operandAt(env, inst, 0, typed > 0 ? typed : pointerWidth);
    Term b = operandAt(env, inst, 1, typed > 0 ? typed : a.width());
    int width = typed > 0 ? typed : Math.max(a.width(), b.width());
    return Terms.compare(predicate.get(), Terms.resize(a, width), Terms.resize(b, width));
  }

  private Term load(SymbolicEnv env, Term address, int width, Instruction inst) {
    if (Terms.containsOpaque(address)) {
      return opaque(env, inst, "load through opaque address", width);
    }
    String key = address.render();
    Term stored = env.memory(key);
    if (stored != null) {
      return Terms.resize(stored, width);
    }
    if (env.memoryClobbered()) {
      return opaque(env, inst, "load after opaque store", width);
    }
    String name = "mem[" + key + "]";
    Term fresh = new Term.Var(secretRegion(address) ? env.execution().tag(name) : name, width);
    env.store(key, fresh);
    return fresh;
  }

  private void storeValue(SymbolicEnv env, Instruction inst) {
    int valueWidth = BitWidths.parse(inst.operandType(0), pointerWidth);
    Term value = operandAt(env, inst, 0, valueWidth > 0 ? valueWidth : pointerWidth);
    Term address = address(env, inst, 1);
    if (Terms.containsOpaque(address)) {
      env.clobberMemory();
      return;
    }
    env.store(address.render(), value);
  }

  private boolean secretRegion(Term address) {
    if (classification.secretMemoryRoots().isEmpty()) {
      return false;
    }
    for (Term.Var v : Terms.variables(address)) {
      if (classification.isSecretMemoryRoot(model.name(), Execution.untag(v.name()))) {
        return true;
      }
    }
    return false;
  }

  private Term address(SymbolicEnv env, Instruction inst, int index) {
    return Terms.resize(operandAt(env, inst, index, pointerWidth), pointerWidth);
  }

  /** {@code base + last index}; element sizes and intermediate indices are not modeled. */
  private Term elementAddress(SymbolicEnv env, Instruction inst) {
    Term base = address(env, inst, 0);
    int last = inst.operands().size() - 1;
    if (last == 0) {
      return base;
    }
    int typed = BitWidths.parse(inst.operandType(last), pointerWidth);
    Term index = operandAt(env, inst, last, typed > 0 ? typed : Term.MAX_WIDTH);
    return Terms.binary(BinaryOp.ADD, base, Terms.resizeSigned(index, pointerWidth));
  }

  private Term operandAt(SymbolicEnv env, Instruction inst, int index, int fallbackWidth) {
    int typed = BitWidths.parse(inst.operandType(index), pointerWidth);
    return operand(env, inst.operands().get(index), typed > 0 ? typed : fallbackWidth);
  }

  private Term missingOperand(SymbolicEnv env, Instruction inst, StepContext ctx, int width) {
    ctx.diagnostics()
        .accept(
            AnalysisDiagnostic.missingOperand(
                model.name(), ctx.pathId(), inst.pp(), inst.opcode()));
    return opaque(env, inst, "missing operand", width > 0 ? width : pointerWidth);
  }

  private Term opaque(SymbolicEnv env, Instruction inst, String reason, int width) {
    return new Term.Opaque(
        reason, env.nextOpaqueId(inst.pp().key()), width > 0 ? width : pointerWidth);
  }

  /** Result width of {@code inst}, {@link BitWidths#UNSUPPORTED} for non bit-vector types. */
  int defWidth(Instruction inst) {
    int declared = BitWidths.parse(inst.defType(), pointerWidth);
    if (declared != BitWidths.UNKNOWN) {
      return declared;
    }
    switch (inst.opcode()) {
      case "icmp":
      case "fcmp":
        return 1;
      case "alloca":
      case "getelementptr":
      case "inttoptr":
        return pointerWidth;
      default:
        int first = BitWidths.parse(inst.operandType(0), pointerWidth);
        return first > 0 ? first : pointerWidth;
    }
  }

  /** Non-zero address standing for a block label. */
  long labelCode(String label) {
    int index = model.blockIndex(label);
    if (index >= 0) {
      return index + 1L;
    }
    return model.blockCount() + 1L + (label.hashCode() & 0x7fffffffL);
  }
}
