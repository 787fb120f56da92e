package publicdata.symbolic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import publicdata.cond.CondExpr;
import publicdata.diagnostics.AnalysisDiagnostic;
import publicdata.diagnostics.DiagnosticReason;
import publicdata.model.Block;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.ValueId;
import publicdata.symbolic.SymbolicInterpreter.StepContext;
import publicdata.testing.FunctionModels;

final class SymbolicInterpreterTest {

  private final List<AnalysisDiagnostic> diagnostics = new ArrayList<>();
  private final StepContext ctx = new StepContext(0, diagnostics::add);

  private static Term run(
      SymbolicInterpreter interpreter, SymbolicEnv env, Block block, StepContext ctx) {
    Term last = null;
    for (Instruction inst : block.instructions()) {
      Term t = interpreter.step(env, inst, ctx);
      if (t != null) {
        last = t;
      }
    }
    return last;
  }

  @Test
  void publicInputsAreSharedAcrossExecutions() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .typed("add", "a", "i32", "x", "key")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, new InputClassification(Set.of("key"), Set.of()), 64);
    SymbolicEnv a = interpreter.newEnv(Execution.A);
    SymbolicEnv b = interpreter.newEnv(Execution.B);
    Term ta = run(interpreter, a, model.entry(), ctx);
    Term tb = run(interpreter, b, model.entry(), ctx);
    assertNotEquals(ta, tb);
    assertTrue(Terms.variables(ta).contains(new Term.Var("x", 32)));
    assertTrue(Terms.variables(tb).contains(new Term.Var("x", 32)));
    assertTrue(Terms.variables(ta).contains(new Term.Var("key#A", 32)));
  }

  @Test
  void storedValueIsLoadedBack() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .op("alloca", "slot", "ptr")
            .store("i32", "v", "slot")
            .load("r", "i32", "slot")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    SymbolicEnv env = interpreter.newEnv(Execution.A);
    Term loaded = run(interpreter, env, model.entry(), ctx);
    assertEquals(new Term.Var("v", 32), loaded);
  }

  @Test
  void secretMemoryRootTagsUnwrittenLoads() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .gep("p", "keys", "i", "i64")
            .load("r", "i8", "p")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, new InputClassification(Set.of(), Set.of("keys")), 64);
    Term a = run(interpreter, interpreter.newEnv(Execution.A), model.entry(), ctx);
    Term b = run(interpreter, interpreter.newEnv(Execution.B), model.entry(), ctx);
    assertNotEquals(a, b);
  }

  @Test
  void callYieldsOpaqueValueWithDiagnostic() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .op("call", "r", "i32", "x")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    Term t = run(interpreter, interpreter.newEnv(Execution.A), model.entry(), ctx);
    assertInstanceOf(Term.Opaque.class, t);
    assertEquals(DiagnosticReason.UNSUPPORTED_OPCODE, diagnostics.get(0).reason());
  }

  @Test
  void vectorTypedDefinitionIsUnsupported() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .op("add", "r", "<4 x i32>", "x", "y")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    Term t = run(interpreter, interpreter.newEnv(Execution.A), model.entry(), ctx);
    assertInstanceOf(Term.Opaque.class, t);
    assertEquals(DiagnosticReason.UNSUPPORTED_TYPE, diagnostics.get(0).reason());
  }

  @Test
  void mergePicksValueOfActualPredecessor() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .br("c", "left", "right")
            .block("left")
            .jump("join")
            .block("right")
            .jump("join")
            .block("join")
            .phi("m", "i32", "const:i32:1", "left", "const:i32:2", "right")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    SymbolicEnv env = interpreter.newEnv(Execution.A);
    Instruction phi = model.block("join").instructions().get(0);
    assertEquals(Terms.constant(32, 2), interpreter.resolveMerge(env, phi, "right", ctx));
    assertEquals(Terms.constant(32, 1), interpreter.resolveMerge(env, phi, "left", ctx));
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  void mergeWithoutMatchingPredecessorIsUnresolved() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .jump("join")
            .block("join")
            .phi("m", "i32", "const:i32:1", "other", "const:i32:2", "elsewhere")
            .ret()
            .block("other")
            .jump("join")
            .block("elsewhere")
            .jump("join")
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    Instruction phi = model.block("join").instructions().get(0);
    Term t = interpreter.resolveMerge(interpreter.newEnv(Execution.A), phi, "entry", ctx);
    assertInstanceOf(Term.Opaque.class, t);
    assertEquals(DiagnosticReason.UNRESOLVED_MERGE, diagnostics.get(0).reason());
  }

  @Test
  void conflictingValuesForOnePredecessorAreAmbiguous() {
    FunctionModel model =
        FunctionModels.function("f")
            .block("entry")
            .jump("join")
            .block("join")
            .phi("m", "i32", "const:i32:1", "entry", "const:i32:2", "entry")
            .ret()
            .build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    Instruction phi = model.block("join").instructions().get(0);
    Term t = interpreter.resolveMerge(interpreter.newEnv(Execution.A), phi, "entry", ctx);
    assertInstanceOf(Term.Opaque.class, t);
    assertEquals(DiagnosticReason.AMBIGUOUS_MERGE, diagnostics.get(0).reason());
  }

  @Test
  void wildcardDefaultAddsNoAssumption() {
    FunctionModel model = FunctionModels.function("f").block("entry").ret().build();
    SymbolicInterpreter interpreter =
        new SymbolicInterpreter(model, InputClassification.allPublic(), 64);
    List<Term> assumptions =
        interpreter.assume(
            interpreter.newEnv(Execution.A),
            new CondExpr.NotEquals(ValueId.parse("s"), ValueId.Wildcard.INSTANCE));
    assertTrue(assumptions.isEmpty());
  }
}
