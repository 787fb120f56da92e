package publicdata.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import publicdata.diagnostics.DiagnosticReason;
import publicdata.model.FunctionModel;
import publicdata.model.Path;
import publicdata.model.ProgramPoint;
import publicdata.model.ValueId;
import publicdata.paths.EnumerationOptions;
import publicdata.paths.PathEnumerator;
import publicdata.solver.QueryCache;
import publicdata.solver.Z3Solver;
import publicdata.symbolic.InputClassification;
import publicdata.testing.FunctionModels;

final class DualExecutionVerifierTest {

  private static List<Path> paths(FunctionModel model) {
    return new PathEnumerator(EnumerationOptions.defaults()).enumerate(model).paths();
  }

  private static FunctionVerification verify(
      FunctionModel model, InputClassification classification, VerifierOptions options) {
    DualExecutionVerifier verifier =
        new DualExecutionVerifier(options, classification, new QueryCache(new Z3Solver()));
    return verifier.verifyAll(model, paths(model), r -> {});
  }

  private static Publicness at(
      FunctionVerification verification, int pathId, ProgramPoint pp, String value) {
    for (PublicnessResult r : verification.results()) {
      if (r.pathId() == pathId && r.pp().equals(pp) && r.value().equals(ValueId.parse(value))) {
        return r.publicness();
      }
    }
    throw new AssertionError("no result for " + value + " at " + pp.key() + " on path " + pathId);
  }

  /** Table lookup indexed by public data only. */
  private static FunctionModel publicLookup() {
    return FunctionModels.function("lookup")
        .block("entry")
        .gep("p", "table", "idx", "i64")
        .load("v", "i32", "p")
        .ret()
        .build();
  }

  /** Branch on the low bit of a secret; both arms load a public address. */
  private static FunctionModel secretBranch() {
    return FunctionModels.function("sb")
        .block("entry")
        .typed("and", "s", "i8", "key", "const:i8:1")
        .icmp("c", "ne", "i8", "s", "const:i8:0")
        .br("c", "then", "else")
        .block("then")
        .gep("p", "table", "idx", "i64")
        .load("v", "i32", "p")
        .ret()
        .block("else")
        .typed("add", "j", "i64", "idx", "const:i64:1")
        .gep("q", "table", "j", "i64")
        .load("w", "i32", "q")
        .ret()
        .build();
  }

  @Test
  void publicOnlyDataflowIsPublic() {
    FunctionVerification v =
        verify(publicLookup(), InputClassification.allPublic(), VerifierOptions.defaults());
    assertEquals(1, v.results().size());
    assertEquals(Publicness.PUBLIC, at(v, 0, ProgramPoint.of("lookup", "entry", 1), "p"));
    assertTrue(v.diagnostics().isEmpty());
  }

  @Test
  void secretBranchDegradesLaterTransmitters() {
    FunctionVerification v =
        verify(
            secretBranch(), InputClassification.parse("key", null), VerifierOptions.defaults());
    assertEquals(2, v.paths().size());
    assertEquals(Publicness.SECRET, at(v, 0, ProgramPoint.of("sb", "entry", 2), "c"));
    assertEquals(Publicness.SECRET, at(v, 0, ProgramPoint.of("sb", "then", 1), "p"));
    assertEquals(Publicness.SECRET, at(v, 1, ProgramPoint.of("sb", "entry", 2), "c"));
    assertEquals(Publicness.SECRET, at(v, 1, ProgramPoint.of("sb", "else", 2), "q"));
  }

  @Test
  void divergencePropagationCanBeSwitchedOff() {
    FunctionVerification v =
        verify(
            secretBranch(),
            InputClassification.parse("key", null),
            VerifierOptions.defaults().withControlDivergence(false));
    assertEquals(Publicness.SECRET, at(v, 0, ProgramPoint.of("sb", "entry", 2), "c"));
    assertEquals(Publicness.PUBLIC, at(v, 0, ProgramPoint.of("sb", "then", 1), "p"));
    assertEquals(Publicness.PUBLIC, at(v, 1, ProgramPoint.of("sb", "else", 2), "q"));
  }

  @Test
  void branchOutcomeIsAssumedForLaterChecks() {
    FunctionModel model =
        FunctionModels.function("eq")
            .block("entry")
            .icmp("z", "eq", "i8", "key", "const:i8:0")
            .br("z", "zero", "nonzero")
            .block("zero")
            .gep("p", "const:null", "key", "i8")
            .load("v", "i8", "p")
            .ret()
            .block("nonzero")
            .gep("q", "const:null", "key", "i8")
            .load("w", "i8", "q")
            .ret()
            .build();
    FunctionVerification v =
        verify(
            model,
            InputClassification.parse("key", null),
            VerifierOptions.defaults().withControlDivergence(false));
    assertEquals(
        Publicness.PUBLIC,
        at(v, 0, ProgramPoint.of("eq", "zero", 1), "p"),
        "key is pinned to zero in both executions on this path");
    assertEquals(Publicness.SECRET, at(v, 1, ProgramPoint.of("eq", "nonzero", 1), "q"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"i32", "i64"})
  void branchOutcomeIsAssumedForWideValues(String type) {
    FunctionModel model =
        FunctionModels.function("wide")
            .block("entry")
            .icmp("z", "eq", type, "key", "const:" + type + ":0")
            .br("z", "zero", "nonzero")
            .block("zero")
            .gep("p", "const:null", "key", type)
            .load("v", "i8", "p")
            .ret()
            .block("nonzero")
            .gep("q", "const:null", "key", type)
            .load("w", "i8", "q")
            .ret()
            .build();
    FunctionVerification v =
        verify(
            model,
            InputClassification.parse("key", null),
            VerifierOptions.defaults().withControlDivergence(false));
    assertEquals(Publicness.SECRET, at(v, 0, ProgramPoint.of("wide", "entry", 1), "z"));
    assertEquals(Publicness.PUBLIC, at(v, 0, ProgramPoint.of("wide", "zero", 1), "p"));
    assertEquals(Publicness.SECRET, at(v, 1, ProgramPoint.of("wide", "nonzero", 1), "q"));
  }

  @Test
  void loadFromSecretMemoryTaintsDependentAddress() {
    FunctionModel model =
        FunctionModels.function("sbox")
            .block("entry")
            .gep("p", "keys", "i", "i64")
            .load("k", "i8", "p")
            .gep("q", "sbox", "k", "i8")
            .load("out", "i8", "q")
            .ret()
            .build();
    FunctionVerification v =
        verify(model, InputClassification.parse(null, "keys"), VerifierOptions.defaults());
    assertEquals(Publicness.PUBLIC, at(v, 0, ProgramPoint.of("sbox", "entry", 1), "p"));
    assertEquals(Publicness.SECRET, at(v, 0, ProgramPoint.of("sbox", "entry", 3), "q"));
  }

  @Test
  void unmodeledCallMakesDependentResultUnknown() {
    FunctionModel model =
        FunctionModels.function("calls")
            .block("entry")
            .op("call", "r", "i64", "x")
            .gep("p", "table", "r", "i64")
            .load("v", "i32", "p")
            .ret()
            .build();
    FunctionVerification v =
        verify(model, InputClassification.allPublic(), VerifierOptions.defaults());
    assertEquals(Publicness.UNKNOWN, at(v, 0, ProgramPoint.of("calls", "entry", 2), "p"));
    assertEquals(1, v.diagnostics().size(), "one diagnostic per path, not per execution");
    assertEquals(DiagnosticReason.UNSUPPORTED_OPCODE, v.diagnostics().get(0).reason());
  }

  @Test
  void definitionsAreCheckedOnRequest() {
    FunctionVerification v =
        verify(
            publicLookup(),
            InputClassification.allPublic(),
            VerifierOptions.defaults().withCheckDefinitions(true));
    assertEquals(3, v.results().size());
    assertEquals(Publicness.PUBLIC, at(v, 0, ProgramPoint.of("lookup", "entry", 0), "p"));
    assertEquals(Publicness.PUBLIC, at(v, 0, ProgramPoint.of("lookup", "entry", 1), "v"));
    assertEquals(3, v.count(Publicness.PUBLIC));
  }

  @Test
  void parallelRunMatchesSequentialRunInPathOrder() {
    FunctionModel model =
        FunctionModels.function("d")
            .block("b0")
            .br("c0", "l0", "r0")
            .block("l0")
            .jump("b1")
            .block("r0")
            .jump("b1")
            .block("b1")
            .br("c1", "l1", "r1")
            .block("l1")
            .gep("p", "table", "i", "i64")
            .load("v", "i32", "p")
            .jump("b2")
            .block("r1")
            .jump("b2")
            .block("b2")
            .br("c2", "l2", "r2")
            .block("l2")
            .jump("exit")
            .block("r2")
            .jump("exit")
            .block("exit")
            .ret()
            .build();
    InputClassification secrets = InputClassification.parse("c1", null);
    FunctionVerification sequential = verify(model, secrets, VerifierOptions.defaults());

    List<PublicnessResult> streamed = new ArrayList<>();
    DualExecutionVerifier parallel =
        new DualExecutionVerifier(
            VerifierOptions.defaults().withParallelism(4),
            secrets,
            new QueryCache(new Z3Solver()));
    FunctionVerification concurrent = parallel.verifyAll(model, paths(model), streamed::add);

    assertEquals(sequential.results(), concurrent.results());
    assertEquals(concurrent.results(), streamed);
    assertFalse(sequential.results().isEmpty());
    assertTrue(concurrent.cacheHits() > 0, "identical queries recur across paths");
  }
}
