package publicdata.paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import publicdata.cond.PathCondFormat;
import publicdata.model.Decision;
import publicdata.model.FunctionModel;
import publicdata.model.Path;
import publicdata.model.PathSummary;
import publicdata.model.PpCoverage;
import publicdata.model.ProgramPoint;
import publicdata.testing.FunctionModels;

final class PathEnumeratorTest {

  /** Three consecutive diamonds: eight paths of seven blocks. */
  private static FunctionModel diamonds() {
    return FunctionModels.function("d")
        .block("b0")
        .br("c0", "l0", "r0")
        .block("l0")
        .jump("b1")
        .block("r0")
        .jump("b1")
        .block("b1")
        .br("c1", "l1", "r1")
        .block("l1")
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
  }

  /** Rotated loop: entry, then a body that either repeats or exits. */
  private static FunctionModel loop() {
    return FunctionModels.function("loop")
        .block("entry")
        .jump("body")
        .block("body")
        .phi("i", "i32", "const:i32:0", "entry", "i.next", "body")
        .typed("add", "acc.next", "i32", "acc", "i")
        .typed("add", "i.next", "i32", "i", "const:i32:1")
        .icmp("more", "slt", "i32", "i.next", "n")
        .br("more", "body", "exit")
        .block("exit")
        .ret()
        .build();
  }

  @Test
  void enumeratesEveryPathWithinBudgets() {
    EnumerationResult result = new PathEnumerator(EnumerationOptions.defaults()).enumerate(diamonds());
    assertEquals(8, result.paths().size());
    assertFalse(result.summary().anyCutoff());
    assertEquals(8, result.summary().dfsLeaves());
  }

  @Test
  void respectsPathAndDepthBudgets() {
    FunctionModel model = diamonds();
    for (int maxPaths = 0; maxPaths <= 9; maxPaths++) {
      for (int depth = 1; depth <= 8; depth++) {
        EnumerationOptions options =
            EnumerationOptions.defaults().withBudgets(maxPaths, depth, 0);
        EnumerationResult result = new PathEnumerator(options).enumerate(model);
        assertTrue(result.paths().size() <= maxPaths, "paths within " + maxPaths);
        for (Path p : result.paths()) {
          assertTrue(p.blocks().size() <= depth, "depth within " + depth);
        }
        if (maxPaths > 0 && depth < 7) {
          assertTrue(result.paths().isEmpty());
          assertTrue(result.summary().cutoffDepth());
        }
      }
    }
  }

  @Test
  void truncationIsReportedNotThrown() {
    EnumerationOptions options = EnumerationOptions.defaults().withBudgets(3, 256, 0);
    PathSummary summary = new PathEnumerator(options).enumerate(diamonds()).summary();
    assertEquals(3, summary.pathsEmitted());
    assertTrue(summary.truncated());
    assertTrue(summary.pruneMaxPaths() > 0);
  }

  @Test
  void decisionsLineUpWithBlocks() {
    for (Path p : new PathEnumerator(EnumerationOptions.defaults()).enumerate(diamonds()).paths()) {
      assertEquals(p.blocks().size() - 1, p.decisions().size());
      for (int k = 0; k < p.decisions().size(); k++) {
        assertEquals(p.blocks().get(k + 1), p.decisions().get(k).successor());
      }
    }
  }

  @Test
  void loopWithoutIterationsVisitsBodyOnce() {
    EnumerationResult result = new PathEnumerator(EnumerationOptions.defaults()).enumerate(loop());
    assertEquals(1, result.paths().size());
    assertEquals(List.of("entry", "body", "exit"), result.paths().get(0).blocks());
    assertTrue(result.summary().cutoffLoop());
    assertEquals(1, result.summary().pruneLoop());
  }

  @Test
  void loopIterationBudgetAllowsRepeats() {
    EnumerationOptions options = EnumerationOptions.defaults().withBudgets(200, 256, 2);
    List<Path> paths = new PathEnumerator(options).enumerate(loop()).paths();
    assertEquals(3, paths.size());
    assertEquals(List.of("entry", "body", "body", "body", "exit"), paths.get(0).blocks());
    assertEquals(List.of("entry", "body", "exit"), paths.get(2).blocks());
  }

  @Test
  void constantBranchFollowsOneSide() {
    FunctionModel model =
        FunctionModels.function("k")
            .block("entry")
            .br("const:i1:0", "then", "else")
            .block("then")
            .ret()
            .block("else")
            .ret()
            .build();
    EnumerationResult result = new PathEnumerator(EnumerationOptions.defaults()).enumerate(model);
    assertEquals(1, result.paths().size());
    assertEquals("else", result.paths().get(0).leaf());
    assertEquals(1, result.summary().constPrunedBranch());
    Decision.Branch taken = (Decision.Branch) result.paths().get(0).decisions().get(0);
    assertFalse(taken.sense());
  }

  @Test
  void constantSwitchKeepsOnlyMatchingCase() {
    FunctionModel model =
        FunctionModels.function("s")
            .block("entry")
            .switchOn("const:i32:2", "i32", "dflt", "const:i32:1", "one", "const:i32:2", "two")
            .block("one")
            .ret()
            .block("two")
            .ret()
            .block("dflt")
            .ret()
            .build();
    EnumerationResult result = new PathEnumerator(EnumerationOptions.defaults()).enumerate(model);
    assertEquals(1, result.paths().size());
    assertEquals(List.of("entry", "two"), result.paths().get(0).blocks());
    assertEquals(1, result.summary().constPrunedSwitch());
    assertInstanceOf(Decision.SwitchCase.class, result.paths().get(0).decisions().get(0));
  }

  @Test
  void unmatchedConstantSwitchTakesDefault() {
    FunctionModel model =
        FunctionModels.function("s")
            .block("entry")
            .switchOn("const:i32:9", "i32", "dflt", "const:i32:1", "one")
            .block("one")
            .ret()
            .block("dflt")
            .ret()
            .build();
    List<Path> paths = new PathEnumerator(EnumerationOptions.defaults()).enumerate(model).paths();
    assertEquals(1, paths.size());
    assertEquals("dflt", paths.get(0).leaf());
  }

  @Test
  void unmatchedConstantSwitchWithoutDefaultEndsThePath() {
    FunctionModel model =
        FunctionModels.function("s")
            .block("entry")
            .switchOn("const:i32:9", "i32", null, "const:i32:1", "one")
            .block("one")
            .ret()
            .build();
    EnumerationResult result = new PathEnumerator(EnumerationOptions.defaults()).enumerate(model);
    assertEquals(1, result.paths().size());
    assertEquals(List.of("entry"), result.paths().get(0).blocks());
    assertTrue(result.paths().get(0).decisions().isEmpty());
    assertEquals(1, result.summary().constPrunedSwitch());
    assertEquals(1, result.summary().pathsEmitted());
  }

  @Test
  void knownIndirectTargetIsPruned() {
    FunctionModel model =
        FunctionModels.function("ind")
            .block("entry")
            .indirect("const:blockaddress(@ind, %b)", "a", "b")
            .block("a")
            .ret()
            .block("b")
            .ret()
            .build();
    EnumerationResult result = new PathEnumerator(EnumerationOptions.defaults()).enumerate(model);
    assertEquals(1, result.paths().size());
    assertEquals("b", result.paths().get(0).leaf());
    assertEquals(1, result.summary().constPrunedIndirect());
  }

  @Test
  void unknownIndirectTargetFollowsEverySuccessor() {
    FunctionModel model =
        FunctionModels.function("ind")
            .block("entry")
            .indirect("t", "a", "b")
            .block("a")
            .ret()
            .block("b")
            .ret()
            .build();
    EnumerationOptions options = EnumerationOptions.defaults().withFormat(PathCondFormat.STRING);
    List<Path> paths = new PathEnumerator(options).enumerate(model).paths();
    assertEquals(2, paths.size());
    assertEquals(List.of("t==label:a"), paths.get(0).conditionText());
  }

  @Test
  void disabledEnumerationReportsDisabledSummary() {
    EnumerationOptions options = EnumerationOptions.defaults().withBudgets(0, 256, 0);
    EnumerationResult result = new PathEnumerator(options).enumerate(diamonds());
    assertTrue(result.paths().isEmpty());
    assertTrue(result.summary().disabled());
  }

  @Test
  void sinkSeesPathsAsTheyAreFound() {
    List<Integer> seen = new ArrayList<>();
    new PathEnumerator(EnumerationOptions.defaults()).enumerate(diamonds(), p -> seen.add(p.id()));
    assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), seen);
  }

  @Test
  void enumerationIsDeterministic() {
    EnumerationOptions options = EnumerationOptions.defaults().withFormat(PathCondFormat.BOTH);
    List<Path> first = new PathEnumerator(options).enumerate(diamonds()).paths();
    List<Path> second = new PathEnumerator(options).enumerate(diamonds()).paths();
    assertEquals(first, second);
  }

  @Test
  void coverageCapsPathIdsAndCountsEveryPath() {
    EnumerationOptions options =
        new EnumerationOptions(200, 256, 0, PathCondFormat.STRING, true, true, 3);
    EnumerationResult result = new PathEnumerator(options).enumerate(diamonds());
    PpCoverage entry =
        result.coverage().stream()
            .filter(c -> c.pp().equals(ProgramPoint.of("d", "b0", 0)))
            .findFirst()
            .orElseThrow();
    assertEquals(8, entry.pathCount());
    assertEquals(List.of(0, 1, 2), entry.pathIds());
    assertTrue(entry.truncated());
    assertFalse(result.paths().get(0).ppSeq().isEmpty());
  }
}
