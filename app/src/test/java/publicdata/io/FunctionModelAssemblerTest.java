package publicdata.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.Terminator;
import publicdata.model.ValueId;

final class FunctionModelAssemblerTest {

  private static final String[] DIAMOND_TRACE = {
    "{\"fn\":\"f\",\"bb\":\"entry\",\"pp\":\"f:entry:i0\",\"op\":\"icmp\",\"def\":\"c\","
        + "\"uses\":[\"x\",\"const:i32:0\"],\"def_ty\":\"i1\",\"use_tys\":[\"i32\",\"i32\"],"
        + "\"icmp_pred\":\"eq\"}",
    "{\"fn\":\"f\",\"bb\":\"entry\",\"pp\":\"f:entry:i1\",\"op\":\"br\",\"uses\":[\"c\"],"
        + "\"tx\":{\"kind\":\"br.cond\"}}",
    "{\"fn\":\"f\",\"bb\":\"a\",\"pp\":\"f:a:i0\",\"op\":\"br\",\"uses\":[]}",
    "{\"fn\":\"f\",\"bb\":\"b\",\"pp\":\"f:b:i0\",\"op\":\"br\",\"uses\":[]}",
    "{\"fn\":\"f\",\"bb\":\"join\",\"pp\":\"f:join:i0\",\"op\":\"phi\",\"def\":\"m\","
        + "\"uses\":[\"const:i32:1\",\"label:a\",\"const:i32:2\",\"b\"],\"def_ty\":\"i32\"}",
    "{\"fn\":\"f\",\"bb\":\"join\",\"pp\":\"f:join:i1\",\"op\":\"ret\",\"uses\":[]}"
  };

  private static final String[] DIAMOND_CFG = {
    "{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"entry\",\"succs\":[\"a\",\"b\"],"
        + "\"term_pp\":\"f:entry:i1\",\"term_op\":\"br\",\"cond\":\"c\"}",
    "{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"a\",\"succs\":[\"join\"],\"term_op\":\"br\"}",
    "{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"b\",\"succs\":[\"join\"],\"term_op\":\"br\"}",
    "{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"join\",\"succs\":[],\"term_op\":\"ret\"}"
  };

  private static FunctionModelAssembler.Assembly assemble(
      TraceOptions options, TraceBundle trace, CfgBundle cfg, String fn) {
    return new FunctionModelAssembler(options)
        .assemble(fn, trace.instructions(fn), cfg.blocks(fn), cfg.edges(fn));
  }

  @Test
  void assemblesBlocksTerminatorsAndTaggedMerges() {
    FunctionModelAssembler.Assembly assembly =
        assemble(
            TraceOptions.unlimited(),
            Fixtures.trace(DIAMOND_TRACE),
            Fixtures.cfg(DIAMOND_CFG),
            "f");
    FunctionModel model = assembly.model();
    assertEquals(4, model.blockCount());
    assertEquals("entry", model.entry().label());
    Terminator.ConditionalBranch br =
        assertInstanceOf(Terminator.ConditionalBranch.class, model.entry().terminator());
    assertEquals("a", br.trueSuccessor());
    assertEquals(ValueId.parse("c"), br.condition());

    Instruction phi = model.block("join").instructions().get(0);
    assertTrue(phi.isMerge());
    assertEquals(List.of("a", "b"), phi.incomingBlocks());
    assertEquals(List.of(ValueId.parse("const:i32:1"), ValueId.parse("const:i32:2")), phi.operands());
    assertInstanceOf(Terminator.Leaf.class, model.block("join").terminator());

    assertEquals(6, assembly.summary().instCount());
    assertEquals(1, assembly.summary().transmitterCount());
    assertFalse(assembly.summary().traceTruncated());
    assertEquals(List.of(ValueId.parse("x")), model.inputs());
  }

  @Test
  void mergeWithoutBlockTagsKeepsEveryUseAsValue() {
    TraceBundle trace =
        Fixtures.trace(
            "{\"fn\":\"g\",\"bb\":\"e\",\"pp\":\"g:e:i0\",\"op\":\"phi\",\"def\":\"m\","
                + "\"uses\":[\"x\",\"y\"],\"def_ty\":\"i32\"}",
            "{\"fn\":\"g\",\"bb\":\"e\",\"pp\":\"g:e:i1\",\"op\":\"ret\",\"uses\":[]}");
    CfgBundle cfg = Fixtures.cfg("{\"kind\":\"block\",\"fn\":\"g\",\"bb\":\"e\",\"succs\":[]}");
    Instruction phi =
        assemble(TraceOptions.unlimited(), trace, cfg, "g").model().entry().instructions().get(0);
    assertEquals(2, phi.operands().size());
    assertEquals(Arrays.asList(null, null), phi.incomingBlocks());
  }

  @Test
  void switchCasesComeFromEdgeRecords() {
    TraceBundle trace =
        Fixtures.trace(
            "{\"fn\":\"s\",\"bb\":\"entry\",\"pp\":\"s:entry:i0\",\"op\":\"switch\","
                + "\"uses\":[\"x\"],\"use_tys\":[\"i32\"],\"tx\":{\"kind\":\"switch.cond\"}}");
    CfgBundle cfg =
        Fixtures.cfg(
            "{\"kind\":\"block\",\"fn\":\"s\",\"bb\":\"entry\",\"succs\":[\"one\",\"other\"],"
                + "\"term_pp\":\"s:entry:i0\",\"term_op\":\"switch\",\"cond\":\"x\"}",
            "{\"kind\":\"block\",\"fn\":\"s\",\"bb\":\"one\",\"succs\":[],\"term_op\":\"ret\"}",
            "{\"kind\":\"block\",\"fn\":\"s\",\"bb\":\"other\",\"succs\":[],\"term_op\":\"ret\"}",
            "{\"kind\":\"edge\",\"fn\":\"s\",\"from\":\"entry\",\"to\":\"one\",\"branch\":\"switch\","
                + "\"cond\":\"x\",\"case\":\"const:i32:1\"}",
            "{\"kind\":\"edge\",\"fn\":\"s\",\"from\":\"entry\",\"to\":\"other\",\"branch\":\"switch\","
                + "\"cond\":\"x\",\"default\":true}");
    Terminator.Switch sw =
        assertInstanceOf(
            Terminator.Switch.class,
            assemble(TraceOptions.unlimited(), trace, cfg, "s").model().entry().terminator());
    assertEquals(1, sw.cases().size());
    assertEquals("one", sw.cases().get(0).successor());
    assertEquals("other", sw.defaultSuccessor());
  }

  @Test
  void switchWithoutEdgesIsMalformed() {
    CfgBundle cfg =
        Fixtures.cfg(
            "{\"kind\":\"block\",\"fn\":\"s\",\"bb\":\"entry\",\"succs\":[\"one\"],"
                + "\"term_op\":\"switch\",\"cond\":\"x\"}",
            "{\"kind\":\"block\",\"fn\":\"s\",\"bb\":\"one\",\"succs\":[]}");
    MalformedRecordException ex =
        assertThrows(
            MalformedRecordException.class,
            () -> assemble(TraceOptions.unlimited(), new TraceBundle(), cfg, "s"));
    assertEquals(1, ex.line());
  }

  @Test
  void unknownSuccessorIsMalformed() {
    CfgBundle cfg =
        Fixtures.cfg("{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"e\",\"succs\":[\"nowhere\"]}");
    assertThrows(
        MalformedRecordException.class,
        () -> assemble(TraceOptions.unlimited(), new TraceBundle(), cfg, "f"));
  }

  @Test
  void duplicateBlockRecordIsMalformed() {
    CfgBundle cfg =
        Fixtures.cfg(
            "{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"e\",\"succs\":[]}",
            "{\"kind\":\"block\",\"fn\":\"f\",\"bb\":\"e\",\"succs\":[]}");
    MalformedRecordException ex =
        assertThrows(
            MalformedRecordException.class,
            () -> assemble(TraceOptions.unlimited(), new TraceBundle(), cfg, "f"));
    assertEquals(2, ex.line());
  }

  @Test
  void traceBudgetTruncatesAndIsReported() {
    FunctionModelAssembler.Assembly assembly =
        assemble(
            new TraceOptions(2), Fixtures.trace(DIAMOND_TRACE), Fixtures.cfg(DIAMOND_CFG), "f");
    assertTrue(assembly.model().traceTruncated());
    assertEquals(2, assembly.model().instructionCount());
    assertEquals(6, assembly.summary().instCount());
    assertEquals(2, assembly.summary().traceEmitted());
    assertTrue(assembly.summary().traceTruncated());
    assertTrue(assembly.model().block("join").instructions().isEmpty());
    assertNull(assembly.model().block("join").terminator().pp());
  }

  @Test
  void blockSeenOnlyInTraceBecomesLeaf() {
    TraceBundle trace =
        Fixtures.trace("{\"fn\":\"h\",\"bb\":\"lone\",\"pp\":\"h:lone:i0\",\"op\":\"ret\"}");
    FunctionModel model =
        assemble(TraceOptions.unlimited(), trace, new CfgBundle(), "h").model();
    assertEquals(1, model.blockCount());
    assertInstanceOf(Terminator.Leaf.class, model.entry().terminator());
    assertTrue(model.entry().successors().isEmpty());
  }
}
