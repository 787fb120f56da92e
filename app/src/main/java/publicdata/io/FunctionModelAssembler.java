package publicdata.io;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.model.Block;
import publicdata.model.FuncSummary;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.ProgramPoint;
import publicdata.model.Terminator;
import publicdata.model.ValueId;

/**
 * Builds {@link FunctionModel}s from instruction-trace records plus CFG {@code block} / {@code
 * edge} records. Block order follows the block records (entry first), then any block seen only in
 * the trace. A block without a block record has no known successors and becomes a leaf.
 */
public final class FunctionModelAssembler {

  private static final Logger LOG = LoggerFactory.getLogger(FunctionModelAssembler.class);

  private final TraceOptions traceOptions;

  public FunctionModelAssembler(TraceOptions traceOptions) {
    this.traceOptions = Objects.requireNonNull(traceOptions, "traceOptions");
  }

  /** Assembled model together with its trace statistics. */
  public record Assembly(FunctionModel model, FuncSummary summary) {}

  public Assembly assemble(
      String function, List<TraceRecord> trace, List<BlockRecord> blocks, List<EdgeRecord> edges) {
    Objects.requireNonNull(function, "function");
    int maxInst = traceOptions.maxInst();
    boolean truncated = maxInst > 0 && trace.size() > maxInst;
    List<TraceRecord> kept = truncated ? trace.subList(0, maxInst) : trace;
    if (truncated) {
      LOG.warn("{}: trace truncated to {} of {} instructions", function, maxInst, trace.size());
    }

    Map<String, BlockRecord> blockRecords = new LinkedHashMap<>();
    for (BlockRecord b : blocks) {
      if (blockRecords.putIfAbsent(b.block(), b) != null) {
        throw new MalformedRecordException(
            "Duplicate block record " + b.block() + " in " + function, b.line(), "bb");
      }
    }
    Map<String, List<TraceRecord>> byBlock = new LinkedHashMap<>();
    for (BlockRecord b : blocks) {
      byBlock.put(b.block(), new ArrayList<>());
    }
    for (TraceRecord r : kept) {
      byBlock.computeIfAbsent(r.block(), k -> new ArrayList<>()).add(r);
    }
    Set<String> labels = new HashSet<>(byBlock.keySet());
    Map<String, List<EdgeRecord>> edgesByBlock = new LinkedHashMap<>();
    for (EdgeRecord e : edges) {
      edgesByBlock.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e);
    }

    List<Block> assembled = new ArrayList<>(byBlock.size());
    int index = 0;
    for (Map.Entry<String, List<TraceRecord>> entry : byBlock.entrySet()) {
      String label = entry.getKey();
      List<Instruction> instructions = new ArrayList<>(entry.getValue().size());
      for (TraceRecord r : entry.getValue()) {
        instructions.add(instruction(r, labels));
      }
      BlockRecord record = blockRecords.get(label);
      Terminator terminator;
      if (record == null) {
        LOG.warn("{}: no block record for {}, treating it as a leaf", function, label);
        terminator = new Terminator.Leaf(lastPp(instructions), null);
      } else {
        terminator =
            terminator(function, record, edgesByBlock.getOrDefault(label, List.of()), instructions);
      }
      assembled.add(new Block(label, index++, instructions, terminator));
    }

    FunctionModel model;
    try {
      model = new FunctionModel(function, assembled, truncated);
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException(ex.getMessage(), 0, null, ex);
    }
    int tx = 0;
    for (TraceRecord r : kept) {
      if (r.transmitter() != null) {
        tx++;
      }
    }
    FuncSummary summary =
        new FuncSummary(
            function, trace.size(), model.blockCount(), tx, kept.size(), truncated, maxInst);
    return new Assembly(model, summary);
  }

  private static Instruction instruction(TraceRecord r, Set<String> labels) {
    List<ValueId> operands = new ArrayList<>(r.uses().size());
    List<String> incoming = null;
    if (Instruction.PHI.equals(r.opcode())) {
      incoming = new ArrayList<>();
      if (isTaggedMerge(r.uses(), labels)) {
        for (int i = 0; i < r.uses().size(); i += 2) {
          operands.add(RecordCodec.value(r.uses().get(i), "uses", r.line()));
          incoming.add(stripLabel(r.uses().get(i + 1)));
        }
      } else {
        for (String use : r.uses()) {
          operands.add(RecordCodec.value(use, "uses", r.line()));
          incoming.add(null);
        }
      }
    } else {
      for (String use : r.uses()) {
        operands.add(RecordCodec.value(use, "uses", r.line()));
      }
    }
    ValueId def = r.def() == null || r.def().isEmpty() ? null : RecordCodec.value(r.def(), "def", r.line());
    String predicate = r.icmpPredicate() != null ? r.icmpPredicate() : r.fcmpPredicate();
    try {
      return new Instruction(
          r.pp(),
          r.opcode(),
          def,
          operands,
          incoming,
          r.defType(),
          r.useTypes(),
          predicate,
          r.transmitter());
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException(ex.getMessage(), r.line(), null, ex);
    }
  }

  /** Merge uses alternate value and block label when every odd entry names a block. */
  private static boolean isTaggedMerge(List<String> uses, Set<String> labels) {
    if (uses.isEmpty() || uses.size() % 2 != 0) {
      return false;
    }
    for (int i = 1; i < uses.size(); i += 2) {
      if (!labels.contains(stripLabel(uses.get(i)))) {
        return false;
      }
    }
    return true;
  }

  private static String stripLabel(String raw) {
    return raw.startsWith(ValueId.LABEL_PREFIX) ? raw.substring(ValueId.LABEL_PREFIX.length()) : raw;
  }

  private static Terminator terminator(
      String function, BlockRecord record, List<EdgeRecord> edges, List<Instruction> instructions) {
    ProgramPoint pp =
        record.terminatorPp() == null
            ? lastPp(instructions)
            : RecordCodec.parsePp(record.terminatorPp(), "term_pp", record.line());
    String op = record.terminatorOp();
    List<String> succs = record.successors();
    if (succs.isEmpty()) {
      return new Terminator.Leaf(pp, op);
    }
    if ("br".equals(op) && record.condition() != null) {
      if (succs.size() != 2) {
        throw new MalformedRecordException(
            "Conditional branch in " + function + ":" + record.block() + " needs two successors",
            record.line(),
            "succs");
      }
      return new Terminator.ConditionalBranch(
          pp, RecordCodec.value(record.condition(), "cond", record.line()), succs.get(0), succs.get(1));
    }
    if ("switch".equals(op)) {
      if (record.condition() == null) {
        throw new MalformedRecordException("Switch without condition", record.line(), "cond");
      }
      return switchTerminator(record, edges, pp);
    }
    if ("indirectbr".equals(op)) {
      if (record.target() == null) {
        throw new MalformedRecordException("Indirect branch without target", record.line(), "target");
      }
      return new Terminator.Indirect(
          pp, RecordCodec.value(record.target(), "target", record.line()), succs);
    }
    return new Terminator.Jump(pp, op, succs);
  }

  private static Terminator switchTerminator(
      BlockRecord record, List<EdgeRecord> edges, ProgramPoint pp) {
    ValueId cond = RecordCodec.value(record.condition(), "cond", record.line());
    List<Terminator.SwitchCase> cases = new ArrayList<>();
    String defaultSucc = null;
    boolean sawSwitchEdge = false;
    for (EdgeRecord e : edges) {
      if (!EdgeRecord.SWITCH.equals(e.branch())) {
        continue;
      }
      sawSwitchEdge = true;
      if (e.isDefault()) {
        defaultSucc = e.to();
      } else {
        if (e.caseValue() == null) {
          throw new MalformedRecordException("Switch edge without case value", e.line(), "case");
        }
        cases.add(
            new Terminator.SwitchCase(RecordCodec.value(e.caseValue(), "case", e.line()), e.to()));
      }
    }
    if (!sawSwitchEdge) {
      throw new MalformedRecordException(
          "Switch in " + record.function() + ":" + record.block() + " has no edge records",
          record.line(),
          "succs");
    }
    return new Terminator.Switch(pp, cond, cases, defaultSucc);
  }

  private static ProgramPoint lastPp(List<Instruction> instructions) {
    return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1).pp();
  }
}
