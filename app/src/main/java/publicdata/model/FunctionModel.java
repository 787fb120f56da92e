package publicdata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-function program model. Blocks live in an index-addressed arena (entry block at
 * index 0) and successors are resolved to indices once, so traversal never chases labels. Every
 * non-constant value receives a small integer handle for dense per-execution bindings.
 */
public final class FunctionModel {

  private final String name;
  private final List<Block> blocks;
  private final Map<String, Integer> blockIndex;
  private final int[][] successorIndices;
  private final Map<ProgramPoint, Instruction> instructionsByPp;
  private final Map<ValueId, Integer> valueHandles;
  private final List<ValueId> inputs;
  private final boolean traceTruncated;

  public FunctionModel(String name, List<Block> blocks, boolean traceTruncated) {
    this.name = Objects.requireNonNull(name, "name");
    this.blocks = List.copyOf(blocks);
    this.traceTruncated = traceTruncated;
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < this.blocks.size(); i++) {
      Block block = this.blocks.get(i);
      if (block.index() != i) {
        throw new IllegalArgumentException(
            "Block " + block.label() + " has index " + block.index() + " but sits at " + i);
      }
      if (index.putIfAbsent(block.label(), i) != null) {
        throw new IllegalArgumentException("Duplicate block label " + block.label() + " in " + name);
      }
    }
    this.blockIndex = Collections.unmodifiableMap(index);
    this.successorIndices = new int[this.blocks.size()][];
    for (Block block : this.blocks) {
      List<String> succ = block.successors();
      int[] resolved = new int[succ.size()];
      for (int s = 0; s < succ.size(); s++) {
        Integer target = index.get(succ.get(s));
        if (target == null) {
          throw new IllegalArgumentException(
              "Block " + block.label() + " in " + name + " names unknown successor " + succ.get(s));
        }
        resolved[s] = target;
      }
      successorIndices[block.index()] = resolved;
    }

    Map<ProgramPoint, Instruction> byPp = new HashMap<>();
    Map<ValueId, Integer> handles = new LinkedHashMap<>();
    Set<ValueId> defined = new LinkedHashSet<>();
    Set<ValueId> used = new LinkedHashSet<>();
    for (Block block : this.blocks) {
      for (Instruction inst : block.instructions()) {
        if (byPp.put(inst.pp(), inst) != null) {
          throw new IllegalArgumentException("Duplicate program point " + inst.pp().key());
        }
        if (inst.hasDef()) {
          defined.add(inst.def());
          handles.putIfAbsent(inst.def(), handles.size());
        }
        for (ValueId op : inst.operands()) {
          if (!op.isConstant()) {
            used.add(op);
            handles.putIfAbsent(op, handles.size());
          }
        }
      }
      for (ValueId op : terminatorOperands(block.terminator())) {
        if (!op.isConstant()) {
          used.add(op);
          handles.putIfAbsent(op, handles.size());
        }
      }
    }
    used.removeAll(defined);
    this.instructionsByPp = Collections.unmodifiableMap(byPp);
    this.valueHandles = Collections.unmodifiableMap(handles);
    this.inputs = List.copyOf(used);
  }

  private static List<ValueId> terminatorOperands(Terminator terminator) {
    if (terminator instanceof Terminator.ConditionalBranch br) {
      return List.of(br.condition());
    }
    if (terminator instanceof Terminator.Switch sw) {
      return List.of(sw.condition());
    }
    if (terminator instanceof Terminator.Indirect ind) {
      return List.of(ind.target());
    }
    return List.of();
  }

  public String name() {
    return name;
  }

  public List<Block> blocks() {
    return blocks;
  }

  public int blockCount() {
    return blocks.size();
  }

  public Block entry() {
    if (blocks.isEmpty()) {
      throw new IllegalStateException("Function " + name + " has no blocks");
    }
    return blocks.get(0);
  }

  public Block block(int index) {
    return blocks.get(index);
  }

  /** Block by label, or {@code null}. */
  public Block block(String label) {
    Integer i = blockIndex.get(label);
    return i == null ? null : blocks.get(i);
  }

  public int blockIndex(String label) {
    Integer i = blockIndex.get(label);
    return i == null ? -1 : i;
  }

  /** Successor indices in declaration order. */
  public int[] successorIndices(int blockIndex) {
    return successorIndices[blockIndex].clone();
  }

  public List<Block> successors(Block block) {
    int[] succ = successorIndices[block.index()];
    List<Block> out = new ArrayList<>(succ.length);
    for (int s : succ) {
      out.add(blocks.get(s));
    }
    return out;
  }

  public Instruction instruction(ProgramPoint pp) {
    return instructionsByPp.get(pp);
  }

  public int instructionCount() {
    return instructionsByPp.size();
  }

  public int transmitterCount() {
    int count = 0;
    for (Instruction inst : instructionsByPp.values()) {
      if (inst.isTransmitter()) {
        count++;
      }
    }
    return count;
  }

  /** Dense handle for a non-constant value, or -1. */
  public int valueHandle(ValueId value) {
    Integer h = valueHandles.get(value);
    return h == null ? -1 : h;
  }

  public int valueCount() {
    return valueHandles.size();
  }

  /** Non-constant values that are used but never defined, in first-use order. */
  public List<ValueId> inputs() {
    return inputs;
  }

  public boolean traceTruncated() {
    return traceTruncated;
  }

  @Override
  public String toString() {
    return "FunctionModel{" + name + ", blocks=" + blocks.size() + "}";
  }
}
