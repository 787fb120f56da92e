package publicdata.testing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import publicdata.model.Block;
import publicdata.model.FunctionModel;
import publicdata.model.Instruction;
import publicdata.model.ProgramPoint;
import publicdata.model.Terminator;
import publicdata.model.Transmitter;
import publicdata.model.TransmitterKind;
import publicdata.model.ValueId;

/**
 * Fluent builder for small function models. Operands use the trace encoding ({@code x}, {@code
 * arg0}, {@code const:i32:1}); every terminator helper also appends the terminator instruction so
 * program points line up with what the front end emits.
 */
public final class FunctionModels {

  private FunctionModels() {}

  public static Builder function(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private final List<BlockBuilder> blocks = new ArrayList<>();
    private boolean truncated;

    private Builder(String name) {
      this.name = name;
    }

    public BlockBuilder block(String label) {
      BlockBuilder b = new BlockBuilder(this, label, blocks.size());
      blocks.add(b);
      return b;
    }

    public Builder truncated() {
      this.truncated = true;
      return this;
    }

    public FunctionModel build() {
      List<Block> built = new ArrayList<>();
      for (BlockBuilder b : blocks) {
        built.add(b.toBlock());
      }
      return new FunctionModel(name, built, truncated);
    }
  }

  public static final class BlockBuilder {
    private final Builder parent;
    private final String label;
    private final int index;
    private final List<Instruction> instructions = new ArrayList<>();
    private Terminator terminator;

    private BlockBuilder(Builder parent, String label, int index) {
      this.parent = parent;
      this.label = label;
      this.index = index;
    }

    private ProgramPoint nextPp() {
      return ProgramPoint.of(parent.name, label, instructions.size());
    }

    private BlockBuilder add(
        String opcode,
        String def,
        String defType,
        List<String> operands,
        List<String> incoming,
        List<String> types,
        String predicate,
        Transmitter tx) {
      List<ValueId> ids = new ArrayList<>();
      for (String raw : operands) {
        ids.add(ValueId.parse(raw));
      }
      instructions.add(
          new Instruction(
              nextPp(),
              opcode,
              def == null ? null : ValueId.parse(def),
              ids,
              incoming,
              defType,
              types,
              predicate,
              tx));
      return this;
    }

    /** Generic instruction with untyped operands. */
    public BlockBuilder op(String opcode, String def, String defType, String... operands) {
      return add(opcode, def, defType, Arrays.asList(operands), null, null, null, null);
    }

    /** Binary or cast instruction whose operands all have {@code type}. */
    public BlockBuilder typed(String opcode, String def, String type, String... operands) {
      List<String> types = new ArrayList<>();
      for (int i = 0; i < operands.length; i++) {
        types.add(type);
      }
      return add(opcode, def, type, Arrays.asList(operands), null, types, null, null);
    }

    public BlockBuilder icmp(String def, String predicate, String type, String left, String right) {
      return add(
          "icmp", def, "i1", List.of(left, right), null, List.of(type, type), predicate, null);
    }

    public BlockBuilder gep(String def, String base, String index, String indexType) {
      return add(
          "getelementptr", def, "ptr", List.of(base, index), null, List.of("ptr", indexType), null,
          null);
    }

    public BlockBuilder load(String def, String type, String address) {
      return add(
          "load", def, type, List.of(address), null, List.of("ptr"), null,
          Transmitter.of(TransmitterKind.LOAD_ADDRESS));
    }

    public BlockBuilder store(String type, String value, String address) {
      return add(
          "store", null, null, List.of(value, address), null, List.of(type, "ptr"), null,
          Transmitter.of(TransmitterKind.STORE_ADDRESS));
    }

    /** Merge; {@code pairs} alternates incoming value and predecessor label. */
    public BlockBuilder phi(String def, String type, String... pairs) {
      List<String> values = new ArrayList<>();
      List<String> blocks = new ArrayList<>();
      List<String> types = new ArrayList<>();
      for (int i = 0; i + 1 < pairs.length; i += 2) {
        values.add(pairs[i]);
        blocks.add(pairs[i + 1]);
        types.add(type);
      }
      return add(Instruction.PHI, def, type, values, blocks, types, null, null);
    }

    public BlockBuilder jump(String target) {
      ProgramPoint pp = nextPp();
      add("br", null, null, List.of(), null, null, null, null);
      terminator = new Terminator.Jump(pp, "br", List.of(target));
      return this;
    }

    public BlockBuilder br(String condition, String whenTrue, String whenFalse) {
      ProgramPoint pp = nextPp();
      add(
          "br", null, null, List.of(condition), null, List.of("i1"), null,
          Transmitter.of(TransmitterKind.BRANCH_CONDITION));
      terminator =
          new Terminator.ConditionalBranch(pp, ValueId.parse(condition), whenTrue, whenFalse);
      return this;
    }

    /** Switch; {@code cases} alternates case constant and successor label. */
    public BlockBuilder switchOn(String condition, String type, String defaultTarget, String... cases) {
      ProgramPoint pp = nextPp();
      add(
          "switch", null, null, List.of(condition), null, List.of(type), null,
          Transmitter.of(TransmitterKind.SWITCH_CONDITION));
      List<Terminator.SwitchCase> built = new ArrayList<>();
      for (int i = 0; i + 1 < cases.length; i += 2) {
        built.add(new Terminator.SwitchCase(ValueId.parse(cases[i]), cases[i + 1]));
      }
      terminator = new Terminator.Switch(pp, ValueId.parse(condition), built, defaultTarget);
      return this;
    }

    public BlockBuilder indirect(String target, String... successors) {
      ProgramPoint pp = nextPp();
      add(
          "indirectbr", null, null, List.of(target), null, List.of("ptr"), null,
          Transmitter.of(TransmitterKind.INDIRECT_TARGET));
      terminator = new Terminator.Indirect(pp, ValueId.parse(target), List.of(successors));
      return this;
    }

    public BlockBuilder ret() {
      ProgramPoint pp = nextPp();
      add("ret", null, null, List.of(), null, null, null, null);
      terminator = new Terminator.Leaf(pp, "ret");
      return this;
    }

    public BlockBuilder block(String next) {
      return parent.block(next);
    }

    public FunctionModel build() {
      return parent.build();
    }

    private Block toBlock() {
      Terminator t =
          terminator != null
              ? terminator
              : new Terminator.Leaf(
                  instructions.isEmpty() ? null : instructions.get(instructions.size() - 1).pp(),
                  null);
      return new Block(label, index, instructions, t);
    }
  }
}
