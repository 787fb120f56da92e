package publicdata.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Control-transfer shape of a block's last instruction. */
public sealed interface Terminator
    permits Terminator.Leaf,
        Terminator.Jump,
        Terminator.ConditionalBranch,
        Terminator.Switch,
        Terminator.Indirect {

  /** Program point of the terminator, {@code null} when the block has none in the trace. */
  ProgramPoint pp();

  /** Successor labels in declaration order, duplicates preserved. */
  List<String> successors();

  /** Return, unreachable, or no traced terminator at all. */
  record Leaf(ProgramPoint pp, String opcode) implements Terminator {
    @Override
    public List<String> successors() {
      return List.of();
    }
  }

  /**
   * Unconditional transfer, or any multi-successor terminator whose selection is not modeled
   * (every successor is taken with no constraint).
   */
  record Jump(ProgramPoint pp, String opcode, List<String> successors) implements Terminator {
    public Jump {
      successors = List.copyOf(successors);
    }
  }

  record ConditionalBranch(
      ProgramPoint pp, ValueId condition, String trueSuccessor, String falseSuccessor)
      implements Terminator {
    public ConditionalBranch {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(trueSuccessor, "trueSuccessor");
      Objects.requireNonNull(falseSuccessor, "falseSuccessor");
    }

    @Override
    public List<String> successors() {
      return List.of(trueSuccessor, falseSuccessor);
    }
  }

  record Switch(
      ProgramPoint pp, ValueId condition, List<SwitchCase> cases, String defaultSuccessor)
      implements Terminator {
    public Switch {
      Objects.requireNonNull(condition, "condition");
      cases = List.copyOf(cases);
    }

    public List<ValueId> caseValues() {
      List<ValueId> values = new ArrayList<>(cases.size());
      for (SwitchCase c : cases) {
        values.add(c.value());
      }
      return values;
    }

    @Override
    public List<String> successors() {
      List<String> out = new ArrayList<>(cases.size() + 1);
      if (defaultSuccessor != null) {
        out.add(defaultSuccessor);
      }
      for (SwitchCase c : cases) {
        out.add(c.successor());
      }
      return out;
    }
  }

  record Indirect(ProgramPoint pp, ValueId target, List<String> successors)
      implements Terminator {
    public Indirect {
      Objects.requireNonNull(target, "target");
      successors = List.copyOf(successors);
    }
  }

  record SwitchCase(ValueId value, String successor) {
    public SwitchCase {
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(successor, "successor");
    }
  }
}
