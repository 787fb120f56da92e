package publicdata.model;

import java.util.List;
import java.util.Objects;

/** One control transfer taken along a path. */
public sealed interface Decision
    permits Decision.Unconditional,
        Decision.Branch,
        Decision.SwitchCase,
        Decision.SwitchDefault,
        Decision.Indirect {

  /** Terminator program point; {@code null} when the block had no traced terminator. */
  ProgramPoint pp();

  /** Label of the block control moved to. */
  String successor();

  /** Wire discriminator. */
  String kind();

  record Unconditional(ProgramPoint pp, String successor) implements Decision {
    public Unconditional {
      Objects.requireNonNull(successor, "successor");
    }

    @Override
    public String kind() {
      return "uncond";
    }
  }

  record Branch(ProgramPoint pp, String successor, ValueId condition, boolean sense)
      implements Decision {
    public Branch {
      Objects.requireNonNull(successor, "successor");
      Objects.requireNonNull(condition, "condition");
    }

    @Override
    public String kind() {
      return "br";
    }
  }

  record SwitchCase(ProgramPoint pp, String successor, ValueId condition, ValueId caseValue)
      implements Decision {
    public SwitchCase {
      Objects.requireNonNull(successor, "successor");
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(caseValue, "caseValue");
    }

    @Override
    public String kind() {
      return "switch";
    }
  }

  /** Switch default; {@code cases} lists every enumerated case value in declaration order. */
  record SwitchDefault(ProgramPoint pp, String successor, ValueId condition, List<ValueId> cases)
      implements Decision {
    public SwitchDefault {
      Objects.requireNonNull(successor, "successor");
      Objects.requireNonNull(condition, "condition");
      cases = List.copyOf(cases);
    }

    @Override
    public String kind() {
      return "switch";
    }
  }

  record Indirect(ProgramPoint pp, String successor, ValueId target) implements Decision {
    public Indirect {
      Objects.requireNonNull(successor, "successor");
      Objects.requireNonNull(target, "target");
    }

    @Override
    public String kind() {
      return "indirect";
    }
  }
}
