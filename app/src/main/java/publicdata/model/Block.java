package publicdata.model;

import java.util.List;
import java.util.Objects;

/** Basic block; {@code index} is its position in the owning {@link FunctionModel}. */
public record Block(String label, int index, List<Instruction> instructions, Terminator terminator) {

  public Block {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(terminator, "terminator");
    instructions = List.copyOf(instructions);
  }

  public List<String> successors() {
    return terminator.successors();
  }

  public boolean isLeaf() {
    return terminator.successors().isEmpty();
  }
}
