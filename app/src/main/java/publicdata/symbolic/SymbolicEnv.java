package publicdata.symbolic;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Bindings and memory of one execution along one path. */
public final class SymbolicEnv {

  private final Execution execution;
  private final Term[] bindings;
  private final Map<String, Term> memory = new HashMap<>();
  private boolean memoryClobbered;
  private int opaqueCounter;

  SymbolicEnv(Execution execution, int valueCount) {
    this.execution = Objects.requireNonNull(execution, "execution");
    this.bindings = new Term[valueCount];
  }

  public Execution execution() {
    return execution;
  }

  Term binding(int handle) {
    return handle < 0 ? null : bindings[handle];
  }

  void bind(int handle, Term value) {
    if (handle >= 0) {
      bindings[handle] = value;
    }
  }

  Term memory(String addressKey) {
    return memory.get(addressKey);
  }

  void store(String addressKey, Term value) {
    memory.put(addressKey, value);
  }

  /** Set after a store through an address the interpreter cannot model. */
  boolean memoryClobbered() {
    return memoryClobbered;
  }

  void clobberMemory() {
    memoryClobbered = true;
  }

  String nextOpaqueId(String site) {
    return execution.name() + ":" + site + ":" + opaqueCounter++;
  }
}
