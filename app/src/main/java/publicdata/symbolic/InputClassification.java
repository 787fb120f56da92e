package publicdata.symbolic;

import com.google.common.base.Splitter;
import java.util.LinkedHashSet;
import java.util.Set;
import publicdata.model.ValueId;

/**
 * Which function inputs and which memory regions hold secrets; everything else is public. Entries
 * are rendered value ids ({@code key}, {@code arg1}), optionally scoped to one function as {@code
 * fn:value}.
 */
public record InputClassification(Set<String> secretInputs, Set<String> secretMemoryRoots) {

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  public InputClassification {
    secretInputs = secretInputs == null ? Set.of() : Set.copyOf(secretInputs);
    secretMemoryRoots = secretMemoryRoots == null ? Set.of() : Set.copyOf(secretMemoryRoots);
  }

  public static InputClassification allPublic() {
    return new InputClassification(Set.of(), Set.of());
  }

  /** Parses comma-separated lists as given on the command line. */
  public static InputClassification parse(String secretInputs, String secretMemoryRoots) {
    return new InputClassification(split(secretInputs), split(secretMemoryRoots));
  }

  private static Set<String> split(String raw) {
    Set<String> out = new LinkedHashSet<>();
    if (raw != null) {
      LIST_SPLITTER.split(raw).forEach(out::add);
    }
    return out;
  }

  public boolean isSecretInput(String function, ValueId value) {
    return matches(secretInputs, function, value.render());
  }

  /** True when memory reached through {@code rootName} is secret. */
  public boolean isSecretMemoryRoot(String function, String rootName) {
    return matches(secretMemoryRoots, function, rootName);
  }

  public boolean isEmpty() {
    return secretInputs.isEmpty() && secretMemoryRoots.isEmpty();
  }

  private static boolean matches(Set<String> entries, String function, String name) {
    return entries.contains(name) || entries.contains(function + ":" + name);
  }
}
