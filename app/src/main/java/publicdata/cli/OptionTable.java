package publicdata.cli;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import publicdata.aggregate.MissingResultPolicy;
import publicdata.cond.PathCondFormat;
import publicdata.solver.SolverKind;

/**
 * Per-command table of accepted flags. Accepts {@code --opt value} and {@code --opt=value}; flags
 * without a value are switches.
 */
final class OptionTable {

  private final Map<String, OptionSpec> specs = new LinkedHashMap<>();

  OptionTable withValue(String option, BiConsumer<CliOptions.Builder, String> consumer) {
    specs.put(option, new OptionSpec(true, consumer));
    return this;
  }

  OptionTable flag(String option, Consumer<CliOptions.Builder> consumer) {
    specs.put(option, new OptionSpec(false, (builder, ignored) -> consumer.accept(builder)));
    return this;
  }

  Set<String> options() {
    return specs.keySet();
  }

  OptionTable inputs() {
    return withValue("--trace", (b, raw) -> b.trace(Path.of(raw)))
        .withValue("--cfg", (b, raw) -> b.cfg(Path.of(raw)))
        .withValue("--function", (b, raw) -> b.function(raw))
        .withValue(
            "--max-inst", (b, raw) -> b.maxInst(CliParsers.parseInt(raw, "--max-inst")));
  }

  OptionTable enumeration() {
    return withValue(
            "--max-paths", (b, raw) -> b.maxPaths(CliParsers.parseInt(raw, "--max-paths")))
        .withValue(
            "--max-path-depth",
            (b, raw) -> b.maxPathDepth(CliParsers.parseInt(raw, "--max-path-depth")))
        .withValue(
            "--max-loop-iters",
            (b, raw) -> b.maxLoopIters(CliParsers.parseInt(raw, "--max-loop-iters")))
        .withValue("--path-cond", (b, raw) -> b.pathCondFormat(PathCondFormat.parse(raw)))
        .flag("--pp-seq", b -> b.ppSeq(true))
        .flag("--pp-coverage", b -> b.ppCoverage(true))
        .withValue(
            "--max-pp-path-ids",
            (b, raw) -> b.maxPpPathIds(CliParsers.parseInt(raw, "--max-pp-path-ids")));
  }

  OptionTable verification() {
    return withValue("--secret", (b, raw) -> b.secretInputs(raw))
        .withValue("--secret-memory", (b, raw) -> b.secretMemory(raw))
        .withValue(
            "--solver-timeout-ms",
            (b, raw) -> b.solverTimeoutMs(CliParsers.parseLong(raw, "--solver-timeout-ms")))
        .withValue(
            "--parallelism",
            (b, raw) -> b.parallelism(CliParsers.parseInt(raw, "--parallelism")))
        .withValue(
            "--pointer-width",
            (b, raw) -> b.pointerWidth(CliParsers.parseInt(raw, "--pointer-width")))
        .withValue("--solver", (b, raw) -> b.solver(SolverKind.parse(raw)))
        .flag("--check-definitions", b -> b.checkDefinitions(true))
        .flag("--no-control-divergence", b -> b.controlDivergence(false));
  }

  OptionTable aggregation() {
    return withValue("--missing", (b, raw) -> b.missingPolicy(MissingResultPolicy.parse(raw)));
  }

  CliOptions parse(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = args[++i];
        }
      } else if (value != null) {
        throw new IllegalArgumentException(parsed.option() + " does not take a value");
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
