package publicdata.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.io.RecordCodec;
import publicdata.io.RecordSink;
import publicdata.paths.PathEnumerator;
import publicdata.pipeline.LoadedFunction;
import publicdata.pipeline.ModelLoader;
import publicdata.solver.QueryCache;
import publicdata.verify.DualExecutionVerifier;
import publicdata.verify.FunctionVerification;
import publicdata.verify.PublicnessResult;

/**
 * {@code verify}: checks the paths recorded in the CFG input and writes one {@code
 * path_publicness} record per (path, point, value). Functions without path records are enumerated
 * first.
 */
final class VerifyCommand {
  private static final Logger LOG = LoggerFactory.getLogger(VerifyCommand.class);

  static OptionTable options() {
    return new OptionTable()
        .inputs()
        .enumeration()
        .verification()
        .withValue("--out", (b, raw) -> b.out(Path.of(raw)));
  }

  int execute(String[] args) throws IOException {
    CliOptions options = options().parse(args);
    ModelLoader.Loaded loaded = CommandSupport.loadModels(options);
    QueryCache cache = options.queryCache();
    DualExecutionVerifier verifier =
        new DualExecutionVerifier(options.verifierOptions(), options.classification(), cache);
    PathEnumerator enumerator = new PathEnumerator(options.enumerationOptions());
    int failed = loaded.failures().size();
    try (RecordSink sink = CommandSupport.openSink(options.out())) {
      for (LoadedFunction fn : loaded.functions()) {
        List<publicdata.model.Path> paths = fn.paths();
        if (paths.isEmpty()) {
          LOG.info("{}: no path records, enumerating", fn.function());
          paths = enumerator.enumerate(fn.model()).paths();
        }
        FunctionVerification verification;
        try {
          verification = verifier.verifyAll(fn.model(), paths, r -> {});
        } catch (RuntimeException ex) {
          failed++;
          LOG.error("Verification failed for {}: {}", fn.function(), ex.getMessage(), ex);
          continue;
        }
        for (PublicnessResult r : verification.results()) {
          sink.write(RecordCodec.publicness(r));
        }
      }
    }
    LOG.info(
        "Solver: {} lookups, hit rate {}",
        cache.stats().snapshot().lookups(),
        String.format("%.2f", cache.stats().snapshot().hitRate()));
    return failed == 0 ? 0 : 1;
  }
}
