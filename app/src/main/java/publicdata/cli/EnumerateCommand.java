package publicdata.cli;

import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.io.RecordSink;
import publicdata.paths.EnumerationResult;
import publicdata.paths.PathEnumerator;
import publicdata.pipeline.LoadedFunction;
import publicdata.pipeline.ModelLoader;

/** {@code enumerate}: trace + CFG records in, CFG with paths, coverage and summaries out. */
final class EnumerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(EnumerateCommand.class);

  static OptionTable options() {
    return new OptionTable()
        .inputs()
        .enumeration()
        .withValue("--out", (b, raw) -> b.out(Path.of(raw)));
  }

  int execute(String[] args) throws IOException {
    CliOptions options = options().parse(args);
    ModelLoader.Loaded loaded = CommandSupport.loadModels(options);
    PathEnumerator enumerator = new PathEnumerator(options.enumerationOptions());
    int paths = 0;
    try (RecordSink sink = CommandSupport.openSink(options.out())) {
      for (LoadedFunction fn : loaded.functions()) {
        EnumerationResult result = enumerator.enumerate(fn.model());
        CommandSupport.writeFunction(sink, fn.model(), fn.summary(), result);
        paths += result.paths().size();
        LOG.info(
            "{}: {} paths (truncated={})",
            fn.function(),
            result.paths().size(),
            result.summary().truncated());
      }
    }
    LOG.info("Enumerated {} paths over {} functions", paths, loaded.functions().size());
    return CommandSupport.exitCode(loaded.failures());
  }
}
