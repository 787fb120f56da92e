package publicdata.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.aggregate.AggregatedPublicness;
import publicdata.io.RecordCodec;
import publicdata.io.RecordSink;
import publicdata.model.FuncSummary;
import publicdata.model.FunctionModel;
import publicdata.pipeline.BatchAnalyzer;
import publicdata.pipeline.FunctionAnalysis;
import publicdata.pipeline.LoadedFunction;
import publicdata.pipeline.ModelLoader;
import publicdata.verify.PublicnessResult;

/**
 * {@code analyze}: enumeration, verification and aggregation in one run. Writes {@code
 * cfg.ndjson}, {@code publicness.ndjson} and {@code public_at_point.ndjson} under {@code
 * --out-dir}, functions in input order.
 */
final class AnalyzeCommand {
  private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

  static final String CFG_FILE = "cfg.ndjson";
  static final String PUBLICNESS_FILE = "publicness.ndjson";
  static final String AGGREGATE_FILE = "public_at_point.ndjson";

  static OptionTable options() {
    return new OptionTable()
        .inputs()
        .enumeration()
        .verification()
        .aggregation()
        .withValue("--jobs", (b, raw) -> b.jobs(CliParsers.parseInt(raw, "--jobs")))
        .withValue("--out-dir", (b, raw) -> b.outDir(Path.of(raw)));
  }

  int execute(String[] args) throws IOException {
    CliOptions options = options().parse(args);
    if (options.outDir() == null) {
      throw new IllegalArgumentException("Missing required option --out-dir");
    }
    ModelLoader.Loaded loaded = CommandSupport.loadModels(options);
    Map<String, FuncSummary> summaries = new HashMap<>();
    List<FunctionModel> models =
        loaded.functions().stream().map(LoadedFunction::model).collect(Collectors.toList());
    for (LoadedFunction fn : loaded.functions()) {
      summaries.put(fn.function(), fn.summary());
    }

    BatchAnalyzer batch =
        new BatchAnalyzer(options.analysisOptions(), options.queryCache());
    BatchAnalyzer.BatchResult result = batch.analyzeAll(models);

    Files.createDirectories(options.outDir());
    try (RecordSink cfg = CommandSupport.openSink(options.outDir().resolve(CFG_FILE));
        RecordSink publicness = CommandSupport.openSink(options.outDir().resolve(PUBLICNESS_FILE));
        RecordSink aggregate = CommandSupport.openSink(options.outDir().resolve(AGGREGATE_FILE))) {
      for (FunctionAnalysis analysis : result.analyses()) {
        CommandSupport.writeFunction(
            cfg, analysis.model(), summaries.get(analysis.function()), analysis.enumeration());
        for (PublicnessResult r : analysis.results()) {
          publicness.write(RecordCodec.publicness(r));
        }
        for (AggregatedPublicness entry : analysis.publicAtPoint()) {
          aggregate.write(RecordCodec.aggregated(entry));
        }
      }
    }
    LOG.info(
        "Wrote results for {} functions to {} ({} failed)",
        result.analyses().size(),
        options.outDir(),
        result.failures().size() + loaded.failures().size());
    return result.failures().isEmpty() && loaded.failures().isEmpty() ? 0 : 1;
  }
}
