package publicdata.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.aggregate.AggregatedPublicness;
import publicdata.aggregate.AggregationReport;
import publicdata.aggregate.Aggregator;
import publicdata.diagnostics.AnalysisDiagnostic;
import publicdata.io.CfgBundle;
import publicdata.io.NdjsonReader;
import publicdata.io.RecordCodec;
import publicdata.io.RecordKinds;
import publicdata.io.RecordSink;
import publicdata.model.PpCoverage;
import publicdata.verify.PublicnessResult;

/** {@code aggregate}: reduces {@code path_publicness} records to {@code public_at_point}. */
final class AggregateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(AggregateCommand.class);

  static OptionTable options() {
    return new OptionTable()
        .aggregation()
        .withValue("--results", (b, raw) -> b.results(Path.of(raw)))
        .withValue("--cfg", (b, raw) -> b.cfg(Path.of(raw)))
        .withValue("--out", (b, raw) -> b.out(Path.of(raw)));
  }

  int execute(String[] args) throws IOException {
    CliOptions options = options().parse(args);
    List<PublicnessResult> results = new ArrayList<>();
    NdjsonReader.read(
        CliParsers.existingFile(options.results(), "--results"),
        (obj, line) -> {
          if (RecordKinds.PATH_PUBLICNESS.equals(RecordKinds.of(obj))) {
            results.add(RecordCodec.parsePublicness(obj, line));
          }
        });
    List<PpCoverage> coverage = new ArrayList<>();
    List<publicdata.model.Path> paths = new ArrayList<>();
    if (options.cfg() != null) {
      CfgBundle cfg = CommandSupport.readCfg(options.cfg());
      for (String fn : cfg.functions()) {
        coverage.addAll(cfg.coverage(fn));
        paths.addAll(cfg.paths(fn));
      }
    }
    AggregationReport report =
        new Aggregator(options.aggregationOptions()).aggregate(results, coverage, paths);
    for (AnalysisDiagnostic issue : report.integrityIssues()) {
      LOG.warn("{}", issue.describe());
    }
    try (RecordSink sink = CommandSupport.openSink(options.out())) {
      for (AggregatedPublicness entry : report.entries()) {
        sink.write(RecordCodec.aggregated(entry));
      }
    }
    LOG.info(
        "Aggregated {} results into {} points ({} integrity issues)",
        results.size(),
        report.entries().size(),
        report.integrityIssues().size());
    return 0;
  }
}
