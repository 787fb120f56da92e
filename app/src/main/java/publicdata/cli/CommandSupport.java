package publicdata.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.io.CfgBundle;
import publicdata.io.NdjsonWriter;
import publicdata.io.RecordCodec;
import publicdata.io.RecordSink;
import publicdata.io.TraceBundle;
import publicdata.model.Block;
import publicdata.model.FuncSummary;
import publicdata.model.FunctionModel;
import publicdata.paths.EnumerationResult;
import publicdata.pipeline.ModelLoader;

/** Input loading and output plumbing shared by the commands. */
final class CommandSupport {
  private static final Logger LOG = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  static ModelLoader.Loaded loadModels(CliOptions options) throws IOException {
    Path tracePath = CliParsers.existingFile(options.trace(), "--trace");
    TraceBundle trace = TraceBundle.read(tracePath);
    CfgBundle cfg = options.cfg() == null ? new CfgBundle() : readCfg(options.cfg());
    LOG.info(
        "Read {} instructions and {} block records", trace.instructionCount(), cfg.blockCount());
    return new ModelLoader(options.traceOptions()).load(trace, cfg, options.functionFilter());
  }

  static CfgBundle readCfg(Path path) throws IOException {
    return CfgBundle.read(CliParsers.existingFile(path, "--cfg"));
  }

  /** Opens {@code out}, or standard output when no file was given. */
  static RecordSink openSink(Path out) throws IOException {
    if (out == null) {
      return new NdjsonWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), false);
    }
    return NdjsonWriter.open(out);
  }

  /** Writes a function's CFG, paths, coverage and summaries in the order readers expect. */
  static void writeFunction(
      RecordSink sink, FunctionModel model, FuncSummary summary, EnumerationResult enumeration)
      throws IOException {
    for (Block block : model.blocks()) {
      sink.write(RecordCodec.block(model.name(), block));
      for (var edge : RecordCodec.edges(model.name(), block)) {
        sink.write(edge);
      }
    }
    for (publicdata.model.Path path : enumeration.paths()) {
      sink.write(RecordCodec.path(path));
    }
    for (var coverage : enumeration.coverage()) {
      sink.write(RecordCodec.coverage(coverage));
    }
    sink.write(RecordCodec.pathSummary(enumeration.summary()));
    sink.write(RecordCodec.funcSummary(summary));
  }

  static int exitCode(List<?> failures) {
    return failures.isEmpty() ? 0 : 1;
  }
}
