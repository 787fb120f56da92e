package publicdata.cli;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.io.NdjsonReader;
import publicdata.io.RecordKinds;
import publicdata.io.RecordSink;
import publicdata.io.TraceBundle;
import publicdata.io.TraceIndex;

/**
 * {@code join-index}: annotates {@code path_publicness} records with the trace line, opcode and
 * definition of their program point. Records without an index entry pass through unchanged.
 */
final class JoinIndexCommand {
  private static final Logger LOG = LoggerFactory.getLogger(JoinIndexCommand.class);

  static OptionTable options() {
    return new OptionTable()
        .withValue("--index", (b, raw) -> b.index(Path.of(raw)))
        .withValue("--results", (b, raw) -> b.results(Path.of(raw)))
        .withValue("--out", (b, raw) -> b.out(Path.of(raw)));
  }

  int execute(String[] args) throws IOException {
    CliOptions options = options().parse(args);
    TraceIndex index =
        new TraceIndex(TraceBundle.read(CliParsers.existingFile(options.index(), "--index")).index());
    if (index.size() == 0) {
      LOG.warn("No trace_index records in {}", options.index());
    }
    AtomicInteger joined = new AtomicInteger();
    AtomicInteger unmatched = new AtomicInteger();
    try (RecordSink sink = CommandSupport.openSink(options.out())) {
      try {
        NdjsonReader.read(
            CliParsers.existingFile(options.results(), "--results"),
            (obj, line) -> {
              JsonObject out = obj;
              if (RecordKinds.PATH_PUBLICNESS.equals(RecordKinds.of(obj))) {
                JsonObject annotated = index.annotate(obj, line);
                if (annotated == null) {
                  unmatched.incrementAndGet();
                } else {
                  joined.incrementAndGet();
                  out = annotated;
                }
              }
              write(sink, out);
            });
      } catch (UncheckedIOException ex) {
        throw ex.getCause();
      }
    }
    if (unmatched.get() > 0) {
      LOG.warn("{} results had no trace_index entry", unmatched.get());
    }
    LOG.info("Joined {} results with the trace index", joined.get());
    return 0;
  }

  private static void write(RecordSink sink, JsonObject record) {
    try {
      sink.write(record);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
