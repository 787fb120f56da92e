package publicdata.io;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

/** In-memory bundles built from NDJSON lines. */
final class Fixtures {

  private Fixtures() {}

  static TraceBundle trace(String... lines) {
    TraceBundle bundle = new TraceBundle();
    read(bundle::accept, lines);
    return bundle;
  }

  static CfgBundle cfg(String... lines) {
    CfgBundle bundle = new CfgBundle();
    read(bundle::accept, lines);
    return bundle;
  }

  private static void read(NdjsonReader.RecordHandler handler, String... lines) {
    try {
      NdjsonReader.read(new StringReader(String.join("\n", lines)), handler);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
