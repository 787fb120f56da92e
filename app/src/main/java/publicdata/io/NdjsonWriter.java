package publicdata.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes one compact JSON object per line. Nulls are kept, since {@code "public": null} is how
 * an unknown verdict is encoded. Writes are synchronized so one sink can be shared by workers.
 */
public final class NdjsonWriter implements RecordSink {

  private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

  private final Writer out;
  private final boolean closeUnderlying;

  public NdjsonWriter(Writer out, boolean closeUnderlying) {
    this.out = Objects.requireNonNull(out, "out");
    this.closeUnderlying = closeUnderlying;
  }

  public static NdjsonWriter open(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    return new NdjsonWriter(writer, true);
  }

  public static String toLine(JsonObject record) {
    return GSON.toJson(record);
  }

  @Override
  public synchronized void write(JsonObject record) throws IOException {
    out.write(GSON.toJson(record));
    out.write('\n');
  }

  @Override
  public synchronized void close() throws IOException {
    if (closeUnderlying) {
      out.close();
    } else {
      out.flush();
    }
  }
}
