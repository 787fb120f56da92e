package publicdata.io;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Line-delimited JSON reader. Blank lines are skipped; every other line must be an object. */
public final class NdjsonReader {

  /** Receives one parsed record and its 1-based line number. */
  @FunctionalInterface
  public interface RecordHandler {
    void accept(JsonObject record, int line);
  }

  private NdjsonReader() {}

  public static void read(Path file, RecordHandler handler) throws IOException {
    Objects.requireNonNull(file, "file");
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      read(reader, handler);
    }
  }

  public static void read(Reader source, RecordHandler handler) throws IOException {
    Objects.requireNonNull(handler, "handler");
    BufferedReader reader =
        source instanceof BufferedReader br ? br : new BufferedReader(source);
    String line;
    int number = 0;
    while ((line = reader.readLine()) != null) {
      number++;
      if (line.isBlank()) {
        continue;
      }
      handler.accept(parse(line, number), number);
    }
  }

  static JsonObject parse(String line, int number) {
    JsonElement element;
    try {
      element = JsonParser.parseString(line);
    } catch (JsonParseException ex) {
      throw new MalformedRecordException("Invalid JSON", number, null, ex);
    }
    if (!element.isJsonObject()) {
      throw new MalformedRecordException("Expected a JSON object", number, null);
    }
    return element.getAsJsonObject();
  }
}
