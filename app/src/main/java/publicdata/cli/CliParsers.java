package publicdata.cli;

import java.nio.file.Files;
import java.nio.file.Path;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {

  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, String optionName) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static Path existingFile(Path path, String optionName) {
    if (path == null) {
      throw new IllegalArgumentException("Missing required option " + optionName);
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("File not found for " + optionName + ": " + path);
    }
    return path;
  }
}
