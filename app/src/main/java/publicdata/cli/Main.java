package publicdata.cli;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import publicdata.io.MalformedRecordException;

/**
 * Command-line entry point.
 *
 * <p>Usage: {@code publicdata <command> [options]} where command is one of {@code enumerate},
 * {@code verify}, {@code aggregate}, {@code analyze}, {@code summarize} or {@code join-index}.
 *
 * <p>Exit codes: 0 success, 1 some function failed or input was malformed, 2 I/O failure, 64
 * usage error.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_IO = 2;
  static final int EXIT_USAGE = 64;

  private Main() {}

  public static void main(String[] args) {
    int code = run(args);
    if (code != EXIT_OK) {
      System.exit(code);
    }
  }

  static int run(String[] args) {
    if (args == null || args.length == 0) {
      printUsage();
      return EXIT_USAGE;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      switch (command) {
        case "enumerate":
          return new EnumerateCommand().execute(rest);
        case "verify":
          return new VerifyCommand().execute(rest);
        case "aggregate":
          return new AggregateCommand().execute(rest);
        case "analyze":
          return new AnalyzeCommand().execute(rest);
        case "summarize":
          return new SummarizeCommand(System.out).execute(rest);
        case "join-index":
          return new JoinIndexCommand().execute(rest);
        case "help":
        case "--help":
          printUsage();
          return EXIT_OK;
        default:
          System.err.println("Unknown command: " + args[0]);
          printUsage();
          return EXIT_USAGE;
      }
    } catch (MalformedRecordException ex) {
      LOG.error("Malformed input: {}", ex.getMessage());
      return EXIT_FAILED;
    } catch (IllegalArgumentException ex) {
      System.err.println(ex.getMessage());
      return EXIT_USAGE;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return EXIT_IO;
    }
  }

  private static void printUsage() {
    System.err.println("Usage: publicdata <command> [options]");
    System.err.println("  enumerate   --trace F [--cfg F] [--out F] [budgets]");
    System.err.println("  verify      --trace F --cfg F [--out F] [--secret a,b] [--secret-memory m]");
    System.err.println("  aggregate   --results F [--cfg F] [--out F] [--missing unknown|public|secret]");
    System.err.println("  analyze     --trace F [--cfg F] --out-dir D [--jobs N] [--solver z3|bounded]");
    System.err.println("  summarize   [--trace F] [--cfg F] [--check-paths]");
    System.err.println("  join-index  --index F --results F [--out F]");
  }
}
