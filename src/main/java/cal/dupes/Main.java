package cal.dupes;

import cal.dupes.impls.DuplicateFinder;
import cal.dupes.impls.DuplicateRemover;
import cal.dupes.impls.ExtensionFilter;
import cal.dupes.impls.HashProgress;
import cal.dupes.impls.JsonReportFormat;
import cal.dupes.impls.ProgressDisplay;
import cal.dupes.impls.ReportPrinter;
import cal.dupes.impls.SkipRules;
import cal.dupes.types.Config;
import cal.dupes.types.DeletionSummary;
import cal.dupes.types.DigestAlgorithm;
import cal.dupes.types.ScanOptions;
import cal.dupes.types.ScanResult;
import cal.prim.QuietAutoCloseable;
import cal.prim.fs.Filesystem;
import cal.prim.fs.PhysicalFilesystem;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {

  private static final String HOME = System.getProperty("user.home");
  private static final Path CFG_FILE = Paths.get(HOME, ".dupes-config.json").toAbsolutePath();
  private static final Duration PROGRESS_INTERVAL = Duration.ofMillis(500);

  private static Options options() {
    Options options = new Options();

    // flags
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption("m", "min-size", true, "Minimum file size, e.g. 512, 10KB, 1MB (default 1)");
    options.addOption("e", "extensions", true, "Only consider these extensions, e.g. \"jpg,png,gif\"");
    options.addOption("a", "algorithm", true, "Digest to use: sha256 (default), sha512, or md5");
    options.addOption("j", "threads", true, "Number of hashing threads (default: one per processor)");
    options.addOption("c", "config", true, "Configuration file (default " + CFG_FILE + ')');
    options.addOption(Option.builder().longOpt("hidden").desc("Include hidden files and directories").build());
    options.addOption(Option.builder().longOpt("verify").desc("Compare files byte-for-byte before calling them duplicates").build());
    options.addOption(Option.builder().longOpt("sort-paths").desc("Keep the copy with the smallest path instead of the first one found").build());
    options.addOption("q", "quiet", false, "Do not show hashing progress");

    // actions
    options.addOption("o", "output", true, "Write a JSON report to this file");
    options.addOption(Option.builder().longOpt("delete").desc("Delete duplicates, keeping the first copy of each").build());
    options.addOption("d", "dry-run", false, "With --delete, show what would be deleted, but do nothing");
    options.addOption("y", "yes", false, "With --delete, do not ask for confirmation");

    return options;
  }

  private static void showHelp(Options options, PrintStream out) {
    PrintWriter w = new PrintWriter(out);
    new HelpFormatter().printHelp(w, HelpFormatter.DEFAULT_WIDTH, "dupes [options] [path]", null, options,
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    w.flush();
  }

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Run the program.
   * @return the exit status
   */
  @VisibleForTesting
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options = options();

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      err.println("Failed to parse options: " + e.getMessage());
      showHelp(options, err);
      return 1;
    }

    if (cli.hasOption('h')) {
      showHelp(options, out);
      return 0;
    }

    List<String> positional = cli.getArgList();
    if (positional.size() > 1) {
      err.println("Expected at most one path, got " + positional);
      return 1;
    }

    final boolean delete = cli.hasOption("delete");
    final boolean dryRun = cli.hasOption('d');
    final boolean assumeYes = cli.hasOption('y');
    final boolean quiet = cli.hasOption('q');
    final @Nullable String output = cli.getOptionValue('o');

    if ((dryRun || assumeYes) && !delete) {
      err.println("WARNING: --dry-run and --yes only matter with --delete; ignoring them.");
    }

    // ------------------------------------------------------------------------------
    // Set up configuration

    final Config config;
    try {
      config = cli.hasOption('c')
              ? loadConfig(Paths.get(cli.getOptionValue('c')))
              : Files.exists(CFG_FILE) ? loadConfig(CFG_FILE) : Config.EMPTY;
    } catch (NoSuchFileException e) {
      err.println("Config file '" + e.getFile() + "' not found");
      return 1;
    } catch (IOException | IllegalArgumentException e) {
      err.println("Bad config file: " + e.getMessage());
      return 1;
    }

    final ScanOptions scanOptions;
    try {
      scanOptions = scanOptions(cli, config, positional.isEmpty() ? "." : positional.get(0));
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return 1;
    }

    // ------------------------------------------------------------------------------
    // Do the work

    Filesystem fs = new PhysicalFilesystem();
    ReportPrinter printer = new ReportPrinter(out);

    out.println("Scanning for duplicates in " + scanOptions.getRoot());
    ScanResult result;
    try {
      result = new DuplicateFinder(fs).find(scanOptions, new DuplicateFinder.Observer() {
        @Override
        public void onIndexed(long filesIndexed, long candidates) {
          out.println("  " + filesIndexed + " files indexed");
          out.println("  " + candidates + " candidates with matching sizes");
        }

        @Override
        public QuietAutoCloseable onHashingStarted(HashProgress progress) {
          return quiet ? () -> { } : new ProgressDisplay(progress, out, PROGRESS_INTERVAL);
        }
      });
    } catch (NoSuchFileException e) {
      err.println("No such directory: " + e.getFile());
      return 1;
    } catch (NotDirectoryException e) {
      err.println("Not a directory: " + e.getFile());
      return 1;
    } catch (IOException e) {
      err.println("Scan failed: " + e);
      return 1;
    }

    printer.printReport(result.report());
    printer.printFailures(result.failures());
    if (result.collisions() > 0) {
      out.println(result.collisions() + " digest collisions were split up by byte comparison");
    }

    if (output != null) {
      try {
        new JsonReportFormat().export(result.report(), Paths.get(output));
        out.println("Report saved to " + output);
      } catch (IOException e) {
        err.println("Failed to write report to " + output + ": " + e);
        return 1;
      }
    }

    if (delete && !result.report().isEmpty()) {
      DuplicateRemover.DeletionPlan plan = new DuplicateRemover(fs).plan(result.report());
      out.println();
      out.println("Deleting duplicates (keeping first occurrence)...");
      DeletionSummary summary;
      if (dryRun) {
        summary = plan.dryRun(p -> out.println("    would delete " + p));
      } else if (assumeYes || Util.confirm("Delete " + plan.filesToDelete().size() + " files (" + Util.formatSize(plan.bytesToFree()) + ")?")) {
        summary = plan.execute(p -> out.println("    x " + p));
      } else {
        out.println("Nothing deleted.  Pass --yes to delete without asking.");
        return 0;
      }
      printer.printDeletionSummary(summary);
      printer.printFailures(summary.failures());
    }

    return 0;
  }

  private static ScanOptions scanOptions(CommandLine cli, Config config, String root) {
    ScanOptions.ScanOptionsBuilder b = ScanOptions.builder().root(Paths.get(root));

    if (cli.hasOption('m')) {
      b.minSize(Util.parseSize(cli.getOptionValue('m')));
    } else if (config.getMinSize() != null) {
      b.minSize(config.getMinSize());
    }

    if (cli.hasOption('e')) {
      b.extensions(ExtensionFilter.parse(cli.getOptionValue('e')));
    }

    if (cli.hasOption('a')) {
      b.algorithm(DigestAlgorithm.fromName(cli.getOptionValue('a')));
    } else if (config.getAlgorithm() != null) {
      b.algorithm(config.getAlgorithm());
    }

    if (cli.hasOption('j')) {
      int n;
      try {
        n = Integer.parseInt(cli.getOptionValue('j'));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("not a thread count: " + cli.getOptionValue('j'), e);
      }
      if (n < 1) {
        throw new IllegalArgumentException("need at least one thread, got " + n);
      }
      b.threads(n);
    } else if (config.getThreads() != null) {
      b.threads(config.getThreads());
    }

    boolean hidden = cli.hasOption("hidden") || Boolean.TRUE.equals(config.getIncludeHidden());
    b.skipRules(new SkipRules(hidden, config.getExclusions()));

    b.verifyContents(cli.hasOption("verify"));
    b.sortByPath(cli.hasOption("sort-paths"));
    return b.build();
  }

  private static class RawConfig {
    public @Nullable String algorithm;
    public @Nullable String minSize;
    public @Nullable Boolean includeHidden;
    public @Nullable Integer threads;
    public @Nullable List<String> exclude;
  }

  /**
   * Read a configuration file.  The format is JSON with comments allowed:
   * <pre>
   *   {
   *     "algorithm": "sha512",
   *     "minSize": "4KB",
   *     "includeHidden": false,
   *     "threads": 4,
   *     // globs match full paths or bare file names
   *     "exclude": ["*.tmp", "~/Library"]
   *   }
   * </pre>
   */
  @VisibleForTesting
  static Config loadConfig(Path target) throws IOException {

    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    ObjectMapper mapper = new ObjectMapper(f);

    RawConfig r;
    try (InputStream in = Files.newInputStream(target)) {
      r = mapper.readValue(in, RawConfig.class);
    }

    if (r.threads != null && r.threads < 1) {
      throw new IllegalArgumentException("Config at " + target + " has \"threads\" < 1");
    }

    List<PathMatcher> exclusions = new ArrayList<>();
    for (String glob : r.exclude != null ? r.exclude : Collections.<String>emptyList()) {
      String pattern = glob.startsWith("~") ? glob.replaceFirst(Pattern.quote("~"), Matcher.quoteReplacement(HOME)) : glob;
      exclusions.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
    }

    return new Config(
            r.algorithm != null ? DigestAlgorithm.fromName(r.algorithm) : null,
            r.minSize != null ? Util.parseSize(r.minSize) : null,
            r.includeHidden,
            r.threads,
            exclusions);
  }

}
