package cal.dupes.impls;

import cal.dupes.Util;
import cal.dupes.types.DeletionSummary;
import cal.dupes.types.DuplicateReport;
import cal.dupes.types.FileFailure;
import cal.dupes.types.HashGroup;

import java.io.PrintStream;
import java.util.List;

/**
 * Human-readable output for the console.
 */
public class ReportPrinter {

  public static final int DIGEST_PREFIX_LENGTH = 16;
  private static final int RULE_WIDTH = 60;

  private final PrintStream out;

  public ReportPrinter(PrintStream out) {
    this.out = out;
  }

  public void printReport(DuplicateReport report) {
    if (report.isEmpty()) {
      out.println("No duplicate files found");
      return;
    }

    out.println();
    out.println("DUPLICATE FILES REPORT");
    out.println();
    out.println("  Duplicate groups:  " + report.totalGroups());
    out.println("  Total duplicates:  " + report.totalDuplicates());
    out.println("  Wasted space:      " + Util.formatSize(report.wastedSpace()));
    out.println();
    rule();

    for (HashGroup g : report.groups()) {
      out.println();
      out.println("  * " + g.files().size() + " files, " + Util.formatSize(g.size()) + " each");
      out.println("    hash: " + Util.abbreviate(g.digest(), DIGEST_PREFIX_LENGTH));
      for (int i = 0; i < g.files().size(); ++i) {
        out.println("    [" + (i == 0 ? "keep" : "dupe") + "] " + g.files().get(i).path());
      }
    }

    out.println();
    rule();
  }

  public void printFailures(List<FileFailure> failures) {
    if (failures.isEmpty()) {
      return;
    }
    out.println(failures.size() + " warnings:");
    for (FileFailure f : failures) {
      out.println(" - " + f);
    }
  }

  public void printDeletionSummary(DeletionSummary summary) {
    out.println();
    if (summary.dryRun()) {
      out.println("Would delete " + summary.deletedFiles() + " files, freeing " + Util.formatSize(summary.bytesFreed()));
    } else {
      out.println("Deleted " + summary.deletedFiles() + " files, freed " + Util.formatSize(summary.bytesFreed()));
    }
    if (!summary.failures().isEmpty()) {
      out.println("Failed to delete " + summary.failures().size() + " files");
    }
  }

  private void rule() {
    out.println("-".repeat(RULE_WIDTH));
  }

}
