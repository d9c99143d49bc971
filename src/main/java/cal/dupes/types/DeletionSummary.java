package cal.dupes.types;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The tally after removing dupes.  When <code>dryRun</code> is set nothing was removed and
 * the counts describe what would have been.
 */
public record DeletionSummary(long deletedFiles, long bytesFreed, List<FileFailure> failures, boolean dryRun) {

  public DeletionSummary {
    failures = ImmutableList.copyOf(failures);
  }

}
