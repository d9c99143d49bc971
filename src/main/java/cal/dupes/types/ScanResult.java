package cal.dupes.types;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Everything one scan learned.
 *
 * @param report the duplicate sets
 * @param filesIndexed files that passed the traversal filters
 * @param candidates files whose size collided with another file's, and which were therefore hashed
 * @param failures per-file problems, in no particular order
 * @param collisions digest groups that byte-for-byte verification had to split
 */
public record ScanResult(DuplicateReport report, long filesIndexed, long candidates, List<FileFailure> failures, int collisions) {

  public ScanResult {
    failures = ImmutableList.copyOf(failures);
  }

  public List<FileFailure> failures(FileFailure.Stage stage) {
    return failures.stream().filter(f -> f.stage() == stage).collect(ImmutableList.toImmutableList());
  }

}
