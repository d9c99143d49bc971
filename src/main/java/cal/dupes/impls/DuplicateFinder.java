package cal.dupes.impls;

import cal.dupes.FileTools;
import cal.dupes.types.DuplicateReport;
import cal.dupes.types.FileFailure;
import cal.dupes.types.ScanOptions;
import cal.dupes.types.ScanResult;
import cal.dupes.types.SizeBucket;
import cal.prim.QuietAutoCloseable;
import cal.prim.fs.FileRecord;
import cal.prim.fs.Filesystem;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds files with identical contents.
 *
 * <p>The run goes through fixed stages:
 * <ol>
 *   <li>scan the tree (one thread)</li>
 *   <li>bucket files by size and drop sizes that only one file has (one thread)</li>
 *   <li>hash the remaining candidates (a pool of threads)</li>
 *   <li>group by digest within each bucket, optionally byte-comparing each group</li>
 * </ol>
 * Problems with individual files are collected into the result instead of ending the run.
 */
public class DuplicateFinder {

  /**
   * Hooks for showing a run's progress.
   */
  public interface Observer {
    default void onIndexed(long filesIndexed, long candidates) {
    }

    /**
     * Called just before hashing begins.  The returned handle is closed once hashing
     * has finished.
     */
    default QuietAutoCloseable onHashingStarted(HashProgress progress) {
      return () -> { };
    }
  }

  public static final Observer SILENT = new Observer() { };

  private final Filesystem fs;
  private final ContentHasher hasher;

  public DuplicateFinder(Filesystem fs) {
    this(fs, new ContentHasher(fs));
  }

  public DuplicateFinder(Filesystem fs, ContentHasher hasher) {
    this.fs = fs;
    this.hasher = hasher;
  }

  public ScanResult find(ScanOptions options) throws IOException {
    return find(options, SILENT);
  }

  /**
   * @throws java.nio.file.NoSuchFileException if the root does not exist
   * @throws java.nio.file.NotDirectoryException if the root is not a directory
   * @throws java.io.InterruptedIOException if interrupted while hashing
   */
  public ScanResult find(ScanOptions options, Observer observer) throws IOException {
    List<FileFailure> failures = new ArrayList<>();

    List<FileRecord> files = FileTools.collectFiles(fs, options, failures::add);

    List<SizeBucket> buckets = new SizeBucketer(options.isSortByPath()).bucket(files);
    List<FileRecord> candidates = new ArrayList<>();
    for (SizeBucket b : buckets) {
      candidates.addAll(b.files());
    }
    observer.onIndexed(files.size(), candidates.size());

    if (candidates.isEmpty()) {
      return new ScanResult(DuplicateReport.EMPTY, files.size(), 0, failures, 0);
    }

    HashProgress progress = ParallelHasher.progressFor(candidates);
    HashResults hashes;
    try (QuietAutoCloseable ignored = observer.onHashingStarted(progress)) {
      hashes = new ParallelHasher(hasher, options.getThreads()).hashAll(candidates, options.getAlgorithm(), progress);
    }
    failures.addAll(hashes.failures());

    DuplicateGrouper grouper = new DuplicateGrouper(options.isVerifyContents() ? new ContentComparer(fs) : null);
    DuplicateGrouper.Grouping grouping = grouper.group(buckets, hashes);
    failures.addAll(grouping.failures());

    return new ScanResult(
            DuplicateReport.of(grouping.groups()),
            files.size(),
            candidates.size(),
            failures,
            grouping.collisions());
  }

}
