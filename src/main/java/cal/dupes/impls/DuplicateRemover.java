package cal.dupes.impls;

import cal.dupes.types.DeletionSummary;
import cal.dupes.types.DuplicateReport;
import cal.dupes.types.FileFailure;
import cal.dupes.types.HashGroup;
import cal.prim.fs.FileRecord;
import cal.prim.fs.Filesystem;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Removes every copy but the first from each duplicate set.
 *
 * <p>Removal is not transactional.  Each file is removed independently and a failure on
 * one file does not stop the rest.  If the process dies part-way, some dupes are gone
 * and the rest remain; the kept copy of each set is never touched.
 */
public class DuplicateRemover {

  public interface DeletionPlan {
    List<FileRecord> filesToDelete();
    long bytesToFree();

    /** Report what {@link #execute(Consumer)} would do, without doing it. */
    DeletionSummary dryRun(Consumer<Path> onWouldDelete);

    /**
     * Remove the files.
     * @param onDeleted called after each successful removal
     */
    DeletionSummary execute(Consumer<Path> onDeleted);
  }

  private final Filesystem fs;

  public DuplicateRemover(Filesystem fs) {
    this.fs = fs;
  }

  public DeletionPlan plan(DuplicateReport report) {
    ImmutableList.Builder<FileRecord> toDelete = ImmutableList.builder();
    long bytes = 0;
    for (HashGroup g : report.groups()) {
      for (FileRecord dupe : g.dupes()) {
        toDelete.add(dupe);
        bytes += g.size();
      }
    }
    List<FileRecord> files = toDelete.build();
    long totalBytes = bytes;

    return new DeletionPlan() {
      @Override
      public List<FileRecord> filesToDelete() {
        return files;
      }

      @Override
      public long bytesToFree() {
        return totalBytes;
      }

      @Override
      public DeletionSummary dryRun(Consumer<Path> onWouldDelete) {
        for (FileRecord f : files) {
          onWouldDelete.accept(f.path());
        }
        return new DeletionSummary(files.size(), totalBytes, List.of(), true);
      }

      @Override
      public DeletionSummary execute(Consumer<Path> onDeleted) {
        return delete(files, onDeleted);
      }
    };
  }

  private DeletionSummary delete(List<FileRecord> files, Consumer<Path> onDeleted) {
    long deleted = 0;
    long freed = 0;
    List<FileFailure> failures = new ArrayList<>();
    for (FileRecord f : files) {
      try {
        fs.delete(f.path());
      } catch (IOException e) {
        failures.add(new FileFailure(f.path(), FileFailure.Stage.DELETE, e));
        continue;
      }
      ++deleted;
      freed += f.size();
      onDeleted.accept(f.path());
    }
    return new DeletionSummary(deleted, freed, failures, false);
  }

}
