package cal.prim.fs;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A regular file observed during a scan.
 *
 * <p>The size is a snapshot taken when the file was visited.  Nothing re-checks it
 * later, so the file may have grown, shrunk, or vanished by the time its contents
 * are read.
 *
 * @param path the path of the file, resolved against the scanned root
 * @param size the length of the file in bytes
 */
public record FileRecord(Path path, long size) {

  public FileRecord {
    Objects.requireNonNull(path);
    if (size < 0) {
      throw new IllegalArgumentException("negative size " + size + " for " + path);
    }
  }

}
