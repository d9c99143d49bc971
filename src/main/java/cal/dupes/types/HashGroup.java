package cal.dupes.types;

import cal.prim.fs.FileRecord;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Files with the same size and the same content digest.
 *
 * <p>Member order is inherited from the {@link SizeBucket} the group came from.
 * The member at index 0 is the copy to keep; every other member is a dupe.
 */
public record HashGroup(String digest, long size, List<FileRecord> files) {

  public HashGroup {
    Objects.requireNonNull(digest);
    files = ImmutableList.copyOf(files);
    if (files.isEmpty()) {
      throw new IllegalArgumentException("empty group for " + digest);
    }
  }

  public boolean isDuplicateSet() {
    return files.size() > 1;
  }

  public FileRecord keep() {
    return files.get(0);
  }

  public List<FileRecord> dupes() {
    return files.subList(1, files.size());
  }

  /**
   * Bytes that would be reclaimed by removing every dupe.
   * @throws ArithmeticException if the total does not fit in a <code>long</code>
   */
  public long wastedBytes() {
    return Math.multiplyExact(size, (long)(files.size() - 1));
  }

}
