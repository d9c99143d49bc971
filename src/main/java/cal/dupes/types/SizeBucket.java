package cal.dupes.types;

import cal.prim.fs.FileRecord;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Files that share an exact byte length.
 *
 * @param size the length shared by every member
 * @param files the members, in the order they were discovered (or by path, if the scan
 *              asked for a stable order).  The first member of any duplicate set that
 *              comes out of this bucket is the one that will be kept.
 */
public record SizeBucket(long size, List<FileRecord> files) {

  public SizeBucket {
    files = ImmutableList.copyOf(files);
    for (FileRecord f : files) {
      if (f.size() != size) {
        throw new IllegalArgumentException(f.path() + " has size " + f.size() + ", not " + size);
      }
    }
  }

}
