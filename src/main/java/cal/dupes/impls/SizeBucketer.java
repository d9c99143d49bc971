package cal.dupes.impls;

import cal.dupes.types.SizeBucket;
import cal.prim.fs.FileRecord;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Groups files by exact length and throws away every length that only one file has.
 * A file with a unique length cannot have a duplicate, so it never needs to be hashed.
 */
public class SizeBucketer {

  private final boolean sortByPath;

  public SizeBucketer(boolean sortByPath) {
    this.sortByPath = sortByPath;
  }

  /**
   * @param files files in discovery order
   * @return the buckets with at least two members, in order of each size's first
   *     appearance.  Members keep discovery order unless this bucketer sorts by path.
   */
  public List<SizeBucket> bucket(Iterable<FileRecord> files) {
    // Keys in insertion order, values in insertion order.
    ListMultimap<Long, FileRecord> bySize = MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (FileRecord f : files) {
      bySize.put(f.size(), f);
    }

    ImmutableList.Builder<SizeBucket> result = ImmutableList.builder();
    for (Map.Entry<Long, Collection<FileRecord>> entry : bySize.asMap().entrySet()) {
      Collection<FileRecord> members = entry.getValue();
      if (members.size() < 2) {
        continue;
      }
      List<FileRecord> ordered = new ArrayList<>(members);
      if (sortByPath) {
        ordered.sort(Comparator.comparing(FileRecord::path));
      }
      result.add(new SizeBucket(entry.getKey(), ordered));
    }
    return result.build();
  }

}
