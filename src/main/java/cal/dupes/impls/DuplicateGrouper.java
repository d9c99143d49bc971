package cal.dupes.impls;

import cal.dupes.types.FileFailure;
import cal.dupes.types.HashGroup;
import cal.dupes.types.SizeBucket;
import cal.prim.fs.FileRecord;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns hashed size buckets into duplicate sets.
 *
 * <p>Files are only ever compared with other files from the same size bucket.  Within a
 * bucket, files are grouped by digest; groups keep the bucket's member order, so the
 * first file of every duplicate set is the first one that was discovered.
 */
public class DuplicateGrouper {

  public static class Grouping {
    private final List<HashGroup> groups;
    private final List<FileFailure> failures;
    private final int collisions;

    Grouping(List<HashGroup> groups, List<FileFailure> failures, int collisions) {
      this.groups = ImmutableList.copyOf(groups);
      this.failures = ImmutableList.copyOf(failures);
      this.collisions = collisions;
    }

    /** duplicate sets only; never a singleton */
    public List<HashGroup> groups() {
      return groups;
    }

    /** files dropped during verification */
    public List<FileFailure> failures() {
      return failures;
    }

    /** digest groups that turned out to hold more than one distinct content */
    public int collisions() {
      return collisions;
    }
  }

  private final @Nullable ContentComparer verifier;

  /**
   * @param verifier if non-null, every digest group is byte-compared before it is
   *                 reported
   */
  public DuplicateGrouper(@Nullable ContentComparer verifier) {
    this.verifier = verifier;
  }

  public Grouping group(List<SizeBucket> buckets, HashResults hashes) {
    List<HashGroup> result = new ArrayList<>();
    List<FileFailure> failures = new ArrayList<>();
    int collisions = 0;

    for (SizeBucket bucket : buckets) {
      Map<String, List<FileRecord>> byDigest = new LinkedHashMap<>();
      for (FileRecord f : bucket.files()) {
        String digest = hashes.digestOf(f.path());
        if (digest != null) {
          byDigest.computeIfAbsent(digest, d -> new ArrayList<>()).add(f);
        }
      }

      for (Map.Entry<String, List<FileRecord>> entry : byDigest.entrySet()) {
        List<FileRecord> members = entry.getValue();
        if (members.size() < 2) {
          continue;
        }
        if (verifier == null) {
          result.add(new HashGroup(entry.getKey(), bucket.size(), members));
          continue;
        }
        List<List<FileRecord>> classes = verifier.partition(members, failures::add);
        if (classes.size() > 1) {
          ++collisions;
        }
        for (List<FileRecord> c : classes) {
          if (c.size() > 1) {
            result.add(new HashGroup(entry.getKey(), bucket.size(), c));
          }
        }
      }
    }

    return new Grouping(result, failures, collisions);
  }

}
