package cal.dupes.types;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

/**
 * The outcome of grouping: every duplicate set found, plus totals.
 *
 * @param totalGroups the number of duplicate sets
 * @param totalDuplicates the number of redundant copies, i.e. members other than the kept one
 * @param wastedSpace the bytes taken up by redundant copies
 * @param groups the duplicate sets
 */
public record DuplicateReport(int totalGroups, long totalDuplicates, long wastedSpace, List<HashGroup> groups) {

  public static final DuplicateReport EMPTY = of(List.of());

  public DuplicateReport {
    groups = ImmutableList.copyOf(groups);
  }

  /**
   * Build a report from duplicate sets.
   * @throws IllegalArgumentException if a group has fewer than two members
   */
  public static DuplicateReport of(Collection<HashGroup> groups) {
    long duplicates = 0;
    long wasted = 0;
    for (HashGroup g : groups) {
      if (!g.isDuplicateSet()) {
        throw new IllegalArgumentException("not a duplicate set: " + g.digest());
      }
      duplicates += g.files().size() - 1;
      wasted = Math.addExact(wasted, g.wastedBytes());
    }
    return new DuplicateReport(groups.size(), duplicates, wasted, List.copyOf(groups));
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

}
