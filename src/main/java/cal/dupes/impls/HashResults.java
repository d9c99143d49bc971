package cal.dupes.impls;

import cal.dupes.types.FileFailure;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The digests computed by one {@link ParallelHasher} pass.  Every candidate appears in
 * exactly one of {@link #digests()} or {@link #failures()}.
 */
public class HashResults {

  private final Map<Path, String> digests;
  private final List<FileFailure> failures;

  HashResults(Map<Path, String> digests, List<FileFailure> failures) {
    this.digests = ImmutableMap.copyOf(digests);
    this.failures = ImmutableList.copyOf(failures);
  }

  public @Nullable String digestOf(Path path) {
    return digests.get(path);
  }

  public Map<Path, String> digests() {
    return digests;
  }

  public List<FileFailure> failures() {
    return failures;
  }

}
