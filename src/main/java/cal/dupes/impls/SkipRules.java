package cal.dupes.impls;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Set;

/**
 * Decides which entries a scan never looks at: hidden entries, well-known directories
 * full of generated or vendored files, and user-supplied glob exclusions.
 *
 * <p>A glob exclusion applies if it matches either the full path or the bare file name
 * of an entry.  If a directory is skipped, its contents are skipped as well.
 */
public final class SkipRules {

  public static final Set<String> NOISE_DIRECTORIES = ImmutableSet.of(
          "node_modules",
          ".git",
          ".svn",
          ".hg",
          "__pycache__",
          ".cache",
          "target",
          ".idea",
          ".vscode",
          "vendor",
          "dist",
          "build");

  public static final SkipRules DEFAULT = new SkipRules(false, List.of());

  private final boolean includeHidden;
  private final List<PathMatcher> exclusions;

  public SkipRules(boolean includeHidden, List<PathMatcher> exclusions) {
    this.includeHidden = includeHidden;
    this.exclusions = ImmutableList.copyOf(exclusions);
  }

  public SkipRules withIncludeHidden(boolean includeHidden) {
    return new SkipRules(includeHidden, exclusions);
  }

  public SkipRules withExclusions(List<PathMatcher> exclusions) {
    return new SkipRules(includeHidden, exclusions);
  }

  public boolean skipDirectory(Path dir) {
    String name = nameOf(dir);
    return NOISE_DIRECTORIES.contains(name) || isSkippedHidden(name) || isExcluded(dir);
  }

  public boolean skipFile(Path file) {
    return isSkippedHidden(nameOf(file)) || isExcluded(file);
  }

  private boolean isSkippedHidden(String name) {
    return !includeHidden && name.startsWith(".");
  }

  private boolean isExcluded(Path path) {
    Path name = path.getFileName();
    return exclusions.stream().anyMatch(r -> r.matches(path) || (name != null && r.matches(name)));
  }

  private static String nameOf(Path path) {
    Path name = path.getFileName();
    return name != null ? name.toString() : "";
  }

}
