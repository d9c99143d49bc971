package cal.dupes.impls;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * An allow-list of file extensions, compared case-insensitively.
 * Files without an extension never match a non-empty list.
 */
public final class ExtensionFilter {

  public static final ExtensionFilter ANY = new ExtensionFilter(ImmutableSet.of());

  private final Set<String> extensions;

  private ExtensionFilter(Set<String> extensions) {
    this.extensions = extensions;
  }

  /**
   * Parse a comma-separated list such as <code>"jpg, PNG,gif"</code>.  Blank entries and
   * leading dots are ignored, so <code>".jpg"</code> means the same as <code>"jpg"</code>.
   * A list with no entries at all matches every file.
   */
  public static ExtensionFilter parse(String list) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    for (String ext : Splitter.on(',').trimResults().omitEmptyStrings().split(list)) {
      String e = ext.startsWith(".") ? ext.substring(1) : ext;
      if (!e.isEmpty()) {
        result.add(e.toLowerCase(Locale.ROOT));
      }
    }
    return new ExtensionFilter(result.build());
  }

  public boolean matchesEverything() {
    return extensions.isEmpty();
  }

  public boolean matches(Path file) {
    if (extensions.isEmpty()) {
      return true;
    }
    String ext = extensionOf(file);
    return ext != null && extensions.contains(ext);
  }

  /**
   * The lower-cased text after the last dot of the file name, or null if there is none.
   * A leading dot (as in <code>.bashrc</code>) does not start an extension.
   */
  static @Nullable String extensionOf(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return null;
    }
    String s = name.toString();
    int dot = s.lastIndexOf('.');
    if (dot <= 0 || dot == s.length() - 1) {
      return null;
    }
    return s.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return extensions.isEmpty() ? "*" : String.join(",", extensions);
  }

}
