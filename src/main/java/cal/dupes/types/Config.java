package cal.dupes.types;

import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Defaults read from the configuration file.  Unset fields are <code>null</code>; the
 * command line overrides anything set here.
 */
@Value
public class Config {
  public static final Config EMPTY = new Config(null, null, null, null, List.of());

  @Nullable DigestAlgorithm algorithm;
  @Nullable Long minSize;
  @Nullable Boolean includeHidden;
  @Nullable Integer threads;
  List<PathMatcher> exclusions;
}
