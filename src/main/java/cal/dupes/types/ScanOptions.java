package cal.dupes.types;

import cal.dupes.impls.ExtensionFilter;
import cal.dupes.impls.SkipRules;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder(toBuilder = true)
public class ScanOptions {
  @NonNull Path root;

  /** files smaller than this many bytes are ignored */
  @Builder.Default long minSize = 1L;

  @Builder.Default @NonNull ExtensionFilter extensions = ExtensionFilter.ANY;
  @Builder.Default @NonNull SkipRules skipRules = SkipRules.DEFAULT;
  @Builder.Default @NonNull DigestAlgorithm algorithm = DigestAlgorithm.SHA256;

  /** byte-compare the members of each digest group before reporting it */
  @Builder.Default boolean verifyContents = false;

  /** order each size bucket by path so that the kept copy does not depend on directory order */
  @Builder.Default boolean sortByPath = false;

  @Builder.Default int threads = Runtime.getRuntime().availableProcessors();
}
