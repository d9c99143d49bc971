package cal.dupes.types;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * A problem with one file that did not stop the run.
 */
public record FileFailure(Path path, Stage stage, IOException cause) {

  public enum Stage {
    /** the entry could not be read while walking the tree */
    SCAN,
    /** the file could not be hashed, so it was left out of grouping */
    HASH,
    /** the file could not be byte-compared, so it was dropped from its group */
    VERIFY,
    /** the file could not be removed */
    DELETE
  }

  @Override
  public String toString() {
    return stage.name().toLowerCase(Locale.ROOT) + ' ' + path + ": " + cause;
  }

}
