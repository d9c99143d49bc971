package cal.dupes;

import cal.dupes.types.FileFailure;
import cal.dupes.types.ScanOptions;
import cal.prim.fs.FileRecord;
import cal.prim.fs.Filesystem;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public class FileTools {

  /**
   * List the files under the scan root that pass every filter, in the order the
   * filesystem yields them.  That order matters: it decides which copy of a duplicate
   * gets kept.
   *
   * @param onFailure told about entries that could not be read; the scan goes on without them
   * @throws java.nio.file.NoSuchFileException if the root does not exist
   * @throws java.nio.file.NotDirectoryException if the root is not a directory
   */
  public static List<FileRecord> collectFiles(Filesystem fs, ScanOptions options, Consumer<FileFailure> onFailure) throws IOException {
    List<FileRecord> result = new ArrayList<>();
    fs.scan(
            options.getRoot(),
            options.getSkipRules()::skipDirectory,
            options.getSkipRules()::skipFile,
            f -> {
              if (f.size() >= options.getMinSize() && options.getExtensions().matches(f.path())) {
                result.add(f);
              }
            },
            (path, cause) -> onFailure.accept(new FileFailure(path, FileFailure.Stage.SCAN, cause)));
    return result;
  }

}
