package cal.prim.fs;

import cal.prim.IOConsumer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;

public interface Filesystem {

  /**
   * A callback for entries that could not be visited during a {@link #scan scan}.
   */
  @FunctionalInterface
  interface ScanErrorHandler {
    void onError(Path path, IOException cause);
  }

  /**
   * Scan the tree under <code>root</code>, calling <code>onFile</code> for each regular
   * file in the order the underlying filesystem yields them.  Symbolic links are not
   * followed and are not reported.
   *
   * @param root the directory to scan.  The skip rules never apply to the root itself.
   * @param skipDirectory directories this matcher accepts are not entered
   * @param skipFile files this matcher accepts are not reported
   * @param onFile a consumer for regular files
   * @param onError a consumer for entries that could not be read; the scan continues
   *                after calling it
   * @throws NoSuchFileException if the root does not exist
   * @throws NotDirectoryException if the root is not a directory
   * @throws IOException if <code>onFile</code> throws
   */
  void scan(Path root, PathMatcher skipDirectory, PathMatcher skipFile, IOConsumer<FileRecord> onFile, ScanErrorHandler onError) throws IOException;

  /**
   * Open the file for reading.
   * Callers are responsible for closing the returned stream.
   * The returned stream is not buffered.
   *
   * <p>This method opens the file when called, so it may return bytes that differ from
   * what was there when the file was scanned.  It may also fail if the file no longer
   * exists.
   *
   * @return an open input stream
   * @throws NoSuchFileException if the file is missing
   * @throws IOException if something goes wrong when opening the file
   */
  InputStream openRegularFileForReading(Path path) throws NoSuchFileException, IOException;

  /**
   * Remove a file.  Removal is atomic for a single file: afterwards the file is either
   * untouched or gone.
   *
   * @throws NoSuchFileException if the file is missing
   * @throws IOException if the file could not be removed
   */
  void delete(Path path) throws NoSuchFileException, IOException;

}
