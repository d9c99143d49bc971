package cal.prim.fs;

import cal.prim.IOConsumer;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;

public class PhysicalFilesystem implements Filesystem {

  @Override
  public void scan(Path root, PathMatcher skipDirectory, PathMatcher skipFile, IOConsumer<FileRecord> onFile, ScanErrorHandler onError) throws IOException {
    if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
      throw new NoSuchFileException(root.toString());
    }
    if (!Files.isDirectory(root)) {
      throw new NotDirectoryException(root.toString());
    }
    // The root is followed if it is a link; nothing below it is.  Entries are still
    // reported under the root path the caller gave.
    Path start = Files.isSymbolicLink(root) ? root.toRealPath() : root;
    // No FOLLOW_LINKS: symbolic links show up in visitFile with isSymbolicLink() set.
    Files.walkFileTree(start, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new Visitor(start, root, skipDirectory, skipFile, onError) {
      @Override
      protected void onFile(Path path, BasicFileAttributes attrs) throws IOException {
        onFile.accept(new FileRecord(path, attrs.size()));
      }
    });
  }

  @Override
  public InputStream openRegularFileForReading(Path path) throws IOException {
    try {
      return Files.newInputStream(path);
    } catch (FileNotFoundException e) {
      // The JavaDoc for Files.newInputStream() does not say which of the two "file is
      // missing" exceptions it throws.  Re-throw the one promised by our own contract.
      throw new NoSuchFileException(path.toString());
    }
  }

  @Override
  public void delete(Path path) throws IOException {
    Files.delete(path);
  }

  private static abstract class Visitor implements FileVisitor<Path> {
    private final Path start;
    private final Path root;
    private final PathMatcher skipDirectory;
    private final PathMatcher skipFile;
    private final ScanErrorHandler onError;

    Visitor(Path start, Path root, PathMatcher skipDirectory, PathMatcher skipFile, ScanErrorHandler onError) {
      this.start = start;
      this.root = root;
      this.skipDirectory = skipDirectory;
      this.skipFile = skipFile;
      this.onError = onError;
    }

    private Path underRoot(Path walked) {
      return start == root ? walked : root.resolve(start.relativize(walked));
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dirPath, BasicFileAttributes attrs) {
      if (dirPath.equals(start)) {
        return FileVisitResult.CONTINUE;
      }
      return skipDirectory.matches(underRoot(dirPath)) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path filePath, BasicFileAttributes attrs) throws IOException {
      Path path = underRoot(filePath);
      if (attrs.isRegularFile() && !skipFile.matches(path)) {
        onFile(path, attrs);
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      onError.onError(underRoot(file), exc);
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
      // A directory whose listing broke off part-way still yields the entries read so far.
      if (exc != null) {
        onError.onError(underRoot(dir), exc);
      }
      return FileVisitResult.CONTINUE;
    }

    protected abstract void onFile(Path file, BasicFileAttributes attrs) throws IOException;
  }

}
