package cal.dupes.impls;

import cal.dupes.Util;
import cal.dupes.types.FileFailure;
import cal.prim.fs.FileRecord;
import cal.prim.fs.Filesystem;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Byte-for-byte comparison of files that are already believed to be identical.
 * Used to guard against digest collisions before files are reported (and maybe deleted).
 */
public class ContentComparer {

  private static class ReadFailure extends IOException {
    final Path path;

    ReadFailure(Path path, IOException cause) {
      super(path + ": " + cause.getMessage(), cause);
      this.path = path;
    }

    IOException unwrap() {
      return (IOException)getCause();
    }
  }

  /** An open file whose read and close failures name the file. */
  private static class OpenFile extends FilterInputStream {
    final Path path;

    OpenFile(Path path, InputStream in) {
      super(in);
      this.path = path;
    }

    @Override
    public void close() throws ReadFailure {
      try {
        super.close();
      } catch (IOException e) {
        throw new ReadFailure(path, e);
      }
    }
  }

  private final Filesystem fs;

  public ContentComparer(Filesystem fs) {
    this.fs = fs;
  }

  /**
   * Partition files into classes of identical content.
   *
   * <p>Each class keeps the relative order of its members, and the classes are ordered by
   * their first member.  A file that cannot be read is reported to <code>onFailure</code>
   * and left out of every class.
   */
  public List<List<FileRecord>> partition(List<FileRecord> files, Consumer<FileFailure> onFailure) {
    List<List<FileRecord>> classes = new ArrayList<>();
    for (FileRecord f : files) {
      place(f, classes, onFailure);
    }
    classes.removeIf(List::isEmpty);
    return classes;
  }

  private void place(FileRecord f, List<List<FileRecord>> classes, Consumer<FileFailure> onFailure) {
    Iterator<List<FileRecord>> it = classes.iterator();
    while (it.hasNext()) {
      List<FileRecord> c = it.next();
      while (!c.isEmpty()) {
        FileRecord representative = c.get(0);
        try {
          if (sameContent(representative.path(), f.path())) {
            c.add(f);
            return;
          }
          break;
        } catch (ReadFailure e) {
          onFailure.accept(new FileFailure(e.path, FileFailure.Stage.VERIFY, e.unwrap()));
          if (e.path.equals(f.path())) {
            return;
          }
          // The representative went bad; the next member is known to match it.
          c.remove(0);
        }
      }
    }
    List<FileRecord> fresh = new ArrayList<>();
    fresh.add(f);
    classes.add(fresh);
  }

  private boolean sameContent(Path a, Path b) throws ReadFailure {
    try (OpenFile inA = open(a);
         OpenFile inB = open(b)) {
      return contentsMatch(inA, inB);
    }
  }

  private static boolean contentsMatch(OpenFile a, OpenFile b) throws ReadFailure {
    byte[] bufA = new byte[Util.SUGGESTED_BUFFER_SIZE];
    byte[] bufB = new byte[Util.SUGGESTED_BUFFER_SIZE];
    for (;;) {
      int nA = read(a, bufA);
      int nB = read(b, bufB);
      if (nA != nB) {
        return false;
      }
      if (nA == 0) {
        return true;
      }
      if (!Arrays.equals(bufA, 0, nA, bufB, 0, nB)) {
        return false;
      }
    }
  }

  private OpenFile open(Path p) throws ReadFailure {
    try {
      return new OpenFile(p, Util.buffered(fs.openRegularFileForReading(p)));
    } catch (IOException e) {
      throw new ReadFailure(p, e);
    }
  }

  private static int read(OpenFile in, byte[] buf) throws ReadFailure {
    try {
      return Util.readChunk(in, buf);
    } catch (IOException e) {
      throw new ReadFailure(in.path, e);
    }
  }

}
