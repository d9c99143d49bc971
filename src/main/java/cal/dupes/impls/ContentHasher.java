package cal.dupes.impls;

import cal.dupes.Util;
import cal.dupes.types.DigestAlgorithm;
import cal.prim.DigestingInputStream;
import cal.prim.fs.Filesystem;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.function.LongConsumer;

/**
 * Computes whole-file digests by streaming each file through a fixed-size buffer,
 * so memory use does not depend on file size.
 *
 * <p>Instances are stateless and may be shared between threads.
 */
public class ContentHasher {

  private final Filesystem fs;

  public ContentHasher(Filesystem fs) {
    this.fs = fs;
  }

  public String hash(Path path, DigestAlgorithm algorithm) throws IOException {
    return hash(path, algorithm, n -> { });
  }

  /**
   * Digest the current contents of a file.
   *
   * @param path the file to read
   * @param algorithm the digest to compute
   * @param onBytesRead called with the size of every chunk read, from the calling thread
   * @return the digest as lowercase hexadecimal
   * @throws IOException if the file cannot be opened or a read fails part-way; no
   *     partial digest is ever returned
   */
  public String hash(Path path, DigestAlgorithm algorithm, LongConsumer onBytesRead) throws IOException {
    try (DigestingInputStream in = new DigestingInputStream(fs.openRegularFileForReading(path), algorithm.newDigest(), onBytesRead)) {
      Util.drain(in);
      return Util.toHex(in.finishDigest());
    }
  }

  public String hash(InputStream data, DigestAlgorithm algorithm) throws IOException {
    DigestingInputStream in = new DigestingInputStream(data, algorithm.newDigest(), n -> { });
    Util.drain(in);
    return Util.toHex(in.finishDigest());
  }

}
