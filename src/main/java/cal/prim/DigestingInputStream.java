package cal.prim;

import org.checkerframework.checker.mustcall.qual.MustCallAlias;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.util.function.LongConsumer;

/**
 * A stream that feeds every byte it passes through into a {@link MessageDigest}.
 * The number of bytes in each successful read is reported to a listener, which
 * lets callers keep running totals without wrapping the stream again.
 *
 * <p>Skipping, marking and resetting are not supported since they would let bytes
 * bypass the digest.
 */
public class DigestingInputStream extends FilterInputStream {

  private final MessageDigest digest;
  private final LongConsumer onBytesRead;
  private long bytesRead;

  public @MustCallAlias DigestingInputStream(@MustCallAlias InputStream in, MessageDigest digest, LongConsumer onBytesRead) {
    super(in);
    this.digest = digest;
    this.onBytesRead = onBytesRead;
    bytesRead = 0L;
  }

  @Override
  public int read() throws IOException {
    int res = super.read();
    if (res >= 0) {
      digest.update((byte)res);
      bytesRead++;
      onBytesRead.accept(1L);
    }
    return res;
  }

  @Override
  public int read(byte[] b) throws IOException {
    return read(b, 0, b.length);
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    int nread = super.read(b, off, len);
    if (nread > 0) {
      digest.update(b, off, nread);
      bytesRead += nread;
      onBytesRead.accept(nread);
    }
    return nread;
  }

  @Override
  public long skip(long n) {
    throw new UnsupportedOperationException();
  }

  @Override
  public synchronized void mark(int readlimit) {
    throw new UnsupportedOperationException();
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  @Override
  public synchronized void reset() {
    throw new UnsupportedOperationException();
  }

  /**
   * Finish the digest.  This resets the underlying {@link MessageDigest}, so it should
   * be called once, after the stream has been drained.
   */
  public byte[] finishDigest() {
    return digest.digest();
  }

  public long getBytesRead() {
    return bytesRead;
  }

}
