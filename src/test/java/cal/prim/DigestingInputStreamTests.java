package cal.prim;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.atomic.AtomicLong;

@Test
public class DigestingInputStreamTests {

  /** Hands out one byte per call no matter how many were asked for. */
  private static class TrickleStream extends InputStream {
    private final byte[] data;
    private int pos = 0;

    TrickleStream(byte[] data) {
      this.data = data;
    }

    @Override
    public int read() {
      return pos < data.length ? Byte.toUnsignedInt(data[pos++]) : -1;
    }

    @Override
    public int read(byte[] b, int off, int len) {
      int i = read();
      if (i < 0) return -1;
      b[off] = (byte)i;
      return 1;
    }
  }

  private static MessageDigest sha256() throws NoSuchAlgorithmException {
    return MessageDigest.getInstance("SHA-256");
  }

  @Test
  public void testDigestMatchesDirect() throws IOException, NoSuchAlgorithmException {
    byte[] data = "the quick brown fox".getBytes(StandardCharsets.UTF_8);
    AtomicLong reported = new AtomicLong();
    try (DigestingInputStream in = new DigestingInputStream(new TrickleStream(data), sha256(), reported::addAndGet)) {
      byte[] buf = new byte[4];
      while (in.read(buf) >= 0) {
        // drain
      }
      Assert.assertEquals(in.getBytesRead(), data.length);
      Assert.assertEquals(reported.get(), data.length);
      Assert.assertEquals(in.finishDigest(), sha256().digest(data));
    }
  }

  @Test
  public void testSingleByteReads() throws IOException, NoSuchAlgorithmException {
    byte[] data = {0, (byte)0xFF, 7};
    try (DigestingInputStream in = new DigestingInputStream(new ByteArrayInputStream(data), sha256(), n -> { })) {
      Assert.assertEquals(in.read(), 0);
      Assert.assertEquals(in.read(), 0xFF);
      Assert.assertEquals(in.read(), 7);
      Assert.assertEquals(in.read(), -1);
      Assert.assertEquals(in.getBytesRead(), 3L);
      Assert.assertEquals(in.finishDigest(), sha256().digest(data));
    }
  }

  @Test(expectedExceptions = UnsupportedOperationException.class)
  public void testNoSkipping() throws IOException, NoSuchAlgorithmException {
    try (DigestingInputStream in = new DigestingInputStream(new ByteArrayInputStream(new byte[10]), sha256(), n -> { })) {
      Assert.assertFalse(in.markSupported());
      in.skip(5);
    }
  }

}
