package cal.dupes;

import java.io.BufferedInputStream;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

public abstract class Util {

  public static final long ONE_BYTE = 1;
  public static final long ONE_KB = ONE_BYTE * 1024;
  public static final long ONE_MB = ONE_KB * 1024;
  public static final long ONE_GB = ONE_MB * 1024;
  public static final long ONE_TB = ONE_GB * 1024;

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link BufferedInputStream}
   * on desktop JVMs.
   *
   * <p>Performance note: there is a large benefit to having every layer of a software
   * system use the same buffer size.  If data from one stream using one buffer size is
   * piped to a consumer reading with a different buffer size, the mismatch can cause
   * an unexpected performance hit.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.  Each hashing
   * worker reuses its own.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  public static long drain(InputStream in) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      count += n;
    }
    return count;
  }

  public static int readChunk(InputStream in, byte[] chunk) throws IOException {
    int soFar = 0;
    int n;
    while (soFar < chunk.length && (n = in.read(chunk, soFar, chunk.length - soFar)) >= 0) {
      soFar += n;
    }
    return soFar;
  }

  public static BufferedInputStream buffered(InputStream in) {
    return new BufferedInputStream(in, SUGGESTED_BUFFER_SIZE);
  }

  /**
   * Format a byte count using binary units, e.g. <code>"1.50 KiB"</code>.
   * Counts below one KiB are printed exactly.
   */
  public static String formatSize(long l) {
    if (l >= ONE_TB) return scaled(l, ONE_TB, "TiB");
    if (l >= ONE_GB) return scaled(l, ONE_GB, "GiB");
    if (l >= ONE_MB) return scaled(l, ONE_MB, "MiB");
    if (l >= ONE_KB) return scaled(l, ONE_KB, "KiB");
    return l + " B";
  }

  private static String scaled(long l, long unit, String suffix) {
    return String.format(Locale.ROOT, "%.2f %s", (double)l / unit, suffix);
  }

  /**
   * Parse a size such as <code>"512"</code>, <code>"10KB"</code>, or <code>"2 gb"</code>.
   * Suffixes are binary multiples (KB = 1024 bytes).
   * @throws IllegalArgumentException if the text is not a size
   */
  public static long parseSize(String text) {
    String s = text.trim().toUpperCase(Locale.ROOT);
    long multiplier;
    if (s.endsWith("GB")) {
      multiplier = ONE_GB;
      s = s.substring(0, s.length() - 2);
    } else if (s.endsWith("MB")) {
      multiplier = ONE_MB;
      s = s.substring(0, s.length() - 2);
    } else if (s.endsWith("KB")) {
      multiplier = ONE_KB;
      s = s.substring(0, s.length() - 2);
    } else if (s.endsWith("B")) {
      multiplier = ONE_BYTE;
      s = s.substring(0, s.length() - 1);
    } else {
      multiplier = ONE_BYTE;
    }
    long n;
    try {
      n = Long.parseLong(s.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a size: '" + text + '\'', e);
    }
    if (n < 0) {
      throw new IllegalArgumentException("negative size: '" + text + '\'');
    }
    try {
      return Math.multiplyExact(n, multiplier);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("size too large: '" + text + '\'', e);
    }
  }

  private static final String HEX_CHARS = "0123456789abcdef";
  public static String toHex(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  public static String abbreviate(String digest, int length) {
    return digest.length() <= length ? digest : digest.substring(0, length);
  }

  public static boolean confirm(String prompt) {
    Console cons = System.console();
    if (cons == null) {
      return false;
    }
    String input = cons.readLine("%s [y/n] ", prompt);
    return input != null && !input.isEmpty() && Character.toLowerCase(input.charAt(0)) == 'y';
  }

}
