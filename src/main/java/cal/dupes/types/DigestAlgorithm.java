package cal.dupes.types;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The content digests a scan can use.
 */
public enum DigestAlgorithm {

  SHA256("sha256", "SHA-256", 32),
  SHA512("sha512", "SHA-512", 64),

  /** Kept for comparing against checksums made by other tools.  Not collision resistant. */
  MD5("md5", "MD5", 16);

  private final String cliName;
  private final String jcaName;
  private final int digestLengthInBytes;

  DigestAlgorithm(String cliName, String jcaName, int digestLengthInBytes) {
    this.cliName = cliName;
    this.jcaName = jcaName;
    this.digestLengthInBytes = digestLengthInBytes;
  }

  public String cliName() {
    return cliName;
  }

  public int digestLengthInBytes() {
    return digestLengthInBytes;
  }

  public int hexLength() {
    return digestLengthInBytes * 2;
  }

  public MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(jcaName);
    } catch (NoSuchAlgorithmException e) {
      // All JREs are required to support MD5, SHA-1, and SHA-256.  SHA-512 ships
      // with every JRE we know of.
      throw new UnsupportedOperationException(jcaName, e);
    }
  }

  /**
   * Look up an algorithm by its command-line name (case-insensitive).
   * @throws IllegalArgumentException if there is no such algorithm
   */
  public static DigestAlgorithm fromName(String name) {
    String needle = name.trim().toLowerCase(Locale.ROOT);
    for (DigestAlgorithm a : values()) {
      if (a.cliName.equals(needle)) {
        return a;
      }
    }
    throw new IllegalArgumentException("Unsupported algorithm: " + name + ". Use " +
            Arrays.stream(values()).map(DigestAlgorithm::cliName).collect(Collectors.joining(", ")));
  }

  @Override
  public String toString() {
    return cliName;
  }

}
