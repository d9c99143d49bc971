package cal.dupes.impls;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters that hashing workers bump and that anyone may read at any time.
 * Reads never block the workers.
 */
public class HashProgress {

  private final long totalFiles;
  private final long totalBytes;
  private final AtomicLong completedFiles = new AtomicLong();
  private final AtomicLong bytesHashed = new AtomicLong();

  public HashProgress(long totalFiles, long totalBytes) {
    this.totalFiles = totalFiles;
    this.totalBytes = totalBytes;
  }

  public long totalFiles() {
    return totalFiles;
  }

  public long totalBytes() {
    return totalBytes;
  }

  /** Files finished so far, successfully or not.  Never decreases. */
  public long completedFiles() {
    return completedFiles.get();
  }

  public long bytesHashed() {
    return bytesHashed.get();
  }

  void fileDone() {
    completedFiles.incrementAndGet();
  }

  void bytesRead(long n) {
    bytesHashed.addAndGet(n);
  }

}
