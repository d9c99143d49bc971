package cal.dupes.impls;

import cal.dupes.Util;
import cal.prim.QuietAutoCloseable;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Prints hashing progress from a background thread.  The display only reads the
 * counters in {@link HashProgress}, so the workers never wait on it.
 */
public class ProgressDisplay implements QuietAutoCloseable {

  private final HashProgress progress;
  private final PrintStream out;
  private final ScheduledExecutorService timer;
  private long lastPrinted = -1L;

  public ProgressDisplay(HashProgress progress, PrintStream out, Duration interval) {
    this.progress = progress;
    this.out = out;
    this.timer = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("progress").setDaemon(true).build());
    long millis = Math.max(1L, interval.toMillis());
    timer.scheduleAtFixedRate(this::refresh, millis, millis, TimeUnit.MILLISECONDS);
  }

  static String formatPercent(long numerator, long denominator) {
    if (numerator < 0) {
      throw new IllegalArgumentException("negative numerator: " + numerator);
    }
    if (denominator < 0) {
      throw new IllegalArgumentException("negative denominator: " + denominator);
    }
    if (denominator == 0 || numerator > denominator) {
      return "100%";
    }
    return String.format("%3d", numerator * 100 / denominator) + '%';
  }

  static String describe(long done, long total, long bytes, long totalBytes) {
    return "  [" + formatPercent(done, total) + "] " + done + '/' + total + " files, " +
            Util.formatSize(bytes) + " of " + Util.formatSize(totalBytes);
  }

  private synchronized void refresh() {
    long done = progress.completedFiles();
    if (done != lastPrinted) {
      lastPrinted = done;
      out.println(describe(done, progress.totalFiles(), progress.bytesHashed(), progress.totalBytes()));
    }
  }

  @Override
  public void close() {
    timer.shutdownNow();
    try {
      timer.awaitTermination(1, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    refresh();
  }

}
