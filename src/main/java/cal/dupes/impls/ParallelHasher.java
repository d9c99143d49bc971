package cal.dupes.impls;

import cal.dupes.types.DigestAlgorithm;
import cal.dupes.types.FileFailure;
import cal.prim.fs.FileRecord;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Hashes many files at once on a fixed pool of worker threads.
 *
 * <p>Each file is hashed by exactly one worker, exactly once.  Workers share nothing but
 * a concurrent map of digests, a concurrent queue of failures, and the counters in
 * {@link HashProgress}.  A file that fails to hash is recorded as a failure and has no
 * digest.
 */
public class ParallelHasher {

  private final ContentHasher hasher;
  private final int nThreads;

  public ParallelHasher(ContentHasher hasher, int nThreads) {
    if (nThreads < 1) {
      throw new IllegalArgumentException("need at least one thread, got " + nThreads);
    }
    this.hasher = hasher;
    this.nThreads = nThreads;
  }

  public static HashProgress progressFor(Collection<FileRecord> candidates) {
    return new HashProgress(candidates.size(), candidates.stream().mapToLong(FileRecord::size).sum());
  }

  /**
   * Hash every candidate.  Blocks until all of them are done.
   *
   * @param candidates the files to hash; if a path appears more than once it is hashed once
   * @param algorithm the digest to compute
   * @param progress counters to update as work completes
   * @throws InterruptedIOException if the calling thread is interrupted while waiting
   */
  public HashResults hashAll(Collection<FileRecord> candidates, DigestAlgorithm algorithm, HashProgress progress) throws InterruptedIOException {
    Map<Path, FileRecord> unique = new LinkedHashMap<>();
    for (FileRecord f : candidates) {
      unique.putIfAbsent(f.path(), f);
    }

    Map<Path, String> digests = new ConcurrentHashMap<>();
    Queue<FileFailure> failures = new ConcurrentLinkedQueue<>();

    List<Callable<Void>> jobs = new ArrayList<>(unique.size());
    for (FileRecord f : unique.values()) {
      jobs.add(() -> {
        try {
          digests.put(f.path(), hasher.hash(f.path(), algorithm, progress::bytesRead));
        } catch (IOException e) {
          failures.add(new FileFailure(f.path(), FileFailure.Stage.HASH, e));
        } catch (UncheckedIOException e) {
          failures.add(new FileFailure(f.path(), FileFailure.Stage.HASH, e.getCause()));
        } finally {
          progress.fileDone();
        }
        return null;
      });
    }

    ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(nThreads, Math.max(1, jobs.size())),
            new ThreadFactoryBuilder().setNameFormat("hasher-%d").setDaemon(true).build());
    try {
      for (Future<Void> f : pool.invokeAll(jobs)) {
        try {
          f.get();
        } catch (ExecutionException e) {
          // Workers catch I/O problems themselves; anything else is a bug.
          Throwables.throwIfUnchecked(e.getCause());
          throw new IllegalStateException(e.getCause());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while hashing");
    } finally {
      pool.shutdownNow();
    }

    return new HashResults(digests, new ArrayList<>(failures));
  }

}
