package cal.prim;

import java.io.IOException;

/**
 * A {@link java.util.function.Consumer Consumer} whose {@link #accept(Object)} method
 * may throw {@link IOException}.  Filesystem scans report entries through these so that
 * callers can do I/O of their own for each entry.
 * @param <T>
 */
@FunctionalInterface
public interface IOConsumer<T> {
  void accept(T x) throws IOException;
}
