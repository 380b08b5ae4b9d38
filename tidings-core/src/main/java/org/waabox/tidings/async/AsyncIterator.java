package org.waabox.tidings.async;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * A single-use, forward-only cursor over elements that become available
 * asynchronously.
 *
 * <p>Each call to {@link #next()} yields a stage holding the next element,
 * or {@link Optional#empty()} once the sequence has ended. Only one call
 * may be outstanding at a time: callers request the next element after
 * the previous stage completed.
 *
 * <p>Iterators hold resources until they end or are closed, so they are
 * meant to be used with try-with-resources.
 *
 * @param <E> the element type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface AsyncIterator<E> extends AutoCloseable {

  /**
   * Requests the next element.
   *
   * @return a stage holding the next element, or empty when the sequence
   *         has ended, never null
   */
  CompletionStage<Optional<E>> next();

  /**
   * Ends the iteration and releases its resources.
   *
   * <p>A pending {@link #next()} completes with {@link Optional#empty()}.
   * Safe to call multiple times.
   */
  @Override
  void close();

  /**
   * Returns a blocking view of this iterator for plain loops.
   *
   * @return a blocking iterator backed by this iterator, never null
   */
  default BlockingIterator<E> blocking() {
    return new BlockingIterator<>(this);
  }
}
