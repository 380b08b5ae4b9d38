package org.waabox.tidings.async;

/**
 * A source of {@link AsyncIterator asynchronous iterators}.
 *
 * <p>Every call to {@link #iterator()} starts an independent iteration.
 *
 * @param <E> the element type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface AsyncSequence<E> {

  /**
   * Starts a new iteration.
   *
   * @return a new iterator, never null
   */
  AsyncIterator<E> iterator();
}
