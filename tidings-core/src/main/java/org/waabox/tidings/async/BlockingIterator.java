package org.waabox.tidings.async;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.tidings.TidingsException;

/**
 * A blocking {@link Iterator} over an {@link AsyncIterator}.
 *
 * <p>{@link #hasNext()} waits until the next element is available or the
 * sequence has ended. If the waiting thread is interrupted, the interrupt
 * flag is restored, the underlying iterator is closed and the iteration
 * reports no more elements.
 *
 * <p>Use with try-with-resources so that breaking out of the loop
 * releases the underlying iterator:
 * <pre>{@code
 * try (BlockingIterator<Notification> it = sequence.iterator().blocking()) {
 *   while (it.hasNext()) {
 *     Notification notification = it.next();
 *     if (isLast(notification)) {
 *       break;
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>This class is not thread-safe; it belongs to the consuming thread.
 *
 * @param <E> the element type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BlockingIterator<E> implements Iterator<E>, AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      BlockingIterator.class);

  /** The underlying iterator, never null. */
  private final AsyncIterator<E> source;

  /** The element fetched by hasNext() and not yet returned, or null. */
  private E lookahead;

  /** Whether the underlying iterator reported the end. */
  private boolean finished;

  /** Creates a new blocking view.
   *
   * @param theSource the iterator to wait on, never null
   */
  public BlockingIterator(final AsyncIterator<E> theSource) {
    source = Objects.requireNonNull(theSource, "source must not be null");
  }

  /** {@inheritDoc}
   *
   * @throws TidingsException if the underlying iterator failed
   */
  @Override
  public boolean hasNext() {
    if (lookahead != null) {
      return true;
    }
    if (finished) {
      return false;
    }

    final Optional<E> next;
    try {
      next = source.next().toCompletableFuture().get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Interrupted while waiting for the next element, closing");
      finish();
      return false;
    } catch (final ExecutionException e) {
      finish();
      throw new TidingsException("Asynchronous iteration failed",
          e.getCause());
    }

    if (next.isEmpty()) {
      finished = true;
      return false;
    }
    lookahead = next.get();
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public E next() {
    if (!hasNext()) {
      throw new NoSuchElementException("The sequence has ended");
    }
    final E result = lookahead;
    lookahead = null;
    return result;
  }

  /**
   * Closes the underlying iterator. Safe to call multiple times.
   */
  @Override
  public void close() {
    lookahead = null;
    finish();
  }

  /** Marks this iterator as finished and closes the underlying one. */
  private void finish() {
    finished = true;
    source.close();
  }
}
