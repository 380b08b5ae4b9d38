package org.waabox.tidings.async;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Static helpers for consuming {@link AsyncIterator asynchronous
 * iterators} without blocking a thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AsyncIterators {

  /** Private constructor to prevent instantiation. */
  private AsyncIterators() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Applies the action to every element of the iterator, in order.
   *
   * <p>Elements that are already available are processed in a loop on
   * the calling thread; when the iterator has to wait, processing resumes
   * on the thread that makes the next element available. The stack does
   * not grow with the number of elements.
   *
   * <p>If the action throws, the iterator is closed and the returned
   * future completes exceptionally with that exception.
   *
   * @param iterator the iterator to drain, never null
   * @param action   the action to apply, never null
   * @param <E>      the element type
   *
   * @return a future completing when the sequence has ended, never null
   */
  public static <E> CompletableFuture<Void> forEach(
      final AsyncIterator<E> iterator, final Consumer<? super E> action) {
    Objects.requireNonNull(iterator, "iterator must not be null");
    Objects.requireNonNull(action, "action must not be null");

    final CompletableFuture<Void> done = new CompletableFuture<>();
    new Drain<>(iterator, action, done).run();
    return done;
  }

  /**
   * Drives one forEach call.
   *
   * @param <E> the element type
   */
  private static final class Drain<E> implements Runnable {

    /** The iterator being drained. */
    private final AsyncIterator<E> iterator;

    /** The per-element action. */
    private final Consumer<? super E> action;

    /** Completed at the end of the sequence or on failure. */
    private final CompletableFuture<Void> done;

    /**
     * Creates a new drain.
     *
     * @param theIterator the iterator, never null
     * @param theAction   the action, never null
     * @param theDone     the completion future, never null
     */
    private Drain(final AsyncIterator<E> theIterator,
        final Consumer<? super E> theAction,
        final CompletableFuture<Void> theDone) {
      iterator = theIterator;
      action = theAction;
      done = theDone;
    }

    @Override
    public void run() {
      while (true) {
        final CompletableFuture<Optional<E>> pending;
        try {
          pending = iterator.next().toCompletableFuture();
        } catch (final RuntimeException e) {
          fail(e);
          return;
        }

        if (!pending.isDone()) {
          pending.whenComplete((element, failure) -> {
            if (failure != null) {
              fail(failure);
            } else if (accept(element)) {
              run();
            }
          });
          return;
        }

        final Optional<E> element;
        try {
          element = pending.join();
        } catch (final RuntimeException e) {
          fail(e.getCause() != null ? e.getCause() : e);
          return;
        }
        if (!accept(element)) {
          return;
        }
      }
    }

    /**
     * Applies the action to a fetched element.
     *
     * @param element the fetched element, empty at the end
     *
     * @return true if draining should continue
     */
    private boolean accept(final Optional<E> element) {
      if (element.isEmpty()) {
        done.complete(null);
        return false;
      }
      try {
        action.accept(element.get());
        return true;
      } catch (final RuntimeException e) {
        fail(e);
        return false;
      }
    }

    /**
     * Closes the iterator and fails the completion future.
     *
     * @param cause the failure, never null
     */
    private void fail(final Throwable cause) {
      try {
        iterator.close();
      } finally {
        done.completeExceptionally(cause);
      }
    }
  }
}
