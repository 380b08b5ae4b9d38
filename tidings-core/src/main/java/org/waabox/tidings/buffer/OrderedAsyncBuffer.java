package org.waabox.tidings.buffer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An unbounded FIFO buffer that bridges any number of pushing producers to
 * a single consumer pulling elements asynchronously.
 *
 * <p>Producers call {@link #push(Object)} from any thread. The consumer
 * calls {@link #next()}, which completes immediately when an element is
 * queued or the buffer is closed, and otherwise completes when the next
 * push or close happens.
 *
 * <p>Elements are delivered in the order in which the pushes went through
 * the buffer's lock. Once {@link #close() closed}, already queued
 * elements are still delivered, after which every {@code next()} yields
 * {@link Optional#empty()}. Pushes after close are discarded.
 *
 * <p>Only one {@code next()} may be outstanding at a time. The stages
 * handed to the consumer are minimal stages: cancelling or completing
 * them has no effect on the buffer.
 *
 * <p>This class is thread-safe.
 *
 * @param <E> the element type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class OrderedAsyncBuffer<E> {

  /** Guards every mutable field below. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The elements pushed but not yet delivered, oldest first. */
  private final Deque<E> pending = new ArrayDeque<>();

  /** The consumer waiting for an element, null if none. */
  private CompletableFuture<Optional<E>> waiter;

  /** Whether the buffer has been closed. Never reset. */
  private boolean closed;

  /**
   * Pushes an element into the buffer.
   *
   * <p>If the consumer is waiting, it is resumed with this element.
   * Otherwise the element is queued. If the buffer is closed the element
   * is silently discarded.
   *
   * <p>The waiting consumer is resumed outside the buffer's lock, on the
   * calling thread.
   *
   * @param element the element to push, never null
   *
   * @throws NullPointerException if element is null
   */
  public void push(final E element) {
    Objects.requireNonNull(element, "element must not be null");

    final CompletableFuture<Optional<E>> handoff;

    lock.lock();
    try {
      if (closed) {
        return;
      }
      if (waiter == null) {
        pending.addLast(element);
        return;
      }
      handoff = waiter;
      waiter = null;
    } finally {
      lock.unlock();
    }

    handoff.complete(Optional.of(element));
  }

  /**
   * Closes the buffer.
   *
   * <p>Queued elements are kept and will still be delivered. A waiting
   * consumer, which implies an empty queue, is resumed with
   * {@link Optional#empty()}. Closing an already closed buffer does
   * nothing.
   */
  public void close() {
    final CompletableFuture<Optional<E>> handoff;

    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      handoff = waiter;
      waiter = null;
    } finally {
      lock.unlock();
    }

    if (handoff != null) {
      handoff.complete(Optional.empty());
    }
  }

  /**
   * Requests the next element.
   *
   * <p>The returned stage is already complete when an element is queued
   * (holding the oldest one) or when the buffer is closed and drained
   * (holding {@link Optional#empty()}). Otherwise it completes on the next
   * {@link #push(Object)} or {@link #close()}.
   *
   * @return a stage holding the next element, or empty when no more
   *         elements will ever arrive, never null
   *
   * @throws IllegalStateException if a previous call is still pending
   */
  public CompletionStage<Optional<E>> next() {
    lock.lock();
    try {
      final E head = pending.pollFirst();
      if (head != null) {
        return CompletableFuture.completedStage(Optional.of(head));
      }
      if (closed) {
        return CompletableFuture.completedStage(Optional.empty());
      }
      if (waiter != null) {
        throw new IllegalStateException(
            "A next() call is already pending on this buffer");
      }
      waiter = new CompletableFuture<>();
      return waiter.minimalCompletionStage();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of queued, undelivered elements.
   *
   * @return the number of queued elements, zero or more
   */
  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether this buffer has been closed.
   *
   * <p>A closed buffer may still hold elements to deliver.
   *
   * @return {@code true} once {@link #close()} has been called
   */
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }
}
