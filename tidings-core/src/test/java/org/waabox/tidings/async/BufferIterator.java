package org.waabox.tidings.async;

import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.tidings.buffer.OrderedAsyncBuffer;

/**
 * An {@link AsyncIterator} over a bare {@link OrderedAsyncBuffer}, counting
 * how many times it was closed.
 *
 * @param <E> the element type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BufferIterator<E> implements AsyncIterator<E> {

  /** The backing buffer. */
  private final OrderedAsyncBuffer<E> buffer = new OrderedAsyncBuffer<>();

  /** The number of close calls. */
  private final AtomicInteger closes = new AtomicInteger();

  @Override
  public CompletionStage<Optional<E>> next() {
    return buffer.next();
  }

  @Override
  public void close() {
    closes.incrementAndGet();
    buffer.close();
  }

  /** Returns the backing buffer. */
  OrderedAsyncBuffer<E> buffer() {
    return buffer;
  }

  /** Returns the number of close calls. */
  int closes() {
    return closes.get();
  }
}
