package org.waabox.tidings;

import java.util.Objects;

import org.waabox.tidings.async.AsyncSequence;

/**
 * An asynchronous sequence of the notifications a {@link NotificationCenter}
 * posts under a given name, optionally restricted to one source.
 *
 * <p>The sequence itself holds no iteration state. Each call to
 * {@link #iterator()} registers a fresh observer and returns an
 * independent {@link NotificationIterator} that sees every matching
 * notification posted from that moment on:
 * <pre>{@code
 * NotificationSequence ticks = center.sequence("tick");
 *
 * try (NotificationIterator it = ticks.iterator()) {
 *   it.next().thenAccept(first -> ...);
 * }
 * }</pre>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationSequence implements AsyncSequence<Notification> {

  /** The observed center, never null. */
  private final NotificationCenter center;

  /** The observed notification name, never null. */
  private final String name;

  /** The observed source, null for any source. */
  private final Object source;

  /**
   * Creates a new sequence.
   *
   * @param theCenter the center to observe, never null
   * @param theName   the notification name, never null or empty
   * @param theSource the source to observe, null for any source
   *
   * @throws NullPointerException     if theCenter or theName is null
   * @throws IllegalArgumentException if theName is empty
   */
  public NotificationSequence(final NotificationCenter theCenter,
      final String theName, final Object theSource) {
    center = Objects.requireNonNull(theCenter, "center must not be null");
    name = Objects.requireNonNull(theName, "name must not be null");
    if (theName.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    source = theSource;
  }

  /**
   * Registers an observer with the center and returns an iterator over
   * the notifications it receives.
   *
   * @return a new, active iterator, never null
   *
   * @throws TidingsException if the center cannot register the observer
   */
  @Override
  public NotificationIterator iterator() {
    return new NotificationIterator(center, name, source);
  }

  /**
   * Returns the observed notification name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the observed source.
   *
   * @return the source, or null if every source is observed
   */
  public Object source() {
    return source;
  }
}
