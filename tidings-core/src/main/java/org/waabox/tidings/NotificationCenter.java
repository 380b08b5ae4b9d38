package org.waabox.tidings;

import java.util.Map;

/**
 * A publish/subscribe facility keyed by notification name and, optionally,
 * by the object that posts the notification.
 *
 * <p>Observers are registered with
 * {@link #addObserver(String, Object, NotificationObserver)} and may be
 * invoked zero or more times, from any thread, until
 * {@link #removeObserver(ObserverToken)} returns.
 *
 * <p>Typical usage with sequential control flow:
 * <pre>{@code
 * try (BlockingIterator<Notification> ticks =
 *     center.sequence("tick").iterator().blocking()) {
 *   while (ticks.hasNext()) {
 *     handle(ticks.next());
 *   }
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface NotificationCenter {

  /**
   * Registers an observer for notifications with the given name.
   *
   * @param name     the notification name to observe, never null or empty
   * @param source   the only source the observer is interested in, matched
   *                 by identity; null observes every source
   * @param observer the callback to invoke, never null
   *
   * @return the token identifying the registration, never null
   *
   * @throws TidingsException if the observer cannot be registered
   */
  ObserverToken addObserver(String name, Object source,
      NotificationObserver observer);

  /**
   * Removes a registered observer.
   *
   * <p>Removing an unknown or already removed token does nothing. Once
   * this method returns the observer is not invoked again.
   *
   * @param token the token returned on registration, never null
   */
  void removeObserver(ObserverToken token);

  /**
   * Delivers the notification to every matching observer, synchronously
   * on the calling thread.
   *
   * @param notification the notification to post, never null
   */
  void post(Notification notification);

  /**
   * Posts a notification built from the given parts.
   *
   * @param name     the notification name, never null or empty
   * @param source   the posting object, may be null
   * @param userInfo the payload, never null
   */
  default void post(final String name, final Object source,
      final Map<String, ?> userInfo) {
    post(Notification.of(name, source, userInfo));
  }

  /**
   * Returns an asynchronous sequence of the notifications posted with the
   * given name by any source.
   *
   * @param name the notification name, never null or empty
   *
   * @return a new sequence, never null
   */
  default NotificationSequence sequence(final String name) {
    return new NotificationSequence(this, name, null);
  }

  /**
   * Returns an asynchronous sequence of the notifications posted with the
   * given name by the given source.
   *
   * @param name   the notification name, never null or empty
   * @param source the source to observe, null for any source
   *
   * @return a new sequence, never null
   */
  default NotificationSequence sequence(final String name,
      final Object source) {
    return new NotificationSequence(this, name, source);
  }
}
