package org.waabox.tidings;

/**
 * A callback registered with a {@link NotificationCenter} that is invoked
 * whenever a matching notification is posted.
 *
 * <p>Callbacks run on the posting thread, so an observer may be invoked
 * from several threads concurrently.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface NotificationObserver {

  /**
   * Called when a matching notification is posted.
   *
   * @param notification the posted notification, never null
   */
  void onNotification(Notification notification);

  /**
   * Called once when the center will never deliver to this observer
   * again, because the center shut down or the observed source was
   * released.
   *
   * <p>The default implementation does nothing.
   */
  default void onTerminated() {
  }
}
