package org.waabox.tidings.metrics;

/**
 * An abstraction for recording operational metrics of a notification
 * center.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopTidingsMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TidingsMetrics {

  /**
   * Records the registration of an observer.
   *
   * @param centerName       the name of the notification center, never null
   * @param notificationName the notification name observed, never null
   */
  void observerAdded(String centerName, String notificationName);

  /**
   * Records the removal of an observer, whether explicit or caused by a
   * release or shutdown.
   *
   * @param centerName       the name of the notification center, never null
   * @param notificationName the notification name observed, never null
   */
  void observerRemoved(String centerName, String notificationName);

  /**
   * Records a posted notification.
   *
   * @param centerName       the name of the notification center, never null
   * @param notificationName the name of the posted notification, never null
   * @param deliveredCount   the number of observers the notification was
   *                         delivered to
   */
  void notificationPosted(String centerName, String notificationName,
      int deliveredCount);

  /**
   * Records an observer that threw while handling a notification.
   *
   * @param centerName       the name of the notification center, never null
   * @param notificationName the name of the notification, never null
   * @param cause            the throwable raised by the observer, never null
   */
  void observerFailed(String centerName, String notificationName,
      Throwable cause);
}
