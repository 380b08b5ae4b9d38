package org.waabox.tidings.metrics;

/**
 * A no-operation implementation of {@link TidingsMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopTidingsMetrics implements TidingsMetrics {

  /** {@inheritDoc} */
  @Override
  public void observerAdded(final String centerName,
      final String notificationName) {
  }

  /** {@inheritDoc} */
  @Override
  public void observerRemoved(final String centerName,
      final String notificationName) {
  }

  /** {@inheritDoc} */
  @Override
  public void notificationPosted(final String centerName,
      final String notificationName, final int deliveredCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void observerFailed(final String centerName,
      final String notificationName, final Throwable cause) {
  }
}
