package org.waabox.tidings;

/**
 * Signals that a notification could not be observed or that a
 * notification sequence broke down.
 *
 * <p>A center throws it from {@code addObserver} when it no longer accepts
 * observers, so it also surfaces from {@link NotificationSequence#iterator()}.
 * {@link org.waabox.tidings.async.BlockingIterator} wraps the failure of an
 * underlying stage in it, keeping the original failure as the cause.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TidingsException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception describing why observing failed.
   *
   * @param message what could not be observed and why, never null
   */
  public TidingsException(final String message) {
    super(message);
  }

  /** Creates an exception wrapping the failure of an iteration.
   *
   * @param message what was being iterated, never null
   * @param cause the failure reported by the sequence, never null
   */
  public TidingsException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
