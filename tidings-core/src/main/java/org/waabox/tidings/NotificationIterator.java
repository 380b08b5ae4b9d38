package org.waabox.tidings;

import java.lang.ref.Cleaner;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.tidings.async.AsyncIterator;
import org.waabox.tidings.buffer.OrderedAsyncBuffer;

/**
 * An {@link AsyncIterator} over the notifications received by one observer
 * registration.
 *
 * <p>The observer is registered when the iterator is created and pushes
 * every notification it receives into an {@link OrderedAsyncBuffer}. The
 * registration is removed exactly once, by whichever comes first:
 * <ul>
 *   <li>{@link #next()} reporting the end of the sequence, which happens
 *       when the center terminates the observer;</li>
 *   <li>{@link #close()};</li>
 *   <li>the iterator becoming unreachable without being closed, in which
 *       case a {@link #next()} still pending resumes with the end of the
 *       sequence.</li>
 * </ul>
 *
 * <p>Removal failures are logged and never reach the consumer.
 *
 * <p>Only one {@link #next()} call may be outstanding at a time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationIterator implements AsyncIterator<Notification> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      NotificationIterator.class);

  /** Removes the registrations of abandoned iterators. */
  private static final Cleaner CLEANER = Cleaner.create();

  /** The buffer fed by the observer, never null. */
  private final OrderedAsyncBuffer<Notification> buffer;

  /** The token of the observer registration, never null. */
  private final ObserverToken token;

  /** Runs the registration removal at most once. */
  private final Cleaner.Cleanable unsubscribe;

  /**
   * Creates a new iterator and registers its observer.
   *
   * @param center the center to observe, never null
   * @param name   the notification name, never null
   * @param source the source to observe, null for any source
   *
   * @throws TidingsException if the center cannot register the observer
   */
  NotificationIterator(final NotificationCenter center, final String name,
      final Object source) {
    buffer = new OrderedAsyncBuffer<>();
    token = center.addObserver(name, source, new BufferingObserver(buffer));
    unsubscribe = CLEANER.register(this,
        new Unsubscriber(center, token, buffer));
    log.debug("Started iteration over '{}' with observer #{}", name,
        token.id());
  }

  /**
   * {@inheritDoc}
   *
   * <p>When the sequence ends, the observer registration is removed
   * before the returned stage completes.
   */
  @Override
  public CompletionStage<Optional<Notification>> next() {
    // A pending stage must not keep this iterator reachable.
    final Cleaner.Cleanable teardown = unsubscribe;
    return buffer.next().thenApply(notification -> {
      if (notification.isEmpty()) {
        teardown.clean();
      }
      return notification;
    });
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    buffer.close();
    unsubscribe.clean();
  }

  /**
   * Returns the token of this iterator's observer registration.
   *
   * @return the token, never null
   */
  public ObserverToken token() {
    return token;
  }

  /**
   * Returns the number of received notifications not yet consumed.
   *
   * @return the backlog size, zero or more
   */
  public int backlog() {
    return buffer.size();
  }

  /**
   * Feeds the buffer. Holds no reference to the iterator so that an
   * abandoned iterator can be collected while the center still holds the
   * observer.
   */
  private static final class BufferingObserver
      implements NotificationObserver {

    /** The buffer to push into. */
    private final OrderedAsyncBuffer<Notification> buffer;

    /** Creates a new observer.
     *
     * @param theBuffer the buffer to push into, never null
     */
    private BufferingObserver(
        final OrderedAsyncBuffer<Notification> theBuffer) {
      buffer = theBuffer;
    }

    @Override
    public void onNotification(final Notification notification) {
      buffer.push(notification);
    }

    @Override
    public void onTerminated() {
      buffer.close();
    }
  }

  /**
   * Removes the observer registration, then ends the buffer so that a
   * pending pull resumes. Must not reference the iterator.
   */
  private static final class Unsubscriber implements Runnable {

    /** The center holding the registration. */
    private final NotificationCenter center;

    /** The registration to remove. */
    private final ObserverToken token;

    /** The buffer fed by the registration. */
    private final OrderedAsyncBuffer<Notification> buffer;

    /** Creates a new unsubscriber.
     *
     * @param theCenter the center, never null
     * @param theToken the token to remove, never null
     * @param theBuffer the buffer to end, never null
     */
    private Unsubscriber(final NotificationCenter theCenter,
        final ObserverToken theToken,
        final OrderedAsyncBuffer<Notification> theBuffer) {
      center = theCenter;
      token = theToken;
      buffer = theBuffer;
    }

    @Override
    public void run() {
      try {
        center.removeObserver(token);
        log.debug("Removed observer #{} for '{}'", token.id(), token.name());
      } catch (final Exception e) {
        log.warn("Failed to remove observer #{} for '{}': {}", token.id(),
            token.name(), e.getMessage(), e);
      }
      // Nothing can push or close once the iterator is gone.
      buffer.close();
    }
  }
}
