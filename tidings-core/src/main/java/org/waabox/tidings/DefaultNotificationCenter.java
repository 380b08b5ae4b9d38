package org.waabox.tidings;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.tidings.metrics.NoopTidingsMetrics;
import org.waabox.tidings.metrics.TidingsMetrics;

/**
 * An in-process {@link NotificationCenter}.
 *
 * <p>Notifications are delivered synchronously on the posting thread to
 * every matching observer, in registration order. An observer that throws
 * is logged and reported to the metrics; the remaining observers still
 * receive the notification.
 *
 * <p>Each registration is guarded by a read/write lock. Deliveries hold
 * the read lock, so concurrent posts reach an observer concurrently.
 * {@link #removeObserver(ObserverToken)} takes the write lock, so it
 * returns only after deliveries in flight on other threads have finished.
 * When an observer removes itself from inside its own callback the
 * registration is deactivated without waiting.
 *
 * <p>Instances are created through {@link #builder()}:
 * <pre>{@code
 * DefaultNotificationCenter center = DefaultNotificationCenter.builder()
 *     .name("orders")
 *     .metrics(micrometerMetrics)
 *     .build();
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DefaultNotificationCenter implements NotificationCenter {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      DefaultNotificationCenter.class);

  /** The default center name. */
  private static final String DEFAULT_NAME = "default";

  /** The center name, used for logging and metrics. */
  private final String name;

  /** The metrics reporter. */
  private final TidingsMetrics metrics;

  /** The active registrations, in registration order. */
  private final List<Registration> registrations =
      new CopyOnWriteArrayList<>();

  /** The source of registration identifiers. */
  private final AtomicLong sequence = new AtomicLong();

  /** Whether this center has been shut down. */
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  /**
   * Creates a new center.
   *
   * @param theName    the center name, never null
   * @param theMetrics the metrics reporter, never null
   */
  private DefaultNotificationCenter(final String theName,
      final TidingsMetrics theMetrics) {
    name = theName;
    metrics = theMetrics;
  }

  /**
   * Creates a new builder for constructing a center.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the name of this center.
   *
   * @return the center name, never null
   */
  public String name() {
    return name;
  }

  /** {@inheritDoc}
   *
   * @throws TidingsException if this center has been shut down
   */
  @Override
  public ObserverToken addObserver(final String notificationName,
      final Object source, final NotificationObserver observer) {
    Objects.requireNonNull(notificationName,
        "notificationName must not be null");
    if (notificationName.isEmpty()) {
      throw new IllegalArgumentException(
          "notificationName must not be empty");
    }
    Objects.requireNonNull(observer, "observer must not be null");

    if (shutdown.get()) {
      throw new TidingsException("Cannot observe '" + notificationName
          + "': notification center '" + name + "' is shut down");
    }

    final ObserverToken token = new ObserverToken(
        sequence.incrementAndGet(), notificationName);
    final Registration registration =
        new Registration(token, source, observer);
    registrations.add(registration);

    // A shutdown racing with this registration may have missed it.
    if (shutdown.get() && registrations.remove(registration)) {
      registration.deactivate();
      throw new TidingsException("Cannot observe '" + notificationName
          + "': notification center '" + name + "' is shut down");
    }

    metrics.observerAdded(name, notificationName);
    log.debug("Center '{}': added observer #{} for '{}'", name, token.id(),
        notificationName);
    return token;
  }

  /** {@inheritDoc} */
  @Override
  public void removeObserver(final ObserverToken token) {
    Objects.requireNonNull(token, "token must not be null");

    Registration found = null;
    for (final Registration registration : registrations) {
      if (registration.token.equals(token)) {
        found = registration;
        break;
      }
    }
    if (found == null || !registrations.remove(found)) {
      log.debug("Center '{}': observer #{} is not registered, ignoring",
          name, token.id());
      return;
    }

    found.deactivate();
    metrics.observerRemoved(name, token.name());
    log.debug("Center '{}': removed observer #{} for '{}'", name, token.id(),
        token.name());
  }

  /** {@inheritDoc}
   *
   * @throws IllegalStateException if this center has been shut down
   */
  @Override
  public void post(final Notification notification) {
    Objects.requireNonNull(notification, "notification must not be null");
    if (shutdown.get()) {
      throw new IllegalStateException("Cannot post '" + notification.name()
          + "': notification center '" + name + "' is shut down");
    }

    int delivered = 0;
    for (final Registration registration : registrations) {
      if (registration.matches(notification)
          && registration.deliver(notification)) {
        delivered++;
      }
    }

    metrics.notificationPosted(name, notification.name(), delivered);
    log.trace("Center '{}': posted '{}' to {} observer(s)", name,
        notification.name(), delivered);
  }

  /**
   * Removes every observer scoped to the given source and tells each of
   * them it will receive nothing more.
   *
   * <p>Observers registered for any source are not affected.
   *
   * @param source the released source, never null
   *
   * @return the number of observers removed
   */
  public int release(final Object source) {
    Objects.requireNonNull(source, "source must not be null");

    final List<Registration> released = new ArrayList<>();
    for (final Registration registration : registrations) {
      if (registration.source == source
          && registrations.remove(registration)) {
        released.add(registration);
      }
    }

    terminate(released);
    log.debug("Center '{}': released {} observer(s) of source {}", name,
        released.size(), source);
    return released.size();
  }

  /**
   * Shuts this center down.
   *
   * <p>Every observer is removed and told it will receive nothing more.
   * Afterwards, registrations fail with a {@link TidingsException} and
   * posts fail with an {@link IllegalStateException}. Calling this method
   * again does nothing.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }

    log.info("Shutting down notification center '{}'...", name);

    final List<Registration> removed = new ArrayList<>();
    for (final Registration registration : registrations) {
      if (registrations.remove(registration)) {
        removed.add(registration);
      }
    }
    terminate(removed);

    log.info("Notification center '{}' shut down, {} observer(s) "
        + "terminated", name, removed.size());
  }

  /**
   * Returns whether this center has been shut down.
   *
   * @return {@code true} after {@link #shutdown()}
   */
  public boolean isShutdown() {
    return shutdown.get();
  }

  /**
   * Returns the number of registered observers.
   *
   * @return the observer count, zero or more
   */
  public int observerCount() {
    return registrations.size();
  }

  /**
   * Deactivates the given registrations and signals their termination.
   *
   * @param removed the registrations already removed from the list,
   *                never null
   */
  private void terminate(final List<Registration> removed) {
    for (final Registration registration : removed) {
      registration.deactivate();
      metrics.observerRemoved(name, registration.token.name());
      try {
        registration.observer.onTerminated();
      } catch (final Exception e) {
        log.error("Center '{}': observer #{} failed on termination: {}",
            name, registration.token.id(), e.getMessage(), e);
      }
    }
  }

  /** One observer registered with this center. */
  private final class Registration {

    /** The registration token. */
    private final ObserverToken token;

    /** The source filter, null matches every source. */
    private final Object source;

    /** The registered observer. */
    private final NotificationObserver observer;

    /** Read-held during delivery, write-held on deactivation. */
    private final ReentrantReadWriteLock gate =
        new ReentrantReadWriteLock();

    /** Whether deliveries are still allowed. */
    private volatile boolean active = true;

    /**
     * Creates a new registration.
     *
     * @param theToken    the token, never null
     * @param theSource   the source filter, may be null
     * @param theObserver the observer, never null
     */
    private Registration(final ObserverToken theToken, final Object theSource,
        final NotificationObserver theObserver) {
      token = theToken;
      source = theSource;
      observer = theObserver;
    }

    /**
     * Checks the notification's name and source against this
     * registration.
     *
     * @param notification the notification, never null
     *
     * @return true if the observer is interested in the notification
     */
    private boolean matches(final Notification notification) {
      return token.name().equals(notification.name())
          && (source == null || source == notification.source());
    }

    /**
     * Invokes the observer unless the registration was deactivated.
     *
     * @param notification the notification to deliver, never null
     *
     * @return true if the observer was invoked, even if it failed
     */
    private boolean deliver(final Notification notification) {
      gate.readLock().lock();
      try {
        if (!active) {
          return false;
        }
        try {
          observer.onNotification(notification);
        } catch (final Exception e) {
          log.error("Center '{}': observer #{} threw while handling '{}': {}",
              name, token.id(), notification.name(), e.getMessage(), e);
          metrics.observerFailed(name, notification.name(), e);
        }
        return true;
      } finally {
        gate.readLock().unlock();
      }
    }

    /**
     * Stops further deliveries, waiting for deliveries in flight on other
     * threads unless called from inside this observer's callback.
     */
    private void deactivate() {
      if (gate.getReadHoldCount() > 0) {
        active = false;
        return;
      }
      gate.writeLock().lock();
      try {
        active = false;
      } finally {
        gate.writeLock().unlock();
      }
    }
  }

  /**
   * A fluent builder for constructing {@link DefaultNotificationCenter}
   * instances.
   *
   * <p>All configuration is optional. Defaults:
   * <ul>
   *   <li>name: {@code "default"}</li>
   *   <li>metrics: {@link NoopTidingsMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    /** The optional center name. */
    private String name;

    /** The optional metrics reporter. */
    private TidingsMetrics metrics;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the center name used in logs and metrics.
     *
     * @param theName the center name, never null or blank
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theName is null
     * @throws IllegalArgumentException if theName is blank
     */
    public Builder name(final String theName) {
      Objects.requireNonNull(theName, "name must not be null");
      if (theName.isBlank()) {
        throw new IllegalArgumentException("name must not be blank");
      }
      this.name = theName;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopTidingsMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final TidingsMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the center with the configured settings.
     *
     * @return a new center, never null
     */
    public DefaultNotificationCenter build() {
      final String resolvedName = name != null ? name : DEFAULT_NAME;
      final TidingsMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopTidingsMetrics();
      return new DefaultNotificationCenter(resolvedName, resolvedMetrics);
    }
  }
}
