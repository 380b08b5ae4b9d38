package org.waabox.tidings.spring;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.PayloadApplicationEvent;
import org.waabox.tidings.DefaultNotificationCenter;
import org.waabox.tidings.Notification;
import org.waabox.tidings.NotificationCenter;

/**
 * Posts every Spring {@link ApplicationEvent} into a
 * {@link NotificationCenter}, so that application events can be consumed
 * as notification sequences.
 *
 * <p>Events map to notifications as follows, always using the event
 * source as the notification source:
 * <ul>
 *   <li>{@link NotificationApplicationEvent}: its name and user info.</li>
 *   <li>{@link PayloadApplicationEvent}: the payload's class name, with
 *       the payload under the {@code payload} key.</li>
 *   <li>any other event: the event's class name, with the event under the
 *       {@code event} key.</li>
 * </ul>
 *
 * <p>Events published after a {@link DefaultNotificationCenter} has been
 * shut down are dropped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ApplicationEventBridge
    implements ApplicationListener<ApplicationEvent> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ApplicationEventBridge.class);

  /** The user info key holding a payload event's payload. */
  public static final String PAYLOAD_KEY = "payload";

  /** The user info key holding a plain application event. */
  public static final String EVENT_KEY = "event";

  /** The center to post into, never null. */
  private final NotificationCenter center;

  /**
   * Creates a new bridge.
   *
   * @param theCenter the center to post into, never null
   */
  public ApplicationEventBridge(final NotificationCenter theCenter) {
    center = Objects.requireNonNull(theCenter, "center must not be null");
  }

  @Override
  public void onApplicationEvent(final ApplicationEvent event) {
    if (center instanceof DefaultNotificationCenter
        && ((DefaultNotificationCenter) center).isShutdown()) {
      log.debug("Notification center is shut down, dropping {}",
          event.getClass().getSimpleName());
      return;
    }
    center.post(toNotification(event));
  }

  /**
   * Maps an application event to the notification posted for it.
   *
   * @param event the application event, never null
   *
   * @return the notification, never null
   */
  static Notification toNotification(final ApplicationEvent event) {
    if (event instanceof NotificationApplicationEvent) {
      final NotificationApplicationEvent notification =
          (NotificationApplicationEvent) event;
      return Notification.of(notification.getName(), event.getSource(),
          notification.getUserInfo());
    }
    if (event instanceof PayloadApplicationEvent) {
      final Object payload = ((PayloadApplicationEvent<?>) event).getPayload();
      return Notification.of(payload.getClass().getName(), event.getSource(),
          Map.of(PAYLOAD_KEY, payload));
    }
    return Notification.of(event.getClass().getName(), event.getSource(),
        Map.of(EVENT_KEY, event));
  }
}
