package org.waabox.tidings.spring;

import java.util.Map;
import java.util.Objects;

import org.springframework.context.ApplicationEvent;

/**
 * An application event that the {@link ApplicationEventBridge} posts as a
 * notification with exactly this name, source and user info.
 *
 * <pre>{@code
 * publisher.publishEvent(new NotificationApplicationEvent(this,
 *     "order.created", Map.of("orderId", id)));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NotificationApplicationEvent extends ApplicationEvent {

  private static final long serialVersionUID = 1L;

  /** The notification name, never null or empty. */
  private final String name;

  /** The notification user info, never null. */
  private final transient Map<String, Object> userInfo;

  /**
   * Creates a new event.
   *
   * @param source      the notification source, never null
   * @param theName     the notification name, never null or empty
   * @param theUserInfo the user info, null means empty. Neither keys nor
   *                    values may be null.
   */
  public NotificationApplicationEvent(final Object source,
      final String theName, final Map<String, ?> theUserInfo) {
    super(source);
    Objects.requireNonNull(theName, "name must not be null");
    if (theName.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    name = theName;
    userInfo = theUserInfo == null ? Map.of() : Map.copyOf(theUserInfo);
  }

  /**
   * Creates a new event without user info.
   *
   * @param source  the notification source, never null
   * @param theName the notification name, never null or empty
   */
  public NotificationApplicationEvent(final Object source,
      final String theName) {
    this(source, theName, null);
  }

  /**
   * Returns the notification name.
   *
   * @return the name, never null
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the notification user info.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, Object> getUserInfo() {
    return userInfo;
  }
}
