package org.waabox.tidings;

import java.util.Map;
import java.util.Objects;

/**
 * A single occurrence of a named notification posted to a
 * {@link NotificationCenter}.
 *
 * <p>Notifications are immutable. The user info map is copied on
 * construction and cannot be modified afterwards; the values it holds are
 * shared as they are, so posters should not mutate them once posted.
 *
 * @param name     the notification name, never null or empty
 * @param source   the object that posted the notification, may be null
 * @param userInfo the notification payload, never null, may be empty
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Notification(
    String name,
    Object source,
    Map<String, Object> userInfo
) {

  /**
   * Creates a new notification, validating its name and copying its
   * user info.
   *
   * @throws NullPointerException     if name or userInfo is null, or if
   *                                  userInfo holds a null key or value
   * @throws IllegalArgumentException if name is empty
   */
  public Notification {
    Objects.requireNonNull(name, "name must not be null");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    Objects.requireNonNull(userInfo, "userInfo must not be null");
    userInfo = Map.copyOf(userInfo);
  }

  /**
   * Creates a notification without a source and without user info.
   *
   * @param name the notification name, never null or empty
   *
   * @return a new notification, never null
   */
  public static Notification of(final String name) {
    return new Notification(name, null, Map.of());
  }

  /**
   * Creates a notification with the given source and user info.
   *
   * @param name     the notification name, never null or empty
   * @param source   the posting object, may be null
   * @param userInfo the payload, never null
   *
   * @return a new notification, never null
   */
  public static Notification of(final String name, final Object source,
      final Map<String, ?> userInfo) {
    Objects.requireNonNull(userInfo, "userInfo must not be null");
    @SuppressWarnings("unchecked")
    final Map<String, Object> values = (Map<String, Object>) userInfo;
    return new Notification(name, source, values);
  }

  /**
   * Returns the user info value for the given key.
   *
   * @param key the key to look up, never null
   *
   * @return the value, or null if the key is not present
   */
  public Object get(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    return userInfo.get(key);
  }
}
