package org.waabox.tidings;

import java.util.Objects;

/**
 * Identifies one observer registered with a {@link NotificationCenter}.
 *
 * <p>Tokens are returned by
 * {@link NotificationCenter#addObserver(String, Object, NotificationObserver)}
 * and handed back to {@link NotificationCenter#removeObserver(ObserverToken)}.
 * Identifiers are unique within the center that issued them.
 *
 * @param id   the registration identifier
 * @param name the observed notification name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ObserverToken(long id, String name) {

  /**
   * Creates a new token.
   *
   * @throws NullPointerException if name is null
   */
  public ObserverToken {
    Objects.requireNonNull(name, "name must not be null");
  }
}
