package org.waabox.tidings.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Tidings, mapped from the {@code tidings.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Currently supports:
 * <ul>
 *   <li>{@code tidings.center-name} - the name of the auto-configured
 *       notification center, used in logs and metrics. Defaults to
 *       {@code tidings}.</li>
 *   <li>{@code tidings.bridge-application-events} - whether Spring
 *       application events are posted into the center. Defaults to
 *       {@code true}.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "tidings")
public class TidingsProperties {

  /** The name of the auto-configured center. */
  private String centerName = "tidings";

  /** Whether application events are bridged into the center. */
  private boolean bridgeApplicationEvents = true;

  /**
   * Returns the name of the auto-configured center.
   *
   * @return the center name, never null
   */
  public String getCenterName() {
    return centerName;
  }

  /**
   * Sets the name of the auto-configured center.
   *
   * @param centerName the center name, must not be blank
   */
  public void setCenterName(final String centerName) {
    this.centerName = centerName;
  }

  /**
   * Returns whether application events are bridged into the center.
   *
   * @return true if the bridge is enabled
   */
  public boolean isBridgeApplicationEvents() {
    return bridgeApplicationEvents;
  }

  /**
   * Enables or disables the application event bridge.
   *
   * @param bridgeApplicationEvents true to post application events into
   *                                the center
   */
  public void setBridgeApplicationEvents(
      final boolean bridgeApplicationEvents) {
    this.bridgeApplicationEvents = bridgeApplicationEvents;
  }
}
