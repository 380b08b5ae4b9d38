package org.waabox.tidings.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.tidings.DefaultNotificationCenter;
import org.waabox.tidings.NotificationCenter;
import org.waabox.tidings.metrics.TidingsMetrics;

/**
 * Spring Boot auto-configuration for Tidings.
 *
 * <p>Creates a {@link DefaultNotificationCenter} unless the application
 * defines its own {@link NotificationCenter}, wiring an optional
 * {@link TidingsMetrics} bean. The center is shut down when the context
 * stops, which ends every open notification sequence.
 *
 * <p>Unless {@code tidings.bridge-application-events} is false, an
 * {@link ApplicationEventBridge} posts every application event into the
 * center.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(TidingsProperties.class)
public class TidingsAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TidingsAutoConfiguration.class);

  /**
   * Creates the default notification center.
   *
   * @param properties      the configuration properties, never null
   * @param metricsProvider provider for an optional TidingsMetrics bean
   *
   * @return the center, never null
   */
  @Bean
  @ConditionalOnMissingBean(NotificationCenter.class)
  public DefaultNotificationCenter notificationCenter(
      final TidingsProperties properties,
      final ObjectProvider<TidingsMetrics> metricsProvider) {

    final DefaultNotificationCenter.Builder builder =
        DefaultNotificationCenter.builder()
            .name(properties.getCenterName());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Tidings using custom TidingsMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final DefaultNotificationCenter center = builder.build();
    log.info("Tidings notification center '{}' created", center.name());
    return center;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that shuts the default center
   * down when the context stops.
   *
   * <p>It stops early (phase {@code Integer.MAX_VALUE - 1}) so that
   * consumers see their sequences end before the beans they depend on
   * stop. Centers other than {@link DefaultNotificationCenter} are left
   * alone.
   *
   * @param center the center to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle tidingsLifecycle(final NotificationCenter center) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        running = true;
        log.debug("Tidings lifecycle started");
      }

      @Override
      public void stop() {
        if (center instanceof DefaultNotificationCenter) {
          ((DefaultNotificationCenter) center).shutdown();
        }
        running = false;
        log.info("Tidings lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Creates the bridge that posts application events into the center.
   *
   * @param center the center to post into, never null
   *
   * @return the bridge, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "tidings", name = "bridge-application-events",
      havingValue = "true", matchIfMissing = true)
  public ApplicationEventBridge applicationEventBridge(
      final NotificationCenter center) {
    log.info("Tidings bridging application events into the center");
    return new ApplicationEventBridge(center);
  }
}
