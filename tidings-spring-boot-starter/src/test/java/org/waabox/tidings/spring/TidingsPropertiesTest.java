package org.waabox.tidings.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TidingsProperties}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TidingsPropertiesTest {

  @Test
  void whenCreated_givenNothingSet_shouldUseDefaults() {
    final TidingsProperties properties = new TidingsProperties();

    assertEquals("tidings", properties.getCenterName());
    assertTrue(properties.isBridgeApplicationEvents());
  }

  @Test
  void whenSetting_givenValues_shouldReturnThem() {
    final TidingsProperties properties = new TidingsProperties();

    properties.setCenterName("orders");
    properties.setBridgeApplicationEvents(false);

    assertEquals("orders", properties.getCenterName());
    assertFalse(properties.isBridgeApplicationEvents());
  }
}
