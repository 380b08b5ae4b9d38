package org.waabox.tidings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Notification}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NotificationTest {

  @Test
  void whenCreating_givenNameOnly_shouldHaveNoSourceAndEmptyUserInfo() {
    final Notification notification = Notification.of("tick");

    assertEquals("tick", notification.name());
    assertNull(notification.source());
    assertTrue(notification.userInfo().isEmpty());
  }

  @Test
  void whenCreating_givenMutableUserInfo_shouldCopyIt() {
    final Map<String, Object> userInfo = new HashMap<>();
    userInfo.put("n", 1);
    final Object source = new Object();

    final Notification notification = Notification.of("tick", source,
        userInfo);
    userInfo.put("n", 2);

    assertEquals(1, notification.get("n"));
    assertSame(source, notification.source());
    assertThrows(UnsupportedOperationException.class,
        () -> notification.userInfo().put("m", 3));
  }

  @Test
  void whenCreating_givenNarrowlyTypedUserInfo_shouldCopyItOnce() {
    final Map<String, Integer> counts = new HashMap<>();
    counts.put("n", 1);

    final Notification notification = Notification.of("tick", null, counts);
    counts.clear();

    assertEquals(Map.of("n", 1), notification.userInfo());
    assertSame(notification.userInfo(), new Notification("tick", null,
        notification.userInfo()).userInfo());
  }

  @Test
  void whenCreating_givenEmptyName_shouldThrowIae() {
    assertThrows(IllegalArgumentException.class,
        () -> Notification.of(""));
  }

  @Test
  void whenCreating_givenNullName_shouldThrowNpe() {
    assertThrows(NullPointerException.class,
        () -> new Notification(null, null, Map.of()));
  }

  @Test
  void whenCreating_givenNullUserInfoValue_shouldThrowNpe() {
    final Map<String, Object> userInfo = new HashMap<>();
    userInfo.put("n", null);

    assertThrows(NullPointerException.class,
        () -> Notification.of("tick", null, userInfo));
  }

  @Test
  void whenLookingUp_givenMissingKey_shouldReturnNull() {
    final Notification notification = Notification.of("tick", null,
        Map.of("n", 1));

    assertNull(notification.get("missing"));
  }
}
