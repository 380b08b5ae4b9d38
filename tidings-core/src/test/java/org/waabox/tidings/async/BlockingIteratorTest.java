package org.waabox.tidings.async;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.waabox.tidings.TidingsException;

/**
 * Tests for {@link BlockingIterator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BlockingIteratorTest {

  @Test
  void whenLooping_givenClosedSourceWithElements_shouldYieldAllThenStop() {
    final BufferIterator<String> source = new BufferIterator<>();
    source.buffer().push("a");
    source.buffer().push("b");
    source.buffer().close();

    final List<String> seen = new ArrayList<>();
    try (BlockingIterator<String> it = source.blocking()) {
      while (it.hasNext()) {
        seen.add(it.next());
      }
      assertFalse(it.hasNext());
      assertThrows(NoSuchElementException.class, it::next);
    }

    assertEquals(List.of("a", "b"), seen);
  }

  @Test
  void whenCallingHasNextTwice_givenOneElement_shouldNotConsumeIt() {
    final BufferIterator<String> source = new BufferIterator<>();
    source.buffer().push("only");

    final BlockingIterator<String> it = new BlockingIterator<>(source);

    assertTrue(it.hasNext());
    assertTrue(it.hasNext());
    assertEquals("only", it.next());
    it.close();
  }

  @Test
  void whenWaiting_givenLaterPushFromAnotherThread_shouldWakeUp()
      throws Exception {
    final BufferIterator<String> source = new BufferIterator<>();
    final ExecutorService executor = Executors.newSingleThreadExecutor();

    try (BlockingIterator<String> it = source.blocking()) {
      executor.submit(() -> {
        Thread.sleep(50);
        source.buffer().push("late");
        return null;
      });

      assertTrue(it.hasNext());
      assertEquals("late", it.next());
    } finally {
      executor.shutdown();
      assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void whenBreakingOut_givenTryWithResources_shouldCloseSource() {
    final BufferIterator<String> source = new BufferIterator<>();
    source.buffer().push("first");
    source.buffer().push("second");

    try (BlockingIterator<String> it = source.blocking()) {
      while (it.hasNext()) {
        if ("first".equals(it.next())) {
          break;
        }
      }
    }

    assertEquals(1, source.closes());
    assertTrue(source.buffer().isClosed());
  }

  @Test
  void whenInterrupted_givenWaitingThread_shouldRestoreFlagAndStop()
      throws Exception {
    final BufferIterator<String> source = new BufferIterator<>();
    final CountDownLatch waiting = new CountDownLatch(1);
    final AtomicBoolean interruptedAfter = new AtomicBoolean(false);
    final ExecutorService executor = Executors.newSingleThreadExecutor();

    final Future<Boolean> result = executor.submit(() -> {
      final BlockingIterator<String> it = source.blocking();
      waiting.countDown();
      final boolean hasNext = it.hasNext();
      interruptedAfter.set(Thread.currentThread().isInterrupted());
      return hasNext;
    });

    assertTrue(waiting.await(5, TimeUnit.SECONDS));
    Thread.sleep(50);
    result.cancel(true);

    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    assertTrue(interruptedAfter.get());
    assertEquals(1, source.closes());
  }

  @Test
  void whenSourceFails_givenFailedStage_shouldThrowTidingsException() {
    final IllegalStateException cause = new IllegalStateException("broken");
    final AsyncIterator<String> failing = new AsyncIterator<>() {
      @Override
      public CompletionStage<Optional<String>> next() {
        return CompletableFuture.failedStage(cause);
      }

      @Override
      public void close() {
      }
    };

    final BlockingIterator<String> it = failing.blocking();

    final TidingsException error = assertThrows(TidingsException.class,
        it::hasNext);
    assertSame(cause, error.getCause());
    assertFalse(it.hasNext());
  }
}
