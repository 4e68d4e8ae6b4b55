package com.finledger.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@DisplayName("LedgerChangeBroadcaster")
class LedgerChangeBroadcasterTest {
  private final LedgerChangeBroadcaster broadcaster = new LedgerChangeBroadcaster();

  @Test
  @DisplayName("subscriptions are kept per owner")
  void subscriptionsPerOwner() {
    UUID owner = UUID.randomUUID();
    UUID other = UUID.randomUUID();

    SseEmitter first = broadcaster.subscribe(owner);
    broadcaster.subscribe(owner);
    broadcaster.subscribe(other);

    assertThat(first.getTimeout()).isEqualTo(30L * 60L * 1000L);
    assertThat(broadcaster.subscriberCount(owner)).isEqualTo(2);
    assertThat(broadcaster.subscriberCount(other)).isEqualTo(1);
    assertThat(broadcaster.subscriberCount(UUID.randomUUID())).isZero();
  }

  @Test
  @DisplayName("events reach subscribers without dropping them")
  void deliversEvents() {
    UUID owner = UUID.randomUUID();
    broadcaster.subscribe(owner);

    assertThatCode(() -> broadcaster.onLedgerChanged(
        new LedgerChangedEvent(owner, LedgerCollection.TRANSACTIONS, UUID.randomUUID(), ChangeKind.CREATED)))
        .doesNotThrowAnyException();
    assertThat(broadcaster.subscriberCount(owner)).isEqualTo(1);
  }

  @Test
  @DisplayName("events for owners without subscribers are ignored")
  void ignoresUnsubscribed() {
    assertThatCode(() -> broadcaster.onLedgerChanged(
        new LedgerChangedEvent(UUID.randomUUID(), LedgerCollection.BUDGETS, null, ChangeKind.DELETED)))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("subscribing again after the last subscriber left is tracked")
  void resubscribeAfterEmpty() {
    UUID owner = UUID.randomUUID();
    SseEmitter first = broadcaster.subscribe(owner);
    broadcaster.remove(owner, first);
    assertThat(broadcaster.subscriberCount(owner)).isZero();

    broadcaster.subscribe(owner);

    assertThat(broadcaster.subscriberCount(owner)).isEqualTo(1);
  }

  @Test
  @DisplayName("concurrent subscribe and leave never loses a live subscriber")
  void concurrentSubscribeAndLeave() throws Exception {
    UUID owner = UUID.randomUUID();
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          for (int round = 0; round < 2_000; round++) {
            SseEmitter transientEmitter = broadcaster.subscribe(owner);
            broadcaster.remove(owner, transientEmitter);
          }
          broadcaster.subscribe(owner);
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(broadcaster.subscriberCount(owner)).isEqualTo(threads);
  }
}
