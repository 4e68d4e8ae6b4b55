package com.finledger.event;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Push side of the storage interface: per-owner Server-Sent-Events streams of ledger changes. */
@Component
public class LedgerChangeBroadcaster {
  private static final Logger log = LoggerFactory.getLogger(LedgerChangeBroadcaster.class);
  private static final long EMITTER_TIMEOUT_MS = 30L * 60L * 1000L;

  private final Map<UUID, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

  public SseEmitter subscribe(UUID userId) {
    SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
    emitters.compute(userId, (key, list) -> {
      List<SseEmitter> subscribers = list == null ? new CopyOnWriteArrayList<>() : list;
      subscribers.add(emitter);
      return subscribers;
    });
    emitter.onCompletion(() -> remove(userId, emitter));
    emitter.onTimeout(() -> remove(userId, emitter));
    emitter.onError(error -> remove(userId, emitter));
    return emitter;
  }

  @TransactionalEventListener(fallbackExecution = true)
  public void onLedgerChanged(LedgerChangedEvent event) {
    List<SseEmitter> subscribers = emitters.get(event.userId());
    if (subscribers == null || subscribers.isEmpty()) {
      return;
    }
    for (SseEmitter emitter : subscribers) {
      try {
        emitter.send(SseEmitter.event()
            .name(event.collection().name().toLowerCase(Locale.ROOT))
            .data(event));
      } catch (IOException | IllegalStateException ex) {
        log.debug("Dropping ledger subscriber for {}: {}", event.userId(), ex.getMessage());
        remove(event.userId(), emitter);
      }
    }
  }

  int subscriberCount(UUID userId) {
    List<SseEmitter> subscribers = emitters.get(userId);
    return subscribers == null ? 0 : subscribers.size();
  }

  void remove(UUID userId, SseEmitter emitter) {
    emitters.computeIfPresent(userId, (key, list) -> {
      list.remove(emitter);
      return list.isEmpty() ? null : list;
    });
  }
}
