package com.finledger.controller;

import com.finledger.event.LedgerChangeBroadcaster;
import com.finledger.service.CurrentUserService;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/ledger")
public class LedgerChangesController {
  private final LedgerChangeBroadcaster broadcaster;
  private final CurrentUserService currentUserService;

  public LedgerChangesController(LedgerChangeBroadcaster broadcaster, CurrentUserService currentUserService) {
    this.broadcaster = broadcaster;
    this.currentUserService = currentUserService;
  }

  @GetMapping(value = "/changes", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter subscribe() {
    UUID userId = currentUserService.requireUserId();
    return broadcaster.subscribe(userId);
  }
}
