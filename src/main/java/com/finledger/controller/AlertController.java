package com.finledger.controller;

import com.finledger.dto.AlertResponse;
import com.finledger.service.AlertService;
import com.finledger.service.CurrentUserService;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger/alerts")
public class AlertController {
  private final AlertService alertService;
  private final CurrentUserService currentUserService;

  public AlertController(AlertService alertService, CurrentUserService currentUserService) {
    this.alertService = alertService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<AlertResponse> listAlerts() {
    UUID userId = currentUserService.requireUserId();
    return alertService.listAlerts(userId);
  }
}
