package com.finledger.config;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "finledger.ledger")
public record LedgerProperties(
    @DefaultValue("10") BigDecimal goalOnTrackBuffer,
    @DefaultValue("80") int defaultAlertThreshold,
    @DefaultValue("0.005") BigDecimal reconciliationEpsilon,
    @DefaultValue("30") int upcomingWindowDays) {

  public static LedgerProperties defaults() {
    return new LedgerProperties(BigDecimal.TEN, 80, new BigDecimal("0.005"), 30);
  }
}
