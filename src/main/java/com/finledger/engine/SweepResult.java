package com.finledger.engine;

import java.util.List;
import java.util.UUID;

/** Occurrences materialized by one sweep, plus the recurring items that stopped on an error. */
public record SweepResult(int generated, List<UUID> failedItemIds) {
  public static SweepResult empty() {
    return new SweepResult(0, List.of());
  }
}
