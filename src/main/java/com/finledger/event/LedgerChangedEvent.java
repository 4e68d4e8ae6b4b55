package com.finledger.event;

import java.util.UUID;

/** Published by services after a write; delivered to subscribers once the storage transaction commits. */
public record LedgerChangedEvent(UUID userId, LedgerCollection collection, UUID recordId, ChangeKind kind) {}
