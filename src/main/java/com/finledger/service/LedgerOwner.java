package com.finledger.service;

import java.util.UUID;

/** Authenticated principal: the owner every ledger record is scoped to. */
public record LedgerOwner(UUID id) {}
