package com.finledger.service;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/** Resolves the owner every ledger read and write is scoped to. */
@Service
public class CurrentUserService {
  public LedgerOwner requireOwner() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null || !(authentication.getPrincipal() instanceof LedgerOwner)) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing bearer token");
    }
    return (LedgerOwner) authentication.getPrincipal();
  }

  public UUID requireUserId() {
    return requireOwner().id();
  }
}
