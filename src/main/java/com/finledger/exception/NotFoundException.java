package com.finledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** A referenced record is missing or belongs to another owner. Usually a stale read. */
public class NotFoundException extends ResponseStatusException {
  public NotFoundException(String reason) {
    super(HttpStatus.NOT_FOUND, reason);
  }
}
