package com.finledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Opaque storage error. Retryable; the transaction and balance writes may have drifted. */
public class StorageFailureException extends ResponseStatusException {
  public StorageFailureException(String reason, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, reason, cause);
  }
}
