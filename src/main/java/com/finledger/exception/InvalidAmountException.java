package com.finledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class InvalidAmountException extends ResponseStatusException {
  public InvalidAmountException(String reason) {
    super(HttpStatus.BAD_REQUEST, reason);
  }
}
