package com.finledger.event;

public enum ChangeKind {
  CREATED,
  UPDATED,
  DELETED
}
