package com.polybot.crypto.domain;

public enum OpportunityStatus {
  DETECTED,
  EXECUTING,
  EXECUTED,
  SKIPPED,
  FAILED;

  public boolean isTerminal() {
    return this == EXECUTED || this == SKIPPED || this == FAILED;
  }
}
