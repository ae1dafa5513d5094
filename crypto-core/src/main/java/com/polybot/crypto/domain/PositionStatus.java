package com.polybot.crypto.domain;

/**
 * Position lifecycle. Transitions only move forward: OPEN, then CLOSING, then CLOSED.
 */
public enum PositionStatus {
  OPEN,
  CLOSING,
  CLOSED
}
