package com.polybot.crypto.domain;

/**
 * Exit rules in the order they are evaluated.
 */
public enum ExitReason {
  PROFIT,
  STOP,
  TIME,
  REVERSAL,
  MANUAL
}
