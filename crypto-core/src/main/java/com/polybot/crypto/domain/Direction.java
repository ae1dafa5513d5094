package com.polybot.crypto.domain;

/**
 * Which side of the threshold resolves the contract's YES outcome.
 */
public enum Direction {
  ABOVE,
  BELOW
}
