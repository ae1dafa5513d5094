package com.polybot.crypto.domain;

public enum MarketStatus {
  ACTIVE,
  INACTIVE,
  RESOLVED
}
