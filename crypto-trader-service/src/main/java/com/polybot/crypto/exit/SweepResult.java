package com.polybot.crypto.exit;

public record SweepResult(int checked, int closed) {
}
