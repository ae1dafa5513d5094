package com.polybot.crypto.web;

import com.polybot.crypto.execution.PaperTradeExecutor;
import com.polybot.crypto.execution.TradingStats;
import com.polybot.crypto.orchestrator.CryptoReactiveTrader;
import com.polybot.crypto.orchestrator.TraderStatus;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/crypto")
@RequiredArgsConstructor
public class TraderStatusController {

  private final @NonNull ObjectProvider<CryptoReactiveTrader> trader;
  private final @NonNull PaperTradeExecutor executor;

  @GetMapping("/status")
  public ResponseEntity<TraderStatus> status() {
    CryptoReactiveTrader current = trader.getIfAvailable();
    if (current == null) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(current.status());
  }

  @GetMapping("/stats")
  public ResponseEntity<TradingStats> stats() {
    return ResponseEntity.ok(executor.stats());
  }
}
