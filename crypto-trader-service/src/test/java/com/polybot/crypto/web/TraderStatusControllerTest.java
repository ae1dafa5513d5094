package com.polybot.crypto.web;

import com.polybot.crypto.execution.PaperTradeExecutor;
import com.polybot.crypto.execution.TradingStats;
import com.polybot.crypto.orchestrator.CryptoReactiveTrader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TraderStatusController.
 */
@ExtendWith(MockitoExtension.class)
class TraderStatusControllerTest {

    @Mock
    private ObjectProvider<CryptoReactiveTrader> traderProvider;

    @Mock
    private PaperTradeExecutor executor;

    @Test
    void statusIsNotFoundWhenTraderIsDisabled() {
        when(traderProvider.getIfAvailable()).thenReturn(null);
        TraderStatusController controller = new TraderStatusController(traderProvider, executor);

        ResponseEntity<?> response = controller.status();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void statsComeFromExecutor() {
        TradingStats stats = new TradingStats(1, 275.0, 12.5, 3, 2, 0.5, 40.0);
        when(executor.stats()).thenReturn(stats);
        TraderStatusController controller = new TraderStatusController(traderProvider, executor);

        ResponseEntity<TradingStats> response = controller.stats();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(stats);
    }
}
