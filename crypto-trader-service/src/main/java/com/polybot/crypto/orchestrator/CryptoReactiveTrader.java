package com.polybot.crypto.orchestrator;

import com.polybot.crypto.concurrent.ExecutorShutdown;
import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.discovery.DiscoveryResult;
import com.polybot.crypto.discovery.MarketCatalog;
import com.polybot.crypto.discovery.MarketDiscoveryService;
import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.MarketQuote;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.ThresholdMarket;
import com.polybot.crypto.execution.ExecutionResult;
import com.polybot.crypto.execution.PaperTradeExecutor;
import com.polybot.crypto.exit.ExitMonitor;
import com.polybot.crypto.feed.FeedEvent;
import com.polybot.crypto.feed.FeedEventChannels;
import com.polybot.crypto.feed.PriceFeed;
import com.polybot.crypto.model.MispricingModel;
import com.polybot.crypto.model.MispricingResult;
import com.polybot.crypto.pricing.MarketPriceCache;
import com.polybot.crypto.repository.CryptoTradingRepository;
import com.polybot.crypto.risk.RiskLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the trader: discovery, price-cache warm-up, the price feed, one intake loop that turns feed
 * events into opportunity scans, the exit monitor, and the periodic maintenance timers.
 *
 * <p>Every scan and trade happens on the intake thread, so feed events are handled one at a time
 * in channel-priority order.
 */
@Slf4j
public class CryptoReactiveTrader {

    private static final Duration WARM_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration PRICE_LOG_RETENTION = Duration.ofHours(24);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    private static final long INTAKE_POLL_MILLIS = 500;

    private final CryptoTraderProperties properties;
    private final MarketDiscoveryService discoveryService;
    private final MarketCatalog catalog;
    private final MarketPriceCache priceCache;
    private final PriceFeed priceFeed;
    private final FeedEventChannels channels;
    private final MispricingModel model;
    private final PaperTradeExecutor executor;
    private final ExitMonitor exitMonitor;
    private final RiskLedger riskLedger;
    private final CryptoTradingRepository repository;
    private final Clock clock;

    private final Deque<Opportunity> recentOpportunities = new ArrayDeque<>();
    private final Counter opportunitiesCounter;

    private volatile boolean running;
    private volatile boolean feedExhausted;
    private ExecutorService intake;
    private ScheduledExecutorService timers;

    public CryptoReactiveTrader(
            CryptoTraderProperties properties,
            MarketDiscoveryService discoveryService,
            MarketCatalog catalog,
            MarketPriceCache priceCache,
            PriceFeed priceFeed,
            FeedEventChannels channels,
            MispricingModel model,
            PaperTradeExecutor executor,
            ExitMonitor exitMonitor,
            RiskLedger riskLedger,
            CryptoTradingRepository repository,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.discoveryService = discoveryService;
        this.catalog = catalog;
        this.priceCache = priceCache;
        this.priceFeed = priceFeed;
        this.channels = channels;
        this.model = model;
        this.executor = executor;
        this.exitMonitor = exitMonitor;
        this.riskLedger = riskLedger;
        this.repository = repository;
        this.clock = clock;

        this.opportunitiesCounter = Counter.builder("crypto.opportunities.detected")
                .description("Mispricings found by opportunity scans")
                .register(meterRegistry);
        Gauge.builder("crypto.feed.connected", priceFeed, f -> f.connectionStatus().connected() ? 1 : 0)
                .description("1 while the price stream is connected")
                .register(meterRegistry);
        Gauge.builder("crypto.positions.open", riskLedger, r -> r.state().openPositions())
                .description("Open positions as of the last risk refresh")
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("ORCHESTRATOR: starting (assets {})", properties.feed().assets());
        running = true;

        refreshCatalog();
        warmPriceCache();

        priceFeed.connect();

        intake = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "crypto-intake");
            t.setDaemon(true);
            return t;
        });
        intake.submit(this::intakeLoop);

        exitMonitor.start();

        timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crypto-orchestrator-timers");
            t.setDaemon(true);
            return t;
        });
        long discoveryMinutes = properties.discovery().discoveryIntervalMinutes();
        timers.scheduleWithFixedDelay(() -> safely("catalog refresh", this::refreshCatalog),
                discoveryMinutes, discoveryMinutes, TimeUnit.MINUTES);
        timers.scheduleWithFixedDelay(() -> safely("price log prune", this::prunePriceLog), 1, 1, TimeUnit.HOURS);
        timers.scheduleAtFixedRate(() -> safely("daily reset", riskLedger::resetDaily),
                millisUntilNextUtcMidnight(), TimeUnit.DAYS.toMillis(1), TimeUnit.MILLISECONDS);

        log.info("ORCHESTRATOR: started with {} markets", catalog.size());
    }

    /**
     * Stops the feed and timers. A catalog refresh or event handler already running is waited for;
     * stored positions are left as they are.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("ORCHESTRATOR: stopping");
        priceFeed.disconnect();
        exitMonitor.stop();
        if (timers != null && !ExecutorShutdown.await(timers, SHUTDOWN_TIMEOUT)) {
            log.warn("ORCHESTRATOR: maintenance task did not finish in time, interrupted");
        }
        if (intake != null && !ExecutorShutdown.await(intake, SHUTDOWN_TIMEOUT)) {
            log.warn("ORCHESTRATOR: intake loop did not finish in time, interrupted");
        }
        log.info("ORCHESTRATOR: stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public DiscoveryResult refreshCatalog() {
        DiscoveryResult result = discoveryService.discover();
        try {
            catalog.reload();
        } catch (RuntimeException e) {
            log.error("ORCHESTRATOR: catalog reload failed, keeping previous snapshot: {}", e.getMessage());
        }
        return result;
    }

    /**
     * Handles one feed event. Called from the intake loop.
     */
    void dispatch(FeedEvent event) {
        if (event instanceof FeedEvent.PriceUpdate update) {
            scan(update.price(), false);
        } else if (event instanceof FeedEvent.SignificantMove move) {
            log.info("ORCHESTRATOR: significant move on {}, forcing scan", move.asset());
            logSignificantMove(move);
            priceFeed.latest(move.asset()).ifPresent(price -> scan(price, true));
        } else if (event instanceof FeedEvent.FeedExhausted exhausted) {
            feedExhausted = true;
            log.error("ORCHESTRATOR: price feed gave up after {} attempts; restart required", exhausted.attempts());
        }
    }

    /**
     * Checks every active market of the asset, nearest threshold first, and trades any mispricing.
     * A forced scan asks for fresh quotes but still honours the cache TTL.
     *
     * @return the opportunities found
     */
    List<Opportunity> scan(AssetPrice price, boolean forceQuoteRefresh) {
        List<ThresholdMarket> markets = new ArrayList<>(catalog.marketsFor(price.asset()));
        if (markets.isEmpty()) {
            return List.of();
        }
        if (forceQuoteRefresh) {
            priceCache.refreshIfStale();
        }
        markets.sort(Comparator.comparingDouble(
                (ThresholdMarket m) -> model.thresholdProximity(price.price(), m.threshold())).reversed());

        Instant now = clock.instant();
        List<Opportunity> found = new ArrayList<>();
        for (ThresholdMarket market : markets) {
            if (riskLedger.isInCooldown(market.marketId())) {
                continue;
            }
            Optional<MarketQuote> quote = priceCache.quote(market.marketId());
            if (quote.isEmpty()) {
                continue;
            }
            MispricingResult result = model.detectMispricing(market, price, quote.get(), now);
            if (!result.found()) {
                log.trace("ORCHESTRATOR: {} no trade: {}", market.marketId(), result.reason());
                continue;
            }
            found.add(result.opportunity());
            onOpportunity(result.opportunity(), market);
        }
        return found;
    }

    public List<Opportunity> recentOpportunities() {
        synchronized (recentOpportunities) {
            return List.copyOf(recentOpportunities);
        }
    }

    public TraderStatus status() {
        return new TraderStatus(
                running,
                priceFeed.connectionStatus(),
                feedExhausted,
                priceFeed.latestPrices(),
                catalog.size(),
                priceCache.size(),
                riskLedger.state(),
                riskLedger.warnings(),
                riskLedger.shouldPauseTrading(),
                exitMonitor.positionSummaries(),
                recentOpportunities(),
                clock.instant()
        );
    }

    private void onOpportunity(Opportunity opportunity, ThresholdMarket market) {
        opportunitiesCounter.increment();
        remember(opportunity);
        log.info("ORCHESTRATOR: opportunity {} {} {} threshold {} gap {}% (expected {} vs {})",
                opportunity.id(), opportunity.asset(), opportunity.side(), market.threshold(),
                String.format("%.1f", opportunity.gapPercent() * 100),
                String.format("%.3f", opportunity.expectedPrice()), String.format("%.3f", opportunity.actualPrice()));
        try {
            repository.saveOpportunity(opportunity);
        } catch (RuntimeException e) {
            log.error("ORCHESTRATOR: failed to store opportunity {}, not trading it: {}", opportunity.id(), e.getMessage());
            return;
        }
        ExecutionResult result = executor.executeTrade(opportunity, market.volume24h());
        if (!result.success()) {
            log.info("ORCHESTRATOR: opportunity {} not executed ({}): {}",
                    opportunity.id(), result.outcome(), result.error());
        }
    }

    private void remember(Opportunity opportunity) {
        synchronized (recentOpportunities) {
            recentOpportunities.addFirst(opportunity);
            while (recentOpportunities.size() > properties.orchestrator().recentOpportunityLimit()) {
                recentOpportunities.removeLast();
            }
        }
    }

    private void intakeLoop() {
        log.info("ORCHESTRATOR: intake loop started");
        while (running) {
            try {
                FeedEvent event = channels.next(INTAKE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("ORCHESTRATOR: event handling failed: {}", e.getMessage(), e);
            }
        }
        log.info("ORCHESTRATOR: intake loop stopped");
    }

    private void warmPriceCache() {
        try {
            priceCache.refresh().get(WARM_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            log.info("ORCHESTRATOR: price cache warmed with {} quotes", priceCache.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            log.warn("ORCHESTRATOR: price cache warm-up still running after {}s", WARM_TIMEOUT.toSeconds());
        } catch (Exception e) {
            log.warn("ORCHESTRATOR: price cache warm-up failed: {}", e.getMessage());
        }
    }

    private void logSignificantMove(FeedEvent.SignificantMove move) {
        priceFeed.latest(move.asset()).ifPresent(price -> {
            try {
                repository.logPrice(price);
            } catch (RuntimeException e) {
                log.warn("ORCHESTRATOR: failed to log price for {}: {}", move.asset(), e.getMessage());
            }
        });
    }

    private void prunePriceLog() {
        int removed = repository.pruneOldPriceLog(clock.instant().minus(PRICE_LOG_RETENTION));
        log.debug("ORCHESTRATOR: pruned {} price log rows", removed);
    }

    private long millisUntilNextUtcMidnight() {
        Instant now = clock.instant();
        Instant midnight = now.truncatedTo(ChronoUnit.DAYS).plus(1, ChronoUnit.DAYS);
        return Duration.between(now, midnight).toMillis();
    }

    private static void safely(String task, Runnable runnable) {
        try {
            runnable.run();
        } catch (Exception e) {
            log.error("ORCHESTRATOR: {} failed: {}", task, e.getMessage(), e);
        }
    }
}
