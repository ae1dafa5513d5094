package com.polybot.crypto.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.crypto.discovery.GammaMarketListingClient;
import com.polybot.crypto.discovery.MarketCatalog;
import com.polybot.crypto.discovery.MarketDiscoveryService;
import com.polybot.crypto.execution.PaperTradeExecutor;
import com.polybot.crypto.exit.ExitMonitor;
import com.polybot.crypto.feed.AssetPriceTracker;
import com.polybot.crypto.feed.BinancePriceFeed;
import com.polybot.crypto.feed.FeedEventChannels;
import com.polybot.crypto.model.MispricingModel;
import com.polybot.crypto.model.PositionSizer;
import com.polybot.crypto.orchestrator.CryptoReactiveTrader;
import com.polybot.crypto.polymarket.discovery.ListingValidator;
import com.polybot.crypto.polymarket.discovery.MarketListingSource;
import com.polybot.crypto.pricing.MarketPriceCache;
import com.polybot.crypto.repository.CryptoTradingRepository;
import com.polybot.crypto.repository.JdbcCryptoTradingRepository;
import com.polybot.crypto.risk.RiskLedger;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the trader. Every component is built here and handed its collaborators; nothing looks up
 * shared instances on its own.
 */
@Configuration
public class CryptoTraderConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient httpClient(CryptoTraderProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.discovery().httpTimeoutMillis()))
                .build();
    }

    @Bean
    public CryptoTradingRepository cryptoTradingRepository(
            JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, Clock clock) {
        return new JdbcCryptoTradingRepository(jdbcTemplate, transactionTemplate, clock);
    }

    @Bean
    public MarketListingSource marketListingSource(
            CryptoTraderProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        return new GammaMarketListingClient(properties.discovery(), httpClient, objectMapper);
    }

    @Bean
    public MarketDiscoveryService marketDiscoveryService(
            MarketListingSource listingSource, CryptoTradingRepository repository,
            CryptoTraderProperties properties, Clock clock) {
        return new MarketDiscoveryService(
                listingSource, new ListingValidator(properties.discovery(), clock), repository, clock);
    }

    @Bean
    public MarketCatalog marketCatalog(CryptoTradingRepository repository) {
        return new MarketCatalog(repository);
    }

    /**
     * Single refresh thread. A load running at shutdown is allowed to finish.
     */
    @Bean
    public ThreadPoolTaskExecutor priceCacheRefreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("crypto-price-cache-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public MarketPriceCache marketPriceCache(
            MarketListingSource listingSource, ThreadPoolTaskExecutor priceCacheRefreshExecutor,
            CryptoTraderProperties properties, Clock clock) {
        return new MarketPriceCache(listingSource, priceCacheRefreshExecutor, clock,
                Duration.ofMillis(properties.priceCache().ttlMillis()));
    }

    @Bean
    public FeedEventChannels feedEventChannels(CryptoTraderProperties properties, MeterRegistry meterRegistry) {
        return new FeedEventChannels(properties.orchestrator().channelCapacity(), meterRegistry);
    }

    @Bean
    public BinancePriceFeed binancePriceFeed(
            CryptoTraderProperties properties, HttpClient httpClient, ObjectMapper objectMapper,
            FeedEventChannels channels, Clock clock) {
        return new BinancePriceFeed(properties.feed(), httpClient, objectMapper,
                new AssetPriceTracker(properties.feed()), channels, clock);
    }

    @Bean
    public MispricingModel mispricingModel(CryptoTraderProperties properties) {
        return new MispricingModel(properties.detection());
    }

    @Bean
    public RiskLedger riskLedger(CryptoTraderProperties properties, CryptoTradingRepository repository, Clock clock) {
        return new RiskLedger(properties.risk(), repository, clock);
    }

    @Bean
    public PaperTradeExecutor paperTradeExecutor(
            CryptoTraderProperties properties, RiskLedger riskLedger, CryptoTradingRepository repository,
            Clock clock, MeterRegistry meterRegistry) {
        return new PaperTradeExecutor(new PositionSizer(properties.sizing()), riskLedger, repository, clock,
                meterRegistry);
    }

    @Bean
    public ExitMonitor exitMonitor(
            CryptoTraderProperties properties, CryptoTradingRepository repository, PaperTradeExecutor executor,
            MarketPriceCache priceCache, MarketCatalog catalog, BinancePriceFeed priceFeed, Clock clock) {
        return new ExitMonitor(properties.exit(), repository, executor, priceCache, catalog, priceFeed, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "crypto.orchestrator", name = "auto-start", havingValue = "true", matchIfMissing = true)
    public CryptoReactiveTrader cryptoReactiveTrader(
            CryptoTraderProperties properties,
            MarketDiscoveryService discoveryService,
            MarketCatalog catalog,
            MarketPriceCache priceCache,
            BinancePriceFeed priceFeed,
            FeedEventChannels channels,
            MispricingModel model,
            PaperTradeExecutor executor,
            ExitMonitor exitMonitor,
            RiskLedger riskLedger,
            CryptoTradingRepository repository,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new CryptoReactiveTrader(properties, discoveryService, catalog, priceCache, priceFeed, channels,
                model, executor, exitMonitor, riskLedger, repository, clock, meterRegistry);
    }
}
