package com.polybot.crypto.discovery;

import com.polybot.crypto.domain.MarketStatus;
import com.polybot.crypto.domain.ThresholdMarket;
import com.polybot.crypto.polymarket.discovery.ListingValidator;
import com.polybot.crypto.polymarket.discovery.MarketListing;
import com.polybot.crypto.polymarket.discovery.MarketListingException;
import com.polybot.crypto.polymarket.discovery.MarketListingSource;
import com.polybot.crypto.polymarket.discovery.QuestionMatch;
import com.polybot.crypto.polymarket.discovery.ThresholdQuestionParser;
import com.polybot.crypto.repository.CryptoTradingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds crypto threshold markets among the open listings and upserts them into the catalog store.
 *
 * <p>A failing listing is recorded and skipped; it never aborts the run. Markets that were active
 * but are missing from a successful, non-empty run are deactivated.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketDiscoveryService {

    private final MarketListingSource listingSource;
    private final ListingValidator validator;
    private final CryptoTradingRepository repository;
    private final Clock clock;

    public DiscoveryResult discover() {
        List<MarketListing> listings;
        try {
            listings = listingSource.fetchOpenListings();
        } catch (MarketListingException e) {
            log.error("DISCOVERY: listing fetch failed: {}", e.getMessage());
            return DiscoveryResult.fetchFailed(e.getMessage());
        }

        Instant now = clock.instant();
        int excluded = 0;
        int rejected = 0;
        Set<String> accepted = new HashSet<>();
        List<String> errors = new ArrayList<>();

        for (MarketListing listing : listings) {
            try {
                QuestionMatch match = ThresholdQuestionParser.parse(listing.question());
                if (match.kind() == QuestionMatch.Kind.EXCLUDED) {
                    excluded++;
                    log.debug("DISCOVERY: excluded '{}' ({})", listing.question(), match.reason());
                    continue;
                }
                if (!match.isMatched()) {
                    continue;
                }
                Optional<String> rejection = validator.rejectionReason(listing);
                if (rejection.isPresent()) {
                    rejected++;
                    log.debug("DISCOVERY: rejected '{}': {}", listing.question(), rejection.get());
                    continue;
                }
                repository.upsertMarket(toMarket(listing, match, now));
                accepted.add(listing.id());
            } catch (RuntimeException e) {
                log.warn("DISCOVERY: failed to save market {}: {}", listing.id(), e.getMessage());
                errors.add(listing.id() + ": " + e.getMessage());
            }
        }

        int deactivated = 0;
        if (!listings.isEmpty()) {
            try {
                deactivated = repository.markMissingMarketsInactive(accepted);
            } catch (RuntimeException e) {
                log.warn("DISCOVERY: failed to deactivate stale markets: {}", e.getMessage());
                errors.add("deactivate: " + e.getMessage());
            }
        }

        DiscoveryResult result = new DiscoveryResult(
                listings.size(), accepted.size(), excluded, rejected, deactivated, List.copyOf(errors));
        log.info("DISCOVERY: {} listings, {} threshold markets, {} excluded, {} rejected, {} deactivated, {} errors",
                result.discovered(), result.matched(), result.excluded(), result.rejected(),
                result.deactivated(), result.errors().size());
        return result;
    }

    private static ThresholdMarket toMarket(MarketListing listing, QuestionMatch match, Instant now) {
        return new ThresholdMarket(
                listing.id(),
                listing.question(),
                match.asset(),
                match.threshold(),
                match.direction(),
                listing.endDate(),
                listing.volume24h(),
                match.whitelisted(),
                MarketStatus.ACTIVE,
                now
        );
    }
}
