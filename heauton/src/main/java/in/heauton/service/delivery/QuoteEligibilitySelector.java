package in.heauton.service.delivery;

import in.heauton.domain.model.DeliveryRecord;
import in.heauton.domain.model.Quote;
import in.heauton.domain.model.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Picks the next quote for a schedule.
 *
 * Candidates are narrowed by the favorites flag and the category filter,
 * then the schedule's last delivered quote and every quote it delivered
 * inside its recency window are excluded. One of the remaining quotes is
 * drawn uniformly at random.
 *
 * Stateless apart from the random source.
 */
public final class QuoteEligibilitySelector {

    private final Random random;

    public QuoteEligibilitySelector() {
        this(new Random());
    }

    public QuoteEligibilitySelector(Random random) {
        this.random = random;
    }

    /**
     * @return id of the chosen quote, or empty when nothing is eligible
     */
    public Optional<String> selectNext(Schedule schedule, Collection<Quote> catalog,
                                       Collection<DeliveryRecord> history, Instant now) {
        List<Quote> eligible = eligibleQuotes(schedule, catalog, history, now);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(eligible.get(random.nextInt(eligible.size())).id());
    }

    /**
     * Eligible quotes in catalog order.
     */
    public List<Quote> eligibleQuotes(Schedule schedule, Collection<Quote> catalog,
                                      Collection<DeliveryRecord> history, Instant now) {
        Set<String> excluded = excludedIds(schedule, history, now);
        List<Quote> eligible = new ArrayList<>();
        for (Quote quote : catalog) {
            if (schedule.favoritesOnly() && !quote.isFavorite()) {
                continue;
            }
            if (!schedule.categories().isEmpty() && !quote.hasAnyCategory(schedule.categories())) {
                continue;
            }
            if (excluded.contains(quote.id())) {
                continue;
            }
            eligible.add(quote);
        }
        return eligible;
    }

    Set<String> excludedIds(Schedule schedule, Collection<DeliveryRecord> history, Instant now) {
        Set<String> excluded = new HashSet<>();
        if (schedule.lastDeliveredQuoteId() != null) {
            excluded.add(schedule.lastDeliveredQuoteId());
        }
        if (schedule.excludeRecentDays() > 0) {
            Instant windowStart = windowStart(schedule, now);
            for (DeliveryRecord record : history) {
                if (schedule.id().equals(record.scheduleId()) && !record.deliveredAt().isBefore(windowStart)) {
                    excluded.add(record.quoteId());
                }
            }
        }
        return excluded;
    }

    /**
     * Start of the recency window, {@code excludeRecentDays} days before {@code now}.
     */
    public static Instant windowStart(Schedule schedule, Instant now) {
        return now.minus(Duration.ofDays(schedule.excludeRecentDays()));
    }
}
