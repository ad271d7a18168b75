package in.heauton.service;

import in.heauton.application.port.output.QuoteRepository;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.Quote;
import in.heauton.infrastructure.cache.BoundedCache;
import in.heauton.infrastructure.cache.CacheRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Read-through view of the quote catalog.
 *
 * Single-quote lookups go through the QUOTES cache region. Candidate pools
 * are read from the repository on every call.
 */
public final class QuoteCatalog {
    private static final Logger log = LoggerFactory.getLogger(QuoteCatalog.class);

    private final QuoteRepository quoteRepo;
    private final BoundedCache cache;

    public QuoteCatalog(QuoteRepository quoteRepo, BoundedCache cache) {
        this.quoteRepo = quoteRepo;
        this.cache = cache;
    }

    public Result<Quote> getQuote(String quoteId) {
        Optional<Quote> cached = cache.get(CacheRegion.QUOTES, quoteId);
        if (cached.isPresent()) {
            return Result.success(cached.get());
        }
        long generation = cache.generation(CacheRegion.QUOTES);
        try {
            Optional<Quote> loaded = quoteRepo.findById(quoteId);
            if (loaded.isEmpty()) {
                return Result.notFound("Quote not found: " + quoteId);
            }
            cache.putIfNotInvalidated(CacheRegion.QUOTES, quoteId, loaded.get(), generation);
            return Result.success(loaded.get());
        } catch (RuntimeException e) {
            log.error("Failed to load quote {}: {}", quoteId, e.getMessage());
            return Result.persistenceFailure("Failed to load quote " + quoteId, e);
        }
    }

    /**
     * Candidate pool for a schedule: favorites only, or the whole catalog.
     */
    public Result<List<Quote>> candidates(boolean favoritesOnly) {
        try {
            return Result.success(favoritesOnly ? quoteRepo.findFavorites() : quoteRepo.findAll());
        } catch (RuntimeException e) {
            log.error("Failed to load {}quotes: {}", favoritesOnly ? "favorite " : "", e.getMessage());
            return Result.persistenceFailure("Failed to load quotes", e);
        }
    }

    public void invalidate(String quoteId) {
        cache.remove(CacheRegion.QUOTES, quoteId);
    }
}
