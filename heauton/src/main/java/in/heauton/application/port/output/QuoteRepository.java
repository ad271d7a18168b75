package in.heauton.application.port.output;

import in.heauton.domain.model.Quote;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the quote catalog.
 */
public interface QuoteRepository {

    List<Quote> findAll();

    List<Quote> findFavorites();

    Optional<Quote> findById(String quoteId);

    int count();
}
