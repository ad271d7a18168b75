package in.heauton.testutil;

import in.heauton.application.port.output.QuoteRepository;
import in.heauton.domain.model.Quote;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class InMemoryQuoteRepository implements QuoteRepository {

    private final List<Quote> quotes = new ArrayList<>();

    public InMemoryQuoteRepository add(String id, boolean favorite, String... categories) {
        quotes.add(new Quote(id, "Text of " + id, "Author", Set.of(categories), favorite));
        return this;
    }

    @Override
    public synchronized List<Quote> findAll() {
        return List.copyOf(quotes);
    }

    @Override
    public synchronized List<Quote> findFavorites() {
        return quotes.stream().filter(Quote::isFavorite).toList();
    }

    @Override
    public synchronized Optional<Quote> findById(String quoteId) {
        return quotes.stream().filter(q -> q.id().equals(quoteId)).findFirst();
    }

    @Override
    public synchronized int count() {
        return quotes.size();
    }
}
