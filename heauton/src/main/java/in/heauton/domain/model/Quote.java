package in.heauton.domain.model;

import java.util.Set;

/**
 * Quote as seen by the delivery engine.
 * Owned by the content subsystem; read-only here.
 */
public record Quote(
        String id,
        String text,
        String author,
        Set<String> categories,
        boolean isFavorite) {

    public Quote {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Quote id cannot be blank");
        }
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }

    public boolean hasAnyCategory(Set<String> wanted) {
        for (String category : categories) {
            if (wanted.contains(category)) {
                return true;
            }
        }
        return false;
    }
}
