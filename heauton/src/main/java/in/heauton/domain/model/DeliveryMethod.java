package in.heauton.domain.model;

import java.util.Locale;

/**
 * How a scheduled quote reaches the user.
 */
public enum DeliveryMethod {
    NOTIFICATION,
    WIDGET,
    BOTH;

    public boolean includesNotification() {
        return this == NOTIFICATION || this == BOTH;
    }

    public boolean includesWidget() {
        return this == WIDGET || this == BOTH;
    }

    /**
     * Parse a stored or user-supplied name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static DeliveryMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Delivery method is required");
        }
        return DeliveryMethod.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
