package in.heauton.domain.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleTest {

    private static final Instant NOW = Instant.parse("2024-03-10T10:00:00Z");

    @Test
    void createDefault_hasSafeDefaults() {
        Schedule s = Schedule.createDefault(NOW);

        assertTrue(s.isDefault());
        assertTrue(s.isEnabled());
        assertEquals(9, s.scheduledHour());
        assertEquals(0, s.scheduledMinute());
        assertEquals(DeliveryMethod.BOTH, s.deliveryMethod());
        assertTrue(s.categories().isEmpty());
        assertTrue(s.validationError().isEmpty());
    }

    @Test
    void validationError_reportsRanges() {
        Schedule base = Schedule.createDefault(NOW);

        assertTrue(base.withTime(-1, 0, NOW).validationError().isPresent());
        assertTrue(base.withTime(23, 59, NOW).validationError().isEmpty());
        assertTrue(base.withTime(12, 60, NOW).validationError().isPresent());
    }

    @Test
    void isActiveOn_emptyMeansEveryDay() {
        Schedule everyDay = Schedule.createDefault(NOW);
        Schedule mondays = new Schedule("s1", true, 9, 0, null, false, null, 0, Set.of(DayOfWeek.MONDAY),
                null, null, false, NOW, NOW);

        assertTrue(everyDay.isActiveOn(DayOfWeek.SUNDAY));
        assertTrue(mondays.isActiveOn(DayOfWeek.MONDAY));
        assertFalse(mondays.isActiveOn(DayOfWeek.TUESDAY));
        assertEquals(DeliveryMethod.BOTH, mondays.deliveryMethod());
    }

    @Test
    void constructor_rejectsBlankId() {
        assertThrows(IllegalArgumentException.class, () -> new Schedule(" ", true, 9, 0, null, false, null, 0, null,
                null, null, false, NOW, NOW));
    }

    @Test
    void deliveryMethod_fromNameIsLenient() {
        assertEquals(DeliveryMethod.WIDGET, DeliveryMethod.fromName(" widget "));
        assertThrows(IllegalArgumentException.class, () -> DeliveryMethod.fromName("pigeon"));
    }

    @Test
    void deliveryMethod_fromNameIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(DeliveryMethod.NOTIFICATION, DeliveryMethod.fromName("notification"));
            assertEquals(DeliveryMethod.WIDGET, DeliveryMethod.fromName("widget"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
