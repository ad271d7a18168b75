package in.heauton.infrastructure.surface;

import in.heauton.domain.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Channel that writes each pushed quote to the application log.
 *
 * Used when no device-side notifier is attached to the server.
 */
public final class LoggingDeliveryChannel implements DeliveryChannel {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    private final String name;
    private final AtomicLong pushed = new AtomicLong();

    public LoggingDeliveryChannel(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void push(Quote quote, String scheduleId) {
        pushed.incrementAndGet();
        log.info("[{}] schedule={} quote={} \"{}\" - {}", name, scheduleId, quote.id(),
                abbreviate(quote.text()), quote.author() != null ? quote.author() : "Unknown");
    }

    public long pushedCount() {
        return pushed.get();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
