package in.heauton.infrastructure.surface;

import in.heauton.application.port.output.DeliverySurface;
import in.heauton.domain.model.DeliveryMethod;
import in.heauton.domain.model.Quote;
import in.heauton.infrastructure.metrics.DeliveryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a delivered quote to the notification and/or widget channel
 * according to the schedule's delivery method.
 *
 * A failing channel is logged and counted; it does not stop the other
 * channel and is never reported back as a scheduling failure.
 */
public final class ChannelDeliverySurface implements DeliverySurface {
    private static final Logger log = LoggerFactory.getLogger(ChannelDeliverySurface.class);

    private final DeliveryChannel notificationChannel;
    private final DeliveryChannel widgetChannel;
    private final DeliveryMetrics metrics;

    public ChannelDeliverySurface(DeliveryChannel notificationChannel, DeliveryChannel widgetChannel,
                                  DeliveryMetrics metrics) {
        this.notificationChannel = notificationChannel;
        this.widgetChannel = widgetChannel;
        this.metrics = metrics;
    }

    @Override
    public void deliver(Quote quote, String scheduleId, DeliveryMethod method) {
        if (method.includesNotification()) {
            push(notificationChannel, quote, scheduleId);
        }
        if (method.includesWidget()) {
            push(widgetChannel, quote, scheduleId);
        }
    }

    private void push(DeliveryChannel channel, Quote quote, String scheduleId) {
        try {
            channel.push(quote, scheduleId);
        } catch (Exception e) {
            log.error("Failed to push quote {} to {} for schedule {}: {}",
                    quote.id(), channel.name(), scheduleId, e.getMessage(), e);
            metrics.recordSurfaceFailure(channel.name());
        }
    }
}
