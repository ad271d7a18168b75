package in.heauton.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.ActivityEvent;
import in.heauton.service.streak.EngagementStats;
import in.heauton.service.streak.EngagementStatsService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.util.Deque;
import java.util.Map;

/**
 * REST API for activity events and engagement streaks.
 */
public final class EngagementApiHandler {

    private final EngagementStatsService statsService;
    private final ObjectMapper objectMapper;

    public EngagementApiHandler(EngagementStatsService statsService, ObjectMapper objectMapper) {
        this.statsService = statsService;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /api/engagement/streaks?eventType=journal_created
     */
    public void streaks(HttpServerExchange exchange) {
        Deque<String> param = exchange.getQueryParameters().get("eventType");
        String eventType = param != null && !param.getFirst().isBlank() ? param.getFirst() : null;

        Result<EngagementStats> result = statsService.statsFor(eventType);
        if (result.isFailure()) {
            HttpResponses.sendFailure(exchange, objectMapper, result);
            return;
        }
        HttpResponses.sendJson(exchange, objectMapper, result.value());
    }

    /**
     * POST /api/engagement/events  {"eventType": "...", "relatedEntityId": "..."}
     */
    public void recordEvent(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            Map<?, ?> request;
            try {
                request = objectMapper.readValue(data, Map.class);
            } catch (Exception e) {
                HttpResponses.sendError(ex, objectMapper, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
                return;
            }
            Object eventType = request.get("eventType");
            Object related = request.get("relatedEntityId");
            Result<ActivityEvent> result = statsService.recordActivity(
                    eventType != null ? eventType.toString() : null,
                    related != null ? related.toString() : null);
            if (result.isFailure()) {
                HttpResponses.sendFailure(ex, objectMapper, result);
                return;
            }
            HttpResponses.sendJson(ex, objectMapper, StatusCodes.CREATED, result.value());
        });
    }
}
