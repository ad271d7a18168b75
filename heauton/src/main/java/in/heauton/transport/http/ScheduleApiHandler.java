package in.heauton.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.heauton.domain.common.Result;
import in.heauton.domain.model.DeliveryMethod;
import in.heauton.domain.model.Quote;
import in.heauton.domain.model.Schedule;
import in.heauton.infrastructure.cache.BoundedCache;
import in.heauton.service.delivery.DeliveryReport;
import in.heauton.service.delivery.ScheduleStore;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for schedules, delivery runs and cache statistics.
 */
public final class ScheduleApiHandler {
    private static final Logger log = LoggerFactory.getLogger(ScheduleApiHandler.class);

    private final ScheduleStore scheduleStore;
    private final BoundedCache cache;
    private final ObjectMapper objectMapper;

    public ScheduleApiHandler(ScheduleStore scheduleStore, BoundedCache cache, ObjectMapper objectMapper) {
        this.scheduleStore = scheduleStore;
        this.cache = cache;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        Result<Integer> count = scheduleStore.getScheduleCount();
        if (count.isFailure()) {
            HttpResponses.sendJson(exchange, objectMapper, StatusCodes.SERVICE_UNAVAILABLE,
                    Map.of("status", "DOWN", "error", count.message()));
            return;
        }
        HttpResponses.sendJson(exchange, objectMapper, Map.of("status", "UP", "schedules", count.value()));
    }

    /**
     * GET /api/schedules
     */
    public void listSchedules(HttpServerExchange exchange) {
        Result<List<Schedule>> result = scheduleStore.getAllSchedules();
        if (result.isFailure()) {
            HttpResponses.sendFailure(exchange, objectMapper, result);
            return;
        }
        List<Map<String, Object>> schedules = result.value().stream().map(this::buildScheduleResponse).toList();
        HttpResponses.sendJson(exchange, objectMapper, Map.of("schedules", schedules));
    }

    /**
     * GET /api/schedules/{id}
     */
    public void getSchedule(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        Result<Schedule> result = scheduleStore.getSchedule(id);
        if (result.isFailure()) {
            HttpResponses.sendFailure(exchange, objectMapper, result);
            return;
        }
        Map<String, Object> response = buildScheduleResponse(result.value());
        scheduleStore.getNextDeliveryTime(id)
                .onSuccess(next -> response.put("nextDeliveryTime", next.orElse(null)));
        HttpResponses.sendJson(exchange, objectMapper, response);
    }

    /**
     * POST /api/schedules
     */
    public void createSchedule(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            Schedule schedule;
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> request = objectMapper.readValue(data, Map.class);
                schedule = buildScheduleFromRequest(Schedule.createDefault(Instant.now()), request, true);
            } catch (Exception e) {
                log.warn("Rejected schedule create request: {}", e.getMessage());
                HttpResponses.sendError(ex, objectMapper, StatusCodes.BAD_REQUEST, "Invalid schedule: " + e.getMessage());
                return;
            }
            Result<Schedule> result = scheduleStore.createSchedule(schedule);
            if (result.isFailure()) {
                HttpResponses.sendFailure(ex, objectMapper, result);
                return;
            }
            HttpResponses.sendJson(ex, objectMapper, StatusCodes.CREATED, buildScheduleResponse(result.value()));
        });
    }

    /**
     * PUT /api/schedules/{id}
     *
     * Fields missing from the body keep their current value.
     */
    public void updateSchedule(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            Result<Schedule> existing = scheduleStore.getSchedule(id);
            if (existing.isFailure()) {
                HttpResponses.sendFailure(ex, objectMapper, existing);
                return;
            }
            Schedule schedule;
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> request = objectMapper.readValue(data, Map.class);
                schedule = buildScheduleFromRequest(existing.value(), request, false);
            } catch (Exception e) {
                log.warn("Rejected update of schedule {}: {}", id, e.getMessage());
                HttpResponses.sendError(ex, objectMapper, StatusCodes.BAD_REQUEST, "Invalid schedule: " + e.getMessage());
                return;
            }
            Result<Schedule> result = scheduleStore.updateSchedule(schedule);
            if (result.isFailure()) {
                HttpResponses.sendFailure(ex, objectMapper, result);
                return;
            }
            HttpResponses.sendJson(ex, objectMapper, buildScheduleResponse(result.value()));
        });
    }

    /**
     * DELETE /api/schedules/{id}
     */
    public void deleteSchedule(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        Result<Void> result = scheduleStore.deleteSchedule(id);
        if (result.isFailure()) {
            HttpResponses.sendFailure(exchange, objectMapper, result);
            return;
        }
        HttpResponses.sendJson(exchange, objectMapper, Map.of("success", true, "id", id));
    }

    /**
     * POST /api/schedules/{id}/test
     */
    public void sendTestDelivery(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        Result<Quote> result = scheduleStore.sendTestDelivery(id);
        if (result.isFailure()) {
            HttpResponses.sendFailure(exchange, objectMapper, result);
            return;
        }
        Quote quote = result.value();
        Map<String, Object> response = new HashMap<>();
        response.put("scheduleId", id);
        response.put("quoteId", quote.id());
        response.put("text", quote.text());
        response.put("author", quote.author());
        HttpResponses.sendJson(exchange, objectMapper, response);
    }

    /**
     * POST /api/deliveries/run
     */
    public void runDeliveries(HttpServerExchange exchange) {
        Result<DeliveryReport> result = scheduleStore.deliverDueQuotes();
        if (result.isFailure()) {
            HttpResponses.sendFailure(exchange, objectMapper, result);
            return;
        }
        HttpResponses.sendJson(exchange, objectMapper, result.value());
    }

    /**
     * GET /api/cache/stats
     */
    public void cacheStats(HttpServerExchange exchange) {
        List<Map<String, Object>> regions = cache.allStats().stream().map(s -> {
            Map<String, Object> map = new HashMap<>();
            map.put("region", s.region());
            map.put("size", s.size());
            map.put("maxSize", s.maxSize());
            map.put("hits", s.hits());
            map.put("misses", s.misses());
            map.put("puts", s.puts());
            map.put("evictions", s.evictions());
            map.put("hitRate", s.hitRate());
            return map;
        }).toList();
        HttpResponses.sendJson(exchange, objectMapper, Map.of("regions", regions));
    }

    Map<String, Object> buildScheduleResponse(Schedule s) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", s.id());
        map.put("isEnabled", s.isEnabled());
        map.put("scheduledHour", s.scheduledHour());
        map.put("scheduledMinute", s.scheduledMinute());
        map.put("deliveryMethod", s.deliveryMethod().name());
        map.put("favoritesOnly", s.favoritesOnly());
        map.put("categories", s.categories().stream().sorted().toList());
        map.put("excludeRecentDays", s.excludeRecentDays());
        map.put("activeDays", s.activeDays().stream().sorted().map(DayOfWeek::getValue).toList());
        map.put("lastDeliveredQuoteId", s.lastDeliveredQuoteId());
        map.put("lastDeliveryDate", s.lastDeliveryDate());
        map.put("isDefault", s.isDefault());
        map.put("createdAt", s.createdAt());
        map.put("updatedAt", s.updatedAt());
        return map;
    }

    /**
     * Overlay request fields on {@code base}. Delivery pointers and the
     * default flag are never taken from a request.
     */
    Schedule buildScheduleFromRequest(Schedule base, Map<String, Object> request, boolean creating) {
        String id = creating
                ? Optional.ofNullable((String) request.get("id")).filter(s -> !s.isBlank())
                        .orElse(UUID.randomUUID().toString())
                : base.id();
        return new Schedule(
                id,
                getBoolOrDefault(request, "isEnabled", base.isEnabled()),
                getIntOrDefault(request, "scheduledHour", base.scheduledHour()),
                getIntOrDefault(request, "scheduledMinute", base.scheduledMinute()),
                request.containsKey("deliveryMethod")
                        ? DeliveryMethod.fromName(String.valueOf(request.get("deliveryMethod")))
                        : base.deliveryMethod(),
                getBoolOrDefault(request, "favoritesOnly", base.favoritesOnly()),
                request.containsKey("categories") ? parseCategories(request.get("categories")) : base.categories(),
                getIntOrDefault(request, "excludeRecentDays", base.excludeRecentDays()),
                request.containsKey("activeDays") ? parseActiveDays(request.get("activeDays")) : base.activeDays(),
                creating ? null : base.lastDeliveredQuoteId(),
                creating ? null : base.lastDeliveryDate(),
                !creating && base.isDefault(),
                creating ? null : base.createdAt(),
                base.updatedAt());
    }

    private static Set<String> parseCategories(Object value) {
        Set<String> categories = new LinkedHashSet<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    categories.add(item.toString().trim());
                }
            }
        } else if (value != null) {
            throw new IllegalArgumentException("categories must be an array");
        }
        return categories;
    }

    /**
     * A null value means every day. An explicit empty list is rejected
     * because it would read as "no active day".
     */
    private static Set<DayOfWeek> parseActiveDays(Object value) {
        Set<DayOfWeek> days = new LinkedHashSet<>();
        if (value instanceof Collection) {
            if (((Collection<?>) value).isEmpty()) {
                throw new IllegalArgumentException("activeDays must name at least one day, or be null for every day");
            }
            for (Object item : (Collection<?>) value) {
                int day = item instanceof Number
                        ? ((Number) item).intValue()
                        : Integer.parseInt(String.valueOf(item).trim());
                if (day < 1 || day > 7) {
                    throw new IllegalArgumentException("activeDays entries must be in 1..7, was " + day);
                }
                days.add(DayOfWeek.of(day));
            }
        } else if (value != null) {
            throw new IllegalArgumentException("activeDays must be an array");
        }
        return days;
    }

    private static int getIntOrDefault(Map<String, Object> request, String key, int defaultValue) {
        Object value = request.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString().trim());
    }

    private static boolean getBoolOrDefault(Map<String, Object> request, String key, boolean defaultValue) {
        Object value = request.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        return exchange.getQueryParameters().get(name).getFirst();
    }
}
