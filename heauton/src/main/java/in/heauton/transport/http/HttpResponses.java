package in.heauton.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.heauton.domain.common.ErrorKind;
import in.heauton.domain.common.Result;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * JSON response helpers shared by the API handlers.
 */
final class HttpResponses {
    private static final Logger log = LoggerFactory.getLogger(HttpResponses.class);

    private HttpResponses() {
    }

    static void sendJson(HttpServerExchange exchange, ObjectMapper objectMapper, Object data) {
        sendJson(exchange, objectMapper, StatusCodes.OK, data);
    }

    static void sendJson(HttpServerExchange exchange, ObjectMapper objectMapper, int statusCode, Object data) {
        try {
            String json = objectMapper.writeValueAsString(data);
            exchange.setStatusCode(statusCode);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json);
        } catch (Exception e) {
            log.error("Failed to send JSON response: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"error\":\"Internal server error\"}");
        }
    }

    static void sendError(HttpServerExchange exchange, ObjectMapper objectMapper, int statusCode, String message) {
        sendJson(exchange, objectMapper, statusCode, Map.of("error", message != null ? message : "Unknown error"));
    }

    static void sendFailure(HttpServerExchange exchange, ObjectMapper objectMapper, Result<?> failure) {
        sendError(exchange, objectMapper, statusFor(failure.errorKind()), failure.message());
    }

    static int statusFor(ErrorKind kind) {
        if (kind == null) {
            return StatusCodes.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case NOT_FOUND -> StatusCodes.NOT_FOUND;
            case INVALID_ARGUMENT -> StatusCodes.BAD_REQUEST;
            case ALREADY_DELIVERED -> StatusCodes.CONFLICT;
            case DELIVERY_FAILURE -> StatusCodes.BAD_GATEWAY;
            case PERSISTENCE_FAILURE -> StatusCodes.INTERNAL_SERVER_ERROR;
        };
    }
}
