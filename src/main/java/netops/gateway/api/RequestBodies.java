package netops.gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import netops.gateway.error.ValidationException;
import netops.gateway.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Request parsing shared by controllers.
 */
public final class RequestBodies {

    private RequestBodies() {
    }

    public static <T> T readJson(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("Request body is required");
        }
        try {
            T value = Jsons.mapper().readValue(body, type);
            if (value == null) {
                throw new ValidationException("Request body must be a JSON object");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON", e.getOriginalMessage());
        }
    }

    public static Optional<String> queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }
}
