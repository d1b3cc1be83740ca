package netops.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.error.UpstreamUnavailableException;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON over HTTP to backend services and the edge provider API.
 * <p>
 * Failure mapping: connection errors and 5xx answers raise {@link UpstreamUnavailableException} (retryable);
 * 4xx answers raise a permanent {@link TaskExecutionException}.
 */
public class BackendClient {

    private static final Logger log = LoggerFactory.getLogger(BackendClient.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public BackendClient(Duration connectTimeout, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.requestTimeout = requestTimeout;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    /**
     * Plain GET returning the raw response, for probes that interpret the status themselves.
     */
    public HttpResponse<String> get(String url, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    public JsonNode getJson(String service, String url) {
        return send(service, "GET", url, null, null);
    }

    public JsonNode postJson(String service, String url, JsonNode body, String bearerToken) {
        return send(service, "POST", url, body, bearerToken);
    }

    public JsonNode send(String service, String method, String url, JsonNode body, String bearerToken) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(Jsons.toJson(body)));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamUnavailableException(service,
                    service + " unreachable: " + method + " " + url + " (" + describe(e) + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TaskExecutionException.transientFailure("Interrupted calling " + service, e);
        }

        int status = response.statusCode();
        log.debug("{} {} -> {}", method, url, status);
        if (status >= 500) {
            throw new UpstreamUnavailableException(service,
                    "%s %s failed (HTTP %d): %s".formatted(method, url, status, abbreviate(response.body())));
        }
        if (status >= 400) {
            throw TaskExecutionException.permanent(
                    "%s %s rejected (HTTP %d): %s".formatted(method, url, status, abbreviate(response.body())));
        }
        return parseBody(response.body());
    }

    private static JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Jsons.object();
        }
        try {
            return Jsons.readTree(body);
        } catch (IllegalArgumentException e) {
            ObjectNode wrapped = Jsons.object();
            wrapped.put("body", abbreviate(body));
            return wrapped;
        }
    }

    public static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
