package netops.gateway.config;

import java.net.URI;
import java.util.Objects;

/**
 * A named backend the gateway proxies to and health-checks.
 *
 * @param name     service name, also the proxy prefix segment ({@code /api/{name}/...})
 * @param baseUrl  backend base URL without trailing slash
 * @param feedPath optional path polled each health cycle and relayed on the channel named after the service
 */
public record BackendService(String name, String baseUrl, String feedPath) {

    public BackendService {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        name = name.trim().toLowerCase();
        baseUrl = stripTrailingSlash(baseUrl.trim());
        if (feedPath != null && feedPath.isBlank()) {
            feedPath = null;
        }
    }

    public BackendService(String name, String baseUrl) {
        this(name, baseUrl, null);
    }

    public URI uri() {
        return URI.create(baseUrl);
    }

    public String host() {
        return uri().getHost();
    }

    public int port() {
        URI uri = uri();
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    /** Path component of the base URL ("" when the backend is mounted at root) */
    public String basePath() {
        String path = uri().getRawPath();
        return path == null ? "" : stripTrailingSlash(path);
    }

    public boolean isTls() {
        return "https".equalsIgnoreCase(uri().getScheme());
    }

    public String healthUrl() {
        return baseUrl + "/health";
    }

    public BackendService withFeedPath(String path) {
        return new BackendService(name, baseUrl, path);
    }

    private static String stripTrailingSlash(String s) {
        String out = s;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
