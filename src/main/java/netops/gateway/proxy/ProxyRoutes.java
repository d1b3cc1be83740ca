package netops.gateway.proxy;

import netops.gateway.config.BackendService;
import netops.gateway.service.BackendRegistry;

import java.util.Optional;

/**
 * Maps {@code /api/{service}/rest?query} onto the backend's base URL, configured or registered at runtime.
 * Names used by the gateway's own API ({@code v1}, {@code status}) never route to a backend.
 */
public class ProxyRoutes {

    static final String PREFIX = "/api/";

    private final BackendRegistry backends;

    public ProxyRoutes(BackendRegistry backends) {
        this.backends = backends;
    }

    /**
     * @param service target backend
     * @param uri     request URI for the backend: base path, the remainder after the prefix, the query
     */
    public record Route(BackendService service, String uri) {
    }

    public Optional<Route> match(String requestUri) {
        if (requestUri == null || !requestUri.startsWith(PREFIX)) {
            return Optional.empty();
        }
        int query = requestUri.indexOf('?');
        String path = query >= 0 ? requestUri.substring(0, query) : requestUri;
        String suffix = query >= 0 ? requestUri.substring(query) : "";

        String rest = path.substring(PREFIX.length());
        int slash = rest.indexOf('/');
        String name = (slash >= 0 ? rest.substring(0, slash) : rest).toLowerCase();
        if (name.isEmpty() || BackendRegistry.RESERVED.contains(name)) {
            return Optional.empty();
        }

        Optional<BackendService> service = backends.find(name);
        if (service.isEmpty()) {
            return Optional.empty();
        }
        String remainder = slash >= 0 ? rest.substring(slash) : "/";
        return Optional.of(new Route(service.get(), service.get().basePath() + remainder + suffix));
    }
}
