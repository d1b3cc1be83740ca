package netops.gateway.error;

/**
 * Backend service could not be reached. Retryable when raised during task execution;
 * a proxied caller gets a 502 and decides on its own whether to retry.
 */
public class UpstreamUnavailableException extends TaskExecutionException {

    private final String service;

    public UpstreamUnavailableException(String service, String detail, Throwable cause) {
        super(502, "Service unavailable", detail, true, cause);
        this.service = service;
    }

    public UpstreamUnavailableException(String service, String detail) {
        this(service, detail, null);
    }

    public String service() {
        return service;
    }
}
