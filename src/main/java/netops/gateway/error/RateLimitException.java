package netops.gateway.error;

/**
 * Client exceeded the request budget of the current window (429).
 */
public class RateLimitException extends GatewayException {

    private final long retryAfterSeconds;

    public RateLimitException(long retryAfterSeconds) {
        super(429, "Too many requests", "Rate limit exceeded, retry in " + retryAfterSeconds + "s");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
