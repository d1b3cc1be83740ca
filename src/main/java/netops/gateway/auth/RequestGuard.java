package netops.gateway.auth;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import netops.gateway.auth.TokenAuthenticator.AuthenticatedUser;
import netops.gateway.error.RateLimitException;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * Admission checks shared by the proxy and the API router: per-IP rate limit, then bearer token.
 */
public class RequestGuard {

    private final RateLimiter rateLimiter;
    private final TokenAuthenticator authenticator;

    public RequestGuard(RateLimiter rateLimiter, TokenAuthenticator authenticator) {
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
    }

    /**
     * @throws RateLimitException when the client's window is exhausted
     */
    public void checkRate(String clientIp) {
        RateLimiter.Decision decision = rateLimiter.tryAcquire(clientIp);
        if (!decision.allowed()) {
            throw new RateLimitException(decision.retryAfterSeconds());
        }
    }

    /**
     * Rate limit, then authenticate.
     *
     * @return the caller when a valid token was presented
     */
    public Optional<AuthenticatedUser> admit(String clientIp, HttpHeaders headers) {
        checkRate(clientIp);
        return authenticator.authenticate(headers.get(HttpHeaderNames.AUTHORIZATION));
    }

    public TokenAuthenticator authenticator() {
        return authenticator;
    }

    public static String clientIp(Channel channel) {
        SocketAddress address = channel.remoteAddress();
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(address);
    }
}
