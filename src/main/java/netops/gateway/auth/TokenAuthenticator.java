package netops.gateway.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Optional;

/**
 * Verifies {@code Authorization: Bearer <jwt>} headers (HMAC-SHA, shared secret).
 * <p>
 * Missing header: anonymous unless authentication is required (401). Present but invalid: 403.
 * The user id comes from the {@code id} claim, falling back to the subject.
 */
public class TokenAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

    private static final String BEARER = "Bearer ";

    private final SecretKey signingKey;
    private final boolean required;

    public TokenAuthenticator(GatewayConfig config) {
        this(config.hasJwtSecret() ? config.jwtSecret() : null, config.requireAuth());
    }

    public TokenAuthenticator(String secret, boolean required) {
        if (required && (secret == null || secret.isBlank())) {
            throw new IllegalArgumentException("Authentication is required but no JWT secret is configured");
        }
        this.signingKey = secret == null || secret.isBlank()
                ? null
                : Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.required = required;
    }

    public record AuthenticatedUser(String userId) {
    }

    /**
     * @param authorization raw {@code Authorization} header value, may be null
     * @return the caller, or empty for an anonymous request that is allowed through
     * @throws AuthException 401 when a token is required and missing, 403 when a token is invalid
     */
    public Optional<AuthenticatedUser> authenticate(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            if (required) {
                throw AuthException.missingToken();
            }
            return Optional.empty();
        }
        if (signingKey == null) {
            log.debug("Ignoring bearer token, no JWT secret configured");
            return Optional.empty();
        }
        if (!authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            throw AuthException.invalidToken("expected a Bearer token");
        }
        String token = authorization.substring(BEARER.length()).trim();
        if (token.isEmpty()) {
            throw AuthException.invalidToken("empty token");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw AuthException.invalidToken(e.getMessage());
        }

        Object id = claims.get("id");
        String userId = id != null ? String.valueOf(id) : claims.getSubject();
        return Optional.of(new AuthenticatedUser(userId));
    }

    /**
     * Sign a token for a user, for operators and tests sharing the secret.
     */
    public String issueToken(String userId, Duration ttl) {
        if (signingKey == null) {
            throw new IllegalStateException("No JWT secret configured");
        }
        Date now = new Date();
        return Jwts.builder()
                .subject(userId)
                .claim("id", userId)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + ttl.toMillis()))
                .signWith(signingKey)
                .compact();
    }

    public boolean required() {
        return required;
    }

    public boolean enabled() {
        return signingKey != null;
    }
}
