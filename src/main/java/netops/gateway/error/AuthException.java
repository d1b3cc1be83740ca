package netops.gateway.error;

/**
 * Missing (401) or invalid (403) bearer token on a protected route.
 */
public class AuthException extends GatewayException {

    private AuthException(int statusCode, String error, String detail) {
        super(statusCode, error, detail);
    }

    public static AuthException missingToken() {
        return new AuthException(401, "Unauthorized", "Authorization bearer token is required");
    }

    public static AuthException invalidToken(String reason) {
        return new AuthException(403, "Forbidden", "Invalid token: " + reason);
    }
}
