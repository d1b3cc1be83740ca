package netops.gateway.error;

/**
 * Malformed request, unknown task type or payload that fails its type's shape check.
 * Rejected at the boundary; never enqueued and never retried.
 */
public class ValidationException extends GatewayException {

    public ValidationException(String error, String detail) {
        super(400, error, detail);
    }

    public ValidationException(String detail) {
        this("Validation failed", detail);
    }
}
