package netops.gateway.error;

/**
 * Base of the gateway's error taxonomy. Carries the HTTP status and short error code
 * used when the error crosses the request boundary.
 */
public abstract class GatewayException extends RuntimeException {

    private final int statusCode;
    private final String error;

    protected GatewayException(int statusCode, String error, String detail) {
        super(detail);
        this.statusCode = statusCode;
        this.error = error;
    }

    protected GatewayException(int statusCode, String error, String detail, Throwable cause) {
        super(detail, cause);
        this.statusCode = statusCode;
        this.error = error;
    }

    public int statusCode() {
        return statusCode;
    }

    /** Short error code, e.g. "Task not found" */
    public String error() {
        return error;
    }

    public String detail() {
        return getMessage();
    }
}
