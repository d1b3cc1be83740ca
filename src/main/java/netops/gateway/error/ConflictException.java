package netops.gateway.error;

/**
 * Request clashes with existing state (409).
 */
public class ConflictException extends GatewayException {

    public ConflictException(String error, String detail) {
        super(409, error, detail);
    }
}
