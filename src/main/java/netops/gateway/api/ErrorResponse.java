package netops.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.error.GatewayException;

/**
 * Error body used by every endpoint and by the proxy.
 */
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("detail") String detail,
        @JsonProperty("status_code") int statusCode) {

    public static ErrorResponse of(GatewayException e) {
        return new ErrorResponse(e.error(), e.detail(), e.statusCode());
    }
}
