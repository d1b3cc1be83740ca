package netops.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import netops.gateway.api.Controller;
import netops.gateway.api.RequestBodies;
import netops.gateway.api.v1.dto.AlertAcceptedResponse;
import netops.gateway.api.v1.dto.AlertListResponse;
import netops.gateway.api.v1.dto.CreateAlertRequest;
import netops.gateway.service.AlertService;

/**
 * Alert endpoints:
 * - POST /api/v1/alerts - Record an alert (critical service_down starts remediation)
 * - GET  /api/v1/alerts - Recorded alerts, oldest first
 */
public class AlertController implements Controller {

    private static final String ALERTS = "/api/v1/alerts";

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return ALERTS.equals(path) && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.json(AlertListResponse.of(alertService.list()));
        }
        CreateAlertRequest request = RequestBodies.readJson(req, CreateAlertRequest.class);
        AlertService.Raised raised = alertService.raise(request.type(), request.severity(), request.service(),
                request.message());
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, AlertAcceptedResponse.from(raised));
    }
}
