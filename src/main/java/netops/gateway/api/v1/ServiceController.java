package netops.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import netops.gateway.api.Controller;
import netops.gateway.api.RequestBodies;
import netops.gateway.api.v1.dto.RegisterServiceRequest;
import netops.gateway.api.v1.dto.ServiceListResponse;
import netops.gateway.api.v1.dto.ServiceRegisteredResponse;
import netops.gateway.service.BackendRegistry;

/**
 * Backend registry endpoints:
 * - POST /api/v1/services - Register a backend reachable under /api/{name}/
 * - GET  /api/v1/services - Configured and registered backends
 */
public class ServiceController implements Controller {

    private static final String SERVICES = "/api/v1/services";

    private final BackendRegistry registry;

    public ServiceController(BackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return SERVICES.equals(path) && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.json(ServiceListResponse.of(registry.configured(), registry.registrations()));
        }
        RegisterServiceRequest request = RequestBodies.readJson(req, RegisterServiceRequest.class);
        BackendRegistry.Registration registration = registry.register(request.name(), request.url());
        return ControllerResponse.json(HttpResponseStatus.CREATED, ServiceRegisteredResponse.from(registration));
    }
}
