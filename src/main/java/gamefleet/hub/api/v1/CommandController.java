package gamefleet.hub.api.v1;

import gamefleet.http.Controller;
import gamefleet.http.PathPattern;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.CommandResponse;
import gamefleet.hub.api.v1.dto.DispatchCommandRequest;
import gamefleet.hub.dispatch.CommandDispatcher;
import gamefleet.hub.dispatch.DispatchRequest;
import gamefleet.hub.model.Command;
import gamefleet.hub.model.CommandVerb;
import gamefleet.security.Role;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;

/**
 * Command dispatch and history.
 * POST /api/v1/spokes/{id}/commands  - issue a command, 202 with the QUEUED command
 * GET  /api/v1/spokes/{id}/commands  - command history, newest first
 * GET  /api/v1/commands/{commandId}  - one command
 */
public class CommandController implements Controller {

    static final PathPattern SPOKE_COMMANDS = PathPattern.of("/api/v1/spokes/{id}/commands");
    static final PathPattern COMMAND = PathPattern.of("/api/v1/commands/{commandId}");

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final CommandDispatcher dispatcher;

    public CommandController(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SPOKE_COMMANDS.matches(path);
        }
        return method.equals(HttpMethod.GET) && (SPOKE_COMMANDS.matches(path) || COMMAND.matches(path));
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        String path = request.path();
        if (COMMAND.matches(path)) {
            request.requireRole(Role.VIEWER);
            return ControllerResponse.json(CommandResponse.from(dispatcher.get(COMMAND.variable(path, "commandId"))));
        }

        String spokeId = SPOKE_COMMANDS.variable(path, "id");
        if (request.method().equals(HttpMethod.GET)) {
            request.requireRole(Role.VIEWER);
            int limit = request.intQuery("limit", DEFAULT_LIMIT, MAX_LIMIT);
            return ControllerResponse.json(Map.of("commands",
                    dispatcher.history(spokeId, limit).stream().map(CommandResponse::from).toList()));
        }

        request.requireRole(Role.VIEWER);
        DispatchCommandRequest body = request.body(DispatchCommandRequest.class);
        DispatchRequest dispatch = new DispatchRequest(spokeId, CommandVerb.parse(body.verb()),
                body.targetInstance(), body.argument());
        Command command = dispatcher.dispatch(dispatch, request.principal());
        return ControllerResponse.accepted(CommandResponse.from(command));
    }
}
