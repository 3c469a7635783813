package gamefleet.spoke.api;

import gamefleet.core.FleetException;
import gamefleet.http.Controller;
import gamefleet.http.PathPattern;
import gamefleet.http.RequestContext;
import gamefleet.protocol.CommandReport;
import gamefleet.protocol.CommandRequest;
import gamefleet.spoke.exec.CommandExecutor;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Command execution on behalf of the hub.
 *
 * Endpoints:
 * - POST /v1/commands      - start a command, 202 with its report
 * - GET  /v1/commands/{id} - current report
 */
public class CommandController implements Controller {

    static final String COMMANDS = "/v1/commands";
    static final PathPattern COMMAND = PathPattern.of("/v1/commands/{id}");

    private final CommandExecutor executor;

    public CommandController(CommandExecutor executor) {
        this.executor = executor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.POST) && COMMANDS.equals(path))
                || (method.equals(HttpMethod.GET) && COMMAND.matches(path));
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        if (request.method().equals(HttpMethod.POST)) {
            CommandReport report = executor.submit(request.body(CommandRequest.class));
            return ControllerResponse.accepted(report);
        }
        String commandId = COMMAND.variable(request.path(), "id");
        return executor.report(commandId)
                .map(ControllerResponse::json)
                .orElseThrow(() -> FleetException.notFound("command", commandId));
    }
}
