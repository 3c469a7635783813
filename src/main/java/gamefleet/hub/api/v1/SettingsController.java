package gamefleet.hub.api.v1;

import gamefleet.http.Controller;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.WebhookSettings;
import gamefleet.hub.service.SettingsService;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import gamefleet.security.SecurityAudit;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Alert webhook setting.
 * GET /api/v1/settings/webhook - any role
 * PUT /api/v1/settings/webhook - ADMIN; an empty url disables alerts
 */
public class SettingsController implements Controller {

    private static final String PATH = "/api/v1/settings/webhook";

    private final SettingsService settings;
    private final SecurityAudit audit;

    public SettingsController(SettingsService settings, SecurityAudit audit) {
        this.settings = settings;
        this.audit = audit;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return PATH.equals(path) && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT));
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        if (request.method().equals(HttpMethod.PUT)) {
            Principal admin = request.requireRole(Role.ADMIN);
            WebhookSettings body = request.body(WebhookSettings.class);
            settings.setWebhookUrl(body.url());
            audit.adminAction(admin.name(), "set-webhook", body.url() == null || body.url().isBlank() ? "cleared" : "set");
        } else {
            request.requireRole(Role.VIEWER);
        }
        return ControllerResponse.json(new WebhookSettings(settings.webhookUrl().orElse(null)));
    }
}
