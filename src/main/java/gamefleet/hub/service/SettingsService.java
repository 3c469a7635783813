package gamefleet.hub.service;

import gamefleet.core.FleetException;
import gamefleet.hub.repository.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;

/**
 * Operator-editable hub settings.
 */
public final class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    static final String WEBHOOK_KEY = "discord_webhook";

    private final SettingsRepository repository;

    public SettingsService(SettingsRepository repository) {
        this.repository = repository;
    }

    public Optional<String> webhookUrl() {
        return repository.get(WEBHOOK_KEY).filter(v -> !v.isBlank());
    }

    /**
     * Set the alert webhook; a null or blank URL disables alerts.
     *
     * @throws FleetException INVALID_REQUEST when the URL is not absolute http(s)
     */
    public void setWebhookUrl(String url) {
        if (url == null || url.isBlank()) {
            repository.remove(WEBHOOK_KEY);
            log.info("Alert webhook cleared");
            return;
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw FleetException.invalid("webhook URL is malformed");
        }
        String scheme = uri.getScheme();
        if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw FleetException.invalid("webhook URL must be an absolute http(s) URL");
        }
        repository.put(WEBHOOK_KEY, trimmed);
        log.info("Alert webhook set to host {}", uri.getHost());
    }
}
