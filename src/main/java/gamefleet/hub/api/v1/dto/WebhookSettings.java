package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET/PUT /api/v1/settings/webhook. A null url means alerts are disabled.
 */
public record WebhookSettings(@JsonProperty("url") String url) {
}
