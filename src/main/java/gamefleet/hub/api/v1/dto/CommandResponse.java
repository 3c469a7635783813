package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.model.Command;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResponse(
        @JsonProperty("commandId") String commandId,
        @JsonProperty("spokeId") String spokeId,
        @JsonProperty("verb") String verb,
        @JsonProperty("targetInstance") String targetInstance,
        @JsonProperty("argument") String argument,
        @JsonProperty("issuedBy") String issuedBy,
        @JsonProperty("issuedAt") Instant issuedAt,
        @JsonProperty("state") String state,
        @JsonProperty("resultDetail") String resultDetail,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static CommandResponse from(Command command) {
        return new CommandResponse(
                command.id(),
                command.spokeId(),
                command.verb().name(),
                command.targetInstance(),
                command.argument(),
                command.issuedBy(),
                command.issuedAt(),
                command.state().name(),
                command.resultDetail(),
                command.updatedAt());
    }
}
