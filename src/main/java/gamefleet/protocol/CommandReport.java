package gamefleet.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution state of a command on a spoke.
 *
 * @param state    RUNNING, SUCCEEDED or FAILED
 * @param exitCode null while running
 * @param output   tail of the combined process output
 */
public record CommandReport(
        @JsonProperty("commandId") String commandId,
        @JsonProperty("state") String state,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("output") String output) {

    public static final String RUNNING = "RUNNING";
    public static final String SUCCEEDED = "SUCCEEDED";
    public static final String FAILED = "FAILED";

    @JsonIgnore
    public boolean isFinished() {
        return SUCCEEDED.equals(state) || FAILED.equals(state);
    }
}
