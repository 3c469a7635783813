package gamefleet.hub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a dispatched command.
 */
public final class Command {
    private final String id;
    private final String spokeId;
    private final CommandVerb verb;
    private final String targetInstance;
    private final String argument;
    private final String issuedBy;
    private final Instant issuedAt;
    private final CommandState state;
    private final String resultDetail;
    private final Instant updatedAt;

    private Command(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.spokeId = Objects.requireNonNull(builder.spokeId, "spokeId is required");
        this.verb = Objects.requireNonNull(builder.verb, "verb is required");
        this.targetInstance = Objects.requireNonNull(builder.targetInstance, "targetInstance is required");
        this.argument = builder.argument;
        this.issuedBy = builder.issuedBy;
        this.issuedAt = builder.issuedAt;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.resultDetail = builder.resultDetail;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String spokeId() {
        return spokeId;
    }

    public CommandVerb verb() {
        return verb;
    }

    public String targetInstance() {
        return targetInstance;
    }

    public String argument() {
        return argument;
    }

    public String issuedBy() {
        return issuedBy;
    }

    public Instant issuedAt() {
        return issuedAt;
    }

    public CommandState state() {
        return state;
    }

    public String resultDetail() {
        return resultDetail;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Action name passed to the LinuxGSM script on the spoke. */
    public String action() {
        return verb == CommandVerb.CUSTOM ? argument : verb.name().toLowerCase();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Copy in a later state; the caller checks {@link CommandState#canAdvanceTo}. */
    public Command advance(CommandState next, String detail, Instant at) {
        return toBuilder()
                .state(next)
                .resultDetail(detail != null ? detail : resultDetail)
                .updatedAt(at)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .spokeId(spokeId)
                .verb(verb)
                .targetInstance(targetInstance)
                .argument(argument)
                .issuedBy(issuedBy)
                .issuedAt(issuedAt)
                .state(state)
                .resultDetail(resultDetail)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String spokeId;
        private CommandVerb verb;
        private String targetInstance;
        private String argument;
        private String issuedBy;
        private Instant issuedAt;
        private CommandState state = CommandState.QUEUED;
        private String resultDetail;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder spokeId(String spokeId) {
            this.spokeId = spokeId;
            return this;
        }

        public Builder verb(CommandVerb verb) {
            this.verb = verb;
            return this;
        }

        public Builder targetInstance(String targetInstance) {
            this.targetInstance = targetInstance;
            return this;
        }

        public Builder argument(String argument) {
            this.argument = argument;
            return this;
        }

        public Builder issuedBy(String issuedBy) {
            this.issuedBy = issuedBy;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder state(CommandState state) {
            this.state = state;
            return this;
        }

        public Builder resultDetail(String resultDetail) {
            this.resultDetail = resultDetail;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Command build() {
            return new Command(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Command command))
            return false;
        return Objects.equals(id, command.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Command{id='" + id + "', spoke='" + spokeId + "', verb=" + verb
                + ", target='" + targetInstance + "', state=" + state + "}";
    }
}
