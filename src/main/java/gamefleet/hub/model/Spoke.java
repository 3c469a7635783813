package gamefleet.hub.model;

import gamefleet.security.SpokeIdentity;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a managed spoke host.
 */
public final class Spoke {
    private final String id;
    private final String name;
    private final String address;
    private final String apiKeyHash;
    private final String allowedSourceIp;
    private final SpokeStatus status;
    private final Instant lastSeen;
    private final int consecutiveFailures;
    private final Instant registeredAt;
    private final long registrationSeq;
    private final SpokeMetrics lastMetrics;

    private Spoke(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.address = Objects.requireNonNull(builder.address, "address is required");
        this.apiKeyHash = Objects.requireNonNull(builder.apiKeyHash, "apiKeyHash is required");
        this.allowedSourceIp = builder.allowedSourceIp;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastSeen = builder.lastSeen;
        this.consecutiveFailures = builder.consecutiveFailures;
        this.registeredAt = builder.registeredAt;
        this.registrationSeq = builder.registrationSeq;
        this.lastMetrics = builder.lastMetrics;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String address() {
        return address;
    }

    public String apiKeyHash() {
        return apiKeyHash;
    }

    public String allowedSourceIp() {
        return allowedSourceIp;
    }

    public SpokeStatus status() {
        return status;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public long registrationSeq() {
        return registrationSeq;
    }

    public SpokeMetrics lastMetrics() {
        return lastMetrics;
    }

    /** Base URL of the agent, {@code http://} assumed when the address has no scheme. */
    public String baseUrl() {
        String trimmed = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "http://" + trimmed;
    }

    public SpokeIdentity identity() {
        return new SpokeIdentity(id, apiKeyHash, allowedSourceIp);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .address(address)
                .apiKeyHash(apiKeyHash)
                .allowedSourceIp(allowedSourceIp)
                .status(status)
                .lastSeen(lastSeen)
                .consecutiveFailures(consecutiveFailures)
                .registeredAt(registeredAt)
                .registrationSeq(registrationSeq)
                .lastMetrics(lastMetrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String address;
        private String apiKeyHash;
        private String allowedSourceIp;
        private SpokeStatus status = SpokeStatus.PENDING;
        private Instant lastSeen;
        private int consecutiveFailures;
        private Instant registeredAt;
        private long registrationSeq;
        private SpokeMetrics lastMetrics;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder apiKeyHash(String apiKeyHash) {
            this.apiKeyHash = apiKeyHash;
            return this;
        }

        public Builder allowedSourceIp(String allowedSourceIp) {
            this.allowedSourceIp = allowedSourceIp;
            return this;
        }

        public Builder status(SpokeStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder registrationSeq(long registrationSeq) {
            this.registrationSeq = registrationSeq;
            return this;
        }

        public Builder lastMetrics(SpokeMetrics lastMetrics) {
            this.lastMetrics = lastMetrics;
            return this;
        }

        public Spoke build() {
            return new Spoke(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Spoke spoke))
            return false;
        return Objects.equals(id, spoke.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Spoke{id='" + id + "', name='" + name + "', address='" + address + "', status=" + status + "}";
    }
}
