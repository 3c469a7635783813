package gamefleet.spoke.server;

import gamefleet.security.IdentityStore;
import gamefleet.security.SpokeIdentity;

import java.util.Optional;

/**
 * The agent's single identity. When the installer did not record the hub-assigned
 * spoke id, any claimed id is checked against the agent's key.
 */
public final class AgentIdentity implements IdentityStore {

    private final String spokeId;
    private final String apiKeyHash;
    private final String hubIp;

    public AgentIdentity(String spokeId, String apiKeyHash, String hubIp) {
        this.spokeId = spokeId;
        this.apiKeyHash = apiKeyHash;
        this.hubIp = hubIp;
    }

    @Override
    public Optional<SpokeIdentity> findIdentity(String claimed) {
        if (claimed == null || (spokeId != null && !spokeId.equals(claimed))) {
            return Optional.empty();
        }
        return Optional.of(new SpokeIdentity(claimed, apiKeyHash, hubIp));
    }
}
