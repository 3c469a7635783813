package gamefleet.hub.dispatch;

import gamefleet.hub.model.CommandVerb;

/**
 * @param targetInstance LinuxGSM script name on the spoke, e.g. {@code csgoserver}
 * @param argument       action name for {@link CommandVerb#CUSTOM}, ignored otherwise
 */
public record DispatchRequest(String spokeId, CommandVerb verb, String targetInstance, String argument) {
}
