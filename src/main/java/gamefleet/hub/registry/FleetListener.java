package gamefleet.hub.registry;

import gamefleet.hub.model.Spoke;

/**
 * Callbacks for registry membership changes.
 * Invoked on the registering/removing thread after the change is persisted.
 */
public interface FleetListener {

    default void onRegistered(Spoke spoke) {
    }

    void onRemoved(Spoke spoke);
}
