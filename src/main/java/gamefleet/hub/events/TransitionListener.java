package gamefleet.hub.events;

import gamefleet.hub.model.TransitionEvent;

/**
 * Consumer of spoke status transitions. Runs on the event bus thread.
 */
@FunctionalInterface
public interface TransitionListener {

    void onTransition(TransitionEvent event);
}
