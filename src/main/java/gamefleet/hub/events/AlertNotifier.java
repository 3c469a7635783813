package gamefleet.hub.events;

import gamefleet.hub.model.TransitionEvent;

/**
 * Outward notification of a status transition. Best-effort: failures are logged, never thrown.
 */
public interface AlertNotifier extends TransitionListener {

    void notify(TransitionEvent event);

    @Override
    default void onTransition(TransitionEvent event) {
        notify(event);
    }
}
