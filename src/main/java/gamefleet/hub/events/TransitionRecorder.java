package gamefleet.hub.events;

import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.repository.TransitionRepository;

/**
 * Persists transitions for the dashboard history views.
 */
public final class TransitionRecorder implements TransitionListener {

    private final TransitionRepository repository;

    public TransitionRecorder(TransitionRepository repository) {
        this.repository = repository;
    }

    @Override
    public void onTransition(TransitionEvent event) {
        repository.append(event);
    }
}
