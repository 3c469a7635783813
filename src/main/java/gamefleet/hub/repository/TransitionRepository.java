package gamefleet.hub.repository;

import gamefleet.hub.model.TransitionEvent;

import java.util.List;

/**
 * Append-only history of spoke status transitions.
 */
public interface TransitionRepository {

    void append(TransitionEvent event);

    /**
     * Newest first.
     */
    List<TransitionEvent> findBySpoke(String spokeId, int limit);

    /**
     * Newest first, across the whole fleet.
     */
    List<TransitionEvent> findRecent(int limit);
}
