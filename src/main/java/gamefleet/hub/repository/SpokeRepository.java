package gamefleet.hub.repository;

import gamefleet.hub.model.Spoke;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for spoke persistence.
 */
public interface SpokeRepository {

    /**
     * Insert a new spoke or replace the stored row with the same id.
     *
     * @param spoke the spoke to save
     */
    void save(Spoke spoke);

    /**
     * Find a spoke by ID.
     *
     * @param spokeId the spoke ID
     * @return the spoke if found
     */
    Optional<Spoke> findById(String spokeId);

    /**
     * Get all spokes in registration order.
     *
     * @return list of all spokes
     */
    List<Spoke> findAll();

    /**
     * Delete a spoke.
     *
     * @param spokeId the spoke ID
     * @return true if deleted
     */
    boolean delete(String spokeId);

    /**
     * Next value for the registration-order sequence.
     */
    long nextRegistrationSeq();
}
