package gamefleet.hub.repository;

import gamefleet.hub.model.DashboardUser;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for dashboard accounts.
 */
public interface UserRepository {

    void save(DashboardUser user);

    Optional<DashboardUser> findByUsername(String username);

    List<DashboardUser> findAll();

    boolean delete(String username);

    int count();
}
