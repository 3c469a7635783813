package gamefleet.hub.repository;

import java.util.Optional;

/**
 * Key/value store for operator-editable settings.
 */
public interface SettingsRepository {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
