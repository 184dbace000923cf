package miniredis.datastore;

import miniredis.error.StoreLockedException;

import java.util.Optional;

public interface KeyValueStore {

    Optional<String> get(String key) throws StoreLockedException;       // Current value, empty if absent
    void set(String key, String value) throws StoreLockedException;      // Insert or overwrite
    void delete(String key) throws StoreLockedException;                 // No-op if absent
    int size() throws StoreLockedException;

}
