package miniredis.datastore;

import com.google.common.base.Preconditions;
import miniredis.error.StoreLockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Key-value map shared by every connection. A single lock guards the whole map, so each
 * operation is atomic with respect to all others and readers never see a half-applied write.
 * Reads and writes are serialized alike.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final Map<String, String> store;
    private final ReentrantLock lock;

    public InMemoryKeyValueStore() {
        this.store = new HashMap<>();
        this.lock = new ReentrantLock();
    }

    @Override
    public Optional<String> get(String key) throws StoreLockedException {
        Preconditions.checkNotNull(key, "key");
        acquire();
        try {
            return Optional.ofNullable(store.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value) throws StoreLockedException {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        acquire();
        try {
            store.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) throws StoreLockedException {
        Preconditions.checkNotNull(key, "key");
        acquire();
        try {
            store.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() throws StoreLockedException {
        acquire();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    // waits as long as it takes; only an interrupt gives up
    private void acquire() throws StoreLockedException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the store lock");
            throw new StoreLockedException(e);
        }
    }
}
