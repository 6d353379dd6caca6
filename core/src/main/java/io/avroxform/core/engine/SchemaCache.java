package io.avroxform.core.engine;

import io.avroxform.core.spi.SchemaRegistryClient;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through cache from schema id to schema text, backed by a {@link SchemaRegistryClient}.
 *
 * <p>
 * Entries are never evicted: the text registered under an id never changes. Concurrent misses on
 * the same id may each call the registry; every writer stores the same text, so the last write
 * wins harmlessly. Failed fetches are not cached.
 *
 * <p>
 * Thread-safe.
 */
public final class SchemaCache {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCache.class);

    private final SchemaRegistryClient registryClient;
    private final Map<Integer, String> schemas = new ConcurrentHashMap<>();

    public SchemaCache(SchemaRegistryClient registryClient) {
        this.registryClient = Objects.requireNonNull(registryClient, "registryClient must not be null");
    }

    /**
     * Returns the schema text for {@code schemaId}, fetching it on a miss.
     *
     * @throws io.avroxform.core.error.RegistryException if the fetch fails
     */
    public String resolve(int schemaId) {
        return lookup(schemaId).schemaText();
    }

    /** Like {@link #resolve(int)} but also reports whether the cache answered. */
    Lookup lookup(int schemaId) {
        String cached = schemas.get(schemaId);
        if (cached != null) {
            return new Lookup(cached, true);
        }
        LOG.debug("Schema cache miss: schema_id={}", schemaId);
        String fetched = registryClient.fetchSchema(schemaId);
        schemas.put(schemaId, fetched);
        return new Lookup(fetched, false);
    }

    /** Returns {@code true} if the id has been resolved before. */
    public boolean contains(int schemaId) {
        return schemas.containsKey(schemaId);
    }

    public int size() {
        return schemas.size();
    }

    record Lookup(String schemaText, boolean cacheHit) {}
}
