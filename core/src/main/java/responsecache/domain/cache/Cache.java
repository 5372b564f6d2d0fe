package responsecache.domain.cache;

import org.jspecify.annotations.Nullable;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.entry.CacheKey;
import responsecache.domain.exceptions.CacheConflict;
import responsecache.domain.exceptions.CacheFileNotFound;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.json.JsonCodec;
import responsecache.domain.persist.BackingStore;
import responsecache.domain.persist.InMemoryBackingStore;
import responsecache.domain.persist.SqliteBackingStore;
import responsecache.domain.persist.config.CacheDatabasePath;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A cache of model responses, keyed by a hash of the request that produced them.
 * <p>
 * The cache sits on top of a {@link BackingStore}, and tracks what happened during the current session: the
 * entries that were stored, and the entries that were served from the cache. When immediate writes are disabled,
 * stored entries are held back and only written to the backing store when the cache is closed. Closing the cache
 * also saves it to the file it was opened from, if any.
 * <p>
 * There are two ways to merge entries into a cache. {@link #addFromMap(Map, boolean)} refuses to replace an
 * existing entry with a different one, and is used when loading files or syncing with a remote cache.
 * {@link #union(Cache)} simply overwrites.
 * <p>
 * Caches are equal when they hold the same keys. The entries themselves are not compared, since the same key
 * should always mean the same response.
 */
public class Cache implements AutoCloseable {
    public static final String VERSION_KEY = "cache_version";
    public static final String CLASS_NAME_KEY = "class_name";
    private static final Set<String> STAMP_KEYS = Set.of(VERSION_KEY, CLASS_NAME_KEY, "edsl_version", "edsl_class_name");
    public static final String FORMAT_VERSION = "1.0";

    private static final Logger logger = Logger.getLogger(Cache.class.getName());

    private final BackingStore data;
    private final boolean immediateWrite;
    @Nullable
    private final Path filename;

    private final Map<String, CacheEntry> newEntries = new LinkedHashMap<>();
    private final Map<String, CacheEntry> fetchedData = new LinkedHashMap<>();
    private final Map<String, CacheEntry> pendingWrites = new LinkedHashMap<>();

    /**
     * An empty in-memory cache that writes immediately.
     */
    public Cache() {
        this(new InMemoryBackingStore(), true, null);
    }

    /**
     * A cache over an existing store. Every value in the store is read and checked up front.
     */
    public Cache(final BackingStore data) {
        this(checkValues(data), true, null);
    }

    Cache(final BackingStore data, final boolean immediateWrite, @Nullable final Path filename) {
        this.data = data;
        this.immediateWrite = immediateWrite;
        this.filename = filename;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A cache backed directly by a SQLite file. Writes go straight to the file.
     */
    public static Cache fromSqliteDb(final Path dbPath) {
        return builder().backingStore(new SqliteBackingStore(dbPath)).build();
    }

    /**
     * The cache stored at the configured default location.
     */
    public static Cache fromLocalCache(final CacheDatabasePath cacheDatabasePath) {
        return fromSqliteDb(cacheDatabasePath.getDatabasePath());
    }

    /**
     * Load a JSON lines file into a new cache.
     *
     * @param jsonlFile The file to load, which must exist
     * @param dbPath    A SQLite file to hold the loaded entries, or null to keep them in memory
     */
    public static Cache fromJsonl(final Path jsonlFile, @Nullable final Path dbPath) {
        if (!Files.exists(jsonlFile)) {
            throw new CacheFileNotFound("File " + jsonlFile + " not found");
        }

        final Cache cache = new Cache(dbPath == null ? new InMemoryBackingStore() : new SqliteBackingStore(dbPath));
        cache.addFromJsonl(jsonlFile, true);
        return cache;
    }

    /**
     * Rebuild a cache from the map produced by {@link #toMap()}. The version stamp is optional.
     */
    public static Cache fromMap(final Map<String, ?> map) {
        checkNotNull(map);

        final Map<String, CacheEntry> entries = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (STAMP_KEYS.contains(key)) {
                return;
            }

            if (!(value instanceof Map<?, ?> entryMap)) {
                throw new CacheValidationFailed("Value for key " + key + " is not a cache entry");
            }

            final Map<String, Object> fields = new LinkedHashMap<>();
            entryMap.forEach((field, fieldValue) -> fields.put(String.valueOf(field), fieldValue));
            entries.put(key, CacheEntry.fromMap(fields));
        });

        return builder().data(entries).build();
    }

    /**
     * Look up a response.
     *
     * @return The cached output, or null if there was a miss, along with the key the request hashes to
     */
    public CacheResult fetch(
            final String model,
            final Map<String, ?> parameters,
            final String systemPrompt,
            final String userPrompt,
            final int iteration) {
        final String key = CacheKey.generate(model, parameters, systemPrompt, userPrompt, iteration);
        final Optional<CacheEntry> entry = data.get(key);

        if (entry.isPresent()) {
            logger.fine("Cache hit for key " + key);
            fetchedData.put(key, entry.get());
            return new CacheResult(entry.get().output(), key);
        }

        logger.fine("Cache miss for key " + key);
        return new CacheResult(null, key);
    }

    /**
     * Save a response. The response is JSON encoded before it is saved.
     *
     * @return The key the entry was saved against
     */
    public String store(
            final String model,
            final Map<String, ?> parameters,
            final String systemPrompt,
            final String userPrompt,
            final Object response,
            final int iteration,
            @Nullable final String service) {
        final CacheEntry entry = CacheEntry.builder()
                .model(model)
                .parameters(parameters)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .output(JsonCodec.serialize(response))
                .iteration(iteration)
                .service(service)
                .build();

        final String key = entry.key();
        newEntries.put(key, entry);

        if (immediateWrite) {
            data.put(key, entry);
        } else {
            pendingWrites.put(key, entry);
        }

        return key;
    }

    public void addFromMap(final Map<String, ?> newData) {
        addFromMap(newData, true);
    }

    /**
     * The strict merge. Every value must be a cache entry, and a key that is already in the cache must map to an
     * equal entry. Nothing is merged if either check fails.
     *
     * @param newData  The entries to merge
     * @param writeNow true to write to the backing store now, false to buffer until the cache is closed
     */
    public void addFromMap(final Map<String, ?> newData, final boolean writeNow) {
        checkNotNull(newData);

        final Map<String, CacheEntry> entries = new LinkedHashMap<>();
        newData.forEach((key, value) -> {
            if (!(value instanceof CacheEntry entry)) {
                throw new CacheValidationFailed("Wrong type - the observed type is "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }

            data.get(key)
                    .filter(existing -> !existing.equals(entry))
                    .ifPresent(existing -> {
                        throw new CacheConflict("Mismatch in values for key " + key);
                    });

            entries.put(key, entry);
        });

        newEntries.putAll(entries);

        if (writeNow) {
            data.update(entries, true);
        } else {
            pendingWrites.putAll(entries);
        }
    }

    public void addFromJsonl(final Path jsonlFile, final boolean writeNow) {
        CacheFileFormat.JSONL.persistence().load(this, jsonlFile, writeNow);
    }

    public void addFromSqlite(final Path dbPath, final boolean writeNow) {
        CacheFileFormat.SQLITE.persistence().load(this, dbPath, writeNow);
    }

    public void writeJsonl(final Path jsonlFile) {
        CacheFileFormat.JSONL.persistence().save(this, jsonlFile);
    }

    public void writeSqliteDb(final Path dbPath) {
        CacheFileFormat.SQLITE.persistence().save(this, dbPath);
    }

    /**
     * Save the cache to the file it was opened from.
     */
    public void write() {
        if (filename == null) {
            throw new CacheValidationFailed("This cache was not opened from a file, so a filename must be supplied");
        }
        write(filename);
    }

    /**
     * Save the cache, picking the format from the file extension.
     */
    public void write(final Path file) {
        CacheFileFormat.fromPath(file).persistence().save(this, file);
    }

    /**
     * The entries whose keys are in this cache but not the other. Only keys are compared.
     */
    public Cache difference(final Cache other) {
        checkNotNull(other);

        final Set<String> otherKeys = new HashSet<>(other.keys());
        final Map<String, CacheEntry> diff = new LinkedHashMap<>();
        data.toMap().forEach((key, entry) -> {
            if (!otherKeys.contains(key)) {
                diff.put(key, entry);
            }
        });

        return builder().data(diff).immediateWrite(immediateWrite).build();
    }

    /**
     * Copy every entry of the other cache into this one, replacing entries with the same key.
     *
     * @return This cache
     */
    public Cache union(final Cache other) {
        checkNotNull(other);
        data.update(other.items(), true);
        return this;
    }

    /**
     * A new in-memory cache holding the entries with the given keys. Keys that are not in this cache are ignored.
     */
    public Cache subset(final Collection<String> keys) {
        final Map<String, CacheEntry> entries = new LinkedHashMap<>();
        keys.forEach(key -> data.get(key).ifPresent(entry -> entries.put(key, entry)));
        return builder().data(entries).build();
    }

    /**
     * A new in-memory cache holding everything that was stored or fetched during this session.
     */
    public Cache newEntriesCache() {
        final Map<String, CacheEntry> entries = new LinkedHashMap<>(newEntries);
        entries.putAll(fetchedData);
        return builder().data(entries).build();
    }

    public Map<String, Object> toMap() {
        return toMap(true);
    }

    public Map<String, Object> toMap(final boolean addVersion) {
        final Map<String, Object> map = new LinkedHashMap<>();
        data.toMap().forEach((key, entry) -> map.put(key, entry.toMap()));

        if (addVersion) {
            map.put(VERSION_KEY, FORMAT_VERSION);
            map.put(CLASS_NAME_KEY, Cache.class.getSimpleName());
        }

        return map;
    }

    public Optional<CacheEntry> get(final String key) {
        return data.get(key);
    }

    public boolean containsKey(final String key) {
        return data.containsKey(key);
    }

    public List<String> keys() {
        return data.keys();
    }

    public List<CacheEntry> values() {
        return data.values();
    }

    public Map<String, CacheEntry> items() {
        return data.toMap();
    }

    public int size() {
        return data.size();
    }

    public BackingStore getBackingStore() {
        return data;
    }

    public boolean isImmediateWrite() {
        return immediateWrite;
    }

    public Optional<Path> getFilename() {
        return Optional.ofNullable(filename);
    }

    public Map<String, CacheEntry> getNewEntries() {
        return Collections.unmodifiableMap(newEntries);
    }

    public Map<String, CacheEntry> getFetchedData() {
        return Collections.unmodifiableMap(fetchedData);
    }

    public Map<String, CacheEntry> getPendingWrites() {
        return Collections.unmodifiableMap(pendingWrites);
    }

    /**
     * Write any buffered entries to the backing store, then save the cache to its file if it was opened from one.
     */
    @Override
    public void close() {
        try {
            if (!pendingWrites.isEmpty()) {
                logger.fine("Flushing " + pendingWrites.size() + " buffered entries");
                data.update(pendingWrites, true);
                pendingWrites.clear();
            }
        } finally {
            if (filename != null) {
                write(filename);
            }
        }
    }

    private static BackingStore checkValues(final BackingStore store) {
        checkNotNull(store);
        // Reading the values of a SQLite store decodes every row, which rejects anything that isn't an entry
        if (store.values().stream().anyMatch(Objects::isNull)) {
            throw new CacheValidationFailed("Not all values are CacheEntry instances");
        }
        return store;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cache other)) {
            return false;
        }
        return new HashSet<>(keys()).equals(new HashSet<>(other.keys()));
    }

    @Override
    public int hashCode() {
        return new HashSet<>(keys()).hashCode();
    }

    @Override
    public String toString() {
        return "Cache(data=" + data + ", immediateWrite=" + immediateWrite + ")";
    }

    public static final class Builder {
        @Nullable
        private Path filename;
        @Nullable
        private BackingStore backingStore;
        @Nullable
        private Map<String, ?> entries;
        private boolean immediateWrite = true;

        private Builder() {
        }

        /**
         * Load the cache from a .jsonl or .db file, and save it back there when the cache is closed. A missing
         * file is created on close.
         */
        public Builder filename(final Path filename) {
            this.filename = filename;
            return this;
        }

        public Builder backingStore(final BackingStore backingStore) {
            this.backingStore = backingStore;
            return this;
        }

        /**
         * Initial entries, held in memory. Every value must be a cache entry.
         */
        public Builder data(final Map<String, ?> entries) {
            this.entries = entries;
            return this;
        }

        public Builder immediateWrite(final boolean immediateWrite) {
            this.immediateWrite = immediateWrite;
            return this;
        }

        public Cache build() {
            if (backingStore != null && entries != null) {
                throw new CacheValidationFailed("Cannot provide both a backing store and data");
            }

            if (filename != null && (backingStore != null || entries != null)) {
                throw new CacheValidationFailed("Cannot provide both filename and data");
            }

            if (filename != null) {
                return openFile(filename);
            }

            final BackingStore store = backingStore != null ? backingStore : toStore(entries);
            return new Cache(checkValues(store), immediateWrite, null);
        }

        private Cache openFile(final Path file) {
            final CacheFileFormat format = CacheFileFormat.fromPath(file);
            final Cache cache = new Cache(new InMemoryBackingStore(), immediateWrite, file);

            if (Files.exists(file)) {
                format.persistence().load(cache, file, true);
            } else {
                logger.info("File " + file + " not found, but will write to this location.");
            }

            return cache;
        }

        private static BackingStore toStore(@Nullable final Map<String, ?> entries) {
            final Map<String, CacheEntry> checked = new LinkedHashMap<>();
            if (entries != null) {
                entries.forEach((key, value) -> {
                    if (!(value instanceof CacheEntry entry)) {
                        throw new CacheValidationFailed("Not all values are CacheEntry instances (key " + key + ")");
                    }
                    checked.put(key, entry);
                });
            }
            return new InMemoryBackingStore(checked);
        }
    }
}
