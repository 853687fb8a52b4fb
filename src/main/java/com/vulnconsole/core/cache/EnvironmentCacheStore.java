package com.vulnconsole.core.cache;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vulnconsole.core.ConsoleProperties;
import com.vulnconsole.core.model.CatalogSnapshot;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Durable single-file store for the {@link CatalogSnapshot}.
 * <p>
 * The file is JSON with {@code format_version} as its first field. Writes go to a
 * sibling temporary file which is forced to disk and renamed over the destination,
 * so a reader only ever sees a complete snapshot. Reads take no lock.
 * <p>
 * {@link #load()} never throws: a missing, unreadable, unparseable, version-mismatched
 * or foreign-root file is reported as empty and the caller performs a cold start.
 * <p>
 * {@link #patch} is a read-modify-write of the whole file under an in-process lock.
 * It re-reads the file each time, so concurrent patches for different ids keep
 * each other's updates.
 * <p>
 * A rescan reads the runtime before it saves, so a patch can land in between.
 * {@link #saveScan} carries the runtime state of every id patched after
 * {@link #patchMark()} into the scanned snapshot instead of overwriting it.
 */
@Component
public class EnvironmentCacheStore {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentCacheStore.class);

    private static final String VERSION_FIELD = "format_version";

    private final Path cacheFile;
    private final String catalogRoot;
    private final ObjectMapper mapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    /** Incremented by every applied patch; ids map to the value of their last patch. */
    private final AtomicLong patchSequence = new AtomicLong();
    private final Map<String, Long> lastPatch = new ConcurrentHashMap<>();

    @Autowired
    public EnvironmentCacheStore(ConsoleProperties properties) {
        this(properties.getCacheFile(), properties.getCatalogRoot().toString());
    }

    public EnvironmentCacheStore(Path cacheFile, String catalogRoot) {
        this.cacheFile = cacheFile;
        this.catalogRoot = catalogRoot;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Reads the snapshot from disk.
     *
     * @return the snapshot, or empty when the store is cold
     */
    public Optional<CatalogSnapshot> load() {
        if (!Files.isRegularFile(cacheFile)) {
            log.debug("No cache file at {}", cacheFile);
            return Optional.empty();
        }
        try {
            int version = readFormatVersion();
            if (version != CatalogSnapshot.CURRENT_FORMAT_VERSION) {
                log.info("Cache format version {} does not match {}, ignoring cache",
                        version, CatalogSnapshot.CURRENT_FORMAT_VERSION);
                return Optional.empty();
            }
            CatalogSnapshot snapshot = mapper.readValue(cacheFile.toFile(), CatalogSnapshot.class);
            if (catalogRoot != null && !catalogRoot.equals(snapshot.catalogRoot())) {
                log.info("Cache was built for catalog {}, current catalog is {}, ignoring cache",
                        snapshot.catalogRoot(), catalogRoot);
                return Optional.empty();
            }
            return Optional.of(snapshot);
        } catch (IOException | RuntimeException e) {
            log.warn("Cache file {} is corrupt, treating as cold start: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Atomically replaces the stored snapshot.
     *
     * @throws UncheckedIOException if the snapshot cannot be written
     */
    public void save(CatalogSnapshot snapshot) {
        writeLock.lock();
        try {
            writeAtomically(snapshot);
            log.debug("Saved {} environments to {}", snapshot.environments().size(), cacheFile);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Current patch sequence. Pass it to {@link #saveScan} to keep patches applied
     * after this point.
     */
    public long patchMark() {
        return patchSequence.get();
    }

    /**
     * Saves a freshly scanned snapshot, keeping the runtime state of descriptors
     * patched after {@code mark}.
     *
     * @return the snapshot as saved
     * @throws UncheckedIOException if the snapshot cannot be written
     */
    public CatalogSnapshot saveScan(CatalogSnapshot scanned, long mark) {
        writeLock.lock();
        try {
            CatalogSnapshot merged = scanned;
            if (patchSequence.get() > mark) {
                Optional<CatalogSnapshot> current = load();
                for (Map.Entry<String, Long> patched : lastPatch.entrySet()) {
                    if (patched.getValue() <= mark || current.isEmpty()) {
                        continue;
                    }
                    Optional<EnvironmentDescriptor> kept = current.get().find(patched.getKey());
                    if (kept.isPresent()) {
                        log.debug("Keeping runtime state of {} patched during rescan", patched.getKey());
                        merged = merged.replacing(patched.getKey(), d -> d.withRuntimeStateOf(kept.get()));
                    }
                }
            }
            writeAtomically(merged);
            log.debug("Saved {} scanned environments to {}", merged.environments().size(), cacheFile);
            return merged;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Applies {@code mutator} to one descriptor of the on-disk snapshot and saves it.
     *
     * @param id      environment id
     * @param mutator returns the updated descriptor; must keep the id
     * @return the updated descriptor, or empty if the store is cold or has no such id
     */
    public Optional<EnvironmentDescriptor> patch(String id, UnaryOperator<EnvironmentDescriptor> mutator) {
        writeLock.lock();
        try {
            Optional<CatalogSnapshot> current = load();
            if (current.isEmpty()) {
                log.debug("Patch for {} skipped: cache is cold", id);
                return Optional.empty();
            }
            if (current.get().find(id).isEmpty()) {
                log.debug("Patch for {} skipped: not in cache", id);
                return Optional.empty();
            }
            CatalogSnapshot updated = current.get().replacing(id, mutator);
            writeAtomically(updated);
            lastPatch.put(id, patchSequence.incrementAndGet());
            return updated.find(id);
        } finally {
            writeLock.unlock();
        }
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    private int readFormatVersion() throws IOException {
        try (JsonParser parser = mapper.getFactory().createParser(cacheFile.toFile())) {
            if (parser.nextToken() != JsonToken.START_OBJECT
                    || parser.nextToken() != JsonToken.FIELD_NAME
                    || !VERSION_FIELD.equals(parser.currentName())
                    || parser.nextToken() != JsonToken.VALUE_NUMBER_INT) {
                throw new IOException("'" + VERSION_FIELD + "' is not the first field");
            }
            return parser.getIntValue();
        }
    }

    private void writeAtomically(CatalogSnapshot snapshot) {
        Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ByteBuffer buffer = ByteBuffer.wrap(mapper.writeValueAsBytes(snapshot));
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", cacheFile);
                Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write cache file " + cacheFile, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not delete temporary cache file {}: {}", tmp, e.getMessage());
        }
    }
}
