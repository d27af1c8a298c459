package com.dcruver.compass.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A record collection persisted as one JSON container file.
 *
 * Every read re-runs normalization and rewrites the container when a record changed
 * shape, so the file converges to the current schema. A container that fails to parse
 * is backed up byte-for-byte and replaced by an empty one.
 *
 * One lock per store serializes every read-migrate-rewrite and every save. The lock is
 * not held across calls: a caller that needs read-modify-write uses {@link #update}.
 *
 * @param <T> typed record
 */
@Slf4j
public abstract class RecordStore<T> {

    static final String CORRUPT_BACKUP_SUFFIX = ".backup.json";

    private final Lock lock = new ReentrantLock();

    protected final ContainerFile container;
    protected final JsonRecordCodec codec;

    protected RecordStore(ContainerFile container, JsonRecordCodec codec) {
        this.container = container;
        this.codec = codec;
    }

    /**
     * A read-modify-write step run under the collection lock. It receives the current,
     * mutable collection; the collection is saved only if the step returns normally.
     */
    @FunctionalInterface
    public interface Mutation<T, R> {
        R apply(List<T> records) throws IOException;
    }

    protected abstract Migration<T> migrate(Map<String, Object> raw);

    protected abstract String idOf(T record);

    /** Record kind used in messages, e.g. "problem". */
    protected abstract String kind();

    /** Called under the lock for every migrated record, before any rewrite. */
    protected void afterMigration(Migration<T> migration) throws IOException {
    }

    /** Called under the lock for a record removed by {@link #remove}. */
    protected void afterRemoval(T removed) throws IOException {
    }

    /** Keys computed on read that must never reach the container. */
    protected Set<String> derivedKeys() {
        return Set.of();
    }

    /** Attach derived values after the lock is released. */
    protected T decorate(T record) {
        return record;
    }

    public void initialize() throws IOException {
        container.ensureExists();
    }

    public Path getContainerPath() {
        return container.getPath();
    }

    public List<T> loadAll() throws IOException {
        List<T> records;
        lock.lock();
        try {
            records = readAndHeal();
        } finally {
            lock.unlock();
        }
        return decorateAll(records);
    }

    /**
     * Replace the whole collection. Derived keys are stripped before writing.
     */
    public void saveAll(List<T> records) throws IOException {
        lock.lock();
        try {
            writeAll(records);
        } finally {
            lock.unlock();
        }
    }

    public T findById(String id) throws IOException {
        return loadAll().stream()
            .filter(record -> id != null && id.equals(idOf(record)))
            .findFirst()
            .orElseThrow(() -> new RecordNotFoundException(kind(), id));
    }

    public <R> R update(Mutation<T, R> mutation) throws IOException {
        lock.lock();
        try {
            List<T> records = readAndHeal();
            R result = mutation.apply(records);
            writeAll(records);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public T remove(String id) throws IOException {
        return update(records -> {
            T removed = records.remove(indexOf(records, id));
            afterRemoval(removed);
            log.info("Deleted {} {}", kind(), id);
            return removed;
        });
    }

    /**
     * Position of the record with the given id, or {@link RecordNotFoundException}.
     */
    public int indexOf(List<T> records, String id) {
        for (int i = 0; i < records.size(); i++) {
            if (id != null && id.equals(idOf(records.get(i)))) {
                return i;
            }
        }
        throw new RecordNotFoundException(kind(), id);
    }

    public List<T> decorateAll(List<T> records) {
        List<T> decorated = new ArrayList<>(records.size());
        for (T record : records) {
            decorated.add(decorate(record));
        }
        return decorated;
    }

    public Map<String, Object> toRaw(T record) {
        Map<String, Object> raw = codec.toRaw(record);
        raw.keySet().removeAll(derivedKeys());
        return raw;
    }

    // Callers must hold the lock.
    protected List<T> readAndHeal() throws IOException {
        byte[] bytes = container.read();

        List<Map<String, Object>> raws;
        try {
            raws = codec.decode(bytes);
        } catch (CorruptContainerException e) {
            Path backup = container.backup(CORRUPT_BACKUP_SUFFIX, bytes);
            log.warn("Corrupt {} container {} ({}); original saved to {}, starting empty",
                kind(), container.getPath(), e.getMessage(), backup);
            writeAll(List.of());
            raws = List.of();
        }

        List<T> records = new ArrayList<>(raws.size());
        int changed = 0;
        for (Map<String, Object> raw : raws) {
            Migration<T> migration = migrate(raw);
            afterMigration(migration);
            if (migration.isChanged() || !raw.equals(toRaw(migration.getRecord()))) {
                changed++;
            }
            records.add(migration.getRecord());
        }

        if (changed > 0) {
            writeAll(records);
            log.info("Normalized {} {} record(s); rewrote {}", changed, kind(), container.getPath());
        }
        return records;
    }

    // Callers must hold the lock.
    protected void writeAll(List<T> records) throws IOException {
        List<Map<String, Object>> raws = new ArrayList<>(records.size());
        for (T record : records) {
            raws.add(toRaw(record));
        }
        container.writeAtomically(codec.encode(raws));
        log.debug("Saved {} {} record(s) to {}", raws.size(), kind(), container.getPath());
    }

    protected <R> R locked(Mutation<T, R> readOnly) throws IOException {
        lock.lock();
        try {
            return readOnly.apply(readAndHeal());
        } finally {
            lock.unlock();
        }
    }
}
