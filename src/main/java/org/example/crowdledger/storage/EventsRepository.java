package org.example.crowdledger.storage;

import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.example.crowdledger.model.EventLog;
import org.example.crowdledger.model.EventType;

/**
 * Repository for persisting and retrieving {@link EventLog} entries.
 *
 * <p>Keeps an in-memory cache of events, initialized from disk on construction, and stores it as
 * JSON ({@link DataPaths#EVENTS_FILE} inside the data directory). Every append is flushed immediately.
 *
 * <h2>Thread-safety</h2>
 * <ul>
 *   <li>{@link #add(EventLog)} and {@link #flush()} are synchronized.
 *   <li>Read methods return defensive copies of the cache.
 * </ul>
 *
 * <h2>Error handling</h2>
 * I/O failures during {@link #flush()} are logged to {@code System.err}; the method does not throw
 * so that a committed workflow is never reported as failed because of the log.
 */
public class EventsRepository {

    private static final Type LIST_TYPE = new TypeToken<List<EventLog>>() {}.getType();

    private final Path file;

    private final List<EventLog> cache;

    /**
     * Repository backed by {@code file}. A missing or unreadable file starts an empty log.
     *
     * @param file JSON file holding the event list
     */
    public EventsRepository(Path file) {
        this.file = file;
        List<EventLog> loaded = JsonRepository.<List<EventLog>>read(file, LIST_TYPE).orElse(null);
        this.cache = (loaded != null) ? new ArrayList<>(loaded) : new ArrayList<>();
    }

    /**
     * Appends a single event and persists the change immediately.
     *
     * @param e the event to add; must not be {@code null}
     */
    public synchronized void add(EventLog e) {
        cache.add(e);
        flush();
    }

    /** Snapshot of all events in insertion order. */
    public synchronized List<EventLog> list() {
        return new ArrayList<>(cache);
    }

    /**
     * Events whose {@code account} equals the given principal, in insertion order.
     *
     * @param account principal used to filter events
     * @return new list
     */
    public synchronized List<EventLog> listByAccount(String account) {
        List<EventLog> out = new ArrayList<>();
        for (EventLog e : cache) if (account.equals(e.account)) out.add(e);
        return out;
    }

    /**
     * Events of one type, in insertion order.
     *
     * @param type event type
     * @return new list
     */
    public synchronized List<EventLog> listByType(EventType type) {
        List<EventLog> out = new ArrayList<>();
        for (EventLog e : cache) if (e.type == type) out.add(e);
        return out;
    }

    /** Persists the cache. I/O errors are reported to {@code System.err} without throwing. */
    public synchronized void flush() {
        try {
            JsonRepository.writeAtomic(file, cache);
        } catch (Exception ex) {
            System.err.println("Failed to write " + file.getFileName() + ": " + ex.getMessage());
        }
    }
}
