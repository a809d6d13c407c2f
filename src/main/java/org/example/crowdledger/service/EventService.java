package org.example.crowdledger.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.example.crowdledger.model.ContentId;
import org.example.crowdledger.model.Digest;
import org.example.crowdledger.model.EventLog;
import org.example.crowdledger.model.EventType;
import org.example.crowdledger.storage.EventsRepository;

/**
 * Records and reads the events emitted by committed workflows.
 *
 * <p>When the service is <em>disabled</em> all writers are no-ops and all readers return empty
 * lists, so the platform can emit unconditionally.
 *
 * <p>One emitter exists per {@link EventType}; each fills the fields that event carries and
 * delegates to {@link #log(EventLog)}. {@link PlatformService} only calls the emitters after a
 * workflow has committed.
 *
 * <p>Read helpers:
 * <ul>
 *   <li>{@link #listByAccount(String)} – all events for one principal (in log order)</li>
 *   <li>{@link #listByType(EventType)} – all events of one type (in log order)</li>
 *   <li>{@link #recentByAccount(String, int)} – newest first, limited</li>
 *   <li>{@link #recentGlobal(int)} – newest first across all principals</li>
 * </ul>
 */
public class EventService {
    private boolean enabled;

    /** Backing repository; {@code null} when the service was created disabled. */
    private final EventsRepository repo;

    private final Clock clock;

    /**
     * @param repo backing repository, or {@code null} for a permanently disabled service
     * @param clock time source for event timestamps
     */
    public EventService(EventsRepository repo, Clock clock) {
        this.repo = repo;
        this.enabled = repo != null;
        this.clock = clock;
    }

    /**
     * Toggles logging. A service created disabled has no repository and stays silent even when
     * re-enabled.
     *
     * @param enabled {@code true} to enable logging and reads
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled && repo != null;
    }

    // ---------- Emitters ----------

    public void uploaded(String creator, ContentId id) {
        EventLog e = base(EventType.UPLOADED, creator, id);
        e.message = "UPLOAD " + id;
        log(e);
    }

    public void liked(String voter, ContentId id) {
        EventLog e = base(EventType.LIKED, voter, id);
        e.message = "LIKE " + id;
        log(e);
    }

    public void disliked(String voter, ContentId id) {
        EventLog e = base(EventType.DISLIKED, voter, id);
        e.message = "DISLIKE " + id;
        log(e);
    }

    /**
     * @param owner account the reward was minted to
     * @param id harvested content
     * @param amount minted base units
     */
    public void harvested(String owner, ContentId id, BigInteger amount) {
        EventLog e = base(EventType.HARVESTED, owner, id);
        e.amount = amount;
        e.message = "HARVEST " + id + " +" + amount;
        log(e);
    }

    /**
     * @param owner former owner of the removed content
     * @param id removed content
     * @param contentHash content hash before removal
     * @param metadataHash metadata hash before removal
     */
    public void deleted(String owner, ContentId id, Digest contentHash, Digest metadataHash) {
        EventLog e = base(EventType.DELETED, owner, id);
        e.contentHash = contentHash;
        e.metadataHash = metadataHash;
        e.message = "DELETE " + id + " (crowd disapproval)";
        log(e);
    }

    public void replied(String replier, ContentId replyId, ContentId targetId) {
        EventLog e = base(EventType.REPLIED, replier, replyId);
        e.targetType = targetId.type();
        e.targetIndex = targetId.index();
        e.message = "REPLY " + replyId + " -> " + targetId;
        log(e);
    }

    private EventLog base(EventType type, String account, ContentId id) {
        EventLog e = new EventLog();
        e.ts = LocalDateTime.now(clock);
        e.type = type;
        e.account = account;
        e.contentType = id.type();
        e.contentIndex = id.index();
        return e;
    }

    private void log(EventLog e) {
        if (!isEnabled()) return;
        repo.add(e);
    }

    // ---------- Readers ----------

    public List<EventLog> listByAccount(String account) {
        if (!isEnabled()) return List.of();
        return repo.listByAccount(account);
    }

    public List<EventLog> listByType(EventType type) {
        if (!isEnabled()) return List.of();
        return repo.listByType(type);
    }

    /**
     * Most recent events of one principal, newest first.
     *
     * @param account principal
     * @param limit maximum number of events; values &lt;= 0 give an empty list
     * @return newest-first list
     */
    public List<EventLog> recentByAccount(String account, int limit) {
        if (!isEnabled() || limit <= 0) return List.of();
        return newestFirst(repo.listByAccount(account), limit);
    }

    /**
     * Most recent events across all principals, newest first. {@code limit} is clamped to at
     * least 1.
     *
     * @param limit maximum number of events
     * @return newest-first list
     */
    public List<EventLog> recentGlobal(int limit) {
        if (!isEnabled()) return List.of();
        return newestFirst(repo.list(), Math.max(1, limit));
    }

    // Log order breaks timestamp ties, so equal timestamps still come out newest first.
    private static List<EventLog> newestFirst(List<EventLog> list, int limit) {
        List<EventLog> reversed = new java.util.ArrayList<>(list);
        java.util.Collections.reverse(reversed);
        return reversed.stream()
                .sorted(Comparator.comparing((EventLog e) -> e.ts).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
