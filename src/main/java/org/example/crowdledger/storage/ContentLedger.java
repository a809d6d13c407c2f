package org.example.crowdledger.storage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.example.crowdledger.model.ContentId;
import org.example.crowdledger.model.ContentRecord;
import org.example.crowdledger.model.ContentType;
import org.example.crowdledger.model.LedgerException;

/**
 * Type-partitioned, append-only content storage with a bidirectional reply graph.
 *
 * <p>There is one ordered collection per {@link ContentType}, selected by {@link
 * ContentType#ordinal()}. A record is addressed by its {@link ContentId}: {@code index <
 * collection.size()} is the only existence test, and an index outside that bound fails with {@code
 * NOT_FOUND}.
 *
 * <h2>Index stability</h2>
 *
 * <p>Deletion tombstones a slot in place (see {@link ContentRecord#tombstone()}); collections never
 * shrink and indices are never reassigned. Other records' reply lists therefore stay valid.
 *
 * <h2>Copies</h2>
 *
 * <p>{@link #get(ContentId)} returns a copy and {@link #update(ContentId, ContentRecord)} stores a
 * copy, so state changes only through the operations of this class.
 *
 * <p><strong>Thread-safety:</strong> not thread-safe. The owning service serializes all calls.
 */
public class ContentLedger {
  private final List<List<ContentRecord>> collections;

  /** Creates an empty ledger with one collection per content type. */
  public ContentLedger() {
    this.collections = new ArrayList<>();
    for (int i = 0; i < ContentType.values().length; i++) collections.add(new ArrayList<>());
  }

  /**
   * Restores a ledger from persisted collections (see {@link #snapshot()}).
   *
   * <p>Missing trailing collections (from a file written with fewer types) are created empty.
   *
   * @param restored collections indexed by type ordinal; may be {@code null}
   */
  public ContentLedger(List<List<ContentRecord>> restored) {
    this();
    if (restored == null) return;
    int n = Math.min(restored.size(), collections.size());
    for (int i = 0; i < n; i++) {
      List<ContentRecord> src = restored.get(i);
      if (src == null) continue;
      List<ContentRecord> dst = collections.get(i);
      for (ContentRecord r : src) dst.add(r == null ? new ContentRecord() : r.copy());
    }
  }

  /**
   * Appends a record to its type's collection.
   *
   * @param record content to store (copied)
   * @param type target collection
   * @return identifier of the new slot
   * @throws IllegalStateException when the collection cannot grow any further
   */
  public ContentId create(ContentRecord record, ContentType type) {
    Objects.requireNonNull(record, "record");
    List<ContentRecord> col = collection(type);
    if (col.size() == Integer.MAX_VALUE) {
      throw new IllegalStateException("Collection " + type + " is full");
    }
    col.add(record.copy());
    return new ContentId(type, col.size() - 1L);
  }

  /**
   * Returns a copy of the record stored under {@code id}.
   *
   * @param id identifier
   * @return record copy (a tombstone if the content was deleted)
   * @throws LedgerException {@code NOT_FOUND} if the index is out of range
   */
  public ContentRecord get(ContentId id) {
    return slot(id).copy();
  }

  /**
   * Overwrites the slot under {@code id} with a copy of {@code record}.
   *
   * @param id identifier
   * @param record full replacement
   * @throws LedgerException {@code NOT_FOUND} if the index is out of range
   */
  public void update(ContentId id, ContentRecord record) {
    Objects.requireNonNull(record, "record");
    requireExists(id);
    collection(id.type()).set((int) id.index(), record.copy());
  }

  /**
   * Tombstones the slot under {@code id}. The index stays allocated.
   *
   * @param id identifier
   * @throws LedgerException {@code NOT_FOUND} if the index is out of range
   */
  public void delete(ContentId id) {
    slot(id).tombstone();
  }

  /**
   * Records {@code replyId} as a reply to {@code targetId}: appends the target to the reply's
   * {@code repliesTo} list and the reply to the target's {@code repliedBy} list.
   *
   * <p>Both identifiers are checked before anything is appended, so either both lists change or
   * neither does.
   *
   * @param replyId the replying record
   * @param targetId the record being replied to
   * @throws LedgerException {@code NOT_FOUND} if either identifier is out of range
   */
  public void link(ContentId replyId, ContentId targetId) {
    ContentRecord reply = slot(replyId);
    ContentRecord target = slot(targetId);
    reply.addReplyTo(targetId);
    target.addRepliedBy(replyId);
  }

  /**
   * Identifiers {@code id} replies to, in insertion order. A fresh list is built on every call.
   *
   * @throws LedgerException {@code NOT_FOUND} if the index is out of range
   */
  public List<ContentId> repliesOf(ContentId id) {
    return slot(id).repliesTo();
  }

  /**
   * Identifiers replying to {@code id}, in insertion order. A fresh list is built on every call.
   *
   * @throws LedgerException {@code NOT_FOUND} if the index is out of range
   */
  public List<ContentId> repliedByOf(ContentId id) {
    return slot(id).repliedBy();
  }

  /** Number of allocated slots (live and tombstoned) for {@code type}. */
  public long length(ContentType type) {
    return collection(type).size();
  }

  /** {@code true} if {@code id} addresses an allocated slot. */
  public boolean exists(ContentId id) {
    return id != null && id.index() < collection(id.type()).size();
  }

  /**
   * Lists the identifiers of live (non-tombstoned) records owned by {@code owner}, grouped by type
   * in declaration order and by index within a type.
   *
   * @param owner principal
   * @return new list, possibly empty
   */
  public List<ContentId> listByOwner(String owner) {
    List<ContentId> out = new ArrayList<>();
    for (ContentType t : ContentType.values()) {
      List<ContentRecord> col = collection(t);
      for (int i = 0; i < col.size(); i++) {
        if (owner.equals(col.get(i).owner)) out.add(new ContentId(t, i));
      }
    }
    return out;
  }

  /**
   * Removes the most recently created slot again.
   *
   * <p>This is the compensation of {@link #create(ContentRecord, ContentType)} for a workflow that
   * is being rolled back; it is not a deletion and must not be used as one.
   *
   * @param id identifier returned by the create being undone
   * @throws IllegalStateException if {@code id} is not the last slot of its collection
   */
  public void discardCreated(ContentId id) {
    List<ContentRecord> col = collection(id.type());
    if (id.index() != col.size() - 1L) {
      throw new IllegalStateException("Only the last slot can be discarded, got " + id);
    }
    col.remove(col.size() - 1);
  }

  /** Deep copy of all collections, indexed by type ordinal, for persistence. */
  public List<List<ContentRecord>> snapshot() {
    List<List<ContentRecord>> out = new ArrayList<>();
    for (List<ContentRecord> col : collections) {
      List<ContentRecord> copy = new ArrayList<>(col.size());
      for (ContentRecord r : col) copy.add(r.copy());
      out.add(copy);
    }
    return out;
  }

  // ---------- Validation ----------

  /** Integrity report produced by {@link #validate()}. */
  public static class ValidationReport {
    /** Allocated slots across all types. */
    public long totalRecords;
    /** Tombstoned slots across all types. */
    public long tombstones;
    /** Number of detected issues. */
    public int issues;
    /** Human-readable list of findings. */
    public List<String> messages = new ArrayList<>();
  }

  /**
   * Checks the stored state for consistency:
   *
   * <ul>
   *   <li>every reply reference points at an allocated slot;
   *   <li>the reply graph is symmetric (A replies to B exactly when B lists A as a reply);
   *   <li>counters are non-negative and {@code harvestedLikes} never exceeds {@code likes}.
   * </ul>
   *
   * @return report with totals and messages
   */
  public ValidationReport validate() {
    ValidationReport r = new ValidationReport();
    for (ContentType t : ContentType.values()) {
      List<ContentRecord> col = collection(t);
      for (int i = 0; i < col.size(); i++) {
        ContentId id = new ContentId(t, i);
        ContentRecord rec = col.get(i);
        r.totalRecords++;
        if (rec.isTombstone()) {
          r.tombstones++;
          continue;
        }
        if (rec.likes < 0 || rec.dislikes < 0 || rec.harvestedLikes < 0) {
          r.issues++;
          r.messages.add("Negative counter at " + id);
        }
        // dislikes may arrive after a harvest, so only likes bound the harvested count
        if (rec.harvestedLikes > rec.likes) {
          r.issues++;
          r.messages.add("harvestedLikes > likes at " + id);
        }
        checkEdges(r, id, rec.repliesTo(), true);
        checkEdges(r, id, rec.repliedBy(), false);
      }
    }
    return r;
  }

  private void checkEdges(ValidationReport r, ContentId from, List<ContentId> edges, boolean out) {
    Set<ContentId> seen = new HashSet<>();
    for (ContentId other : edges) {
      if (!exists(other)) {
        r.issues++;
        r.messages.add("Dangling reply reference " + from + " -> " + other);
        continue;
      }
      if (!seen.add(other)) continue;
      ContentRecord peer = collection(other.type()).get((int) other.index());
      if (peer.isTombstone()) continue;
      List<ContentId> back = out ? peer.repliedBy() : peer.repliesTo();
      if (!back.contains(from)) {
        r.issues++;
        r.messages.add(
            "Asymmetric reply edge "
                + (out ? from + " -> " + other : other + " -> " + from));
      }
    }
  }

  // ---------- Helpers ----------

  private List<ContentRecord> collection(ContentType type) {
    return collections.get(Objects.requireNonNull(type, "type").ordinal());
  }

  private void requireExists(ContentId id) {
    Objects.requireNonNull(id, "id");
    if (!exists(id)) throw LedgerException.notFound(id);
  }

  private ContentRecord slot(ContentId id) {
    requireExists(id);
    return collection(id.type()).get((int) id.index());
  }
}
