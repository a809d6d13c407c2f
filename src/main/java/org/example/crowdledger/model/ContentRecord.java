package org.example.crowdledger.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One published piece of content together with its vote counters and reply references.
 *
 * <p>Fields are public to keep Gson serialization simple; the record is a mutable data holder
 * owned by {@code org.example.crowdledger.storage.ContentLedger}. Callers receive copies (see
 * {@link #copy()}) and write changes back with a full overwrite.
 *
 * <h2>Reply references</h2>
 *
 * <p>References are kept as two pairs of parallel lists (type + index) and rebuilt into {@link
 * ContentId} sequences by {@link #repliesTo()} and {@link #repliedBy()}. Insertion order is
 * preserved; nothing is ever re-sorted.
 *
 * <h2>Tombstones</h2>
 *
 * <p>A deleted record keeps its slot but has every field reset (see {@link #tombstone()}). The
 * index stays allocated so that other records' reply lists remain valid.
 */
public class ContentRecord {

  /** Principal that published the content; {@code null} for a tombstone. */
  public String owner;

  /** Hash of the content body. */
  public Digest contentHash = Digest.ZERO;

  /** Hash of the content metadata (title, tags, etc.). */
  public Digest metadataHash = Digest.ZERO;

  public long likes;

  public long dislikes;

  /** Net likes already converted into minted rewards. */
  public long harvestedLikes;

  /** Types of the records this one replies to (parallel to {@link #repliesToIndexes}). */
  public List<ContentType> repliesToTypes = new ArrayList<>();

  public List<Long> repliesToIndexes = new ArrayList<>();

  /** Types of the records replying to this one (parallel to {@link #repliedByIndexes}). */
  public List<ContentType> repliedByTypes = new ArrayList<>();

  public List<Long> repliedByIndexes = new ArrayList<>();

  /**
   * Creates a fresh record for an upload.
   *
   * @param owner publishing principal
   * @param contentHash content hash
   * @param metadataHash metadata hash
   * @return record with zero counters and no replies
   */
  public static ContentRecord newContent(String owner, Digest contentHash, Digest metadataHash) {
    ContentRecord r = new ContentRecord();
    r.owner = owner;
    r.contentHash = contentHash;
    r.metadataHash = metadataHash;
    return r;
  }

  /** Returns the identifiers this record replies to, in insertion order. */
  public List<ContentId> repliesTo() {
    return rebuild(repliesToTypes, repliesToIndexes);
  }

  /** Returns the identifiers of records replying to this one, in insertion order. */
  public List<ContentId> repliedBy() {
    return rebuild(repliedByTypes, repliedByIndexes);
  }

  public void addReplyTo(ContentId target) {
    ensureLists();
    repliesToTypes.add(target.type());
    repliesToIndexes.add(target.index());
  }

  public void addRepliedBy(ContentId reply) {
    ensureLists();
    repliedByTypes.add(reply.type());
    repliedByIndexes.add(reply.index());
  }

  /** Resets every field to its zero value, leaving the slot allocated. */
  public void tombstone() {
    owner = null;
    contentHash = Digest.ZERO;
    metadataHash = Digest.ZERO;
    likes = 0;
    dislikes = 0;
    harvestedLikes = 0;
    repliesToTypes = new ArrayList<>();
    repliesToIndexes = new ArrayList<>();
    repliedByTypes = new ArrayList<>();
    repliedByIndexes = new ArrayList<>();
  }

  /** A record is a tombstone when it has no owner. */
  public boolean isTombstone() {
    return owner == null;
  }

  /** Net likes not yet harvested; zero when dislikes dominate. */
  public long unharvestedLikes() {
    long net = likes - dislikes - harvestedLikes;
    return Math.max(0L, net);
  }

  /** Deep copy; the reply lists are not shared with the original. */
  public ContentRecord copy() {
    ContentRecord c = new ContentRecord();
    c.owner = owner;
    c.contentHash = contentHash;
    c.metadataHash = metadataHash;
    c.likes = likes;
    c.dislikes = dislikes;
    c.harvestedLikes = harvestedLikes;
    c.repliesToTypes = new ArrayList<>(nonNull(repliesToTypes));
    c.repliesToIndexes = new ArrayList<>(nonNull(repliesToIndexes));
    c.repliedByTypes = new ArrayList<>(nonNull(repliedByTypes));
    c.repliedByIndexes = new ArrayList<>(nonNull(repliedByIndexes));
    return c;
  }

  // Gson leaves missing arrays null when reading older files.
  private void ensureLists() {
    if (repliesToTypes == null) repliesToTypes = new ArrayList<>();
    if (repliesToIndexes == null) repliesToIndexes = new ArrayList<>();
    if (repliedByTypes == null) repliedByTypes = new ArrayList<>();
    if (repliedByIndexes == null) repliedByIndexes = new ArrayList<>();
  }

  private static <T> List<T> nonNull(List<T> list) {
    return list == null ? List.of() : list;
  }

  private static List<ContentId> rebuild(List<ContentType> types, List<Long> indexes) {
    List<ContentId> out = new ArrayList<>();
    if (types == null || indexes == null) return out;
    int n = Math.min(types.size(), indexes.size());
    for (int i = 0; i < n; i++) out.add(new ContentId(types.get(i), indexes.get(i)));
    return out;
  }
}
