package org.example.crowdledger.model;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * A single record emitted by a committed workflow.
 *
 * <p>Events are appended to the persistent event log (see {@code
 * org.example.crowdledger.storage.EventsRepository}) and can be queried per account or globally via
 * {@code org.example.crowdledger.service.EventService}.
 *
 * <h2>Serialization</h2>
 *
 * <ul>
 *   <li>Instances are serialized with the app's {@code Gson} configuration (see {@code
 *       org.example.crowdledger.util.JsonUtils}).
 *   <li>{@link #ts} is written as ISO-8601 local date-time without timezone; digests as hex; amounts
 *       as decimal strings.
 * </ul>
 *
 * <h2>Field semantics</h2>
 *
 * <ul>
 *   <li>{@link #account} – principal the event concerns: the creator for {@code UPLOADED}, the
 *       voter for {@code LIKED}/{@code DISLIKED}, the owner for {@code HARVESTED}/{@code DELETED},
 *       the replier for {@code REPLIED}.
 *   <li>{@link #contentType}/{@link #contentIndex} – the content the event is about (the replying
 *       record for {@code REPLIED}).
 *   <li>{@link #targetType}/{@link #targetIndex} – reply target; only set for {@code REPLIED}.
 *   <li>{@link #amount} – minted amount; only set for {@code HARVESTED}.
 *   <li>{@link #contentHash}/{@link #metadataHash} – hashes of a removed record; only set for
 *       {@code DELETED}.
 * </ul>
 *
 * @see EventType
 */
public class EventLog {
  /** Event timestamp (local time). */
  public LocalDateTime ts;

  public EventType type;

  public String account;

  public ContentType contentType;

  public long contentIndex;

  public ContentType targetType;

  public Long targetIndex;

  public BigInteger amount;

  public Digest contentHash;

  public Digest metadataHash;

  /** Human-readable summary suitable for console listing. */
  public String message;

  /** Identifier of the content this event is about. */
  public ContentId contentId() {
    return contentType == null ? null : new ContentId(contentType, contentIndex);
  }
}
