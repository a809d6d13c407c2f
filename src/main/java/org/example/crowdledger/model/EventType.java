package org.example.crowdledger.model;

/**
 * Records emitted by completed platform workflows.
 *
 * <p>Stored in {@code EventLog.type} and produced by {@link
 * org.example.crowdledger.service.EventService}. An event is only published after its workflow has
 * committed; a failed workflow emits nothing.
 */
public enum EventType {
  /** New content was published. Carries creator, type and index. */
  UPLOADED,

  /** A like was recorded on a piece of content. */
  LIKED,

  /** A dislike was recorded on a piece of content. */
  DISLIKED,

  /** Net likes were converted into minted tokens. Carries the minted amount. */
  HARVESTED,

  /**
   * Content was removed because the crowd disapproved of it. Carries the former owner and the
   * content and metadata hashes of the removed record.
   */
  DELETED,

  /** One record was linked as a reply to another. Carries both identifiers. */
  REPLIED
}
