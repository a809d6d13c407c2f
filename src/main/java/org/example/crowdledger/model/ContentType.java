package org.example.crowdledger.model;

/**
 * The fixed set of content kinds a user can publish.
 *
 * <p>Every type owns an independent, append-only collection in {@code
 * org.example.crowdledger.storage.ContentLedger}; the collection slot is selected by {@link
 * #ordinal()}. The number of variants is part of the persisted layout, so new kinds must be
 * appended, never inserted.
 */
public enum ContentType {
  POST,
  COMMENT,
  IMAGE,
  VIDEO,
  AUDIO,
  ARTICLE,
  LINK,
  POLL,
  STORY,
  SHORT_VIDEO,
  LIVESTREAM,
  EVENT,
  DOCUMENT,
  CODE,
  OTHER;

  /**
   * Parses a type name case-insensitively (e.g. {@code "post"} or {@code "SHORT_VIDEO"}).
   *
   * @param raw user input
   * @return matching type
   * @throws IllegalArgumentException if the name is unknown or blank
   */
  public static ContentType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Content type is required.");
    }
    return ContentType.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
  }
}
