package org.example.crowdledger.model;

import java.util.Objects;

/**
 * Identifier of one content record: the pair of its {@link ContentType} and its zero-based index in
 * that type's collection.
 *
 * <p>Identifiers are stable for the life of the record and are never reassigned, not even after
 * the record has been deleted (tombstoned). Instances are immutable and compare by value.
 *
 * <p>The text form is {@code TYPE:index} (e.g. {@code POST:12}), see {@link #parse(String)}.
 */
public final class ContentId {
  private final ContentType type;
  private final long index;

  public ContentId(ContentType type, long index) {
    this.type = Objects.requireNonNull(type, "type");
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0: " + index);
    }
    this.index = index;
  }

  public static ContentId of(ContentType type, long index) {
    return new ContentId(type, index);
  }

  /**
   * Parses the {@code TYPE:index} form produced by {@link #toString()}.
   *
   * @param raw text such as {@code post:3}
   * @return parsed identifier
   * @throws IllegalArgumentException on malformed input
   */
  public static ContentId parse(String raw) {
    if (raw == null) throw new IllegalArgumentException("Identifier is required.");
    String s = raw.trim();
    int colon = s.indexOf(':');
    if (colon <= 0 || colon == s.length() - 1) {
      throw new IllegalArgumentException("Expected TYPE:index, got: " + raw);
    }
    ContentType t = ContentType.parse(s.substring(0, colon));
    long idx;
    try {
      idx = Long.parseLong(s.substring(colon + 1).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Index is not a number: " + raw, e);
    }
    return new ContentId(t, idx);
  }

  public ContentType type() {
    return type;
  }

  public long index() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ContentId)) return false;
    ContentId other = (ContentId) o;
    return index == other.index && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, index);
  }

  @Override
  public String toString() {
    return type.name() + ":" + index;
  }
}
