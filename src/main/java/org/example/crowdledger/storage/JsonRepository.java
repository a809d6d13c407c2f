package org.example.crowdledger.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Objects;
import java.util.Optional;
import org.example.crowdledger.util.JsonUtils;

/**
 * Minimal JSON-backed persistence helper shared by the stores in this package.
 *
 * <ul>
 *   <li>{@link #read(Path, Type)} - parse a file into a model type, or nothing if the file is
 *       absent, empty or unreadable.
 *   <li>{@link #writeAtomic(Path, Object)} - write to a temporary sibling file and atomically move
 *       it into place, so readers never observe a partially written file.
 * </ul>
 *
 * <p>All file I/O is UTF-8. Parent directories are created as needed. The class is stateless;
 * concurrent writers to the same path must be coordinated by the caller.
 */
final class JsonRepository {
  private JsonRepository() {}

  private static final Gson GSON = JsonUtils.gson();

  /**
   * Reads {@code path} as JSON of type {@code typeOfT}.
   *
   * <p>A missing file yields an empty result silently. An unreadable or malformed file also yields
   * an empty result, with a warning on {@code System.err}, so that callers fall back to their
   * defaults instead of failing start-up.
   *
   * @param path file to read
   * @param typeOfT target type (e.g. {@code new TypeToken<List<Foo>>() {}.getType()})
   * @param <T> result type
   * @return parsed value, or empty
   */
  static <T> Optional<T> read(Path path, Type typeOfT) {
    if (!Files.exists(path)) return Optional.empty();
    try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      T data = GSON.fromJson(br, typeOfT);
      return Optional.ofNullable(data);
    } catch (IOException | JsonParseException e) {
      System.err.println("Warning: failed to read " + path + ": " + e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Writes {@code value} as JSON to {@code target} using a temp file ({@code .<name>.tmp}) and an
   * atomic replace.
   *
   * @param target destination file; must have a parent directory
   * @param value object to serialize
   * @throws IOException if the parent is missing and cannot be created, or the write/move fails
   */
  static void writeAtomic(Path target, Object value) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(value, "value");

    Path parent = target.toAbsolutePath().getParent();
    if (parent == null) {
      throw new IOException("Target path has no parent directory: " + target);
    }
    Files.createDirectories(parent);

    Path fn = target.getFileName();
    String baseName = (fn != null) ? fn.toString() : "data";
    Path tmp = parent.resolve("." + baseName + ".tmp");

    try (BufferedWriter bw =
        Files.newBufferedWriter(
            tmp,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(value, bw);
    }

    Files.move(
        tmp,
        target.toAbsolutePath(),
        StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
  }
}
