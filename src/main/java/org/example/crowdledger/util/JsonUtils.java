package org.example.crowdledger.util;

import com.google.gson.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.example.crowdledger.model.Digest;

/**
 * JSON utilities for the application.
 *
 * <p>This class provides a shared {@link Gson} configuration with:
 * <ul>
 *   <li><b>Pretty printing</b> for human-readable JSON;</li>
 *   <li>(De)serializers for {@link LocalDateTime} using
 *       {@link DateTimeFormatter#ISO_LOCAL_DATE_TIME};</li>
 *   <li>(De)serializers for {@link Digest} as 64-character hex strings.</li>
 * </ul>
 *
 * <p>{@link java.math.BigInteger} amounts need no adapter: Gson writes them as JSON numbers and
 * reads them back without loss of precision.
 *
 * <p><b>Thread safety:</b> the returned {@link Gson} instance is thread-safe after construction.
 */
public final class JsonUtils {
    private JsonUtils() {}

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private static final JsonSerializer<LocalDateTime> LDT_SER =
            (src, t, ctx) -> new JsonPrimitive(ISO.format(src));

    private static final JsonDeserializer<LocalDateTime> LDT_DES =
            (json, t, ctx) -> LocalDateTime.parse(json.getAsString(), ISO);

    private static final JsonSerializer<Digest> DIGEST_SER =
            (src, t, ctx) -> new JsonPrimitive(src.toHex());

    /**
     * Reads a digest from its hex form. Malformed values are reported as {@link JsonParseException}
     * so that callers see a parse failure rather than an {@link IllegalArgumentException}.
     */
    private static final JsonDeserializer<Digest> DIGEST_DES =
            (json, t, ctx) -> {
                try {
                    return Digest.fromHex(json.getAsString());
                } catch (IllegalArgumentException e) {
                    throw new JsonParseException("Bad digest: " + json, e);
                }
            };

    /**
     * Returns a {@link Gson} instance configured with pretty printing and the type adapters above.
     *
     * @return configured {@link Gson} ready for use across the app
     */
    public static Gson gson() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .registerTypeAdapter(LocalDateTime.class, LDT_SER)
                .registerTypeAdapter(LocalDateTime.class, LDT_DES)
                .registerTypeAdapter(Digest.class, DIGEST_SER)
                .registerTypeAdapter(Digest.class, DIGEST_DES)
                .create();
    }
}
