package org.example.taskprobe.util;

import com.google.gson.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * JSON utilities for the probe.
 *
 * <p>This class provides a single, shared {@link Gson} configuration with:
 * <ul>
 *   <li><b>Pretty printing</b> for human-readable JSON;</li>
 *   <li>Custom (de)serializers for {@link LocalDateTime} using
 *       {@link DateTimeFormatter#ISO_LOCAL_DATE_TIME}.</li>
 * </ul>
 *
 * <p>It is used for the probe configuration file and for scheduled task snapshots. Task
 * timestamps are local scheduler times, encoded as strings like {@code 2024-01-15T10:30:00}.
 * A {@code null} JSON field stays {@code null}; the adapters are not invoked for it.
 */
public final class JsonUtils {
    private JsonUtils() {}

    /** Formatter used for {@link LocalDateTime} ISO serialization. */
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private static final JsonSerializer<LocalDateTime> LDT_SER =
            (src, t, ctx) -> new JsonPrimitive(ISO.format(src));

    /**
     * Deserializer for {@link LocalDateTime}. Blank strings are read as {@code null}, which is how
     * task exports encode "never ran".
     */
    private static final JsonDeserializer<LocalDateTime> LDT_DES =
            (json, t, ctx) -> {
                String s = json.getAsString();
                return s.isBlank() ? null : LocalDateTime.parse(s.trim(), ISO);
            };

    /**
     * Returns a {@link Gson} instance configured with pretty printing and ISO-8601 adapters for
     * {@link LocalDateTime}.
     *
     * @return configured {@link Gson} ready for use across the probe
     */
    public static Gson gson() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .registerTypeAdapter(LocalDateTime.class, LDT_SER)
                .registerTypeAdapter(LocalDateTime.class, LDT_DES)
                .create();
    }
}
