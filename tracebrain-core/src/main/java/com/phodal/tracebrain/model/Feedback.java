package com.phodal.tracebrain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A human feedback entry. Entries are only ever appended to a trace.
 *
 * @param rating 1..5, optional
 * @param comment free text
 * @param tags labels chosen by the reviewer
 * @param metadata implementation specific data
 * @param timestamp when the entry was recorded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Feedback(
    Integer rating,
    String comment,
    List<String> tags,
    Map<String, Object> metadata,
    Instant timestamp
) {

    public Feedback {
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Feedback of(int rating, String comment) {
        return new Feedback(rating, comment, null, null, null);
    }

    public Feedback withTimestamp(Instant timestamp) {
        return new Feedback(rating, comment, tags, metadata, timestamp);
    }
}
