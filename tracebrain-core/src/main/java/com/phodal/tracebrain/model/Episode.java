package com.phodal.tracebrain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Traces sharing an episode id, ordered by creation time.
 * Derived on read and never stored on its own.
 */
public record Episode(
    @JsonProperty("episode_id") String episodeId,
    List<Trace> traces
) {

    public Episode {
        traces = traces == null ? List.of() : List.copyOf(traces);
    }
}
