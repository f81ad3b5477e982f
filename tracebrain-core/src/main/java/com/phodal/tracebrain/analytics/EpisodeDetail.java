package com.phodal.tracebrain.analytics;

import com.phodal.tracebrain.model.Trace;

import java.util.List;

/**
 * An episode's summary together with its traces, oldest first.
 */
public record EpisodeDetail(EpisodeSummary summary, List<Trace> traces) {

    public EpisodeDetail {
        traces = traces == null ? List.of() : List.copyOf(traces);
    }
}
