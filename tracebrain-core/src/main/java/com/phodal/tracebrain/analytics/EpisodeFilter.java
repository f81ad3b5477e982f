package com.phodal.tracebrain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.error.ValidationException;

/**
 * Constraints on episode listings.
 *
 * @param maxAvgConfidence keep episodes whose average confidence is strictly below this value;
 *                         episodes without any evaluation never match a set bound
 */
public record EpisodeFilter(
    @JsonProperty("max_avg_confidence") Double maxAvgConfidence
) {

    public EpisodeFilter {
        if (maxAvgConfidence != null
            && (maxAvgConfidence.isNaN() || maxAvgConfidence < 0.0 || maxAvgConfidence > 1.0)) {
            throw new ValidationException("max_avg_confidence must be within [0, 1], got " + maxAvgConfidence);
        }
    }

    public static EpisodeFilter none() {
        return new EpisodeFilter(null);
    }

    public boolean matches(EpisodeSummary summary) {
        if (maxAvgConfidence == null) {
            return true;
        }
        return summary.avgConfidence() != null && summary.avgConfidence() < maxAvgConfidence;
    }
}
