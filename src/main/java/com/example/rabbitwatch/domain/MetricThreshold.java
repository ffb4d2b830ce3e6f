package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Warning / critical pair for one metric. Either bound may be null in a
 * partial update; consumer utilization never has a critical bound.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricThreshold(Double warning, Double critical) {

    public static MetricThreshold of(double warning, double critical) {
        return new MetricThreshold(warning, critical);
    }

    public static MetricThreshold warningOnly(double warning) {
        return new MetricThreshold(warning, null);
    }

    /** Overlay the non-null bounds of {@code update} onto this pair. */
    public MetricThreshold mergedWith(MetricThreshold update) {
        if (update == null) {
            return this;
        }
        return new MetricThreshold(
                update.warning() != null ? update.warning() : warning,
                update.critical() != null ? update.critical() : critical);
    }
}
