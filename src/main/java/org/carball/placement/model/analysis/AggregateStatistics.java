package org.carball.placement.model.analysis;

import lombok.Builder;

/**
 * Batch-wide baselines the blocking rules and segmentation compare against.
 * {@code averageCpa} only covers placements with at least one conversion and is 0 when there are none.
 */
@Builder(toBuilder = true)
public record AggregateStatistics(
        double averageCtr,
        double averageCpc,
        double averageBounceRate,
        double averageDepth,
        double averageSpend,
        double averageConversions,
        double averageCpa,
        int placementCount,
        int convertingPlacementCount,
        double totalSpend
) {}
