package org.carball.placement.model.placement;

import lombok.Builder;

/**
 * One row of the ad-network placement export after numeric cleaning.
 * CTR and bounce rate are percentages on a 0-100 scale.
 */
@Builder(toBuilder = true)
public record PlacementRecord(
        String placement,
        String placementType,
        long impressions,
        long clicks,
        double ctr,
        double spend,
        double averageCpc,
        double bounceRate,
        double depth,
        double costPerConversion,
        long conversions
) {

    public boolean hasConversions() {
        return conversions > 0;
    }
}
