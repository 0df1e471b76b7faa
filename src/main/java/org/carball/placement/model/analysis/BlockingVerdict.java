package org.carball.placement.model.analysis;

import lombok.Builder;
import org.carball.placement.model.placement.PlacementRecord;
import org.carball.placement.model.placement.PlatformType;

import java.util.List;

@Builder
public record BlockingVerdict(
        PlacementRecord record,
        PlatformType platformType,
        String criterionId,
        String reason,
        BlockingPriority priority,
        BlockingAction action,
        String deviation,
        String justification,
        List<String> features
) {

    public String placement() {
        return record.placement();
    }

    public double spend() {
        return record.spend();
    }

    public boolean hasPriority(BlockingPriority expected) {
        return priority == expected;
    }
}
