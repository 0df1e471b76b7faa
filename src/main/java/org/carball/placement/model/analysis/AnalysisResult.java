package org.carball.placement.model.analysis;

import org.carball.placement.config.BlockingThresholds;
import org.carball.placement.model.placement.PlacementRecord;

import java.util.List;

public record AnalysisResult (
    List<PlacementRecord> records,
    AggregateStatistics statistics,
    List<BlockingVerdict> verdicts,
    Segmentation segmentation,
    BlockingThresholds thresholds
) {

    public double blockedSpend() {
        return verdicts.stream().mapToDouble(BlockingVerdict::spend).sum();
    }
}
