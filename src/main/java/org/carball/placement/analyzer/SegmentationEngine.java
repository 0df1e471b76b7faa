package org.carball.placement.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.placement.config.BlockingThresholds;
import org.carball.placement.model.analysis.AggregateStatistics;
import org.carball.placement.model.analysis.SegmentTag;
import org.carball.placement.model.analysis.Segmentation;
import org.carball.placement.model.placement.PlacementRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits placements into effective, medium and ineffective tiers.
 * Thresholds are applied as-is, without the leniency coefficient used for blocking.
 */
@Slf4j
public class SegmentationEngine {

    private final BlockingThresholds thresholds;

    public SegmentationEngine() {
        this(BlockingThresholds.defaults());
    }

    public SegmentationEngine(BlockingThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Segmentation segment(List<PlacementRecord> records, AggregateStatistics statistics) {
        List<String> effective = new ArrayList<>();
        List<String> medium = new ArrayList<>();
        List<String> ineffective = new ArrayList<>();

        for (PlacementRecord record : records) {
            switch (tag(record, statistics)) {
                case EFFECTIVE -> effective.add(record.placement());
                case INEFFECTIVE -> ineffective.add(record.placement());
                case MEDIUM -> medium.add(record.placement());
            }
        }

        int total = records.size();
        log.info("Segments - effective: {} ({}), medium: {} ({}), ineffective: {} ({})",
                effective.size(), share(effective.size(), total),
                medium.size(), share(medium.size(), total),
                ineffective.size(), share(ineffective.size(), total));

        return new Segmentation(effective, medium, ineffective);
    }

    public SegmentTag tag(PlacementRecord record, AggregateStatistics statistics) {
        if (isEffective(record, statistics)) {
            return SegmentTag.EFFECTIVE;
        }
        if (isIneffective(record, statistics)) {
            return SegmentTag.INEFFECTIVE;
        }
        return SegmentTag.MEDIUM;
    }

    private boolean isEffective(PlacementRecord record, AggregateStatistics statistics) {
        return record.hasConversions()
                && record.costPerConversion() <= statistics.averageCpa()
                && record.ctr() >= thresholds.getEffectiveMinCtr()
                && record.ctr() <= thresholds.getEffectiveMaxCtr()
                && record.bounceRate() <= statistics.averageBounceRate();
    }

    private boolean isIneffective(PlacementRecord record, AggregateStatistics statistics) {
        double ctr = record.ctr();
        boolean converting = record.hasConversions();

        return ctr >= thresholds.getFraudCtr()
                || (ctr >= thresholds.getHighCtr() && !converting)
                || (converting && record.costPerConversion() > statistics.averageCpa() * thresholds.getCpaMultiplier())
                || (!converting
                        && record.spend() >= thresholds.getZeroConversionMinSpend()
                        && record.clicks() >= thresholds.getZeroConversionMinClicks())
                || (ctr < thresholds.getLowCtr() && record.impressions() >= thresholds.getLowCtrMinImpressions());
    }

    private static String share(int count, int total) {
        return total == 0 ? "0.0%" : String.format(Locale.ROOT, "%.1f%%", count * 100.0 / total);
    }
}
