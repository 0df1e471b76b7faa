package org.carball.placement.analyzer;

import org.carball.placement.config.BlockingThresholds;
import org.carball.placement.model.analysis.AggregateStatistics;
import org.carball.placement.model.analysis.BlockingAction;
import org.carball.placement.model.analysis.BlockingPriority;
import org.carball.placement.model.placement.PlacementRecord;
import org.carball.placement.model.placement.PlatformType;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the blocking precedence table: when {@code condition} holds for a placement,
 * the placement is blocked under {@code criterionId}.
 *
 * @param feature optional trait recorded on the verdict, {@code null} when the rule adds none
 */
public record BlockingRule(
        String criterionId,
        String reason,
        BlockingPriority priority,
        BlockingAction action,
        String feature,
        Predicate<Context> condition,
        Function<Context, String> deviation
) {

    public boolean matches(Context context) {
        return condition.test(context);
    }

    public String describeDeviation(Context context) {
        return deviation.apply(context);
    }

    /**
     * Everything a rule may look at for a single placement.
     *
     * @param coefficient leniency multiplier, greater than 1 for the network's own placements
     */
    public record Context(
            PlacementRecord record,
            PlatformType platformType,
            double coefficient,
            AggregateStatistics statistics,
            BlockingThresholds thresholds
    ) {

        public double cpaLimit() {
            return statistics.averageCpa() * thresholds.getCpaMultiplier() * coefficient;
        }

        public double bounceLimit() {
            return statistics.averageBounceRate() * thresholds.getBounceMultiplier() * coefficient;
        }

        public double lowCtrLimit() {
            return thresholds.getLowCtr() / coefficient;
        }

        public double minZeroConversionSpend() {
            return thresholds.getZeroConversionMinSpend() * coefficient;
        }

        public boolean isExpensiveConversion() {
            return record.hasConversions()
                    && statistics.averageCpa() > 0
                    && record.costPerConversion() > cpaLimit();
        }

        public boolean isInHighCtrBand() {
            double ctr = record.ctr();
            return ctr >= thresholds.getHighCtr() * coefficient
                    && ctr < thresholds.getFraudCtr()
                    && record.impressions() >= thresholds.getMinCtrImpressions();
        }
    }
}
