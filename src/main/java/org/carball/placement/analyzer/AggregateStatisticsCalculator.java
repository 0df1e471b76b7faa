package org.carball.placement.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.placement.model.analysis.AggregateStatistics;
import org.carball.placement.model.placement.PlacementRecord;

import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

@Slf4j
public class AggregateStatisticsCalculator {

    public AggregateStatistics calculate(List<PlacementRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new EmptyBatchException("Cannot calculate averages for an empty batch of placements");
        }

        List<PlacementRecord> converting = records.stream()
                .filter(PlacementRecord::hasConversions)
                .collect(Collectors.toList());

        double averageCpa = converting.isEmpty() ? 0.0 : mean(converting, PlacementRecord::costPerConversion);

        AggregateStatistics statistics = AggregateStatistics.builder()
                .averageCtr(mean(records, PlacementRecord::ctr))
                .averageCpc(mean(records, PlacementRecord::averageCpc))
                .averageBounceRate(mean(records, PlacementRecord::bounceRate))
                .averageDepth(mean(records, PlacementRecord::depth))
                .averageSpend(mean(records, PlacementRecord::spend))
                .averageConversions(mean(records, PlacementRecord::conversions))
                .averageCpa(averageCpa)
                .placementCount(records.size())
                .convertingPlacementCount(converting.size())
                .totalSpend(records.stream().mapToDouble(PlacementRecord::spend).sum())
                .build();

        log.info("Averages over {} placements - CTR: {}%, CPC: {}, bounce: {}%, depth: {}, spend: {}",
                statistics.placementCount(),
                twoDecimals(statistics.averageCtr()),
                twoDecimals(statistics.averageCpc()),
                twoDecimals(statistics.averageBounceRate()),
                twoDecimals(statistics.averageDepth()),
                twoDecimals(statistics.averageSpend()));
        log.info("Average cost per conversion over {} converting placements: {}",
                statistics.convertingPlacementCount(), twoDecimals(averageCpa));

        return statistics;
    }

    private static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static double mean(List<PlacementRecord> records, ToDoubleFunction<PlacementRecord> metric) {
        return records.stream().mapToDouble(metric).average().orElse(0.0);
    }
}
