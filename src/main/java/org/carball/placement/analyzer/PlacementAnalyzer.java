package org.carball.placement.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.placement.config.BlockingThresholds;
import org.carball.placement.model.analysis.AggregateStatistics;
import org.carball.placement.model.analysis.AnalysisResult;
import org.carball.placement.model.analysis.BlockingVerdict;
import org.carball.placement.model.analysis.Segmentation;
import org.carball.placement.model.placement.PlacementRecord;
import org.carball.placement.parser.PlacementCsvLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Slf4j
public class PlacementAnalyzer {

    private final BlockingThresholds thresholds;
    private final PlacementCsvLoader loader;
    private final AggregateStatisticsCalculator statisticsCalculator;
    private final BlockingRuleEngine ruleEngine;
    private final SegmentationEngine segmentationEngine;

    public PlacementAnalyzer() {
        this(BlockingThresholds.defaults());
    }

    public PlacementAnalyzer(BlockingThresholds thresholds) {
        this(thresholds, new PlacementCsvLoader());
    }

    public PlacementAnalyzer(BlockingThresholds thresholds, PlacementCsvLoader loader) {
        this.thresholds = thresholds != null ? thresholds : BlockingThresholds.defaults();
        this.loader = loader;
        this.statisticsCalculator = new AggregateStatisticsCalculator();
        this.ruleEngine = new BlockingRuleEngine(this.thresholds);
        this.segmentationEngine = new SegmentationEngine(this.thresholds);

        log.info("Using thresholds: {}", this.thresholds.getConfigurationSummary());
    }

    public AnalysisResult analyze(Path placementExport) throws IOException {
        return analyze(loader.load(placementExport));
    }

    public AnalysisResult analyze(List<PlacementRecord> records) {
        log.info("Starting analysis of {} placements", records == null ? 0 : records.size());

        // Baselines first, both engines depend on them
        AggregateStatistics statistics = statisticsCalculator.calculate(records);

        List<BlockingVerdict> verdicts = ruleEngine.evaluate(records, statistics);
        Segmentation segmentation = segmentationEngine.segment(records, statistics);

        log.info("Analysis complete. {} of {} placements recommended for blocking", verdicts.size(), records.size());

        return new AnalysisResult(List.copyOf(records), statistics, List.copyOf(verdicts), segmentation, thresholds);
    }
}
