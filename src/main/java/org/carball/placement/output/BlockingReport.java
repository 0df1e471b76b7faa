package org.carball.placement.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.placement.config.BlockingThresholds;
import org.carball.placement.model.analysis.*;
import org.carball.placement.model.placement.PlacementRecord;
import org.carball.placement.model.placement.PlatformType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
public class BlockingReport {

    private static final String RULE = "=".repeat(80);
    private static final String LINE = "-".repeat(80);
    private static final int TOP_LIMIT = 10;

    private final AnalysisResult analysisResult;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public BlockingReport(AnalysisResult analysisResult) {
        this(analysisResult, LocalDateTime.now());
    }

    public BlockingReport(AnalysisResult analysisResult, LocalDateTime timestamp) {
        this.analysisResult = analysisResult;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        this.csvMapper = new CsvMapper();
    }

    /**
     * Blocked placements, one semicolon separated row per verdict.
     */
    public String toCsv() {
        CsvSchema schema = csvMapper.schemaFor(BlockedPlacementRow.class)
                .withHeader()
                .withColumnSeparator(';');
        List<BlockedPlacementRow> rows = analysisResult.verdicts().stream()
                .map(BlockedPlacementRow::from)
                .collect(Collectors.toList());
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            log.error("Error generating blocked placements CSV", e);
            throw new IllegalStateException("Failed to generate blocked placements CSV", e);
        }
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toText() {
        List<PlacementRecord> records = analysisResult.records();
        List<BlockingVerdict> verdicts = analysisResult.verdicts();
        Segmentation segments = analysisResult.segmentation();
        int total = records.size();

        StringBuilder report = new StringBuilder();
        line(report, RULE);
        line(report, "ANALYTICAL REPORT");
        line(report, "Ad network placement analysis");
        line(report, RULE);
        line(report, "Generated: " + timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        line(report, "Thresholds: " + analysisResult.thresholds().getConfigurationSummary());
        line(report, "");

        // 1. General statistics
        line(report, "1. GENERAL STATISTICS");
        line(report, LINE);
        line(report, "Placements analyzed: " + total);
        line(report, format("Placements to block: %d (%.1f%%)", verdicts.size(), percent(verdicts.size(), total)));
        for (SegmentTag tag : SegmentTag.values()) {
            int size = segments.placementsFor(tag).size();
            line(report, format("Category %s (%s): %d (%.1f%%)",
                    tag.getCategory(), tag.getDisplayName(), size, percent(size, total)));
        }
        line(report, "");

        // 2. Financial assessment
        double totalSpend = analysisResult.statistics().totalSpend();
        double blockedSpend = analysisResult.blockedSpend();
        line(report, "2. FINANCIAL ASSESSMENT");
        line(report, LINE);
        line(report, format("Total spend across all placements: %.2f", totalSpend));
        line(report, format("Spend on ineffective placements: %.2f", blockedSpend));
        line(report, format("Share of spend on ineffective placements: %.1f%%", percentOf(blockedSpend, totalSpend)));
        line(report, averageEffectiveCpa()
                .map(cpa -> format("Average cost per conversion on effective placements: %.2f", cpa))
                .orElse("Average cost per conversion on effective placements: no data"));
        line(report, averageBlockedCpa()
                .map(cpa -> format("Average cost per conversion on ineffective placements: %.2f", cpa))
                .orElse("Average cost per conversion on ineffective placements: no conversions"));
        line(report, format("Potential budget savings from blocking: %.2f", blockedSpend));
        line(report, "");

        // 3. By criterion
        line(report, "3. DISTRIBUTION BY BLOCKING CRITERION");
        line(report, LINE);
        if (verdicts.isEmpty()) {
            line(report, "No placements to block were found.");
        } else {
            summarizeByCriterion().forEach(summary -> line(report,
                    format("Criterion %s: %d placements (%.1f%%), spend %.2f",
                            summary.key(), summary.count(), summary.share(), summary.spend())));
        }
        line(report, "");

        // 4. By platform type
        line(report, "4. DISTRIBUTION BY PLATFORM TYPE");
        line(report, LINE);
        summarizeByPlatformType().forEach(summary -> line(report,
                format("%s: %d placements (%.1f%%), spend %.2f",
                        summary.key(), summary.count(), summary.share(), summary.spend())));
        line(report, "");

        // 5. Top spenders
        line(report, "5. TOP-10 MOST EXPENSIVE INEFFECTIVE PLACEMENTS");
        line(report, LINE);
        topBySpend(verdicts, TOP_LIMIT).forEach(v -> line(report,
                format("%s: %.2f, CTR %.2f%%, conversions %d, %s",
                        v.placement(), v.spend(), v.record().ctr(), v.record().conversions(), v.reason())));
        line(report, "");

        // 6. Recommendations
        line(report, "6. RECOMMENDATIONS");
        line(report, LINE);
        if (!verdicts.isEmpty()) {
            appendRecommendations(report, verdicts);
        }

        line(report, RULE);
        line(report, "END OF ANALYTICAL REPORT");
        line(report, RULE);

        return report.toString();
    }

    private void appendRecommendations(StringBuilder report, List<BlockingVerdict> verdicts) {
        List<BlockingVerdict> critical = withPriority(verdicts, BlockingPriority.CRITICAL);
        List<BlockingVerdict> high = withPriority(verdicts, BlockingPriority.HIGH);

        line(report, "BLOCKING PRIORITY:");
        line(report, format("1. CRITICAL priority: %d placements - block IMMEDIATELY", critical.size()));
        line(report, format("   Savings: %.2f", totalSpend(critical)));
        line(report, format("2. HIGH priority: %d placements - block after review", high.size()));
        line(report, format("   Savings: %.2f", totalSpend(high)));
        line(report, "");

        List<BlockingVerdict> mobile = ofType(verdicts, PlatformType.MOBILE_APP);
        if (!mobile.isEmpty()) {
            line(report, "TOP-10 MOBILE APPS BY SPEND:");
            topBySpend(mobile, TOP_LIMIT).forEach(v -> line(report,
                    format("  - %s: %.2f, CTR %.2f%%", v.placement(), v.spend(), v.record().ctr())));
            line(report, "Recommendation: mobile apps show high CTR without conversions.");
            line(report, format("This points to accidental clicks. Block %d apps.", mobile.size()));
            line(report, "");
        }

        List<BlockingVerdict> dsp = ofType(verdicts, PlatformType.DSP);
        if (!dsp.isEmpty()) {
            line(report, "DSP PLACEMENTS:");
            line(report, format("To block: %d placements, spend %.2f", dsp.size(), totalSpend(dsp)));
            dsp.forEach(v -> line(report, format("  - %s: %.2f, %s", v.placement(), v.spend(), v.reason())));
            line(report, "Recommendation: programmatic placements show low efficiency.");
            line(report, "");
        }

        List<BlockingVerdict> yandex = ofType(verdicts, PlatformType.YANDEX_NETWORK);
        if (!yandex.isEmpty()) {
            line(report, "YANDEX PLACEMENTS:");
            line(report, format("To block: %d placements, spend %.2f", yandex.size(), totalSpend(yandex)));
            yandex.forEach(v -> line(report, format("  - %s: %.2f, %s", v.placement(), v.spend(), v.reason())));
            line(report, "WARNING: Yandex placements are usually of good quality. Re-check the criteria.");
            line(report, "");
        }
    }

    /**
     * Blocked placements grouped by criterion, ordered by criterion id.
     */
    public List<GroupSummary> summarizeByCriterion() {
        return summarize(BlockingVerdict::criterionId);
    }

    public List<GroupSummary> summarizeByPlatformType() {
        return summarize(v -> v.platformType().getDisplayName());
    }

    public static List<BlockingVerdict> topBySpend(List<BlockingVerdict> verdicts, int limit) {
        return verdicts.stream()
                .sorted(Comparator.comparingDouble(BlockingVerdict::spend).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private List<GroupSummary> summarize(Function<BlockingVerdict, String> key) {
        List<BlockingVerdict> verdicts = analysisResult.verdicts();
        Map<String, List<BlockingVerdict>> groups = verdicts.stream()
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.toList()));

        return groups.entrySet().stream()
                .map(e -> new GroupSummary(
                        e.getKey(),
                        e.getValue().size(),
                        percent(e.getValue().size(), verdicts.size()),
                        totalSpend(e.getValue())))
                .collect(Collectors.toList());
    }

    private Optional<Double> averageEffectiveCpa() {
        Set<String> effective = new HashSet<>(analysisResult.segmentation().effective());
        return averageCpa(analysisResult.records().stream()
                .filter(r -> effective.contains(r.placement()))
                .collect(Collectors.toList()));
    }

    private Optional<Double> averageBlockedCpa() {
        return averageCpa(analysisResult.verdicts().stream()
                .map(BlockingVerdict::record)
                .collect(Collectors.toList()));
    }

    private static Optional<Double> averageCpa(List<PlacementRecord> records) {
        List<PlacementRecord> converting = records.stream()
                .filter(PlacementRecord::hasConversions)
                .collect(Collectors.toList());
        if (converting.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(converting.stream()
                .mapToDouble(r -> Math.max(r.costPerConversion(), 0))
                .average()
                .orElse(0));
    }

    private static List<BlockingVerdict> withPriority(List<BlockingVerdict> verdicts, BlockingPriority priority) {
        return verdicts.stream().filter(v -> v.hasPriority(priority)).collect(Collectors.toList());
    }

    private static List<BlockingVerdict> ofType(List<BlockingVerdict> verdicts, PlatformType type) {
        return verdicts.stream().filter(v -> v.platformType() == type).collect(Collectors.toList());
    }

    private static double totalSpend(List<BlockingVerdict> verdicts) {
        return verdicts.stream().mapToDouble(BlockingVerdict::spend).sum();
    }

    private static double percent(int count, int total) {
        return total == 0 ? 0 : count * 100.0 / total;
    }

    private static double percentOf(double part, double total) {
        return total == 0 ? 0 : part * 100.0 / total;
    }

    private static void line(StringBuilder report, String text) {
        report.append(text).append("\n");
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        Segmentation segments = analysisResult.segmentation();

        report.setAnalysisMetadata(new AnalysisMetadata(
                timestamp,
                analysisResult.records().size(),
                analysisResult.verdicts().size(),
                analysisResult.blockedSpend()
        ));
        report.setStatistics(analysisResult.statistics());
        report.setThresholds(analysisResult.thresholds());
        report.setBlockedPlacements(analysisResult.verdicts().stream()
                .map(BlockedPlacementRow::from)
                .collect(Collectors.toList()));
        report.setSegments(new SegmentLists(segments.effective(), segments.medium(), segments.ineffective()));
        report.setCriteria(summarizeByCriterion());
        report.setPlatformTypes(summarizeByPlatformType());
        return report;
    }

    /**
     * Count, share of all blocked placements (percent) and spend of one group of verdicts.
     */
    public record GroupSummary(String key, int count, double share, double spend) {}

    @lombok.Data
    @JsonPropertyOrder({"placement", "type", "blockingReason", "criterion", "priority", "impressions", "clicks",
            "ctr", "conversions", "costPerConversion", "spend", "bounceRate", "depth", "deviation",
            "justification", "recommendation", "features"})
    static class BlockedPlacementRow {
        @JsonProperty("placement")
        private String placement;
        @JsonProperty("type")
        private String type;
        @JsonProperty("blockingReason")
        private String blockingReason;
        @JsonProperty("criterion")
        private String criterion;
        @JsonProperty("priority")
        private String priority;
        @JsonProperty("impressions")
        private long impressions;
        @JsonProperty("clicks")
        private long clicks;
        @JsonProperty("ctr")
        private double ctr;
        @JsonProperty("conversions")
        private long conversions;
        @JsonProperty("costPerConversion")
        private double costPerConversion;
        @JsonProperty("spend")
        private double spend;
        @JsonProperty("bounceRate")
        private double bounceRate;
        @JsonProperty("depth")
        private double depth;
        @JsonProperty("deviation")
        private String deviation;
        @JsonProperty("justification")
        private String justification;
        @JsonProperty("recommendation")
        private String recommendation;
        @JsonProperty("features")
        private String features;

        static BlockedPlacementRow from(BlockingVerdict verdict) {
            PlacementRecord record = verdict.record();
            BlockedPlacementRow row = new BlockedPlacementRow();
            row.setPlacement(record.placement());
            row.setType(verdict.platformType().getDisplayName());
            row.setBlockingReason(verdict.reason());
            row.setCriterion(verdict.criterionId());
            row.setPriority(verdict.priority().getDisplayName());
            row.setImpressions(record.impressions());
            row.setClicks(record.clicks());
            row.setCtr(record.ctr());
            row.setConversions(record.conversions());
            row.setCostPerConversion(record.costPerConversion() > 0 ? record.costPerConversion() : 0);
            row.setSpend(record.spend());
            row.setBounceRate(record.bounceRate());
            row.setDepth(record.depth());
            row.setDeviation(verdict.deviation());
            row.setJustification(verdict.justification());
            row.setRecommendation(verdict.action().getLabel());
            row.setFeatures(String.join(", ", verdict.features()));
            return row;
        }
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private AnalysisMetadata analysisMetadata;
        private AggregateStatistics statistics;
        private BlockingThresholds thresholds;
        private List<GroupSummary> criteria;
        private List<GroupSummary> platformTypes;
        private SegmentLists segments;
        private List<BlockedPlacementRow> blockedPlacements;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class AnalysisMetadata {
        private LocalDateTime timestamp;
        private int totalPlacementsAnalyzed;
        private int placementsToBlock;
        private double potentialSavings;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class SegmentLists {
        private List<String> effective;
        private List<String> medium;
        private List<String> ineffective;
    }
}
