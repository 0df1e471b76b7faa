package org.carball.placement.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.placement.analyzer.PlacementAnalyzer;
import org.carball.placement.model.analysis.AnalysisResult;
import org.carball.placement.model.placement.PlacementRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class BlockingReportTest {

    private static final LocalDateTime GENERATED_AT = LocalDateTime.of(2024, 3, 1, 10, 0);

    private BlockingReport report;

    @BeforeEach
    void setUp() {
        AnalysisResult result = new PlacementAnalyzer().analyze(List.of(
                placement("fraud.ru", 1000, 600, 60.0, 30.0, 0, 0),
                placement("com.example.app", 5, 25, 18.0, 20.0, 0, 0),
                placement("yandex.ru", 1000, 700, 70.0, 40.0, 0, 0),
                placement("news-portal.ru", 5000, 50, 1.0, 20.0, 2, 10.0)));
        report = new BlockingReport(result, GENERATED_AT);
    }

    @Test
    void shouldWriteOneCsvRowPerBlockedPlacement() {
        // When
        String csv = report.toCsv();

        // Then
        String[] lines = csv.split("\n");
        assertThat(lines).hasSize(4);
        assertThat(lines[0]).isEqualTo("placement;type;blockingReason;criterion;priority;impressions;clicks;ctr;"
                + "conversions;costPerConversion;spend;bounceRate;depth;deviation;justification;recommendation;features");
        assertThat(lines[1]).startsWith("fraud.ru;Site;");
        assertThat(lines[1]).contains("BLOCK IMMEDIATELY");
        assertThat(lines[2]).startsWith("com.example.app;").contains("Mobile app").doesNotContain("IMMEDIATELY");
    }

    @Test
    void shouldSummarizeByCriterionInIdOrder() {
        // When
        List<BlockingReport.GroupSummary> criteria = report.summarizeByCriterion();

        // Then
        assertThat(criteria).extracting(BlockingReport.GroupSummary::key).containsExactly("2.2a", "2.5");
        assertThat(criteria.get(0).count()).isEqualTo(2);
        assertThat(criteria.get(0).spend()).isCloseTo(70.0, within(1e-9));
        assertThat(criteria.get(1).share()).isCloseTo(100.0 / 3, within(1e-9));
    }

    @Test
    void shouldRenderAllTextSections() {
        // When
        String text = report.toText();

        // Then
        assertThat(text).contains(
                "1. GENERAL STATISTICS",
                "2. FINANCIAL ASSESSMENT",
                "3. DISTRIBUTION BY BLOCKING CRITERION",
                "4. DISTRIBUTION BY PLATFORM TYPE",
                "5. TOP-10 MOST EXPENSIVE INEFFECTIVE PLACEMENTS",
                "6. RECOMMENDATIONS");
        assertThat(text).contains("Generated: 2024-03-01T10:00:00");
        assertThat(text).contains("Placements analyzed: 4");
        assertThat(text).contains("Placements to block: 3 (75.0%)");
        assertThat(text).contains("Category A (Effective): 1 (25.0%)", "Category C (Ineffective): 3 (75.0%)");
        assertThat(text).contains("Spend on ineffective placements: 90.00");
        assertThat(text).contains("Average cost per conversion on effective placements: 10.00");
        assertThat(text).contains("Average cost per conversion on ineffective placements: no conversions");
        assertThat(text).contains("Criterion 2.2a: 2 placements (66.7%), spend 70.00");
        assertThat(text).contains("Mobile app: 1 placements (33.3%), spend 20.00");
    }

    @Test
    void shouldRecommendByPriorityAndPlatform() {
        // When
        String text = report.toText();

        // Then
        assertThat(text).contains("1. CRITICAL priority: 2 placements - block IMMEDIATELY");
        assertThat(text).contains("2. HIGH priority: 0 placements - block after review");
        assertThat(text).contains("TOP-10 MOBILE APPS BY SPEND:", "  - com.example.app: 20.00, CTR 18.00%");
        assertThat(text).contains("WARNING: Yandex placements are usually of good quality");
        assertThat(text).doesNotContain("DSP PLACEMENTS:");
        assertThat(text.indexOf("yandex.ru: 40.00")).isLessThan(text.indexOf("fraud.ru: 30.00"));
    }

    @Test
    void shouldReportNoBlockingWhenNothingMatches() {
        // Given
        AnalysisResult clean = new PlacementAnalyzer().analyze(List.of(
                placement("news-portal.ru", 5000, 50, 1.0, 20.0, 2, 10.0)));

        // When
        String text = new BlockingReport(clean, GENERATED_AT).toText();

        // Then
        assertThat(text).contains("No placements to block were found.");
        assertThat(text).contains("Placements to block: 0 (0.0%)");
        assertThat(text).doesNotContain("BLOCKING PRIORITY:");
    }

    @Test
    void shouldGenerateStructuredJson() throws Exception {
        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.path("analysisMetadata").path("timestamp").asText()).isEqualTo("2024-03-01T10:00:00");
        assertThat(json.path("analysisMetadata").path("totalPlacementsAnalyzed").asInt()).isEqualTo(4);
        assertThat(json.path("analysisMetadata").path("placementsToBlock").asInt()).isEqualTo(3);
        assertThat(json.path("analysisMetadata").path("potentialSavings").asDouble()).isCloseTo(90.0, within(1e-9));
        assertThat(json.path("thresholds").path("fraud_ctr").asDouble()).isEqualTo(50.0);
        assertThat(json.path("thresholds").has("configurationSummary")).isFalse();
        assertThat(json.path("statistics").path("averageCpa").asDouble()).isCloseTo(10.0, within(1e-9));
        assertThat(json.path("segments").path("effective").get(0).asText()).isEqualTo("news-portal.ru");
        assertThat(json.path("criteria").get(0).path("key").asText()).isEqualTo("2.2a");
        assertThat(json.path("blockedPlacements")).hasSize(3);
        assertThat(json.path("blockedPlacements").get(1).path("criterion").asText()).isEqualTo("2.5");
    }

    private static PlacementRecord placement(String name, long impressions, long clicks, double ctr,
                                             double spend, long conversions, double costPerConversion) {
        return PlacementRecord.builder()
                .placement(name)
                .placementType("Site")
                .impressions(impressions)
                .clicks(clicks)
                .ctr(ctr)
                .spend(spend)
                .averageCpc(0.4)
                .bounceRate(20.0)
                .depth(3.0)
                .conversions(conversions)
                .costPerConversion(costPerConversion)
                .build();
    }
}
