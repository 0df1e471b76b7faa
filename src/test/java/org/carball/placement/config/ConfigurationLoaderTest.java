package org.carball.placement.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigurationLoader loader = new ConfigurationLoader(Map.of());

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        BlockingThresholds thresholds = loader.loadConfiguration(null, null, new String[0]);

        // Then
        assertThat(thresholds).isEqualTo(BlockingThresholds.defaults());
    }

    @Test
    void shouldLoadSpecificProfile() {
        // When
        BlockingThresholds thresholds = loader.loadProfile("strict");

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
        assertThat(thresholds.getYandexLeniencyCoefficient()).isEqualTo(1.25);
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown blocking profile: nonexistent");
    }

    @Test
    void shouldApplyCliOverrides() {
        // Given
        String[] args = {"placements.csv", "--thresholds.fraud-ctr", "40", "--thresholds.min-ctr-impressions", "25"};

        // When
        BlockingThresholds thresholds = loader.loadConfiguration(null, null, args);

        // Then
        assertThat(thresholds.getFraudCtr()).isEqualTo(40.0);
        assertThat(thresholds.getMinCtrImpressions()).isEqualTo(25);
        assertThat(thresholds.getHighCtr()).isEqualTo(10.0);
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "PLACEMENT_CPA_MULTIPLIER", "3.5",
                "PLACEMENT_ENGAGEMENT_MIN_CLICKS", "50"));

        // When
        BlockingThresholds thresholds = envLoader.loadConfiguration(null, null, new String[0]);

        // Then
        assertThat(thresholds.getCpaMultiplier()).isEqualTo(3.5);
        assertThat(thresholds.getEngagementMinClicks()).isEqualTo(50);
    }

    @Test
    void shouldPreferCliOverEnvironmentOverYamlOverProfile() throws IOException {
        // Given
        Path yaml = tempDir.resolve("thresholds.yml");
        Files.writeString(yaml, "fraud_ctr: 45\nhigh_ctr: 9\ncpa_multiplier: 2.2\n");
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "PLACEMENT_HIGH_CTR", "7",
                "PLACEMENT_CPA_MULTIPLIER", "2.8"));
        String[] args = {"placements.csv", "--thresholds.cpa-multiplier", "4"};

        // When
        BlockingThresholds thresholds = envLoader.loadConfiguration("lenient", yaml, args);

        // Then
        assertThat(thresholds.getFraudCtr()).isEqualTo(45.0);
        assertThat(thresholds.getHighCtr()).isEqualTo(7.0);
        assertThat(thresholds.getCpaMultiplier()).isEqualTo(4.0);
        assertThat(thresholds.getYandexLeniencyCoefficient()).isEqualTo(2.0);
        assertThat(thresholds.getProfileName()).isEqualTo("lenient");
    }

    @Test
    void shouldIgnoreInvalidNumericOverride() {
        // Given
        String[] args = {"--thresholds.high-ctr", "ten"};

        // When
        BlockingThresholds thresholds = loader.loadConfiguration(null, null, args);

        // Then
        assertThat(thresholds.getHighCtr()).isEqualTo(10.0);
    }

    @Test
    void shouldIgnoreUnknownKeys() throws IOException {
        // Given
        Path yaml = tempDir.resolve("thresholds.yml");
        Files.writeString(yaml, "no_such_threshold: 1\nlow_ctr: 0.1\n");
        String[] args = {"--thresholds.no-such-option", "5"};

        // When
        BlockingThresholds thresholds = loader.loadConfiguration(null, yaml, args);

        // Then
        assertThat(thresholds.getLowCtr()).isEqualTo(0.1);
    }

    @Test
    void shouldLoadExampleThresholdFile() throws URISyntaxException {
        // Given
        Path example = Paths.get(getClass().getResource("/thresholds-example.yml").toURI());

        // When
        BlockingThresholds thresholds = loader.loadConfiguration(null, example, new String[0]);

        // Then
        BlockingThresholds defaults = BlockingThresholds.defaults();
        assertThat(thresholds.getFraudCtr()).isEqualTo(defaults.getFraudCtr());
        assertThat(thresholds.getLowCtr()).isEqualTo(defaults.getLowCtr());
        assertThat(thresholds.getEffectiveMaxCtr()).isEqualTo(defaults.getEffectiveMaxCtr());
    }

    @Test
    void shouldFailForMissingThresholdFile() {
        Path missing = tempDir.resolve("missing.yml");

        assertThatThrownBy(() -> loader.loadConfiguration(null, missing, new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Threshold config file not found");
    }

    @Test
    void shouldMapKeysToOptionsAndVariables() {
        assertThat(ConfigurationLoader.toCliOption("zero_conversion_min_spend"))
                .isEqualTo("--thresholds.zero-conversion-min-spend");
        assertThat(ConfigurationLoader.toEnvironmentVariable("zero_conversion_min_spend"))
                .isEqualTo("PLACEMENT_ZERO_CONVERSION_MIN_SPEND");
        assertThat(ConfigurationLoader.getThresholdHelp())
                .contains("--thresholds.fraud-ctr", "PLACEMENT_FRAUD_CTR");
    }
}
