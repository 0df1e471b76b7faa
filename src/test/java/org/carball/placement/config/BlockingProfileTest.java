package org.carball.placement.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class BlockingProfileTest {

    @Test
    void balancedProfileShouldKeepDefaults() {
        // When
        BlockingThresholds thresholds = BlockingProfile.BALANCED.buildThresholds();
        BlockingThresholds defaults = BlockingThresholds.defaults();

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("balanced");
        assertThat(thresholds.getZeroConversionMinSpend()).isEqualTo(defaults.getZeroConversionMinSpend());
        assertThat(thresholds.getZeroConversionMinClicks()).isEqualTo(defaults.getZeroConversionMinClicks());
        assertThat(thresholds.getYandexLeniencyCoefficient()).isEqualTo(1.5);
        assertThat(thresholds.getCpaMultiplier()).isEqualTo(2.5);
    }

    @Test
    void strictProfileShouldBlockEarlier() {
        // When
        BlockingThresholds thresholds = BlockingProfile.STRICT.buildThresholds();

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
        assertThat(thresholds.getZeroConversionMinSpend()).isCloseTo(30.0, within(1e-9));
        assertThat(thresholds.getSuspiciousAppSpend()).isCloseTo(18.0, within(1e-9));
        assertThat(thresholds.getComDomainSpend()).isCloseTo(18.0, within(1e-9));
        assertThat(thresholds.getZeroConversionMinClicks()).isEqualTo(5);
        assertThat(thresholds.getEngagementMinClicks()).isEqualTo(10);
        assertThat(thresholds.getYandexLeniencyCoefficient()).isEqualTo(1.25);
        assertThat(thresholds.getHighCtr()).isEqualTo(8.0);
        assertThat(thresholds.getCpaMultiplier()).isEqualTo(2.0);
    }

    @Test
    void lenientProfileShouldBlockLater() {
        // When
        BlockingThresholds thresholds = BlockingProfile.LENIENT.buildThresholds();

        // Then
        assertThat(thresholds.getZeroConversionMinSpend()).isCloseTo(75.0, within(1e-9));
        assertThat(thresholds.getZeroConversionMinClicks()).isEqualTo(20);
        assertThat(thresholds.getEngagementMinClicks()).isEqualTo(40);
        assertThat(thresholds.getYandexLeniencyCoefficient()).isEqualTo(2.0);
        assertThat(thresholds.getCpaMultiplier()).isEqualTo(3.0);
    }

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(BlockingProfile.fromName("STRICT")).isEqualTo(BlockingProfile.STRICT);
        assertThat(BlockingProfile.fromName("Lenient")).isEqualTo(BlockingProfile.LENIENT);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> BlockingProfile.fromName("aggressive"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown blocking profile: aggressive. Available profiles: balanced, strict, lenient");
    }

    @Test
    void shouldListProfilesInHelp() {
        // When
        String help = BlockingProfile.getProfileHelp();

        // Then
        assertThat(help).contains("balanced", "strict", "lenient", "--profile");
    }
}
