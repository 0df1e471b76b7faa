package org.carball.placement.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Data
@Builder(toBuilder = true)
@Slf4j
public class BlockingThresholds {

    // Leniency for the network's own inventory
    @Builder.Default
    @JsonProperty("yandex_leniency_coefficient")
    private double yandexLeniencyCoefficient = 1.5;

    // CTR criteria (percent)
    @Builder.Default
    @JsonProperty("fraud_ctr")
    private double fraudCtr = 50.0;

    @Builder.Default
    @JsonProperty("high_ctr")
    private double highCtr = 10.0;

    @Builder.Default
    @JsonProperty("min_ctr_impressions")
    private long minCtrImpressions = 10;

    @Builder.Default
    @JsonProperty("low_ctr")
    private double lowCtr = 0.20;

    @Builder.Default
    @JsonProperty("low_ctr_min_impressions")
    private long lowCtrMinImpressions = 1000;

    // Conversion cost criteria
    @Builder.Default
    @JsonProperty("cpa_multiplier")
    private double cpaMultiplier = 2.5;

    @Builder.Default
    @JsonProperty("zero_conversion_min_spend")
    private double zeroConversionMinSpend = 50.0;

    @Builder.Default
    @JsonProperty("zero_conversion_min_clicks")
    private long zeroConversionMinClicks = 10;

    // Cheap clicks
    @Builder.Default
    @JsonProperty("cheap_cpc_ratio")
    private double cheapCpcRatio = 0.3;

    @Builder.Default
    @JsonProperty("cheap_cpc_min_ctr")
    private double cheapCpcMinCtr = 15.0;

    // Engagement
    @Builder.Default
    @JsonProperty("bounce_multiplier")
    private double bounceMultiplier = 1.2;

    @Builder.Default
    @JsonProperty("max_shallow_depth")
    private double maxShallowDepth = 1.0;

    @Builder.Default
    @JsonProperty("engagement_min_clicks")
    private long engagementMinClicks = 20;

    // Mobile apps and DSP placements
    @Builder.Default
    @JsonProperty("suspicious_app_ctr")
    private double suspiciousAppCtr = 15.0;

    @Builder.Default
    @JsonProperty("suspicious_app_max_cpc")
    private double suspiciousAppMaxCpc = 0.5;

    @Builder.Default
    @JsonProperty("suspicious_app_cheap_click_ctr")
    private double suspiciousAppCheapClickCtr = 20.0;

    @Builder.Default
    @JsonProperty("suspicious_app_spend")
    private double suspiciousAppSpend = 30.0;

    // .com domains
    @Builder.Default
    @JsonProperty("com_domain_spend")
    private double comDomainSpend = 30.0;

    // Segmentation band for effective placements
    @Builder.Default
    @JsonProperty("effective_min_ctr")
    private double effectiveMinCtr = 0.5;

    @Builder.Default
    @JsonProperty("effective_max_ctr")
    private double effectiveMaxCtr = 2.0;

    // Profile information
    @Builder.Default
    @JsonProperty("profile_name")
    private String profileName = "default";

    @Builder.Default
    @JsonProperty("profile_description")
    private String profileDescription = "Default blocking thresholds";

    public static BlockingThresholds defaults() {
        return BlockingThresholds.builder().build();
    }

    /**
     * Validates the threshold configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (yandexLeniencyCoefficient < 1.0) {
            log.warn("Yandex leniency coefficient ({}) should not be below 1.0", yandexLeniencyCoefficient);
        }

        if (highCtr >= fraudCtr) {
            log.warn("High CTR threshold ({}) should be lower than fraud CTR threshold ({})", highCtr, fraudCtr);
        }

        if (lowCtr >= highCtr) {
            log.warn("Low CTR threshold ({}) should be lower than high CTR threshold ({})", lowCtr, highCtr);
        }

        if (cpaMultiplier <= 1.0) {
            log.warn("CPA multiplier ({}) should be greater than 1.0", cpaMultiplier);
        }

        if (cheapCpcRatio <= 0 || cheapCpcRatio >= 1.0) {
            log.warn("Cheap CPC ratio ({}) should be between 0 and 1", cheapCpcRatio);
        }

        if (effectiveMinCtr > effectiveMaxCtr) {
            log.warn("Effective CTR band is empty: min ({}) is greater than max ({})", effectiveMinCtr, effectiveMaxCtr);
        }

        log.debug("Using thresholds - Fraud CTR: {}, High CTR: {}, CPA x{}, Leniency: {}, Profile: {}",
                fraudCtr, highCtr, cpaMultiplier, yandexLeniencyCoefficient, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    @JsonIgnore
    public String getConfigurationSummary() {
        return String.format(Locale.ROOT,
                "Profile: %s | Fraud CTR: %.1f%% | High CTR: %.1f%% | CPA x%.1f | Min spend: %.1f | Leniency: %.2f",
                profileName, fraudCtr, highCtr, cpaMultiplier, zeroConversionMinSpend, yandexLeniencyCoefficient);
    }
}
