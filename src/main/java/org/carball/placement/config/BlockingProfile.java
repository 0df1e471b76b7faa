package org.carball.placement.config;

import lombok.Getter;

@Getter
public enum BlockingProfile {

    BALANCED("balanced", "Default criteria - block clear offenders only",
            1.0, 1.0, 1.5),

    STRICT("strict", "Block earlier - lower spend and click minimums, less leniency for Yandex placements",
            0.6, 0.5, 1.25) {
        @Override
        public BlockingThresholds buildThresholds() {
            BlockingThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .highCtr(8.0)
                    .cpaMultiplier(2.0)
                    .build();
        }
    },

    LENIENT("lenient", "Block later - higher spend and click minimums, more leniency for Yandex placements",
            1.5, 2.0, 2.0) {
        @Override
        public BlockingThresholds buildThresholds() {
            BlockingThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .cpaMultiplier(3.0)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double spendMultiplier;
    private final double clickMultiplier;
    private final double leniencyCoefficient;

    BlockingProfile(String name, String description,
                    double spendMultiplier, double clickMultiplier, double leniencyCoefficient) {
        this.name = name;
        this.description = description;
        this.spendMultiplier = spendMultiplier;
        this.clickMultiplier = clickMultiplier;
        this.leniencyCoefficient = leniencyCoefficient;
    }

    /**
     * Creates BlockingThresholds based on this profile's settings.
     */
    public BlockingThresholds buildThresholds() {
        BlockingThresholds defaults = BlockingThresholds.defaults();

        return defaults.toBuilder()
                .profileName(name)
                .profileDescription(description)
                .yandexLeniencyCoefficient(leniencyCoefficient)
                .zeroConversionMinSpend(defaults.getZeroConversionMinSpend() * spendMultiplier)
                .suspiciousAppSpend(defaults.getSuspiciousAppSpend() * spendMultiplier)
                .comDomainSpend(defaults.getComDomainSpend() * spendMultiplier)
                .zeroConversionMinClicks(Math.round(defaults.getZeroConversionMinClicks() * clickMultiplier))
                .engagementMinClicks(Math.round(defaults.getEngagementMinClicks() * clickMultiplier))
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static BlockingProfile fromName(String name) {
        for (BlockingProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown blocking profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (BlockingProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Blocking Profiles:\n\n");
        for (BlockingProfile profile : values()) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile, or --help-thresholds for detailed threshold information.\n");
        return help.toString();
    }
}
