package org.carball.placement.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

@Slf4j
public class ConfigurationLoader {

    static final String CLI_PREFIX = "--thresholds.";
    static final String ENV_PREFIX = "PLACEMENT_";

    private static final Map<String, BiConsumer<BlockingThresholds.BlockingThresholdsBuilder, String>> SETTERS =
            new LinkedHashMap<>();

    static {
        SETTERS.put("yandex_leniency_coefficient", (b, v) -> b.yandexLeniencyCoefficient(Double.parseDouble(v)));
        SETTERS.put("fraud_ctr", (b, v) -> b.fraudCtr(Double.parseDouble(v)));
        SETTERS.put("high_ctr", (b, v) -> b.highCtr(Double.parseDouble(v)));
        SETTERS.put("min_ctr_impressions", (b, v) -> b.minCtrImpressions(Long.parseLong(v)));
        SETTERS.put("low_ctr", (b, v) -> b.lowCtr(Double.parseDouble(v)));
        SETTERS.put("low_ctr_min_impressions", (b, v) -> b.lowCtrMinImpressions(Long.parseLong(v)));
        SETTERS.put("cpa_multiplier", (b, v) -> b.cpaMultiplier(Double.parseDouble(v)));
        SETTERS.put("zero_conversion_min_spend", (b, v) -> b.zeroConversionMinSpend(Double.parseDouble(v)));
        SETTERS.put("zero_conversion_min_clicks", (b, v) -> b.zeroConversionMinClicks(Long.parseLong(v)));
        SETTERS.put("cheap_cpc_ratio", (b, v) -> b.cheapCpcRatio(Double.parseDouble(v)));
        SETTERS.put("cheap_cpc_min_ctr", (b, v) -> b.cheapCpcMinCtr(Double.parseDouble(v)));
        SETTERS.put("bounce_multiplier", (b, v) -> b.bounceMultiplier(Double.parseDouble(v)));
        SETTERS.put("max_shallow_depth", (b, v) -> b.maxShallowDepth(Double.parseDouble(v)));
        SETTERS.put("engagement_min_clicks", (b, v) -> b.engagementMinClicks(Long.parseLong(v)));
        SETTERS.put("suspicious_app_ctr", (b, v) -> b.suspiciousAppCtr(Double.parseDouble(v)));
        SETTERS.put("suspicious_app_max_cpc", (b, v) -> b.suspiciousAppMaxCpc(Double.parseDouble(v)));
        SETTERS.put("suspicious_app_cheap_click_ctr", (b, v) -> b.suspiciousAppCheapClickCtr(Double.parseDouble(v)));
        SETTERS.put("suspicious_app_spend", (b, v) -> b.suspiciousAppSpend(Double.parseDouble(v)));
        SETTERS.put("com_domain_spend", (b, v) -> b.comDomainSpend(Double.parseDouble(v)));
        SETTERS.put("effective_min_ctr", (b, v) -> b.effectiveMinCtr(Double.parseDouble(v)));
        SETTERS.put("effective_max_ctr", (b, v) -> b.effectiveMaxCtr(Double.parseDouble(v)));
    }

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public BlockingThresholds loadProfile(String profileName) {
        try {
            BlockingProfile profile = BlockingProfile.fromName(profileName);
            BlockingThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Resolves thresholds in priority order: CLI args > env vars > YAML file > profile > defaults.
     * Both the profile name and the file are optional.
     */
    public BlockingThresholds loadConfiguration(String profileName, Path thresholdsFile, String[] args) {
        BlockingThresholds base = profileName != null ? loadProfile(profileName) : BlockingThresholds.defaults();
        return overlay(base, thresholdsFile, args);
    }

    private BlockingThresholds overlay(BlockingThresholds base, Path thresholdsFile, String[] args) {
        BlockingThresholds.BlockingThresholdsBuilder builder = base.toBuilder();

        if (thresholdsFile != null) {
            applyYamlFile(builder, thresholdsFile);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        BlockingThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    private void applyYamlFile(BlockingThresholds.BlockingThresholdsBuilder builder, Path thresholdsFile) {
        if (!Files.exists(thresholdsFile)) {
            throw new IllegalArgumentException("Threshold config file not found: " + thresholdsFile);
        }

        JsonNode root;
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            root = mapper.readTree(thresholdsFile.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid threshold config file " + thresholdsFile + ": " + e.getMessage(), e);
        }

        if (root == null || !root.isObject()) {
            log.warn("Threshold config file {} is empty, ignoring", thresholdsFile);
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!SETTERS.containsKey(field.getKey())) {
                log.warn("Unknown threshold '{}' in {}", field.getKey(), thresholdsFile);
                continue;
            }
            apply(builder, field.getKey(), field.getValue().asText(), thresholdsFile.toString());
        }
        log.info("Loaded threshold configuration from: {}", thresholdsFile);
    }

    private void applyEnvironmentVariables(BlockingThresholds.BlockingThresholdsBuilder builder) {
        for (String key : SETTERS.keySet()) {
            String variable = toEnvironmentVariable(key);
            if (environment.containsKey(variable)) {
                apply(builder, key, environment.get(variable), variable);
            }
        }
    }

    private void applyCLIArguments(BlockingThresholds.BlockingThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (!arg.startsWith(CLI_PREFIX)) {
                continue;
            }

            String key = arg.substring(CLI_PREFIX.length()).replace('-', '_');
            if (SETTERS.containsKey(key)) {
                apply(builder, key, args[i + 1], arg);
            } else {
                log.warn("Unknown threshold option: {}", arg);
            }
        }
    }

    private void apply(BlockingThresholds.BlockingThresholdsBuilder builder, String key, String value, String source) {
        try {
            SETTERS.get(key).accept(builder, value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    static String toCliOption(String key) {
        return CLI_PREFIX + key.replace('_', '-');
    }

    static String toEnvironmentVariable(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        BlockingThresholds defaults = BlockingThresholds.defaults();
        StringBuilder help = new StringBuilder();
        help.append("Threshold Configuration Options:\n\n");
        help.append("CLI Arguments / Environment Variables:\n");
        for (String key : SETTERS.keySet()) {
            help.append(String.format("  %-44s %-42s\n", toCliOption(key) + " <num>", toEnvironmentVariable(key)));
        }
        help.append("\nYAML file (--thresholds <file.yml>) uses the same keys in snake_case, e.g.\n");
        help.append(String.format(Locale.ROOT, "  cpa_multiplier: %.1f%n", defaults.getCpaMultiplier()));
        help.append(String.format(Locale.ROOT, "  zero_conversion_min_spend: %.1f%n", defaults.getZeroConversionMinSpend()));
        help.append("""

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML threshold file
              4. Profile defaults or built-in defaults
            """);
        return help.toString();
    }
}
