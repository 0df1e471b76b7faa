package org.carball.placement.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.placement.config.BlockingThresholds;
import org.carball.placement.model.analysis.AggregateStatistics;
import org.carball.placement.model.analysis.BlockingAction;
import org.carball.placement.model.analysis.BlockingPriority;
import org.carball.placement.model.analysis.BlockingVerdict;
import org.carball.placement.model.placement.PlacementRecord;
import org.carball.placement.model.placement.PlatformType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides per placement whether it should be blocked.
 * <p>
 * Rules are evaluated in the order of {@link #RULES} and the first match wins, so a placement
 * gets at most one verdict. Thresholds scaled by the leniency coefficient are relaxed for
 * the network's own placements.
 */
@Slf4j
public class BlockingRuleEngine {

    static final List<BlockingRule> RULES = List.of(
            new BlockingRule("2.2a", "Extremely high CTR (fraudulent traffic)",
                    BlockingPriority.CRITICAL, BlockingAction.BLOCK_IMMEDIATELY, "Extreme CTR",
                    c -> c.record().ctr() >= c.thresholds().getFraudCtr()
                            && c.record().impressions() >= c.thresholds().getMinCtrImpressions(),
                    c -> format("CTR %.2f%% (expected 1-2%%)", c.record().ctr())),

            new BlockingRule("2.2b", "Suspiciously high CTR without conversions",
                    BlockingPriority.HIGH, BlockingAction.BLOCK, "High CTR",
                    c -> c.isInHighCtrBand() && !c.record().hasConversions(),
                    c -> format("CTR %.2f%% against expected 1-2%%, conversions = 0", c.record().ctr())),

            new BlockingRule("2.2b+2.1", "High CTR with expensive conversions",
                    BlockingPriority.HIGH, BlockingAction.BLOCK, null,
                    c -> c.isInHighCtrBand() && c.isExpensiveConversion(),
                    c -> format("CTR %.2f%%, cost per conversion %.2f > %.2f",
                            c.record().ctr(), c.record().costPerConversion(), c.cpaLimit())),

            new BlockingRule("2.1A", "High cost per conversion",
                    BlockingPriority.CRITICAL, BlockingAction.BLOCK, null,
                    BlockingRule.Context::isExpensiveConversion,
                    c -> format("Cost per conversion %.2f is %.1fx the average %.2f",
                            c.record().costPerConversion(),
                            c.record().costPerConversion() / c.statistics().averageCpa(),
                            c.statistics().averageCpa())),

            new BlockingRule("2.1B", "No conversions despite significant spend",
                    BlockingPriority.CRITICAL, BlockingAction.BLOCK, null,
                    c -> !c.record().hasConversions()
                            && c.record().spend() >= c.minZeroConversionSpend()
                            && c.record().clicks() >= c.thresholds().getZeroConversionMinClicks(),
                    c -> format("Spend %.2f, clicks %d, conversions = 0", c.record().spend(), c.record().clicks())),

            new BlockingRule("2.3", "Critically low CTR",
                    BlockingPriority.HIGH, BlockingAction.BLOCK, null,
                    c -> c.record().ctr() < c.lowCtrLimit()
                            && c.record().impressions() >= c.thresholds().getLowCtrMinImpressions(),
                    c -> format("CTR %.4f%% < %.2f%%", c.record().ctr(), c.lowCtrLimit())),

            new BlockingRule("2.8", "Suspiciously cheap clicks with high CTR",
                    BlockingPriority.HIGH, BlockingAction.BLOCK, null,
                    c -> c.record().averageCpc() < c.statistics().averageCpc() * c.thresholds().getCheapCpcRatio()
                            && c.record().ctr() > c.thresholds().getCheapCpcMinCtr(),
                    c -> format("CPC %.2f (%.0f%% of average), CTR %.2f%%",
                            c.record().averageCpc(),
                            c.record().averageCpc() / c.statistics().averageCpc() * 100,
                            c.record().ctr())),

            new BlockingRule("2.4", "Low user engagement",
                    BlockingPriority.MEDIUM, BlockingAction.BLOCK, null,
                    c -> (c.record().bounceRate() > c.bounceLimit()
                            || c.record().depth() <= c.thresholds().getMaxShallowDepth())
                            && !c.record().hasConversions()
                            && c.record().clicks() >= c.thresholds().getEngagementMinClicks(),
                    c -> c.record().bounceRate() > c.bounceLimit()
                            ? format("Bounce rate %.2f%% > %.2f%%", c.record().bounceRate(), c.bounceLimit())
                            : format("Page depth %.2f pages", c.record().depth())),

            new BlockingRule("2.5", "Mobile app: suspicious metrics",
                    BlockingPriority.SUPPLEMENTARY, BlockingAction.BLOCK, null,
                    c -> c.platformType() == PlatformType.MOBILE_APP && hasSuspiciousAppSignals(c),
                    BlockingRuleEngine::describeAppSignals),

            new BlockingRule("2.5B", "DSP placement: suspicious metrics",
                    BlockingPriority.SUPPLEMENTARY, BlockingAction.BLOCK, null,
                    c -> c.platformType() == PlatformType.DSP && hasSuspiciousAppSignals(c),
                    BlockingRuleEngine::describeAppSignals),

            new BlockingRule("2.6", ".com domain without conversions despite spend",
                    BlockingPriority.SUPPLEMENTARY, BlockingAction.BLOCK, null,
                    c -> c.platformType() == PlatformType.COM_DOMAIN
                            && !c.record().hasConversions()
                            && c.record().spend() > c.thresholds().getComDomainSpend(),
                    c -> format("Spend %.2f, conversions = 0", c.record().spend()))
    );

    private final BlockingThresholds thresholds;
    private final PlatformTypeClassifier classifier;

    public BlockingRuleEngine() {
        this(BlockingThresholds.defaults());
    }

    public BlockingRuleEngine(BlockingThresholds thresholds) {
        this(thresholds, new PlatformTypeClassifier());
    }

    public BlockingRuleEngine(BlockingThresholds thresholds, PlatformTypeClassifier classifier) {
        this.thresholds = thresholds;
        this.classifier = classifier;
        log.debug("Initialized BlockingRuleEngine with {} rules: {}", RULES.size(), thresholds.getConfigurationSummary());
    }

    public List<BlockingVerdict> evaluate(List<PlacementRecord> records, AggregateStatistics statistics) {
        List<BlockingVerdict> verdicts = new ArrayList<>();
        for (PlacementRecord record : records) {
            evaluate(record, statistics).ifPresent(verdicts::add);
        }

        log.info("Blocking criteria applied to {} placements, {} to block", records.size(), verdicts.size());
        return verdicts;
    }

    public Optional<BlockingVerdict> evaluate(PlacementRecord record, AggregateStatistics statistics) {
        PlatformType platformType = classifier.classify(record.placement());
        BlockingRule.Context context = new BlockingRule.Context(
                record, platformType, leniencyCoefficient(platformType), statistics, thresholds);

        for (BlockingRule rule : RULES) {
            if (rule.matches(context)) {
                log.debug("Placement '{}' matched criterion {}", record.placement(), rule.criterionId());
                return Optional.of(buildVerdict(rule, context));
            }
        }
        return Optional.empty();
    }

    public double leniencyCoefficient(PlatformType platformType) {
        return platformType == PlatformType.YANDEX_NETWORK ? thresholds.getYandexLeniencyCoefficient() : 1.0;
    }

    public List<BlockingRule> getRules() {
        return RULES;
    }

    private BlockingVerdict buildVerdict(BlockingRule rule, BlockingRule.Context context) {
        String deviation = rule.describeDeviation(context);

        List<String> features = new ArrayList<>();
        if (context.platformType() != PlatformType.GENERIC_SITE) {
            features.add(context.platformType().getDisplayName());
        }
        if (rule.feature() != null) {
            features.add(rule.feature());
        }

        return BlockingVerdict.builder()
                .record(context.record())
                .platformType(context.platformType())
                .criterionId(rule.criterionId())
                .reason(rule.reason())
                .priority(rule.priority())
                .action(rule.action())
                .deviation(deviation)
                .justification(buildJustification(rule.reason(), context.record(), deviation))
                .features(List.copyOf(features))
                .build();
    }

    static String buildJustification(String reason, PlacementRecord record, String deviation) {
        StringBuilder justification = new StringBuilder();
        justification.append(reason).append(". ");
        justification.append(format("Impressions: %d, clicks: %d, CTR: %.2f%%, spend: %.2f. ",
                record.impressions(), record.clicks(), record.ctr(), record.spend()));

        if (record.hasConversions()) {
            justification.append(format("Conversions: %d, cost per conversion: %.2f. ",
                    record.conversions(), record.costPerConversion()));
        } else {
            justification.append("Conversions: 0. ");
        }

        justification.append(format("Bounce rate: %.2f%%, depth: %.2f pages. ", record.bounceRate(), record.depth()));
        justification.append(deviation);
        return justification.toString();
    }

    private static boolean hasSuspiciousAppSignals(BlockingRule.Context c) {
        PlacementRecord record = c.record();
        BlockingThresholds t = c.thresholds();
        return (record.ctr() > t.getSuspiciousAppCtr() && !record.hasConversions())
                || (record.averageCpc() < t.getSuspiciousAppMaxCpc() && record.ctr() > t.getSuspiciousAppCheapClickCtr())
                || (record.spend() > t.getSuspiciousAppSpend() && !record.hasConversions());
    }

    private static String describeAppSignals(BlockingRule.Context c) {
        return format("CTR %.2f%%, spend %.2f, conversions = %d",
                c.record().ctr(), c.record().spend(), c.record().conversions());
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
