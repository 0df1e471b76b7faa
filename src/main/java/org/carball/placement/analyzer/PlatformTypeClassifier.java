package org.carball.placement.analyzer;

import org.carball.placement.model.placement.PlatformType;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Maps a placement identifier to its platform type. Rules are checked in order and the first match wins;
 * anything unmatched is a generic site.
 */
public class PlatformTypeClassifier {

    static final List<String> MOBILE_APP_PREFIXES = List.of(
            "com.", "ru.", "by.", "fm.", "org.", "cz.", "net.", "biz.",
            "game.", "afisha.", "asian.", "air.", "and.", "io.", "con.", "tap.");

    private static final String YANDEX_MARKER = "yandex";
    private static final String DZEN_MARKER = "dzen";
    private static final String DZEN_DOMAIN = "dzen.ru";
    private static final String DSP_PREFIX = "dsp-";
    private static final String COM_SUFFIX = ".com";

    private record ClassificationRule(Predicate<String> matches, PlatformType type) {}

    private static final List<ClassificationRule> RULES = List.of(
            new ClassificationRule(id -> id.contains(YANDEX_MARKER) || id.equals(DZEN_DOMAIN), PlatformType.YANDEX_NETWORK),
            new ClassificationRule(id -> id.startsWith(DSP_PREFIX), PlatformType.DSP),
            new ClassificationRule(PlatformTypeClassifier::looksLikeMobileApp, PlatformType.MOBILE_APP),
            new ClassificationRule(id -> id.endsWith(COM_SUFFIX), PlatformType.COM_DOMAIN)
    );

    public PlatformType classify(String placement) {
        String id = placement == null ? "" : placement.toLowerCase(Locale.ROOT);

        for (ClassificationRule rule : RULES) {
            if (rule.matches().test(id)) {
                return rule.type();
            }
        }
        return PlatformType.GENERIC_SITE;
    }

    // A reverse-domain bundle id, unless it is a two-part domain of the network itself
    private static boolean looksLikeMobileApp(String id) {
        boolean hasAppPrefix = MOBILE_APP_PREFIXES.stream().anyMatch(id::startsWith);
        if (!hasAppPrefix) {
            return false;
        }
        boolean networkOwned = id.contains(YANDEX_MARKER) || id.contains(DZEN_MARKER);
        return countDots(id) >= 2 || !networkOwned;
    }

    private static long countDots(String id) {
        return id.chars().filter(c -> c == '.').count();
    }
}
