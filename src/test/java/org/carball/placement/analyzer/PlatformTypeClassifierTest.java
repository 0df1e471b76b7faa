package org.carball.placement.analyzer;

import org.carball.placement.model.placement.PlatformType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PlatformTypeClassifierTest {

    private final PlatformTypeClassifier classifier = new PlatformTypeClassifier();

    @Test
    void shouldClassifyNetworkOwnedPlacements() {
        assertThat(classifier.classify("yandex.ru")).isEqualTo(PlatformType.YANDEX_NETWORK);
        assertThat(classifier.classify("Games.Yandex.RU")).isEqualTo(PlatformType.YANDEX_NETWORK);
        assertThat(classifier.classify("dzen.ru")).isEqualTo(PlatformType.YANDEX_NETWORK);
        // network marker wins over an app prefix
        assertThat(classifier.classify("ru.yandex.searchplugin")).isEqualTo(PlatformType.YANDEX_NETWORK);
    }

    @Test
    void shouldClassifyDspPlacements() {
        assertThat(classifier.classify("dsp-adfox")).isEqualTo(PlatformType.DSP);
        assertThat(classifier.classify("DSP-Exchange.com")).isEqualTo(PlatformType.DSP);
    }

    @Test
    void shouldClassifyMobileApps() {
        assertThat(classifier.classify("com.example.app")).isEqualTo(PlatformType.MOBILE_APP);
        assertThat(classifier.classify("air.com.puzzle.game")).isEqualTo(PlatformType.MOBILE_APP);
        assertThat(classifier.classify("org.telegram")).isEqualTo(PlatformType.MOBILE_APP);
    }

    @Test
    void shouldNotTreatTwoPartNetworkDomainAsMobileApp() {
        // app prefix, one dot, network marker but not the network domain itself
        assertThat(classifier.classify("ru.dzen")).isEqualTo(PlatformType.GENERIC_SITE);
    }

    @Test
    void shouldClassifyComDomainsAndGenericSites() {
        assertThat(classifier.classify("example.com")).isEqualTo(PlatformType.COM_DOMAIN);
        assertThat(classifier.classify("news-portal.ru")).isEqualTo(PlatformType.GENERIC_SITE);
        assertThat(classifier.classify("")).isEqualTo(PlatformType.GENERIC_SITE);
        assertThat(classifier.classify(null)).isEqualTo(PlatformType.GENERIC_SITE);
    }

    @Test
    void shouldBeDeterministic() {
        for (String placement : new String[]{"com.example.app", "yandex.ru", "dsp-1", "example.com", "site.ru"}) {
            assertThat(classifier.classify(placement)).isEqualTo(classifier.classify(placement));
        }
    }
}
