package com.example.i18n.locale;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocaleNegotiatorTest {

    private final LocaleNegotiator negotiator = new LocaleNegotiator(List.of("en", "es", "ja"), "en");

    @Test
    void testNegotiate_LocaleFromFirstPathSegment() {
        LocaleMatch match = negotiator.negotiate("/es/indicators/1", "ja");

        assertThat(match.locale()).isEqualTo("es");
        assertThat(match.path()).isEqualTo("/indicators/1");
        assertThat(match.fromPath()).isTrue();
    }

    @Test
    void testNegotiate_BareLocaleSegmentRoutesToRoot() {
        assertThat(negotiator.negotiate("/es", null).path()).isEqualTo("/");
        assertThat(negotiator.negotiate("/es/", null).path()).isEqualTo("/");
    }

    @Test
    void testNegotiate_UnsupportedSegmentKeepsPath() {
        LocaleMatch match = negotiator.negotiate("/fr/page", null);

        assertThat(match.locale()).isEqualTo("en");
        assertThat(match.path()).isEqualTo("/fr/page");
        assertThat(match.fromPath()).isFalse();
    }

    @Test
    void testNegotiate_AcceptLanguageByWeight() {
        LocaleMatch match = negotiator.negotiate("/indicators", "fr-CA;q=0.4, es;q=0.9, en;q=0.8");

        assertThat(match.locale()).isEqualTo("es");
        assertThat(match.path()).isEqualTo("/indicators");
    }

    @Test
    void testPreferredLanguage_PrimarySubtagCaseInsensitive() {
        assertThat(negotiator.preferredLanguage("ES-mx")).isEqualTo("es");
        assertThat(negotiator.preferredLanguage("ja-JP,en;q=0.5")).isEqualTo("ja");
    }

    @Test
    void testPreferredLanguage_EqualWeightsKeepHeaderOrder() {
        assertThat(negotiator.preferredLanguage("es, en")).isEqualTo("es");
        assertThat(negotiator.preferredLanguage("en, es")).isEqualTo("en");
    }

    @Test
    void testPreferredLanguage_UnparsableWeightRanksLast() {
        assertThat(negotiator.preferredLanguage("es;q=abc, ja;q=0.5")).isEqualTo("ja");
    }

    @Test
    void testPreferredLanguage_FallsBackToDefault() {
        assertThat(negotiator.preferredLanguage(null)).isEqualTo("en");
        assertThat(negotiator.preferredLanguage("")).isEqualTo("en");
        assertThat(negotiator.preferredLanguage("de, fr;q=0.8")).isEqualTo("en");
    }
}
