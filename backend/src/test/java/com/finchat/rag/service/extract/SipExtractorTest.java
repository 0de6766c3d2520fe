package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SipExtractorTest {

    private final SipExtractor extractor = new SipExtractor();

    @Test
    void readsAmountInThousandsAndYears() {
        Map<String, Object> params = extractor.extract(Query.of("SIP of 7.5k for 12 years", null));

        assertThat(params)
                .containsEntry("monthly_sip", 7_500L)
                .containsEntry("years", 12)
                .containsEntry("expected_return", SipExtractor.DEFAULT_EXPECTED_RETURN);
    }

    @Test
    void readsPlainAmount() {
        assertThat(extractor.extract(Query.of("monthly sip 15000", null)))
                .containsEntry("monthly_sip", 15_000L)
                .containsEntry("years", SipExtractor.DEFAULT_YEARS);
    }

    @Test
    void appliesDefaultsWhenNothingIsGiven() {
        assertThat(extractor.extract(Query.of("should i start a sip", null)))
                .containsEntry("monthly_sip", SipExtractor.DEFAULT_MONTHLY_SIP)
                .containsEntry("years", SipExtractor.DEFAULT_YEARS);
    }
}
