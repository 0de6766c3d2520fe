package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PortfolioExtractorTest {

    private final PortfolioExtractor extractor = new PortfolioExtractor();

    @Test
    void ageIsNotMistakenForTheAmount() {
        assertThat(extractor.extract(Query.of("I am 28 and have 2 lakh, build an aggressive portfolio", null)))
                .containsEntry("age", 28)
                .containsEntry("investment_amount", 200_000L)
                .containsEntry("risk_appetite", "aggressive");
    }

    @Test
    void appliesDefaults() {
        assertThat(extractor.extract(Query.of("suggest a portfolio", null)))
                .containsEntry("age", PortfolioExtractor.DEFAULT_AGE)
                .containsEntry("investment_amount", PortfolioExtractor.DEFAULT_INVESTMENT)
                .containsEntry("risk_appetite", PortfolioExtractor.DEFAULT_RISK);
    }

    @Test
    void detectsConservativeRisk() {
        assertThat(extractor.extract(Query.of("safe portfolio for 50k", null)))
                .containsEntry("risk_appetite", "conservative")
                .containsEntry("investment_amount", 50_000L);
    }
}
