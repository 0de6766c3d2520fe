package com.finchat.rag.service;

import com.finchat.rag.config.AnswerTemplateConfigLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerTemplateFormatterTest {

    private AnswerTemplateFormatter formatter;

    @BeforeEach
    void setUp() {
        AnswerTemplateConfigLoader templates = new AnswerTemplateConfigLoader("/answer-templates.json");
        templates.load();
        formatter = new AnswerTemplateFormatter(templates);
    }

    @Test
    void fillsHeadlineAndListsEveryField() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("monthly_sip", 5000);
        data.put("years", 10);
        data.put("expected_return", 0.12);
        data.put("maturity_amount", 1161695.38);
        data.put("total_invested", 600000);

        String answer = formatter.format("calculate_sip", data);

        assertThat(answer).startsWith(
                "A monthly SIP of ₹5,000 for 10 years could grow to about ₹1,161,695.38.");
        assertThat(answer).contains("Details:")
                .contains("- monthly_sip: 5,000")
                .contains("- years: 10")
                .contains("- expected_return: 0.12")
                .contains("- maturity_amount: 1,161,695.38")
                .contains("- total_invested: 600,000");
    }

    @Test
    void flattensNestedMapsAndLists() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("investment_amount", 200000);
        data.put("allocation", Map.of("equity", 70));
        data.put("funds", List.of("Index fund", Map.of("name", "Liquid fund")));

        String answer = formatter.format("get_portfolio_recommendation", data);

        assertThat(answer).startsWith("Suggested allocation for an investment of ₹200,000:")
                .contains("- allocation.equity: 70")
                .contains("- funds[0]: Index fund")
                .contains("- funds[1].name: Liquid fund");
    }

    @Test
    void missingPlaceholderFieldUsesGenericHeadline() {
        String answer = formatter.format("get_stock_price", Map.of("symbol", "TCS.NS"));

        assertThat(answer).startsWith("Here is what I found for get stock price:")
                .contains("- symbol: TCS.NS");
    }

    @Test
    void unknownIntentStillListsFields() {
        String answer = formatter.format("gold_rate", Map.of("rate", 6250.456));

        assertThat(answer).contains("- rate: 6,250.46");
    }

    @Test
    void unavailableTextComesFromTemplateOrDefault() {
        assertThat(formatter.unavailable("calculate_emi")).contains("EMI calculator");
        assertThat(formatter.unavailable("gold_rate")).isEqualTo(AnswerTemplateFormatter.DEFAULT_UNAVAILABLE);
    }

    @Test
    void formatsNumbers() {
        assertThat(AnswerTemplateFormatter.formatValue(1234567L)).isEqualTo("1,234,567");
        assertThat(AnswerTemplateFormatter.formatValue(12.5)).isEqualTo("12.50");
        assertThat(AnswerTemplateFormatter.formatValue(5000.0)).isEqualTo("5,000");
        assertThat(AnswerTemplateFormatter.formatValue(null)).isEqualTo("-");
        assertThat(AnswerTemplateFormatter.formatValue(true)).isEqualTo("true");
    }

    @Test
    void wholeNumbersBeyondLongRangeKeepTheirDigits() {
        assertThat(AnswerTemplateFormatter.formatValue(1e20)).isEqualTo("100,000,000,000,000,000,000");
        assertThat(AnswerTemplateFormatter.formatValue(-2.5e19)).isEqualTo("-25,000,000,000,000,000,000");
    }
}
