package com.finchat.rag.service.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AmountParserTest {

    @Test
    void scalesIndianUnits() {
        assertThat(AmountParser.firstAmount("loan of 50 lakh")).isEqualTo(5_000_000L);
        assertThat(AmountParser.firstAmount("1.5 cr home")).isEqualTo(15_000_000L);
        assertThat(AmountParser.firstAmount("2 crore")).isEqualTo(20_000_000L);
        assertThat(AmountParser.firstAmount("25k per month")).isEqualTo(25_000L);
        assertThat(AmountParser.firstAmount("250000 rupees")).isEqualTo(250_000L);
    }

    @Test
    void returnsNullWithoutDigits() {
        assertThat(AmountParser.firstAmount("no numbers here")).isNull();
    }
}
