package com.finchat.rag.service.extract;

import com.finchat.rag.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterExtractorRegistryTest {

    @Test
    void looksUpByName() {
        ParameterExtractorRegistry registry =
                new ParameterExtractorRegistry(List.of(new QueryTextExtractor(), new EmiExtractor()));

        assertThat(registry.names()).containsExactly("query", "emi");
        assertThat(registry.get("emi")).isInstanceOf(EmiExtractor.class);
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> new ParameterExtractorRegistry(List.of(new SipExtractor(), new SipExtractor())))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsUnknownName() {
        ParameterExtractorRegistry registry = new ParameterExtractorRegistry(List.of(new QueryTextExtractor()));

        assertThatThrownBy(() -> registry.get("sip")).isInstanceOf(ConfigurationException.class);
    }
}
