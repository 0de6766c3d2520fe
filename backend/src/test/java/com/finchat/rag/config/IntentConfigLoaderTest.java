package com.finchat.rag.config;

import com.finchat.rag.exception.ConfigurationException;
import com.finchat.rag.model.DetectionRule;
import com.finchat.rag.model.IntentRule;
import com.finchat.rag.model.RuleTable;
import com.finchat.rag.service.extract.ParameterExtractorRegistry;
import com.finchat.rag.service.extract.QueryTextExtractor;
import com.finchat.rag.service.extract.SipExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentConfigLoaderTest {

    private ParameterExtractorRegistry registry;
    private IntentConfigLoader loader;

    @BeforeEach
    void setUp() {
        registry = new ParameterExtractorRegistry(List.of(new QueryTextExtractor(), new SipExtractor()));
        loader = new IntentConfigLoader(registry, "/rag-intents.json");
    }

    @Test
    void compileOrdersRulesByRank() {
        RuleTable table = loader.compile(List.of(
                rule(20, "second", List.of("b")),
                rule(3, "first", List.of("a"))));

        assertThat(table.getRules()).extracting(DetectionRule::getRank).containsExactly(3, 20);
        assertThat(table.findByIntent("second").getExtractorName()).isEqualTo(QueryTextExtractor.NAME);
    }

    @Test
    void keywordsAreLowerCasedAndTtlIsCompiled() {
        IntentRule sip = new IntentRule(1, "calculate_sip", List.of("SIP"), null, null, null, "sip", 3600L);

        DetectionRule compiled = loader.compile(List.of(sip)).getRules().get(0);

        assertThat(compiled.getKeywords()).containsExactly("sip");
        assertThat(compiled.getCacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(compiled.matches("start a sip of 5000")).isTrue();
    }

    @Test
    void emptyRuleListIsRejected() {
        assertThatThrownBy(() -> loader.compile(List.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void duplicateRankIsRejected() {
        assertThatThrownBy(() -> loader.compile(List.of(
                rule(1, "a", List.of("x")),
                rule(1, "b", List.of("y")))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate rule rank 1");
    }

    @Test
    void missingRankOrNameIsRejected() {
        assertThatThrownBy(() -> loader.compile(List.of(rule(null, "a", List.of("x")))))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> loader.compile(List.of(rule(1, " ", List.of("x")))))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void reservedIntentNameIsRejected() {
        assertThatThrownBy(() -> loader.compile(List.of(rule(1, "unmatched", List.of("x")))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("reserved");
    }

    @Test
    void ruleWithoutTermsIsRejected() {
        assertThatThrownBy(() -> loader.compile(List.of(rule(1, "empty", List.of()))))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidPatternIsRejected() {
        IntentRule broken = new IntentRule(1, "broken", null, List.of("(unclosed"), null, null, null, null);

        assertThatThrownBy(() -> loader.compile(List.of(broken)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid pattern");
    }

    @Test
    void unknownExtractorIsRejected() {
        IntentRule rule = new IntentRule(1, "calc", List.of("calc"), null, null, null, "abacus", null);

        assertThatThrownBy(() -> loader.compile(List.of(rule)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("abacus");
    }

    @Test
    void missingResourceFailsLoad() {
        IntentConfigLoader missing = new IntentConfigLoader(registry, "/no-such-rules.json");

        assertThatThrownBy(missing::load)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedResourceFailsLoad() {
        IntentConfigLoader malformed = new IntentConfigLoader(registry, "/rules/malformed-intents.json");

        assertThatThrownBy(malformed::load).isInstanceOf(ConfigurationException.class);
    }

    private static IntentRule rule(Integer rank, String intent, List<String> keywords) {
        return new IntentRule(rank, intent, keywords, null, null, null, null, null);
    }
}
