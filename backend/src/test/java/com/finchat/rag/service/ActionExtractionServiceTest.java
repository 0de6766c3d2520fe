package com.finchat.rag.service;

import com.finchat.rag.client.GenerationBackend;
import com.finchat.rag.exception.GenerationUnavailableException;
import com.finchat.rag.model.GenerationRequest;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RouteDecision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActionExtractionServiceTest {

    private static final List<String> ACTIONS = List.of("get_stock_price", "calculate_sip");

    @Mock
    private GenerationBackend generationBackend;

    @Test
    void detectedActionBecomesModelDecision() {
        when(generationBackend.generate(any())).thenReturn(
                "```json\n{\"action\": \"calculate_sip\", \"parameters\": {\"monthly_sip\": 2000, \"years\": 5}}\n```");

        Optional<RouteDecision> decision = service(true).detect(Query.of("grow 2000 a month for five years", null), ACTIONS);

        assertThat(decision).isPresent();
        assertThat(decision.get().getIntent()).isEqualTo("calculate_sip");
        assertThat(decision.get().getSource()).isEqualTo(RouteDecision.Source.LLM);
        assertThat(decision.get().getRank()).isEqualTo(-1);
        assertThat(decision.get().getParams()).containsEntry("monthly_sip", 2000).containsEntry("years", 5);

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationBackend).generate(request.capture());
        assertThat(request.getValue().isJsonMode()).isTrue();
        assertThat(request.getValue().getMaxTokens()).isEqualTo(300);
        assertThat(request.getValue().getPrompt()).contains("get_stock_price, calculate_sip");
    }

    @Test
    void noneOrUnknownActionIsIgnored() {
        ActionExtractionService service = service(true);

        assertThat(service.parse("{\"action\": \"none\", \"parameters\": {}}", ACTIONS)).isEmpty();
        assertThat(service.parse("{\"action\": \"book_flight\"}", ACTIONS)).isEmpty();
        assertThat(service.parse("I think you want a SIP", ACTIONS)).isEmpty();
        assertThat(service.parse("{\"action\": ", ACTIONS)).isEmpty();
    }

    @Test
    void generationFailureIsIgnored() {
        when(generationBackend.generate(any())).thenThrow(new GenerationUnavailableException("down"));

        assertThat(service(true).detect(Query.of("hello", null), ACTIONS)).isEmpty();
    }

    @Test
    void disabledServiceNeverCallsTheModel() {
        assertThat(service(false).detect(Query.of("price of tcs", null), ACTIONS)).isEmpty();
        verifyNoInteractions(generationBackend);
    }

    @Test
    void extractsOutermostObject() {
        assertThat(ActionExtractionService.extractJsonObject("Sure! {\"a\": {\"b\": 1}} done"))
                .isEqualTo("{\"a\": {\"b\": 1}}");
        assertThat(ActionExtractionService.extractJsonObject("no json")).isNull();
    }

    private ActionExtractionService service(boolean enabled) {
        return new ActionExtractionService(generationBackend, new PromptBuilderService(), enabled);
    }
}
