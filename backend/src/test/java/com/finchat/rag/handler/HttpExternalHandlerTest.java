package com.finchat.rag.handler;

import com.finchat.rag.exception.HandlerException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpExternalHandlerTest {

    private static final String ENDPOINT = "http://market-data.local/stock/price";

    @Test
    void returnsJsonObjectFromEndpoint() {
        HttpExternalHandler handler = handlerReturning(HttpStatus.OK, "{\"symbol\": \"TCS.NS\", \"price\": 3890.5}");

        Map<String, Object> result = handler.execute(Map.of("query", "price of tcs"));

        assertThat(handler.intent()).isEqualTo("get_stock_price");
        assertThat(result).containsEntry("symbol", "TCS.NS").containsEntry("price", 3890.5);
    }

    @Test
    void errorFieldIsAFailure() {
        HttpExternalHandler handler = handlerReturning(HttpStatus.OK, "{\"error\": \"Symbol not found\"}");

        assertThatThrownBy(() -> handler.execute(Map.of("query", "price of xyz")))
                .isInstanceOf(HandlerException.class)
                .hasMessageContaining("Symbol not found");
    }

    @Test
    void serverErrorIsAFailure() {
        HttpExternalHandler handler = handlerReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        assertThatThrownBy(() -> handler.execute(Map.of())).isInstanceOf(HandlerException.class);
    }

    @Test
    void emptyObjectIsAFailure() {
        HttpExternalHandler handler = handlerReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> handler.execute(Map.of())).isInstanceOf(HandlerException.class);
    }

    private static HttpExternalHandler handlerReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new HttpExternalHandler("get_stock_price", ENDPOINT, webClient, Duration.ofSeconds(2));
    }
}
