package com.finchat.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote handler endpoints, one URL per intent:
 * {@code finchat.handlers.endpoints.[get_stock_price]=http://market-data:8081/stock/price}.
 * Keys are bracketed, otherwise binding drops the underscores.
 */
@Data
@ConfigurationProperties(prefix = "finchat.handlers")
public class HandlerProperties {

    private Map<String, String> endpoints = new LinkedHashMap<>();

    private long timeoutMs = 8000;
}
