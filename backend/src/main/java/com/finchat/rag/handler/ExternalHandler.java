package com.finchat.rag.handler;

import com.finchat.rag.exception.HandlerException;

import java.util.Map;

/**
 * Answers one routed intent (price lookup, calculator, portfolio builder...) with a structured result.
 * Timeouts are the handler's own concern and are reported like any other failure.
 */
public interface ExternalHandler {

    String intent();

    /**
     * @throws HandlerException when the handler cannot produce a result for these parameters
     */
    Map<String, Object> execute(Map<String, Object> params);
}
