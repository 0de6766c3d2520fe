package com.finchat.rag.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the core hands back to its caller for every query.
 */
@Value
@Builder
public class FinalAnswer {

    String answer;
    String intent;
    ResponseStrategy strategy;

    // true when a lower fallback tier produced the answer
    boolean fallbackUsed;

    Map<String, Object> data;
    List<String> sources;
}
