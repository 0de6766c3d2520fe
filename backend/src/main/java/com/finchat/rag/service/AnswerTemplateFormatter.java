package com.finchat.rag.service;

import com.finchat.rag.config.AnswerTemplateConfigLoader;
import com.finchat.rag.model.AnswerTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic text for handler results when no generated summary is available.
 * Every field of the result is listed, so nothing the handler returned is lost.
 */
@Component
@Slf4j
public class AnswerTemplateFormatter {

    static final String DEFAULT_UNAVAILABLE =
            "Sorry, I couldn't fetch that information right now. Please try again in a little while.";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([\\w.\\[\\]]+)}");

    private final AnswerTemplateConfigLoader templateConfig;

    public AnswerTemplateFormatter(AnswerTemplateConfigLoader templateConfig) {
        this.templateConfig = templateConfig;
    }

    public String format(String intent, Map<String, Object> data) {
        Map<String, String> fields = flatten(data);

        StringBuilder answer = new StringBuilder();
        answer.append(headline(intent, fields)).append("\n\nDetails:\n");
        fields.forEach((label, value) ->
                answer.append("- ").append(label).append(": ").append(value).append("\n"));
        return answer.toString().trim();
    }

    public String unavailable(String intent) {
        AnswerTemplate template = templateConfig.getTemplate(intent);
        if (template != null && template.getUnavailable() != null && !template.getUnavailable().isBlank()) {
            return template.getUnavailable();
        }
        return DEFAULT_UNAVAILABLE;
    }

    /**
     * Flattens nested maps into dotted labels and lists into indexed labels, in result order.
     */
    static Map<String, String> flatten(Map<String, Object> data) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((key, value) -> flattenInto(fields, key, value));
        }
        return fields;
    }

    @SuppressWarnings("unchecked")
    private static void flattenInto(Map<String, String> fields, String label, Object value) {
        if (value instanceof Map) {
            Map<String, Object> nested = (Map<String, Object>) value;
            if (nested.isEmpty()) {
                fields.put(label, "-");
            }
            nested.forEach((key, child) -> flattenInto(fields, label + "." + key, child));
        } else if (value instanceof List) {
            List<Object> items = (List<Object>) value;
            if (items.isEmpty()) {
                fields.put(label, "-");
            }
            for (int i = 0; i < items.size(); i++) {
                flattenInto(fields, label + "[" + i + "]", items.get(i));
            }
        } else {
            fields.put(label, formatValue(value));
        }
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "-";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof BigInteger) {
            return String.format(Locale.ENGLISH, "%,d", value);
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                // through BigDecimal so values past the long range keep their digits
                return String.format(Locale.ENGLISH, "%,d", BigDecimal.valueOf(number).toBigInteger());
            }
            return String.format(Locale.ENGLISH, "%,.2f", number);
        }
        return value.toString();
    }

    private String headline(String intent, Map<String, String> fields) {
        AnswerTemplate template = templateConfig.getTemplate(intent);
        if (template != null && template.getHeadline() != null) {
            Matcher matcher = PLACEHOLDER.matcher(template.getHeadline());
            StringBuilder filled = new StringBuilder();
            boolean complete = true;
            while (matcher.find()) {
                String value = fields.get(matcher.group(1));
                if (value == null) {
                    complete = false;
                    break;
                }
                matcher.appendReplacement(filled, Matcher.quoteReplacement(value));
            }
            if (complete) {
                matcher.appendTail(filled);
                return filled.toString();
            }
            log.debug("Template for {} references fields missing from the result, using generic headline", intent);
        }
        return "Here is what I found for " + intent.replace('_', ' ') + ":";
    }
}
