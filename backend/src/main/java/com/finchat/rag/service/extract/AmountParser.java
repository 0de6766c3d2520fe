package com.finchat.rag.service.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Indian-style money amounts such as "50 lakh", "1.2 cr" or "10k".
 */
final class AmountParser {

    static final Pattern AMOUNT_WITH_UNIT =
            Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(lakh|lakhs|crore|cr|k)?");

    private AmountParser() {
    }

    /**
     * First amount in the text, scaled by its unit, or null when the text has no number.
     */
    static Long firstAmount(String text) {
        Matcher m = AMOUNT_WITH_UNIT.matcher(text);
        if (!m.find()) {
            return null;
        }
        return scale(Double.parseDouble(m.group(1)), m.group(2));
    }

    static long scale(double value, String unit) {
        String u = unit != null ? unit : "";
        if (u.contains("lakh")) {
            return (long) (value * 100_000);
        }
        if (u.contains("cr")) {
            return (long) (value * 10_000_000);
        }
        if (u.equals("k")) {
            return (long) (value * 1_000);
        }
        return (long) value;
    }
}
