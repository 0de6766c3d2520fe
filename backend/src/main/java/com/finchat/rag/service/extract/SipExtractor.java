package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class SipExtractor implements ParameterExtractor {

    static final long DEFAULT_MONTHLY_SIP = 5000;
    static final int DEFAULT_YEARS = 10;
    static final double DEFAULT_EXPECTED_RETURN = 0.12;

    private static final Pattern THOUSANDS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*k\\b");
    private static final Pattern PLAIN_AMOUNT = Pattern.compile("(\\d{3,9})");
    private static final Pattern YEARS = Pattern.compile("(\\d{1,2})\\s*(year|years|yrs|y)");

    @Override
    public String name() {
        return "sip";
    }

    @Override
    public Map<String, Object> extract(Query query) {
        String q = query.getNormalizedText();

        long amount = DEFAULT_MONTHLY_SIP;
        Matcher m = THOUSANDS.matcher(q);
        if (m.find()) {
            amount = (long) (Double.parseDouble(m.group(1)) * 1000);
        } else {
            m = PLAIN_AMOUNT.matcher(q);
            if (m.find()) {
                amount = Long.parseLong(m.group(1));
            }
        }

        Matcher years = YEARS.matcher(q);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("monthly_sip", amount);
        params.put("years", years.find() ? Integer.parseInt(years.group(1)) : DEFAULT_YEARS);
        params.put("expected_return", DEFAULT_EXPECTED_RETURN);
        return params;
    }
}
