package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class EmiExtractor implements ParameterExtractor {

    static final double DEFAULT_INTEREST_RATE = 8.5;
    static final int DEFAULT_TENURE_YEARS = 20;

    private static final Pattern INTEREST = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%");
    private static final Pattern TENURE = Pattern.compile("(\\d{1,2})\\s*(year|years|yrs)");

    @Override
    public String name() {
        return "emi";
    }

    @Override
    public Map<String, Object> extract(Query query) {
        String q = query.getNormalizedText();
        Long amount = AmountParser.firstAmount(q);
        Matcher interest = INTEREST.matcher(q);
        Matcher tenure = TENURE.matcher(q);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("loan_amount", amount != null ? amount : 0L);
        params.put("interest_rate", interest.find() ? Double.parseDouble(interest.group(1)) : DEFAULT_INTEREST_RATE);
        params.put("tenure_years", tenure.find() ? Integer.parseInt(tenure.group(1)) : DEFAULT_TENURE_YEARS);
        return params;
    }
}
