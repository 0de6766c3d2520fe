package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

@Component
public class PortfolioExtractor implements ParameterExtractor {

    static final long DEFAULT_INVESTMENT = 100_000;
    static final int DEFAULT_AGE = 30;
    static final String DEFAULT_RISK = "moderate";

    @Override
    public String name() {
        return "portfolio";
    }

    @Override
    public Map<String, Object> extract(Query query) {
        String q = query.getNormalizedText();

        // age phrases are read first so "i am 25" is not taken as the amount
        Matcher age = RetirementExtractor.CURRENT_AGE.matcher(q);
        int currentAge = DEFAULT_AGE;
        String remainder = q;
        if (age.find()) {
            currentAge = Integer.parseInt(age.group(1));
            remainder = q.substring(0, age.start()) + q.substring(age.end());
        }
        Long amount = AmountParser.firstAmount(remainder);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("investment_amount", amount != null ? amount : DEFAULT_INVESTMENT);
        params.put("age", currentAge);
        params.put("risk_appetite", detectRisk(q));
        return params;
    }

    private static String detectRisk(String q) {
        if (q.contains("aggressive") || q.contains("high risk")) {
            return "aggressive";
        }
        if (q.contains("conservative") || q.contains("low risk") || q.contains("safe")) {
            return "conservative";
        }
        return DEFAULT_RISK;
    }
}
