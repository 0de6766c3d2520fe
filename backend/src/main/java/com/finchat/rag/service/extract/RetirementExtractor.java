package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class RetirementExtractor implements ParameterExtractor {

    static final int DEFAULT_CURRENT_AGE = 30;
    static final int DEFAULT_RETIREMENT_AGE = 60;
    static final long DEFAULT_MONTHLY_EXPENSE = 50_000;

    static final Pattern CURRENT_AGE = Pattern.compile("(?:age|i am|i'm)\\s*(\\d{1,2})");
    private static final Pattern RETIREMENT_AGE = Pattern.compile("(?:retire\\s*at|retirement\\s*age)\\s*(\\d{2})");
    private static final Pattern EXPENSE =
            Pattern.compile("(?:expense|spend|need)\\s*(\\d+(?:\\.\\d+)?)\\s*(k|lakh|lakhs|crore|cr)?");

    @Override
    public String name() {
        return "retirement";
    }

    @Override
    public Map<String, Object> extract(Query query) {
        String q = query.getNormalizedText();
        Matcher age = CURRENT_AGE.matcher(q);
        Matcher retireAt = RETIREMENT_AGE.matcher(q);
        Matcher expense = EXPENSE.matcher(q);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("current_age", age.find() ? Integer.parseInt(age.group(1)) : DEFAULT_CURRENT_AGE);
        params.put("retirement_age", retireAt.find() ? Integer.parseInt(retireAt.group(1)) : DEFAULT_RETIREMENT_AGE);
        params.put("monthly_expense", expense.find()
                ? AmountParser.scale(Double.parseDouble(expense.group(1)), expense.group(2))
                : DEFAULT_MONTHLY_EXPENSE);
        return params;
    }
}
