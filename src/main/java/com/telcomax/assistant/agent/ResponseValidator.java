package com.telcomax.assistant.agent;

import com.telcomax.assistant.model.AgentResponse;
import com.telcomax.assistant.model.Citation;
import com.telcomax.assistant.model.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Cross-checks an account answer before it is shown. Every check runs, so the rejection lists all
 * failing reasons regardless of citation order.
 */
@Component
public class ResponseValidator {

    private static final Logger log = LoggerFactory.getLogger(ResponseValidator.class);

    public static final String MISSING_CITATIONS = "missing citations";
    public static final String LOW_CONFIDENCE = "confidence below threshold";
    public static final String UNVERIFIED_AMOUNT = "unverified amount: ";

    private final double confidenceThreshold;

    public ResponseValidator(
            @Value("${app.validator.confidence-threshold:0.75}") double confidenceThreshold) {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalStateException(
                    "app.validator.confidence-threshold must be within [0,1]: " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    public ValidationResult validate(AgentResponse response) {
        List<String> reasons = new ArrayList<>();

        if (response.citations().isEmpty()) {
            reasons.add(MISSING_CITATIONS);
        }
        if (response.confidence() < confidenceThreshold) {
            reasons.add(LOW_CONFIDENCE);
        }
        for (String amount : CurrencyAmounts.find(response.answer())) {
            boolean quoted = response.citations().stream()
                    .map(Citation::quote)
                    .anyMatch(q -> q != null && q.contains(amount));
            if (!quoted) {
                reasons.add(UNVERIFIED_AMOUNT + amount);
            }
        }

        ValidationResult result = ValidationResult.of(reasons);
        log.info("Validation approved={} citations={} confidence={} reasons={}",
                result.approved(), response.citations().size(), response.confidence(), reasons);
        return result;
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }
}
