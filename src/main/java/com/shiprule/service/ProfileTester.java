package com.shiprule.service;

import com.shiprule.condition.ConditionEvaluator;
import com.shiprule.config.ShippingProfile;
import com.shiprule.core.MatchRecord;
import com.shiprule.core.MatchRecordFactory;
import com.shiprule.cost.CostContext;
import com.shiprule.cost.CostRuleEvaluator;
import com.shiprule.variable.DefaultVariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dry-runs a candidate profile against synthetic test data.
 * <p>
 * All test values feed the match record; numeric ones (numeric strings included) also
 * become cost variables such as {@code group_subtotal} or {@code quantity}.
 */
public class ProfileTester {

    private static final Logger log = LoggerFactory.getLogger(ProfileTester.class);

    private final ConditionEvaluator conditionEvaluator;
    private final CostRuleEvaluator costRuleEvaluator;

    public ProfileTester(ConditionEvaluator conditionEvaluator, CostRuleEvaluator costRuleEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
        this.costRuleEvaluator = costRuleEvaluator;
    }

    /**
     * Test a profile against test data given as a map.
     */
    public ProfileTestResult test(ShippingProfile profile, Map<String, ?> testData) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (testData != null) {
            testData.forEach((key, value) -> {
                if (key != null && value != null) {
                    data.put(key, value);
                }
            });
        }

        MatchRecord record = MatchRecordFactory.fromMap(data);
        boolean matched = conditionEvaluator.evaluate(profile.matchConditions(), record);
        if (!matched) {
            log.debug("Profile {} did not match test data", profile.id());
            return ProfileTestResult.notMatched();
        }

        CostContext.Builder context = CostContext.builder();
        data.forEach((key, value) ->
                DefaultVariableResolver.convertToDouble(value).ifPresent(number -> context.variable(key, number)));
        double cost = costRuleEvaluator.evaluate(profile.costRule(), context.build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("match_conditions", profile.matchConditions());
        details.put("cost_rule", profile.costRule());
        details.put("test_data", data);
        log.debug("Profile {} matched test data, cost {}", profile.id(), cost);
        return new ProfileTestResult(true, cost, details);
    }

    /**
     * Test a profile against test data given as a JSON object.
     *
     * @throws IllegalArgumentException if the JSON is invalid
     */
    public ProfileTestResult test(ShippingProfile profile, String testDataJson) {
        return test(profile, MatchRecordFactory.parseJson(testDataJson));
    }
}
