package com.shiprule.condition;

import com.shiprule.condition.impl.NeverMatchCondition;
import com.shiprule.config.MatchConditionConfig;
import com.shiprule.core.MatchRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultConditionEvaluator and the string conditions it builds.
 */
class DefaultConditionEvaluatorTest {

    private ConditionEvaluator evaluator;
    private MatchRecord record;

    @BeforeEach
    void setUp() {
        evaluator = new DefaultConditionEvaluator();
        record = MatchRecord.builder()
                .field("product_title", "2 Plug Adapter")
                .field("quantity", 3)
                .field("total", 50.0)
                .build();
    }

    @ParameterizedTest
    @CsvSource({
            "contains,    plug,        true",
            "contains,    PLUG,        true",
            "contains,    socket,      false",
            "equals,      2 plug adapter, true",
            "equals,      2 plug,      false",
            "starts_with, 2 PLUG,      true",
            "starts-with, 2 plug,      true",
            "ends_with,   adapter,     true",
            "ends_with,   plug,        false",
            "regex,       ^\\d+ plug,  true",
            "regex,       ^plug,       false"
    })
    @DisplayName("Should evaluate operators case-insensitively by default")
    void shouldEvaluateOperators(String operator, String value, boolean expected) {
        MatchConditionConfig config = new MatchConditionConfig("product_title", operator, value, false);

        assertEquals(expected, evaluator.evaluate(config, record));
    }

    @Test
    @DisplayName("Should respect case sensitivity when requested")
    void shouldRespectCaseSensitivity() {
        assertFalse(evaluator.evaluate(new MatchConditionConfig("product_title", "contains", "PLUG", true), record));
        assertTrue(evaluator.evaluate(new MatchConditionConfig("product_title", "contains", "Plug", true), record));
        assertFalse(evaluator.evaluate(new MatchConditionConfig("product_title", "regex", "plug", true), record));
    }

    @Test
    @DisplayName("Should lower-case the regex pattern when case-insensitive")
    void shouldLowerCaseRegexPattern() {
        MatchConditionConfig lowered = MatchConditionConfig.regex("product_title", "^\\D");
        MatchConditionConfig exact = new MatchConditionConfig("product_title", "regex", "^\\D", true);

        assertTrue(evaluator.evaluate(lowered, record));
        assertFalse(evaluator.evaluate(exact, record));
    }

    @Test
    @DisplayName("Should match any present field with an empty contains value")
    void shouldMatchEmptyContains() {
        assertTrue(evaluator.evaluate(MatchConditionConfig.contains("product_title", ""), record));
        assertTrue(evaluator.evaluate(MatchConditionConfig.contains("missing", ""), record));
    }

    @Test
    @DisplayName("Should treat a missing field as the empty string")
    void shouldTreatMissingFieldAsEmpty() {
        assertFalse(evaluator.evaluate(MatchConditionConfig.contains("variant_title", "red"), record));
        assertTrue(evaluator.evaluate(MatchConditionConfig.equalTo("variant_title", ""), record));
    }

    @Test
    @DisplayName("Should compare numeric fields by their text")
    void shouldStringifyNumbers() {
        assertTrue(evaluator.evaluate(MatchConditionConfig.equalTo("quantity", "3"), record));
        assertTrue(evaluator.evaluate(MatchConditionConfig.equalTo("total", "50.0"), record));
    }

    @Test
    @DisplayName("Should fail closed on an invalid regex")
    void shouldFailClosedOnInvalidRegex() {
        MatchConditionConfig config = new MatchConditionConfig("t", "regex", "[invalid(", false);
        MatchRecord x = MatchRecord.builder().field("t", "x").build();

        Condition condition = evaluator.create(config);

        NeverMatchCondition never = assertInstanceOf(NeverMatchCondition.class, condition);
        assertTrue(never.getReason().contains("invalid regex"));
        assertFalse(condition.evaluate(x));
    }

    @Test
    @DisplayName("Should fail closed on an unknown operator")
    void shouldFailClosedOnUnknownOperator() {
        MatchConditionConfig config = new MatchConditionConfig("product_title", "sounds_like", "plug", false);

        assertFalse(evaluator.evaluate(config, record));
        assertEquals(ConditionType.NEVER_MATCH, evaluator.create(config).getType());
    }

    @Test
    @DisplayName("Should never throw for odd inputs")
    void shouldNeverThrow() {
        MatchRecord empty = MatchRecord.builder().build();

        assertDoesNotThrow(() -> evaluator.evaluate(null, record));
        assertDoesNotThrow(() -> evaluator.evaluate(new MatchConditionConfig(null, null, null, false), empty));
        assertDoesNotThrow(() -> evaluator.evaluate(MatchConditionConfig.regex("x", "(((("), empty));
        assertFalse(evaluator.evaluate(null, record));
    }

    @Test
    @DisplayName("Should default the operator to contains")
    void shouldDefaultOperatorToContains() {
        MatchConditionConfig config = new MatchConditionConfig("product_title", null, "adapter", false);

        assertEquals("contains", config.operator());
        assertTrue(evaluator.evaluate(config, record));
    }
}
