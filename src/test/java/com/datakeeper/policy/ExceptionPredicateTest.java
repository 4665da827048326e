package com.datakeeper.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionPredicateTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "metadata.priority == 'high'                      | PRIORITY_HIGH",
            "metadata.priority=='high'                        | PRIORITY_HIGH",
            "metadata.priority == 'high' and enabled          | PRIORITY_HIGH",
            "(metadata.tagged == 'preserve')                  | TAGGED_PRESERVE",
            "metadata.owner == 'ops' or metadata.tagged == 'preserve' | TAGGED_PRESERVE"
    })
    @DisplayName("Should find a supported equality anywhere in the condition")
    void shouldParseContainedEquality(String condition, ExceptionPredicate expected) {
        assertEquals(expected, ExceptionPredicate.parse(condition).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"metadata.size > 10", "metadata.priority == 'low'", "priority == 'high'", ""})
    @DisplayName("Should not parse conditions without a supported equality")
    void shouldRejectUnsupportedConditions(String condition) {
        assertTrue(ExceptionPredicate.parse(condition).isEmpty());
    }

    @Test
    @DisplayName("Should tell a bare equality from a decorated one")
    void shouldDetectWholeCondition() {
        assertTrue(ExceptionPredicate.PRIORITY_HIGH.isWholeCondition(" metadata.priority == 'high' "));
        assertTrue(ExceptionPredicate.PRIORITY_HIGH.isWholeCondition("metadata.priority == \"high\""));
        assertFalse(ExceptionPredicate.PRIORITY_HIGH.isWholeCondition("metadata.priority == 'high' and enabled"));
    }

    @Test
    @DisplayName("Should compare metadata values as strings")
    void shouldTestMetadata() {
        assertTrue(ExceptionPredicate.TAGGED_PRESERVE.test(Map.of("tagged", "preserve")));
        assertFalse(ExceptionPredicate.TAGGED_PRESERVE.test(Map.of("tagged", "archive")));
        assertFalse(ExceptionPredicate.TAGGED_PRESERVE.test(Map.of()));
    }
}
