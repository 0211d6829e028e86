package com.questrail.edgecontrol.rule;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonOperatorTest {

    @Test
    void sixComparisonsBehaveNumerically() {
        assertTrue(ComparisonOperator.GREATER_THAN.test(2, 1));
        assertFalse(ComparisonOperator.GREATER_THAN.test(1, 1));
        assertTrue(ComparisonOperator.LESS_THAN.test(0, 1));
        assertTrue(ComparisonOperator.GREATER_OR_EQUAL.test(1, 1));
        assertTrue(ComparisonOperator.LESS_OR_EQUAL.test(1, 1));
        assertTrue(ComparisonOperator.EQUAL.test(3.5, 3.5));
        assertTrue(ComparisonOperator.NOT_EQUAL.test(3.5, 3.6));
    }

    @Test
    void parsesSymbolsAndNames() {
        assertEquals(ComparisonOperator.GREATER_OR_EQUAL, ComparisonOperator.parse(">="));
        assertEquals(ComparisonOperator.GREATER_OR_EQUAL, ComparisonOperator.parse("greater_equal"));
        assertEquals(ComparisonOperator.NOT_EQUAL, ComparisonOperator.parse(" != "));
        assertEquals(ComparisonOperator.LESS_THAN, ComparisonOperator.parse("LESS_THAN"));
    }

    @Test
    void unknownTextIsUnrecognized() {
        assertEquals(ComparisonOperator.UNRECOGNIZED, ComparisonOperator.parse("between"));
        assertEquals(ComparisonOperator.UNRECOGNIZED, ComparisonOperator.parse(null));
        assertTrue(ComparisonOperator.lookup("between").isEmpty());
        assertFalse(ComparisonOperator.UNRECOGNIZED.test(1, 1));
    }
}
