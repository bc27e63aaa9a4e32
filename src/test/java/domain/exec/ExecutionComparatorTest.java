package domain.exec;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionComparatorTest {

    private static final double EPS = 1e-9;

    private static ExecutionResult rows(ResultRow... rows) {
        return ExecutionResult.success(List.of(rows), 1);
    }

    @Test
    void compare_shouldIgnoreRowOrderAndDuplicates() {
        ResultComparison c = ExecutionComparator.compare(
                rows(ResultRow.of(2L), ResultRow.of(1L), ResultRow.of(1L)),
                rows(ResultRow.of(1L), ResultRow.of(2L)));

        assertTrue(c.isExactMatch());
        assertEquals(1.0, c.getF1(), EPS);
    }

    @Test
    void compare_shouldScorePartialOverlap() {
        ResultComparison c = ExecutionComparator.compare(
                rows(ResultRow.of(1L), ResultRow.of(2L)),
                rows(ResultRow.of(1L), ResultRow.of(3L), ResultRow.of(4L)));

        assertFalse(c.isExactMatch());
        assertEquals(0.5, c.getPrecision(), EPS);
        assertEquals(1.0 / 3, c.getRecall(), EPS);
        assertEquals(0.4, c.getF1(), EPS);
    }

    @Test
    void compare_shouldBeExact_whenBothEmpty() {
        ResultComparison c = ExecutionComparator.compare(rows(), rows());

        assertTrue(c.isExactMatch());
        assertEquals(1.0, c.getPrecision(), EPS);
        assertEquals(1.0, c.getRecall(), EPS);
    }

    @Test
    void compare_shouldBeZero_whenOnlyOneSideEmpty() {
        ResultComparison c = ExecutionComparator.compare(rows(), rows(ResultRow.of("a")));

        assertFalse(c.isExactMatch());
        assertEquals(0.0, c.getF1(), EPS);
    }

    @Test
    void compare_shouldBeZero_whenEitherSideFailed() {
        ExecutionResult failed = ExecutionResult.failure(ExecutionErrorType.MISSING_OBJECT, "no such table: x", 0);

        ResultComparison c = ExecutionComparator.compare(failed, rows(ResultRow.of(1L)));

        assertFalse(c.isExactMatch());
        assertEquals(0.0, c.getPrecision(), EPS);
        assertFalse(ExecutionComparator.compare(rows(), failed).isExactMatch());
    }

    @Test
    void resultRow_shouldTreatIntegralNumbersAlike() {
        assertEquals(ResultRow.of(5), ResultRow.of(5.0));
        assertEquals(ResultRow.of(5L), ResultRow.of(new BigDecimal("5.00")));
        assertEquals(ResultRow.of(2.5), ResultRow.of(new BigDecimal("2.50")));
        assertNotEquals(ResultRow.of(2.5), ResultRow.of("2.5"));
        assertEquals(ResultRow.of("0aff"), ResultRow.of((Object) new byte[]{0x0a, (byte) 0xff}));
    }

    @Test
    void executionStats_shouldCountAccuracyOnlyWhereBothSidesRan() {
        ExecutionStats stats = new ExecutionStats();
        ExecutionResult one = rows(ResultRow.of(1L));
        ExecutionResult failed = ExecutionResult.failure(ExecutionErrorType.SYNTAX_ERROR, "syntax error", 0);

        stats.record(one, one, ExecutionComparator.compare(one, one));
        stats.record(failed, one, ExecutionComparator.compare(failed, one));

        assertEquals(1, stats.getBothSuccessful());
        assertEquals(1.0, stats.getExecutionAccuracy(), EPS);
        assertEquals(2, stats.getPredicted().getTotal());
        assertEquals(1, stats.getPredicted().getFailed());
        assertEquals(0.5, stats.getPredicted().getSuccessRate(), EPS);
        assertEquals(1, stats.getPredicted().getErrors().get(ExecutionErrorType.SYNTAX_ERROR));
        assertEquals(1.0, stats.getGold().getSuccessRate(), EPS);
    }
}
