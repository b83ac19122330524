package org.truthtable.formula;

import org.junit.jupiter.api.Test;
import org.truthtable.parser.FormulaParser;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaEvaluatorTest {

    private static final Variable A = Variable.of("A");
    private static final Variable B = Variable.of("B");

    private final FormulaParser parser = new FormulaParser();
    private final FormulaEvaluator evaluator = new FormulaEvaluator();

    private boolean evaluate(String text, boolean a, boolean b) {
        return evaluator.evaluate(parser.parse(text).getRoot(), Assignment.of(List.of(A, B), new boolean[]{a, b}));
    }

    @Test
    void shouldEvaluateImplicationAsMaterialConditional() {
        assertTrue(evaluate("A -> B", false, false));
        assertTrue(evaluate("A -> B", false, true));
        assertFalse(evaluate("A -> B", true, false));
        assertTrue(evaluate("A -> B", true, true));
    }

    @Test
    void shouldEvaluateDerivedOperators() {
        assertTrue(evaluate("A XOR B", true, false));
        assertFalse(evaluate("A XOR B", true, true));
        assertTrue(evaluate("A <-> B", false, false));
        assertFalse(evaluate("A <-> B", false, true));
        assertFalse(evaluate("NAND(A, B)", true, true));
        assertTrue(evaluate("NAND(A, B)", true, false));
        assertTrue(evaluate("NOR(A, B)", false, false));
        assertFalse(evaluate("NOR(A, B)", false, true));
    }

    @Test
    void shouldEvaluateConstantsWithoutAssignment() {
        Assignment empty = new Assignment(Map.of());

        assertTrue(evaluator.evaluate(parser.parse("TRUE OR FALSE").getRoot(), empty));
        assertFalse(evaluator.evaluate(parser.parse("NOT TRUE").getRoot(), empty));
    }

    @Test
    void shouldReportMissingVariableEvenWhenLeftOperandDecides() {
        Assignment onlyA = new Assignment(Map.of(A, false));

        assertThatThrownBy(() -> evaluator.evaluate(parser.parse("A AND B").getRoot(), onlyA))
                .isInstanceOf(FormulaEvaluationException.class)
                .satisfies(e -> assertThat(((FormulaEvaluationException) e).getMissingVariable()).isEqualTo(B))
                .hasMessageContaining("B");
    }

    @Test
    void shouldRejectMismatchedAssignmentLength() {
        assertThatThrownBy(() -> Assignment.of(List.of(A, B), new boolean[]{true}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
