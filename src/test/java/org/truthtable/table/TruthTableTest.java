package org.truthtable.table;

import org.junit.jupiter.api.Test;
import org.truthtable.formula.Variable;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TruthTableTest {

    private static final Variable A = Variable.of("A");
    private static final Variable B = Variable.of("B");

    private static TruthTableRow row(boolean result, boolean... values) {
        return new TruthTableRow(values, result);
    }

    @Test
    void shouldBuildTableWithDistinctVariables() {
        TruthTable table = new TruthTable(List.of(A, B), List.of(
                row(false, false, false), row(true, false, true),
                row(true, true, false), row(false, true, true)));

        assertEquals(4, table.getRowCount());
        assertEquals(List.of(1, 2), table.getTrueRowIndexes());
    }

    @Test
    void shouldRejectDuplicateVariables() {
        List<TruthTableRow> rows = List.of(
                row(false, false, false), row(true, false, true),
                row(true, true, false), row(false, true, true));

        assertThatThrownBy(() -> new TruthTable(List.of(A, A), rows))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void shouldRejectWrongRowCount() {
        assertThatThrownBy(() -> new TruthTable(List.of(A), List.of(row(true, false))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectRowOfWrongWidth() {
        assertThatThrownBy(() -> new TruthTable(List.of(A), List.of(row(true, false), row(true, true, true))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
