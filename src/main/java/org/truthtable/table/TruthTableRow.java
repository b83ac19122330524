package org.truthtable.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Riga della tabella di verità: un valore per variabile (nell'ordine delle
 * colonne della tabella) seguito dal risultato della formula. Immutabile.
 */
public final class TruthTableRow {

    private final boolean[] values;
    private final boolean result;

    /**
     * @param values valori delle variabili (copiati)
     * @param result valore della formula per questa riga
     */
    public TruthTableRow(boolean[] values, boolean result) {
        if (values == null) {
            throw new IllegalArgumentException("Valori della riga non possono essere null");
        }
        this.values = values.clone();
        this.result = result;
    }

    /**
     * @return numero di variabili della riga
     */
    public int width() {
        return values.length;
    }

    /**
     * @param index posizione della variabile nella tabella
     * @return valore assegnato alla variabile
     */
    public boolean getValue(int index) {
        return values[index];
    }

    /**
     * @return copia dei valori delle variabili
     */
    public boolean[] getValues() {
        return values.clone();
    }

    /**
     * @return valori delle variabili come tupla immutabile, usata come chiave della mappa di Karnaugh
     */
    public List<Boolean> getAssignmentTuple() {
        List<Boolean> tuple = new ArrayList<>(values.length);
        for (boolean value : values) {
            tuple.add(value);
        }
        return Collections.unmodifiableList(tuple);
    }

    public boolean getResult() {
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        TruthTableRow other = (TruthTableRow) obj;
        return result == other.result && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Boolean.hashCode(result);
    }

    @Override
    public String toString() {
        StringBuilder description = new StringBuilder("(");
        for (boolean value : values) {
            description.append(value ? 'T' : 'F').append(',');
        }
        description.append(result ? 'T' : 'F').append(')');
        return description.toString();
    }
}
