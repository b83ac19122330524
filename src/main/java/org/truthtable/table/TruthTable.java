package org.truthtable.table;

import org.truthtable.formula.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * TABELLA DI VERITÀ - Sequenza ordinata delle 2^n righe di una formula
 *
 * ORDINE DELLE RIGHE:
 * • Conteggio binario standard, prima variabile (alfabetica) come bit più significativo
 * • Equivale a cicli annidati dalla prima variabile (più esterna, più lenta)
 *   all'ultima (più interna, più veloce), ciascuno con False prima di True
 *
 * PREDICATI DERIVATI:
 * • Tautologia: tutte le righe vere
 * • Contraddizione: tutte le righe false
 *
 * La tabella è immutabile: una nuova generazione produce una nuova istanza.
 */
public final class TruthTable {

    private final List<Variable> variables;
    private final List<TruthTableRow> rows;

    //region COSTRUZIONE CON VALIDAZIONE

    /**
     * Costruisce la tabella validando dimensioni e larghezza delle righe.
     *
     * @param variables variabili nell'ordine delle colonne
     * @param rows righe nell'ordine di enumerazione
     * @throws IllegalArgumentException se le variabili sono duplicate, o se le righe non sono 2^n
     *         o hanno larghezza errata
     */
    public TruthTable(List<Variable> variables, List<TruthTableRow> rows) {
        if (variables == null || rows == null) {
            throw new IllegalArgumentException("Variabili e righe non possono essere null");
        }

        // Al più 26 variabili distinte: lo shift non può traboccare
        if (new HashSet<>(variables).size() != variables.size()) {
            throw new IllegalArgumentException("Variabili duplicate: " + variables);
        }

        int expectedRows = 1 << variables.size();
        if (rows.size() != expectedRows) {
            throw new IllegalArgumentException("Tabella con " + variables.size() + " variabili richiede " +
                    expectedRows + " righe, ricevute: " + rows.size());
        }
        for (TruthTableRow row : rows) {
            if (row.width() != variables.size()) {
                throw new IllegalArgumentException("Riga " + row + " con " + row.width() +
                        " valori, attesi: " + variables.size());
            }
        }

        this.variables = List.copyOf(variables);
        this.rows = List.copyOf(rows);
    }

    //endregion

    //region ACCESSORS

    public List<Variable> getVariables() {
        return variables;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public TruthTableRow getRow(int index) {
        return rows.get(index);
    }

    public int getRowCount() {
        return rows.size();
    }

    //endregion

    //region PREDICATI E STATISTICHE

    /**
     * @return true se la formula è vera sotto ogni assegnamento
     */
    public boolean isTautology() {
        for (TruthTableRow row : rows) {
            if (!row.getResult()) return false;
        }
        return true;
    }

    /**
     * @return true se la formula è falsa sotto ogni assegnamento
     */
    public boolean isContradiction() {
        for (TruthTableRow row : rows) {
            if (row.getResult()) return false;
        }
        return true;
    }

    /**
     * @return numero di righe con risultato vero
     */
    public int countTrueRows() {
        int count = 0;
        for (TruthTableRow row : rows) {
            if (row.getResult()) count++;
        }
        return count;
    }

    /**
     * Indici delle righe vere (mintermini), che per l'ordine di enumerazione
     * coincidono con il valore binario dell'assegnamento.
     *
     * @return indici crescenti delle righe vere
     */
    public List<Integer> getTrueRowIndexes() {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).getResult()) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        TruthTable other = (TruthTable) obj;
        return variables.equals(other.variables) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, rows);
    }

    @Override
    public String toString() {
        return "TruthTable{variables=" + variables + ", rows=" + rows.size() +
                ", true=" + countTrueRows() + '}';
    }
}
