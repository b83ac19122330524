package org.truthtable.table;

import org.truthtable.formula.Variable;

import java.util.StringJoiner;

/**
 * Esportazione della tabella nel formato piatto a righe.
 *
 * FORMATO CSV:
 * - Intestazione: nomi delle variabili seguiti da "Result", separati da virgola
 * - Una riga per assegnamento con valori 0/1
 *
 * FORMATO TABULATO:
 * - Solo le righe, valori 0/1 separati da tabulazione (formato per gli appunti)
 */
public final class TruthTableExporter {

    /** Intestazione della colonna del risultato */
    public static final String RESULT_HEADER = "Result";

    static final String CSV_SEPARATOR = ",";
    static final String TAB_SEPARATOR = "\t";

    private TruthTableExporter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param table tabella da esportare
     * @return testo CSV con intestazione, ogni riga terminata da '\n'
     */
    public static String toCsv(TruthTable table) {
        StringBuilder csv = new StringBuilder();

        StringJoiner header = new StringJoiner(CSV_SEPARATOR);
        for (Variable variable : table.getVariables()) {
            header.add(variable.toString());
        }
        header.add(RESULT_HEADER);
        csv.append(header).append('\n');

        for (TruthTableRow row : table.getRows()) {
            csv.append(formatRow(row, CSV_SEPARATOR)).append('\n');
        }
        return csv.toString();
    }

    /**
     * @param table tabella da esportare
     * @return righe separate da '\n', senza intestazione
     */
    public static String toTabSeparated(TruthTable table) {
        StringJoiner lines = new StringJoiner("\n");
        for (TruthTableRow row : table.getRows()) {
            lines.add(formatRow(row, TAB_SEPARATOR));
        }
        return lines.toString();
    }

    private static String formatRow(TruthTableRow row, String separator) {
        StringJoiner line = new StringJoiner(separator);
        for (int i = 0; i < row.width(); i++) {
            line.add(bit(row.getValue(i)));
        }
        line.add(bit(row.getResult()));
        return line.toString();
    }

    private static String bit(boolean value) {
        return value ? "1" : "0";
    }
}
