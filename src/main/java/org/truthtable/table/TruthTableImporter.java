package org.truthtable.table;

import org.truthtable.formula.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rilettura del formato CSV prodotto da {@link TruthTableExporter}.
 *
 * Ricostruisce una tabella strutturalmente uguale all'originale. Non rivaluta
 * nessuna formula: verifica solo intestazione, valori 0/1 e ordine delle righe.
 */
public final class TruthTableImporter {

    private static final Logger LOGGER = Logger.getLogger(TruthTableImporter.class.getName());

    private TruthTableImporter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param csv testo CSV con intestazione (righe vuote ignorate)
     * @return tabella ricostruita
     * @throws IllegalArgumentException se il testo non rispetta il formato
     */
    public static TruthTable fromCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new IllegalArgumentException("Contenuto CSV vuoto");
        }

        List<String> lines = new ArrayList<>();
        for (String line : csv.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }

        List<Variable> variables = parseHeader(lines.get(0));

        List<TruthTableRow> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            TruthTableRow row = parseRow(lines.get(i), variables.size(), i + 1);
            validateRowOrder(row, rows.size(), variables.size(), i + 1);
            rows.add(row);
        }

        TruthTable table = new TruthTable(variables, rows);
        LOGGER.fine("Tabella importata da CSV: " + table);
        return table;
    }

    private static List<Variable> parseHeader(String header) {
        String[] columns = header.split(TruthTableExporter.CSV_SEPARATOR, -1);
        if (!TruthTableExporter.RESULT_HEADER.equals(columns[columns.length - 1].trim())) {
            throw new IllegalArgumentException("Intestazione deve terminare con la colonna " +
                    TruthTableExporter.RESULT_HEADER + ": " + header);
        }

        List<Variable> variables = new ArrayList<>();
        for (String column : Arrays.copyOf(columns, columns.length - 1)) {
            variables.add(Variable.of(column.trim()));
        }
        return variables;
    }

    private static TruthTableRow parseRow(String line, int variableCount, int lineNumber) {
        String[] cells = line.split(TruthTableExporter.CSV_SEPARATOR, -1);
        if (cells.length != variableCount + 1) {
            throw new IllegalArgumentException("Riga " + lineNumber + ": attesi " + (variableCount + 1) +
                    " valori, trovati " + cells.length);
        }

        boolean[] values = new boolean[variableCount];
        for (int i = 0; i < variableCount; i++) {
            values[i] = parseBit(cells[i], lineNumber);
        }
        return new TruthTableRow(values, parseBit(cells[variableCount], lineNumber));
    }

    private static boolean parseBit(String cell, int lineNumber) {
        return switch (cell.trim()) {
            case "1" -> true;
            case "0" -> false;
            default -> throw new IllegalArgumentException("Riga " + lineNumber + ": valore non binario '" + cell + "'");
        };
    }

    /**
     * La riga in posizione index deve riportare l'assegnamento di indice index.
     */
    private static void validateRowOrder(TruthTableRow row, int index, int variableCount, int lineNumber) {
        boolean[] expected = TruthTableGenerator.assignmentValues(index, variableCount);
        if (!Arrays.equals(expected, row.getValues())) {
            throw new IllegalArgumentException("Riga " + lineNumber + ": assegnamento fuori ordine " + row);
        }
    }
}
