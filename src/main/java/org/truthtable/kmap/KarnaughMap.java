package org.truthtable.kmap;

import org.truthtable.formula.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MAPPA DI KARNAUGH - Risultati della tabella indicizzati per assegnamento
 *
 * Definita solo per funzioni di 2, 3 o 4 variabili. Per ogni altro numero di
 * variabili si ottiene un'istanza "non supportata": è un esito normale e
 * verificabile con {@link #isSupported()}, non un errore.
 *
 * DISPOSIZIONE A GRIGLIA:
 * • Le prime n/2 variabili (arrotondato per difetto) indicizzano le righe
 * • Le restanti indicizzano le colonne
 * • Intestazioni di righe e colonne in ordine Gray: celle adiacenti differiscono di un bit
 *
 * Esempio con 3 variabili (A sulle righe, BC sulle colonne: 00 01 11 10).
 */
public final class KarnaughMap {

    public static final int MIN_VARIABLES = 2;
    public static final int MAX_VARIABLES = 4;

    private final List<Variable> variables;
    private final Map<List<Boolean>, Boolean> cells;
    private final boolean supported;

    //region COSTRUZIONE

    KarnaughMap(List<Variable> variables, Map<List<Boolean>, Boolean> cells) {
        this.variables = List.copyOf(variables);
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
        this.supported = true;
    }

    private KarnaughMap(List<Variable> variables) {
        this.variables = List.copyOf(variables);
        this.cells = Collections.emptyMap();
        this.supported = false;
    }

    /**
     * @param variables variabili della tabella (numero fuori dall'intervallo 2-4)
     * @return mappa vuota che segnala il caso non supportato
     */
    public static KarnaughMap unsupported(List<Variable> variables) {
        return new KarnaughMap(variables);
    }

    /**
     * @return true se il numero di variabili è gestito da una mappa di Karnaugh
     */
    public static boolean isSupportedVariableCount(int variableCount) {
        return variableCount >= MIN_VARIABLES && variableCount <= MAX_VARIABLES;
    }

    //endregion

    //region INTERROGAZIONE

    public boolean isSupported() {
        return supported;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    /**
     * @return numero di celle (2^n se supportata, 0 altrimenti)
     */
    public int size() {
        return cells.size();
    }

    /**
     * @return vista immutabile tupla di assegnamento -> risultato
     */
    public Map<List<Boolean>, Boolean> asMap() {
        return cells;
    }

    /**
     * Risultato per l'assegnamento dato, nell'ordine delle variabili della tabella.
     *
     * @throws IllegalStateException se la mappa non è supportata
     * @throws IllegalArgumentException se la tupla non ha un valore per variabile
     */
    public boolean get(List<Boolean> assignment) {
        requireSupported();
        Boolean result = cells.get(assignment);
        if (result == null) {
            throw new IllegalArgumentException("Assegnamento " + assignment +
                    " non valido per le variabili " + variables);
        }
        return result;
    }

    public boolean get(boolean... assignment) {
        return get(toList(assignment));
    }

    //endregion

    //region DISPOSIZIONE A GRIGLIA

    public List<Variable> getRowVariables() {
        return variables.subList(0, variables.size() / 2);
    }

    public List<Variable> getColumnVariables() {
        return variables.subList(variables.size() / 2, variables.size());
    }

    /**
     * @return assegnamenti delle variabili di riga in ordine Gray
     */
    public List<List<Boolean>> getRowHeaders() {
        requireSupported();
        return grayCode(getRowVariables().size());
    }

    /**
     * @return assegnamenti delle variabili di colonna in ordine Gray
     */
    public List<List<Boolean>> getColumnHeaders() {
        requireSupported();
        return grayCode(getColumnVariables().size());
    }

    /**
     * @return griglia [riga][colonna] dei risultati secondo le intestazioni Gray
     */
    public boolean[][] toGrid() {
        List<List<Boolean>> rowHeaders = getRowHeaders();
        List<List<Boolean>> columnHeaders = getColumnHeaders();

        boolean[][] grid = new boolean[rowHeaders.size()][columnHeaders.size()];
        for (int r = 0; r < rowHeaders.size(); r++) {
            for (int c = 0; c < columnHeaders.size(); c++) {
                List<Boolean> assignment = new ArrayList<>(rowHeaders.get(r));
                assignment.addAll(columnHeaders.get(c));
                grid[r][c] = get(assignment);
            }
        }
        return grid;
    }

    /**
     * Rappresentazione testuale della griglia, una riga per riga della mappa.
     * Esempio con 2 variabili:
     * <pre>
     * A\B  0  1
     * 0    0  1
     * 1    1  1
     * </pre>
     */
    public String render() {
        requireSupported();

        String corner = joinNames(getRowVariables()) + "\\" + joinNames(getColumnVariables());
        List<List<Boolean>> rowHeaders = getRowHeaders();
        List<List<Boolean>> columnHeaders = getColumnHeaders();
        boolean[][] grid = toGrid();

        int firstWidth = Math.max(corner.length(), getRowVariables().size()) + 2;
        int cellWidth = getColumnVariables().size() + 2;

        StringBuilder text = new StringBuilder();
        StringBuilder line = new StringBuilder(pad(corner, firstWidth));
        for (List<Boolean> header : columnHeaders) {
            line.append(pad(bits(header), cellWidth));
        }
        text.append(line.toString().stripTrailing()).append('\n');

        for (int r = 0; r < rowHeaders.size(); r++) {
            line = new StringBuilder(pad(bits(rowHeaders.get(r)), firstWidth));
            for (int c = 0; c < columnHeaders.size(); c++) {
                line.append(pad(grid[r][c] ? "1" : "0", cellWidth));
            }
            text.append(line.toString().stripTrailing()).append('\n');
        }
        return text.toString();
    }

    /**
     * Sequenza Gray riflessa su k bit, bit più significativo per primo.
     */
    static List<List<Boolean>> grayCode(int bitCount) {
        List<List<Boolean>> codes = new ArrayList<>();
        for (int i = 0; i < (1 << bitCount); i++) {
            int gray = i ^ (i >> 1);
            List<Boolean> code = new ArrayList<>(bitCount);
            for (int b = bitCount - 1; b >= 0; b--) {
                code.add(((gray >> b) & 1) == 1);
            }
            codes.add(Collections.unmodifiableList(code));
        }
        return Collections.unmodifiableList(codes);
    }

    //endregion

    //region UTILITY

    private void requireSupported() {
        if (!supported) {
            throw new IllegalStateException("Mappa di Karnaugh non supportata per " +
                    variables.size() + " variabili");
        }
    }

    private static List<Boolean> toList(boolean[] values) {
        List<Boolean> list = new ArrayList<>(values.length);
        for (boolean value : values) {
            list.add(value);
        }
        return list;
    }

    private static String joinNames(List<Variable> variables) {
        StringBuilder names = new StringBuilder();
        for (Variable variable : variables) {
            names.append(variable);
        }
        return names.toString();
    }

    private static String bits(List<Boolean> values) {
        StringBuilder text = new StringBuilder();
        for (Boolean value : values) {
            text.append(value ? '1' : '0');
        }
        return text.toString();
    }

    private static String pad(String text, int width) {
        return String.format("%-" + width + "s", text);
    }

    //endregion

    @Override
    public String toString() {
        return supported ? "KarnaughMap" + variables + cells : "KarnaughMap{non supportata, variabili=" + variables + '}';
    }
}
