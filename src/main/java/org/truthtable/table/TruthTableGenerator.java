package org.truthtable.table;

import org.truthtable.formula.Assignment;
import org.truthtable.formula.Formula;
import org.truthtable.formula.FormulaEvaluator;
import org.truthtable.formula.FormulaNode;
import org.truthtable.formula.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.logging.Logger;

/**
 * GENERATORE DELLA TABELLA DI VERITÀ
 *
 * Enumera tutti i 2^n assegnamenti delle variabili e valuta la formula una volta
 * per ciascuno. La riga i corrisponde alla rappresentazione binaria di i su n bit,
 * con la prima variabile come bit più significativo.
 *
 * Gli errori di valutazione non vengono intercettati: si propagano al chiamante
 * e nessuna tabella parziale viene prodotta.
 */
public class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    private final FormulaEvaluator evaluator;

    public TruthTableGenerator() {
        this(new FormulaEvaluator());
    }

    public TruthTableGenerator(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Genera la tabella per una formula già analizzata, sulle sue variabili.
     *
     * @param formula formula prodotta dal parser
     * @return tabella con 2^n righe
     */
    public TruthTable generate(Formula formula) {
        return generate(formula.getVariableList(), formula.getRoot());
    }

    /**
     * Genera la tabella enumerando gli assegnamenti sulle variabili fornite.
     *
     * @param variables variabili nell'ordine delle colonne (tipicamente alfabetico)
     * @param root radice dell'albero sintattico
     * @return tabella con 2^n righe; con zero variabili una sola riga costante
     * @throws org.truthtable.formula.FormulaEvaluationException se l'albero usa variabili non elencate
     * @throws IllegalArgumentException se le variabili contengono duplicati
     */
    public TruthTable generate(List<Variable> variables, FormulaNode root) {
        if (new HashSet<>(variables).size() != variables.size()) {
            throw new IllegalArgumentException("Variabili duplicate: " + variables);
        }

        int variableCount = variables.size();
        int rowCount = 1 << variableCount;

        LOGGER.fine("Generazione tabella: " + variableCount + " variabili, " + rowCount + " righe");

        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        for (int index = 0; index < rowCount; index++) {
            boolean[] values = assignmentValues(index, variableCount);
            boolean result = evaluator.evaluate(root, Assignment.of(variables, values));
            rows.add(new TruthTableRow(values, result));
        }

        TruthTable table = new TruthTable(variables, rows);
        LOGGER.fine("Tabella generata: " + table);
        return table;
    }

    /**
     * Decodifica l'indice di riga nei valori delle variabili.
     * Bit (n-1-j) dell'indice = valore della variabile j.
     */
    static boolean[] assignmentValues(int index, int variableCount) {
        boolean[] values = new boolean[variableCount];
        for (int j = 0; j < variableCount; j++) {
            values[j] = ((index >> (variableCount - 1 - j)) & 1) == 1;
        }
        return values;
    }
}
