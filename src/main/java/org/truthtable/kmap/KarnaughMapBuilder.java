package org.truthtable.kmap;

import org.truthtable.formula.Variable;
import org.truthtable.table.TruthTable;
import org.truthtable.table.TruthTableRow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Costruisce la mappa di Karnaugh indicizzando le righe della tabella per tupla
 * di assegnamento. Con meno di 2 o più di 4 variabili restituisce la mappa
 * "non supportata".
 */
public final class KarnaughMapBuilder {

    private static final Logger LOGGER = Logger.getLogger(KarnaughMapBuilder.class.getName());

    private KarnaughMapBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param variables variabili nell'ordine delle colonne della tabella
     * @param table tabella di verità già generata
     * @return mappa completa (una cella per riga) oppure mappa non supportata
     * @throws IllegalArgumentException se le variabili non corrispondono alle colonne della tabella
     */
    public static KarnaughMap build(List<Variable> variables, TruthTable table) {
        if (!table.getVariables().equals(variables)) {
            throw new IllegalArgumentException("Variabili " + variables +
                    " non corrispondono alle colonne della tabella " + table.getVariables());
        }

        if (!KarnaughMap.isSupportedVariableCount(variables.size())) {
            LOGGER.fine("Mappa di Karnaugh non disponibile per " + variables.size() + " variabili");
            return KarnaughMap.unsupported(variables);
        }

        Map<List<Boolean>, Boolean> cells = new LinkedHashMap<>();
        for (TruthTableRow row : table.getRows()) {
            cells.put(row.getAssignmentTuple(), row.getResult());
        }

        LOGGER.fine("Mappa di Karnaugh costruita con " + cells.size() + " celle");
        return new KarnaughMap(variables, cells);
    }
}
