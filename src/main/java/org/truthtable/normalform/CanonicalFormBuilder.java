package org.truthtable.normalform;

import org.truthtable.formula.Variable;
import org.truthtable.table.TruthTable;
import org.truthtable.table.TruthTableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * FORME NORMALI CANONICHE - DNF e CNF derivate dalla tabella di verità
 *
 * Le forme vengono lette direttamente dalle righe della tabella già generata,
 * senza rivalutare la formula e senza alcuna minimizzazione.
 *
 * DNF (somma di mintermini):
 * • Una clausola per ogni riga vera: congiunzione dei letterali della riga
 * • Letterale X se il valore è vero, "not X" altrimenti
 * • Clausole unite con "or"; nessuna riga vera -> "False"
 *
 * CNF (prodotto di maxtermini):
 * • Una clausola per ogni riga falsa: disgiunzione che esclude quell'assegnamento
 * • Letterale "not X" se il valore è vero, X altrimenti
 * • Clausole unite con "and"; nessuna riga falsa -> "True"
 *
 * Entrambe le stringhe sono rileggibili dal parser delle formule.
 */
public final class CanonicalFormBuilder {

    private static final Logger LOGGER = Logger.getLogger(CanonicalFormBuilder.class.getName());

    public static final String TRUE_CONSTANT = "True";
    public static final String FALSE_CONSTANT = "False";

    private CanonicalFormBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region DNF

    /**
     * Costruisce la Forma Normale Disgiuntiva.
     *
     * @param variables variabili nell'ordine delle colonne della tabella
     * @param table tabella di verità già generata
     * @return DNF testuale, oppure "False" se nessuna riga è vera
     */
    public static String buildDnf(List<Variable> variables, TruthTable table) {
        validateColumns(variables, table);

        List<String> clauses = new ArrayList<>();
        for (TruthTableRow row : table.getRows()) {
            if (row.getResult()) {
                clauses.add(buildClause(variables, row, true));
            }
        }

        String dnf = clauses.isEmpty() ? FALSE_CONSTANT : String.join(" or ", clauses);
        LOGGER.fine("DNF costruita con " + clauses.size() + " clausole");
        return dnf;
    }

    //endregion

    //region CNF

    /**
     * Costruisce la Forma Normale Congiuntiva.
     *
     * @param variables variabili nell'ordine delle colonne della tabella
     * @param table tabella di verità già generata
     * @return CNF testuale, oppure "True" se nessuna riga è falsa
     */
    public static String buildCnf(List<Variable> variables, TruthTable table) {
        validateColumns(variables, table);

        List<String> clauses = new ArrayList<>();
        for (TruthTableRow row : table.getRows()) {
            if (!row.getResult()) {
                clauses.add(buildClause(variables, row, false));
            }
        }

        String cnf = clauses.isEmpty() ? TRUE_CONSTANT : String.join(" and ", clauses);
        LOGGER.fine("CNF costruita con " + clauses.size() + " clausole");
        return cnf;
    }

    //endregion

    //region COSTRUZIONE CLAUSOLE

    /**
     * Costruisce la clausola di una riga.
     *
     * @param conjunctive true per un mintermine (DNF), false per un maxtermine (CNF)
     */
    private static String buildClause(List<Variable> variables, TruthTableRow row, boolean conjunctive) {
        // Senza variabili la clausola è l'elemento neutro dell'operatore
        if (variables.isEmpty()) {
            return "(" + (conjunctive ? TRUE_CONSTANT : FALSE_CONSTANT) + ")";
        }

        List<String> literals = new ArrayList<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            // Nel maxtermine il letterale è negato quando la variabile vale true
            boolean positive = conjunctive == row.getValue(i);
            literals.add(positive ? variables.get(i).toString() : "not " + variables.get(i));
        }
        return "(" + String.join(conjunctive ? " and " : " or ", literals) + ")";
    }

    /**
     * Le variabili devono corrispondere alle colonne della tabella.
     */
    private static void validateColumns(List<Variable> variables, TruthTable table) {
        if (!table.getVariables().equals(variables)) {
            throw new IllegalArgumentException("Variabili " + variables +
                    " non corrispondono alle colonne della tabella " + table.getVariables());
        }
    }

    //endregion
}
