package org.truthtable.formula;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VALUTATORE - Calcola il valore di verità di un albero sintattico
 *
 * Valutazione ricorsiva bottom-up di ciascun nodo secondo la semantica standard
 * della logica proposizionale. Nessuno stato interno: lo stesso albero con lo
 * stesso assegnamento produce sempre lo stesso risultato.
 *
 * SEMANTICA OPERATORI:
 * • A -> B  ~ !A | B
 * • A <-> B ~ A == B
 * • A XOR B ~ A != B
 * • NAND(A, B) ~ !(A & B)
 * • NOR(A, B)  ~ !(A | B)
 */
public class FormulaEvaluator {

    private static final Logger LOGGER = Logger.getLogger(FormulaEvaluator.class.getName());

    /**
     * Valuta la formula sotto l'assegnamento dato.
     *
     * @param node radice dell'albero sintattico
     * @param assignment valori delle variabili (deve coprire tutte quelle dell'albero)
     * @return valore di verità della formula
     * @throws FormulaEvaluationException se una variabile referenziata non è assegnata
     */
    public boolean evaluate(FormulaNode node, Assignment assignment) {
        boolean result = evaluateNode(node, assignment);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Valutazione %s con %s -> %s", node, assignment, result));
        }
        return result;
    }

    private boolean evaluateNode(FormulaNode node, Assignment assignment) {
        switch (node.getType()) {
            case VARIABLE:
                return lookup(node.getVariable(), assignment);
            case CONSTANT:
                return node.getValue();
            case NOT:
                return !evaluateNode(node.getOperand(), assignment);
            default:
                break;
        }

        // Nessun cortocircuito: ogni variabile referenziata deve risultare assegnata
        boolean left = evaluateNode(node.getLeft(), assignment);
        boolean right = evaluateNode(node.getRight(), assignment);

        return switch (node.getType()) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left != right;
            case IMPLIES -> !left || right;
            case EQUIV -> left == right;
            case NAND -> !(left && right);
            case NOR -> !(left || right);
            default -> throw new IllegalStateException("Tipo di nodo non gestito: " + node.getType());
        };
    }

    /**
     * Recupera il valore della variabile, fallendo se manca nell'assegnamento.
     */
    private boolean lookup(Variable variable, Assignment assignment) {
        Boolean value = assignment.valueOf(variable);
        if (value == null) {
            throw new FormulaEvaluationException(variable);
        }
        return value;
    }
}
