package org.truthtable.formula;

/**
 * Segnala un assegnamento che non copre una variabile referenziata dalla formula.
 * Indica un errore di consistenza interna: il generatore della tabella fornisce
 * sempre assegnamenti completi.
 */
public class FormulaEvaluationException extends RuntimeException {

    private final Variable missingVariable;

    public FormulaEvaluationException(Variable missingVariable) {
        super("Variabile " + missingVariable + " non assegnata durante la valutazione della formula");
        this.missingVariable = missingVariable;
    }

    /**
     * @return variabile priva di valore nell'assegnamento
     */
    public Variable getMissingVariable() {
        return missingVariable;
    }
}
