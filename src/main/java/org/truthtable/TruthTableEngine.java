package org.truthtable;

import org.truthtable.formula.Formula;
import org.truthtable.formula.Variable;
import org.truthtable.kmap.KarnaughMap;
import org.truthtable.kmap.KarnaughMapBuilder;
import org.truthtable.normalform.CanonicalFormBuilder;
import org.truthtable.parser.FormulaParser;
import org.truthtable.parser.VariableExtractor;
import org.truthtable.table.TruthTable;
import org.truthtable.table.TruthTableExporter;
import org.truthtable.table.TruthTableGenerator;
import org.truthtable.table.TruthTableImporter;

import java.util.List;
import java.util.SortedSet;

/**
 * MOTORE DELLE TABELLE DI VERITÀ - Operazioni esposte al livello di presentazione
 *
 * Raccoglie in un solo punto tutte le operazioni del nucleo. Non conserva stato
 * tra una chiamata e l'altra: è il chiamante a tenere l'ultima tabella generata
 * e le sue variabili, e a passarle alle operazioni successive.
 *
 * FLUSSO TIPICO:
 * 1. parse(testo) -> Formula (variabili + albero)
 * 2. generateTable(variabili, formula) -> TruthTable
 * 3. isTautology / isContradiction / buildDnf / buildCnf / buildKarnaughMap sulla tabella
 * 4. exportCsv per il salvataggio
 *
 * ERRORI:
 * - {@link org.truthtable.parser.FormulaSyntaxException} da parse
 * - {@link org.truthtable.formula.FormulaEvaluationException} da generateTable
 * Entrambe si propagano al chiamante senza tentativi di recupero.
 */
public class TruthTableEngine {

    private final FormulaParser parser;
    private final TruthTableGenerator generator;

    public TruthTableEngine() {
        this(new FormulaParser(), new TruthTableGenerator());
    }

    public TruthTableEngine(FormulaParser parser, TruthTableGenerator generator) {
        this.parser = parser;
        this.generator = generator;
    }

    //region PARSING

    public SortedSet<Variable> extractVariables(String text) {
        return VariableExtractor.extractVariables(text);
    }

    public Formula parse(String text) {
        return parser.parse(text);
    }

    //endregion

    //region TABELLA E PREDICATI

    /**
     * @param variables colonne della tabella, in ordine
     * @param formula formula analizzata
     * @return tabella con 2^n righe
     */
    public TruthTable generateTable(List<Variable> variables, Formula formula) {
        return generator.generate(variables, formula.getRoot());
    }

    /**
     * Variante che usa direttamente le variabili estratte dalla formula.
     */
    public TruthTable generateTable(Formula formula) {
        return generator.generate(formula);
    }

    public boolean isTautology(TruthTable table) {
        return table.isTautology();
    }

    public boolean isContradiction(TruthTable table) {
        return table.isContradiction();
    }

    //endregion

    //region FORME CANONICHE E MAPPA

    public String buildDnf(List<Variable> variables, TruthTable table) {
        return CanonicalFormBuilder.buildDnf(variables, table);
    }

    public String buildCnf(List<Variable> variables, TruthTable table) {
        return CanonicalFormBuilder.buildCnf(variables, table);
    }

    public KarnaughMap buildKarnaughMap(List<Variable> variables, TruthTable table) {
        return KarnaughMapBuilder.build(variables, table);
    }

    //endregion

    //region ESPORTAZIONE

    public String exportCsv(TruthTable table) {
        return TruthTableExporter.toCsv(table);
    }

    public String exportTabSeparated(TruthTable table) {
        return TruthTableExporter.toTabSeparated(table);
    }

    public TruthTable importCsv(String csv) {
        return TruthTableImporter.fromCsv(csv);
    }

    //endregion
}
