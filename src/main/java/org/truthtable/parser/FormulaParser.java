package org.truthtable.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.truthtable.antlr.LogicFormulaLexer;
import org.truthtable.antlr.LogicFormulaParser;
import org.truthtable.formula.Formula;
import org.truthtable.formula.FormulaNode;
import org.truthtable.formula.Variable;

import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER DELLE FORMULE - Pipeline completa testo -> {@link Formula}
 *
 * PIPELINE:
 * 1. Normalizzazione del testo (maiuscolo, trim)
 * 2. Lexing e parsing ANTLR con interruzione al primo errore
 * 3. Visita del parse tree con {@link FormulaTreeBuilder}
 * 4. Estrazione dell'insieme ordinato delle variabili
 *
 * Ogni errore di sintassi produce una {@link FormulaSyntaxException}; non esistono
 * risultati parziali.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Analizza il testo e costruisce la formula.
     *
     * @param text testo grezzo inserito dall'utente
     * @return formula con albero sintattico e variabili
     * @throws FormulaSyntaxException se il testo è vuoto o sintatticamente non valido
     */
    public Formula parse(String text) {
        String normalized = VariableExtractor.normalize(text);
        if (normalized.isEmpty()) {
            throw new FormulaSyntaxException("formula vuota", "", 0);
        }

        LOGGER.fine("Parsing formula: " + normalized);

        FormulaNode root = buildTree(normalized);
        SortedSet<Variable> variables = VariableExtractor.extractVariables(normalized);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Formula analizzata: %s [variabili=%s, profondità=%d]",
                    root, variables, root.calculateDepth()));
        }
        return new Formula(normalized, root, variables);
    }

    /**
     * Esegue lexing, parsing e visita sul testo già normalizzato.
     */
    private FormulaNode buildTree(String normalized) {
        SyntaxErrorListener errorListener = new SyntaxErrorListener(normalized);

        // Setup pipeline ANTLR senza listener su console
        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(normalized));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        return new FormulaTreeBuilder().visit(tree);
    }
}
