package org.truthtable.formula;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * FORMULA - Testo normalizzato, albero sintattico e variabili
 *
 * Prodotta esclusivamente da un parsing riuscito: un testo non valido non genera
 * mai un'istanza. Immutabile.
 */
public final class Formula {

    /** Testo normalizzato (maiuscolo, senza spazi ai bordi) */
    private final String text;

    /** Radice dell'albero sintattico */
    private final FormulaNode root;

    /** Variabili della formula in ordine alfabetico */
    private final SortedSet<Variable> variables;

    /**
     * @param text testo normalizzato da cui è stato costruito l'albero
     * @param root radice dell'albero sintattico
     * @param variables insieme ordinato delle variabili della formula
     * @throws IllegalArgumentException se uno dei parametri è null
     */
    public Formula(String text, FormulaNode root, SortedSet<Variable> variables) {
        if (text == null || root == null || variables == null) {
            throw new IllegalArgumentException("Testo, albero e variabili della formula non possono essere null");
        }
        this.text = text;
        this.root = root;
        this.variables = Collections.unmodifiableSortedSet(new TreeSet<>(variables));
    }

    public String getText() {
        return text;
    }

    public FormulaNode getRoot() {
        return root;
    }

    public SortedSet<Variable> getVariables() {
        return variables;
    }

    /**
     * @return variabili come lista, nell'ordine delle colonne della tabella
     */
    public List<Variable> getVariableList() {
        return List.copyOf(variables);
    }

    @Override
    public String toString() {
        return text;
    }
}
