package org.truthtable.parser;

import org.truthtable.formula.Variable;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizzazione del testo ed estrazione delle variabili.
 *
 * Le variabili sono le lettere singole che compaiono come parole intere: le
 * lettere interne alle parole chiave (AND, NAND, IMPLIES, TRUE, ...) non contano.
 */
public final class VariableExtractor {

    private static final Logger LOGGER = Logger.getLogger(VariableExtractor.class.getName());

    /** Lettera isolata, delimitata da caratteri non alfanumerici */
    private static final Pattern STANDALONE_LETTER = Pattern.compile("\\b[A-Z]\\b");

    private VariableExtractor() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Porta in maiuscolo le lettere a-z e rimuove gli spazi ai bordi.
     *
     * Gli altri caratteri restano invariati: una lettera non ASCII (ı, ß, ...)
     * non diventa mai una variabile e il lexer la rifiuta nella sua posizione.
     *
     * @param text testo grezzo (null trattato come vuoto)
     * @return testo normalizzato, della stessa lunghezza del testo senza spazi ai bordi
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }

        char[] chars = text.trim().toCharArray();
        for (int i = 0; i < chars.length; i++) {
            if (chars[i] >= 'a' && chars[i] <= 'z') {
                chars[i] = (char) (chars[i] - 'a' + 'A');
            }
        }
        return new String(chars);
    }

    /**
     * Estrae l'insieme ordinato e senza duplicati delle variabili.
     *
     * @param text testo grezzo della formula
     * @return variabili in ordine alfabetico (vuoto se nessuna)
     */
    public static SortedSet<Variable> extractVariables(String text) {
        SortedSet<Variable> variables = new TreeSet<>();

        Matcher matcher = STANDALONE_LETTER.matcher(normalize(text));
        while (matcher.find()) {
            variables.add(new Variable(matcher.group().charAt(0)));
        }

        LOGGER.fine("Variabili estratte: " + variables);
        return Collections.unmodifiableSortedSet(variables);
    }
}
