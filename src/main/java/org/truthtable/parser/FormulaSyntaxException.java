package org.truthtable.parser;

/**
 * Errore di sintassi nel testo della formula.
 *
 * Riporta il frammento che ha causato l'errore e la sua posizione (indice del
 * carattere, a partire da 0) nel testo normalizzato.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final String fragment;
    private final int position;

    public FormulaSyntaxException(String detail, String fragment, int position) {
        super("Errore di sintassi alla posizione " + position + " vicino a '" + fragment + "': " + detail);
        this.fragment = fragment;
        this.position = position;
    }

    /**
     * @return porzione di testo in cui è stato rilevato l'errore
     */
    public String getFragment() {
        return fragment;
    }

    /**
     * @return indice del carattere in cui inizia il frammento
     */
    public int getPosition() {
        return position;
    }
}
