package org.truthtable.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Listener ANTLR che interrompe lexing e parsing al primo errore.
 *
 * Sostituisce il ConsoleErrorListener predefinito: invece di stampare su stderr
 * e tentare il recupero, converte l'errore in {@link FormulaSyntaxException}.
 */
class SyntaxErrorListener extends BaseErrorListener {

    /** Lunghezza massima del frammento riportato quando l'errore è a fine testo */
    private static final int TRAILING_FRAGMENT_LENGTH = 10;

    private final String text;

    SyntaxErrorListener(String text) {
        this.text = text;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        // Errore del lexer: carattere non riconosciuto
        if (e instanceof LexerNoViableAltException) {
            int position = ((LexerNoViableAltException) e).getStartIndex();
            throw new FormulaSyntaxException("simbolo non riconosciuto", characterAt(position), position);
        }

        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            if (token.getType() == Token.EOF) {
                throw new FormulaSyntaxException("fine della formula inattesa (" + msg + ")",
                        trailingFragment(), text.length());
            }
            throw new FormulaSyntaxException(msg, token.getText(), token.getStartIndex());
        }

        throw new FormulaSyntaxException(msg, "", charPositionInLine);
    }

    private String characterAt(int position) {
        if (position < 0 || position >= text.length()) {
            return "";
        }
        return text.substring(position, position + 1);
    }

    private String trailingFragment() {
        return text.substring(Math.max(0, text.length() - TRAILING_FRAGMENT_LENGTH));
    }
}
