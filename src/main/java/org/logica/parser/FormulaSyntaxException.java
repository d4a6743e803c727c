package org.logica.parser;

import org.logica.support.LogicException;

/**
 * Errore di sintassi nel testo di una formula, con posizione (riga da 1, colonna da 0).
 */
public class FormulaSyntaxException extends LogicException {

    private final int line;
    private final int column;

    public FormulaSyntaxException(String message, int line, int column) {
        super("Errore di sintassi alla riga " + line + ", colonna " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public FormulaSyntaxException(String message, int line, int column, Throwable cause) {
        super("Errore di sintassi alla riga " + line + ", colonna " + column + ": " + message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
