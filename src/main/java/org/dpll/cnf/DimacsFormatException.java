package org.dpll.cnf;

/**
 * Errore di formato in un input DIMACS CNF, con la posizione del problema.
 */
public class DimacsFormatException extends IllegalArgumentException {

    /** Riga (da 1) dell'errore */
    private final int line;

    /** Colonna (da 0) dell'errore */
    private final int column;

    public DimacsFormatException(String message, int line, int column) {
        super("Riga " + line + ":" + column + " - " + message);
        this.line = line;
        this.column = column;
    }

    public DimacsFormatException(String message, int line, int column, Throwable cause) {
        super("Riga " + line + ":" + column + " - " + message, cause);
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
