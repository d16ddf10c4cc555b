package org.dpll.search;

/**
 * Esito di una risoluzione.
 */
public enum Verdict {

    /** Esiste un assegnamento che soddisfa tutte le clausole. */
    SATISFIABLE,

    /** Nessun assegnamento soddisfa la formula. */
    UNSATISFIABLE,

    /** Ricerca interrotta (timeout o limite di nodi) prima di un esito. */
    UNKNOWN
}
