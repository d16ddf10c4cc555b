package org.dpll.search;

/**
 * Segnala l'interruzione della ricerca prima di un esito: thread interrotto
 * dal chiamante oppure limite di nodi superato.
 */
public class SearchAbortedException extends RuntimeException {

    /** Nodi visitati al momento dell'interruzione. */
    private final long visitedNodes;

    public SearchAbortedException(String message, long visitedNodes) {
        super(message);
        this.visitedNodes = visitedNodes;
    }

    public long getVisitedNodes() {
        return visitedNodes;
    }
}
