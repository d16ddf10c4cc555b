package org.dpll.search;

/**
 * STATISTICHE DPLL - Raccolta delle metriche di esecuzione della ricerca
 *
 * Conta nodi visitati, decisioni di branching, propagazioni unitarie, clausole eliminate
 * per letterali puri e conflitti (clausole vuote), oltre alla profondità massima della
 * ricorsione e al tempo di esecuzione.
 */
public class SATStatistics {

    //region CONTATORI METRICHE CORE

    /** Chiamate ricorsive della ricerca, radice inclusa. */
    private long nodes = 0;

    /** Branching effettivi: coppie di rami [n] / [-n] generate. */
    private long decisions = 0;

    /** Variabili di branching saltate perché assenti dalla formula semplificata. */
    private long skippedVariables = 0;

    /** Letterali propagati dalle clausole unitarie. */
    private long propagations = 0;

    /** Clausole rimosse dall'eliminazione dei letterali puri. */
    private long pureLiteralEliminations = 0;

    /** Nodi terminati con una clausola vuota. */
    private long conflicts = 0;

    /** Profondità massima raggiunta dalla ricorsione (radice = 1). */
    private int maxDepth = 0;

    //endregion

    //region TIMING

    /** Tempo di esecuzione finale in millisecondi, valido dopo stopTimer(). */
    private long executionTimeMs = 0;

    /** Timestamp di inizio misurazione. */
    private final long startTime;

    /** Evita fermate multiple del timer. */
    private boolean timerStopped = false;

    //endregion

    //region INIZIALIZZAZIONE

    /**
     * Inizializza le statistiche avviando subito il timer.
     */
    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //endregion

    //region OPERAZIONI DI INCREMENTO CONTATORI

    /**
     * Registra l'ingresso in un nodo della ricerca alla profondità indicata.
     *
     * @param depth profondità del nodo (radice = 1)
     */
    public synchronized void enterNode(int depth) {
        nodes++;
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    public synchronized void incrementDecisions() {
        decisions++;
    }

    public synchronized void incrementSkippedVariables() {
        skippedVariables++;
    }

    public synchronized void addPropagations(int count) {
        propagations += count;
    }

    public synchronized void addPureLiteralEliminations(int count) {
        pureLiteralEliminations += count;
    }

    public synchronized void incrementConflicts() {
        conflicts++;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma la misurazione del tempo. Chiamate multiple sono sicure.
     */
    public synchronized void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale se il timer è fermo, altrimenti tempo parziale corrente
     */
    public synchronized long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public synchronized boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS LETTURA METRICHE

    public synchronized long getNodes() {
        return nodes;
    }

    public synchronized long getDecisions() {
        return decisions;
    }

    public synchronized long getSkippedVariables() {
        return skippedVariables;
    }

    public synchronized long getPropagations() {
        return propagations;
    }

    public synchronized long getPureLiteralEliminations() {
        return pureLiteralEliminations;
    }

    public synchronized long getConflicts() {
        return conflicts;
    }

    public synchronized int getMaxDepth() {
        return maxDepth;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * Report multilinea usato nei file RESULT.
     */
    @Override
    public synchronized String toString() {
        StringBuilder output = new StringBuilder();

        output.append("======================================[ SEARCH STATS ]=======================================\n");
        output.append("    Nodi:              ").append(nodes).append("\n");
        output.append("    Decisioni:         ").append(decisions).append("\n");
        if (skippedVariables > 0) {
            output.append("    Variabili saltate: ").append(skippedVariables).append("\n");
        }
        output.append("    Propagazioni:      ").append(propagations).append("\n");
        output.append("    Letterali puri:    ").append(pureLiteralEliminations).append(" clausole rimosse\n");
        output.append("    Conflitti:         ").append(conflicts).append("\n");
        output.append("    Profondità max:    ").append(maxDepth).append("\n");
        output.append("    Tempo:             ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=============================================================================================\n");

        return output.toString();
    }

    /**
     * @return metriche essenziali su una sola riga, per il logging
     */
    public synchronized String toCompactString() {
        return String.format("Stats[Nodi:%d, Dec:%d, Prop:%d, Puri:%d, Conf:%d, Prof:%d, Time:%dms]",
                nodes, decisions, propagations, pureLiteralEliminations, conflicts, maxDepth, getExecutionTimeMs());
    }

    //endregion
}
