package org.dpll.search;

import java.util.Objects;

/**
 * RISULTATO SAT - Contenitore immutabile per l'esito della ricerca DPLL
 *
 * Associa il verdetto alle statistiche di esecuzione. Il solutore non estrae modelli:
 * un risultato SATISFIABLE attesta solo l'esistenza di un assegnamento.
 *
 * COMPONENTI:
 * • Verdetto: SATISFIABLE, UNSATISFIABLE oppure UNKNOWN (ricerca interrotta)
 * • Motivo dell'interruzione: presente solo per UNKNOWN
 * • Statistiche: sempre disponibili
 */
public class SATResult {

    //region ATTRIBUTI CORE

    private final Verdict verdict;

    /** Motivo dell'interruzione, non null se e solo se il verdetto è UNKNOWN. */
    private final String abortReason;

    private final SATStatistics statistics;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * @param verdict esito della ricerca
     * @param abortReason motivo dell'interruzione (richiesto per UNKNOWN, null altrimenti)
     * @param statistics metriche di esecuzione (null → statistiche vuote)
     * @throws IllegalArgumentException se verdetto e motivo non sono coerenti
     */
    public SATResult(Verdict verdict, String abortReason, SATStatistics statistics) {
        if (verdict == null) {
            throw new IllegalArgumentException("Verdetto non può essere null");
        }
        if (verdict == Verdict.UNKNOWN && (abortReason == null || abortReason.isBlank())) {
            throw new IllegalArgumentException("Risultato UNKNOWN richiede il motivo dell'interruzione");
        }
        if (verdict != Verdict.UNKNOWN && abortReason != null) {
            throw new IllegalArgumentException("Risultato " + verdict + " non può avere un motivo di interruzione");
        }

        this.verdict = verdict;
        this.abortReason = abortReason;
        this.statistics = statistics != null ? statistics : new SATStatistics();
    }

    //endregion

    //region FACTORY METHODS

    public static SATResult satisfiable(SATStatistics statistics) {
        return new SATResult(Verdict.SATISFIABLE, null, statistics);
    }

    public static SATResult unsatisfiable(SATStatistics statistics) {
        return new SATResult(Verdict.UNSATISFIABLE, null, statistics);
    }

    public static SATResult unknown(String reason, SATStatistics statistics) {
        return new SATResult(Verdict.UNKNOWN, reason, statistics);
    }

    //endregion

    //region ACCESSORS E QUERY

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isSatisfiable() {
        return verdict == Verdict.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return verdict == Verdict.UNSATISFIABLE;
    }

    public boolean isUnknown() {
        return verdict == Verdict.UNKNOWN;
    }

    /**
     * @return motivo dell'interruzione per UNKNOWN, null altrimenti
     */
    public String getAbortReason() {
        return abortReason;
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * Estrae riepilogo esecuzione per reporting rapido.
     */
    public String getExecutionSummary() {
        return String.format("Esito: %s | Nodi: %d | Decisioni: %d | Conflitti: %d | Profondità max: %d | Tempo: %dms",
                verdict,
                statistics.getNodes(),
                statistics.getDecisions(),
                statistics.getConflicts(),
                statistics.getMaxDepth(),
                statistics.getExecutionTimeMs());
    }

    @Override
    public String toString() {
        if (verdict == Verdict.UNKNOWN) {
            return verdict + " (" + abortReason + ")";
        }
        return verdict.toString();
    }

    /**
     * Uguaglianza sul contenuto logico: le statistiche sono ignorate.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SATResult other = (SATResult) obj;
        return verdict == other.verdict && Objects.equals(abortReason, other.abortReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verdict, abortReason);
    }

    //endregion
}
