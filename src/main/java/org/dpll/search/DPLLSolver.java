package org.dpll.search;

import org.dpll.support.CNFFormula;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE DPLL - Ricerca ricorsiva con propagazione unitaria e letterali puri
 *
 * Ogni chiamata della ricerca, parametrizzata da (formula, n):
 * 1. Semplifica: propagazione unitaria, poi eliminazione dei letterali puri
 * 2. Formula senza clausole → soddisfacibile
 * 3. Formula con una clausola vuota → insoddisfacibile
 * 4. Altrimenti biforca su n: una copia con [n], una con [-n], entrambe con n+1
 *
 * L'assegnamento parziale non è memorizzato esplicitamente: è implicito nelle clausole
 * unitarie aggiunte dagli antenati e già consumate dalla propagazione. Ogni ramo lavora
 * sulla propria copia della formula, i rami fratelli non condividono stato.
 *
 * VARIANTI CHE NON CAMBIANO IL VERDETTO:
 * - OR in corto circuito: il ramo negativo non viene esplorato se il positivo è SAT
 * - Se la variabile n non compare più nella formula i due rami sono identici
 *   (la clausola [n] verrebbe solo propagata via): il contatore avanza nello stesso nodo
 *   fino alla prima variabile presente, senza ricorsione
 *
 * La ricerca controlla a ogni nodo il flag di interruzione del thread e l'eventuale
 * limite di nodi, così un chiamante con timeout può fermarla.
 */
public class DPLLSolver {

    /** Logger per tracciamento debug della ricerca */
    private static final Logger LOGGER = Logger.getLogger(DPLLSolver.class.getName());

    /** Valore di nodeLimit che disattiva il limite di nodi */
    public static final long UNLIMITED_NODES = 0;

    //region STRUTTURE DATI CORE

    /** Formula da risolvere: mai modificata, solve() lavora su una copia */
    private final CNFFormula formula;

    /** Limite sui nodi visitati, UNLIMITED_NODES per nessun limite */
    private final long nodeLimit;

    private final UnitPropagator unitPropagator = new UnitPropagator();

    private final PureLiteralEliminator pureLiteralEliminator = new PureLiteralEliminator();

    /** Statistiche dell'ultima ricerca */
    private volatile SATStatistics statistics = new SATStatistics();

    //endregion

    //region INIZIALIZZAZIONE

    /**
     * @param formula formula validata da risolvere
     */
    public DPLLSolver(CNFFormula formula) {
        this(formula, UNLIMITED_NODES);
    }

    /**
     * @param formula formula validata da risolvere
     * @param nodeLimit numero massimo di nodi di ricerca (UNLIMITED_NODES = nessun limite)
     * @throws IllegalArgumentException se la formula è null o il limite è negativo
     */
    public DPLLSolver(CNFFormula formula, long nodeLimit) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        if (nodeLimit < 0) {
            throw new IllegalArgumentException("Limite nodi non può essere negativo: " + nodeLimit);
        }
        this.formula = formula;
        this.nodeLimit = nodeLimit;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Risolve la formula partendo dalla variabile 1.
     *
     * La formula passata al costruttore resta invariata. Un'interruzione del thread o il
     * superamento del limite di nodi producono un risultato UNKNOWN.
     *
     * @return risultato con verdetto e statistiche
     */
    public SATResult solve() {
        this.statistics = new SATStatistics();
        LOGGER.fine(String.format("Avvio ricerca DPLL: %d clausole, %d variabili",
                formula.getClausesCount(), formula.getVariableCount()));

        try {
            boolean satisfiable = search(formula.copy(), 1, 1);
            statistics.stopTimer();

            SATResult result = satisfiable
                    ? SATResult.satisfiable(statistics)
                    : SATResult.unsatisfiable(statistics);
            LOGGER.fine("Ricerca DPLL completata: " + result + " " + statistics.toCompactString());
            return result;

        } catch (SearchAbortedException e) {
            statistics.stopTimer();
            LOGGER.fine("Ricerca DPLL interrotta dopo " + e.getVisitedNodes() + " nodi: " + e.getMessage());
            return SATResult.unknown(e.getMessage(), statistics);
        }
    }

    /**
     * Decide se la formula è soddisfacibile usando le variabili numerate da
     * branchVariable in su. La formula viene semplificata sul posto.
     *
     * @param formula formula di lavoro, di proprietà esclusiva di questa chiamata
     * @param branchVariable prossima variabile su cui biforcare (≥ 1)
     * @return true se e solo se la formula è soddisfacibile
     * @throws IllegalStateException se le variabili si esauriscono con la formula ancora indecisa
     * @throws SearchAbortedException se il thread viene interrotto o il limite di nodi è superato
     */
    public boolean search(CNFFormula formula, int branchVariable) {
        return search(formula, branchVariable, 1);
    }

    /**
     * @return statistiche dell'ultima ricerca (parziali se ancora in corso)
     */
    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region RICERCA RICORSIVA

    private boolean search(CNFFormula current, int branchVariable, int depth) {
        checkAbortConditions();
        statistics.enterNode(depth);

        // FASE 1: semplificazione
        statistics.addPropagations(unitPropagator.propagate(current));
        statistics.addPureLiteralEliminations(pureLiteralEliminator.eliminate(current));

        // FASE 2: condizioni terminali
        if (current.isEmpty()) {
            LOGGER.finest("Nodo SAT a profondità " + depth);
            return true;
        }
        if (current.hasEmptyClause()) {
            statistics.incrementConflicts();
            LOGGER.finest("Clausola vuota a profondità " + depth);
            return false;
        }

        // FASE 3: variabili assenti, i due rami coinciderebbero
        int variable = branchVariable;
        while (variable <= current.getVariableCount() && !current.containsVariable(variable)) {
            statistics.incrementSkippedVariables();
            variable++;
        }

        if (variable > current.getVariableCount()) {
            throw new IllegalStateException("Variabili esaurite (n=" + variable + " > "
                    + current.getVariableCount() + ") con formula ancora indecisa: " + current);
        }

        // FASE 4: branching su n e -n, ciascun ramo sulla propria copia
        statistics.incrementDecisions();
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Branching su " + variable + " a profondità " + depth
                    + " (" + current.getClausesCount() + " clausole)");
        }

        if (search(current.withUnitClause(variable), variable + 1, depth + 1)) {
            return true;
        }
        return search(current.withUnitClause(-variable), variable + 1, depth + 1);
    }

    /**
     * Interrompe la ricerca se il thread è stato interrotto o il limite di nodi è raggiunto.
     */
    private void checkAbortConditions() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SearchAbortedException("Ricerca interrotta", statistics.getNodes());
        }
        if (nodeLimit != UNLIMITED_NODES && statistics.getNodes() >= nodeLimit) {
            throw new SearchAbortedException("Limite di " + nodeLimit + " nodi raggiunto", statistics.getNodes());
        }
    }

    //endregion
}
