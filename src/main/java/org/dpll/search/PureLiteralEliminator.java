package org.dpll.search;

import org.dpll.support.CNFFormula;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ELIMINAZIONE LETTERALI PURI - Rimozione delle clausole banalmente soddisfacibili
 *
 * Un letterale l è puro se -l non compare in nessuna clausola. Asserire l soddisfa
 * tutte le clausole che lo contengono senza toccare le altre, quindi quelle clausole
 * possono essere rimosse senza cambiare la soddisfacibilità.
 *
 * Dopo ogni passata la formula viene riesaminata: rimuovere clausole può rendere puri
 * letterali che prima non lo erano.
 */
public class PureLiteralEliminator {

    private static final Logger LOGGER = Logger.getLogger(PureLiteralEliminator.class.getName());

    /**
     * Elimina ripetutamente le clausole che contengono letterali puri, sul posto.
     *
     * @param formula formula da semplificare (tipicamente già propagata)
     * @return numero di clausole rimosse; 0 se non c'erano letterali puri
     */
    public int eliminate(CNFFormula formula) {
        int removedClauses = 0;

        while (true) {
            Set<Integer> pureLiterals = findPureLiterals(formula.collectLiterals());
            if (pureLiterals.isEmpty()) {
                break;
            }

            // Ogni letterale puro compare in almeno una clausola: la passata rimuove sempre qualcosa
            int removed = formula.removeClausesContainingAny(pureLiterals);
            removedClauses += removed;

            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Letterali puri " + pureLiterals + ": " + removed + " clausole rimosse");
            }
        }

        return removedClauses;
    }

    /**
     * @param literals tutti i letterali presenti nella formula
     * @return sottoinsieme dei letterali la cui negazione è assente
     */
    private Set<Integer> findPureLiterals(Set<Integer> literals) {
        Set<Integer> pure = new HashSet<>();
        for (Integer literal : literals) {
            if (!literals.contains(-literal)) {
                pure.add(literal);
            }
        }
        return pure;
    }
}
