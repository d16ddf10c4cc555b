package org.dpll.search;

import org.dpll.support.CNFFormula;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PROPAGAZIONE UNITARIA - Risoluzione esaustiva delle clausole unitarie
 *
 * Finché la formula contiene una clausola unitaria [p]:
 * 1. Rimuove tutte le clausole che contengono p (ormai soddisfatte)
 * 2. Rimuove -p da tutte le clausole rimanenti (non più soddisfacibile tramite -p)
 *
 * Un singolo passaggio non basta: togliere -p può creare nuove clausole unitarie.
 * La propagazione è confluente, quindi l'ordine di scelta delle clausole unitarie
 * (qui la prima in ordine di inserimento) non cambia il punto fisso raggiunto.
 *
 * Il ciclo non si ferma alla prima clausola vuota: continua fino a quando non restano
 * clausole unitarie, così una seconda applicazione non modifica più la formula.
 * Ogni iterazione rimuove almeno la clausola [p], quindi il ciclo termina.
 */
public class UnitPropagator {

    private static final Logger LOGGER = Logger.getLogger(UnitPropagator.class.getName());

    /**
     * Applica la propagazione unitaria fino al punto fisso, modificando la formula sul posto.
     *
     * @param formula formula da semplificare
     * @return numero di letterali propagati
     */
    public int propagate(CNFFormula formula) {
        int propagated = 0;

        Integer unitLiteral;
        while ((unitLiteral = formula.findUnitLiteral()) != null) {
            int satisfied = formula.removeClausesContaining(unitLiteral);
            int falsified = formula.removeLiteral(-unitLiteral);
            propagated++;

            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Propagato " + unitLiteral + ": " + satisfied + " clausole soddisfatte, "
                        + falsified + " occorrenze di " + (-unitLiteral) + " rimosse");
            }
        }

        return propagated;
    }
}
