package org.dpll.search;

import org.dpll.support.CNFFormula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PureLiteralEliminator")
class PureLiteralEliminatorTest {

    private final PureLiteralEliminator eliminator = new PureLiteralEliminator();

    @Test
    @DisplayName("Non modifica una formula senza letterali puri")
    void shouldBeNoOpWithoutPureLiterals() {
        CNFFormula formula = new CNFFormula(2, List.of(List.of(1, 2), List.of(-1, -2)));

        assertEquals(0, eliminator.eliminate(formula));
        assertEquals(2, formula.getClausesCount());
    }

    @Test
    @DisplayName("Rimuove le clausole con letterali puri")
    void shouldRemoveClausesWithPureLiterals() {
        // Given: 3 è puro, 1 e 2 compaiono con entrambe le polarità
        CNFFormula formula = new CNFFormula(3,
                List.of(List.of(1, 2), List.of(-1, -2), List.of(1, -2), List.of(-1, 2), List.of(3, 1)));

        // When
        int removed = eliminator.eliminate(formula);

        // Then
        assertEquals(1, removed);
        assertFalse(formula.containsVariable(3));
        assertEquals(4, formula.getClausesCount());
    }

    @Test
    @DisplayName("Riesamina la formula dopo ogni passata")
    void shouldRescanAfterRemoval() {
        // Given: rimuovere [3, -1] rende puro il letterale 1
        CNFFormula formula = new CNFFormula(3, List.of(List.of(3, -1), List.of(1, 2), List.of(1, -2)));

        // When
        int removed = eliminator.eliminate(formula);

        // Then
        assertEquals(3, removed);
        assertTrue(formula.isEmpty());
    }

    @Test
    @DisplayName("Ignora le clausole vuote")
    void shouldKeepEmptyClauses() {
        CNFFormula formula = new CNFFormula(1, List.of(List.of(), List.of(1)));

        assertEquals(1, eliminator.eliminate(formula));
        assertTrue(formula.hasEmptyClause());
    }
}
