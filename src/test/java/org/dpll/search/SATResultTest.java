package org.dpll.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SATResult")
class SATResultTest {

    @Test
    @DisplayName("UNKNOWN richiede il motivo, gli altri verdetti lo vietano")
    void shouldValidateAbortReason() {
        assertThrows(IllegalArgumentException.class, () -> new SATResult(Verdict.UNKNOWN, null, null));
        assertThrows(IllegalArgumentException.class, () -> new SATResult(Verdict.UNKNOWN, " ", null));
        assertThrows(IllegalArgumentException.class, () -> new SATResult(Verdict.SATISFIABLE, "timeout", null));
        assertThrows(IllegalArgumentException.class, () -> new SATResult(null, null, null));
    }

    @Test
    @DisplayName("Le factory impostano verdetto e statistiche")
    void factoriesShouldSetVerdict() {
        SATStatistics statistics = new SATStatistics();

        SATResult unknown = SATResult.unknown("Timeout di 10 secondi", statistics);

        assertTrue(SATResult.satisfiable(statistics).isSatisfiable());
        assertTrue(SATResult.unsatisfiable(statistics).isUnsatisfiable());
        assertTrue(unknown.isUnknown());
        assertSame(statistics, unknown.getStatistics());
        assertEquals("UNKNOWN (Timeout di 10 secondi)", unknown.toString());
        assertNotNull(SATResult.unsatisfiable(null).getStatistics());
    }

    @Test
    @DisplayName("L'uguaglianza ignora le statistiche")
    void equalityShouldIgnoreStatistics() {
        SATStatistics busy = new SATStatistics();
        busy.enterNode(3);
        busy.incrementDecisions();

        assertEquals(SATResult.unsatisfiable(new SATStatistics()), SATResult.unsatisfiable(busy));
        assertNotEquals(SATResult.satisfiable(busy), SATResult.unsatisfiable(busy));
        assertEquals(SATResult.unsatisfiable(busy).hashCode(), SATResult.unsatisfiable(null).hashCode());
    }
}
