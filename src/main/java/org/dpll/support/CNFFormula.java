package org.dpll.support;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA CNF - Archivio delle clausole su cui lavora la ricerca DPLL
 *
 * Rappresenta una formula in Forma Normale Congiuntiva come lista di clausole, dove ogni
 * clausola è una lista di letterali interi in notazione DIMACS. La stessa struttura è
 * utilizzata sia come formula validata in ingresso sia come copia di lavoro dei singoli
 * rami della ricerca, che la semplificano sul posto.
 *
 * VALIDAZIONI IN COSTRUZIONE:
 * - Numero variabili non negativo
 * - Nessun letterale 0 e nessun letterale con |l| > numero variabili
 * - Clausole tautologiche (contengono v e -v) scartate silenziosamente
 * - Letterali duplicati nella stessa clausola collassati
 * - Clausole vuote in ingresso conservate (contraddizione)
 *
 * INVARIANTI MANTENUTE:
 * - Nessuna clausola contiene contemporaneamente un letterale e la sua negazione
 * - Ogni letterale ha modulo compreso tra 1 e il numero di variabili
 * - Le copie sono indipendenti: nessuna clausola è condivisa tra due formule
 */
public class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    //region STRUTTURE DATI CORE

    /**
     * Clausole della formula. Ogni clausola è una ArrayList mutabile di letterali:
     * - Valori positivi: variabile asserita vera
     * - Valori negativi: variabile asserita falsa
     * - Lista vuota: clausola vuota, sempre falsa
     */
    private final List<List<Integer>> clauses;

    /**
     * Limite superiore dichiarato per il modulo dei letterali.
     * Coincide con il numero di variabili dell'header DIMACS.
     */
    private final int variableCount;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * Costruisce la formula a partire da sequenze grezze di letterali.
     *
     * PROCESSO DI COSTRUZIONE:
     * 1. Validazione del limite sulle variabili
     * 2. Validazione di ogni letterale (non nullo, non zero, entro il limite)
     * 3. Eliminazione dei duplicati interni alla clausola
     * 4. Scarto delle clausole tautologiche
     * 5. Registrazione delle statistiche di costruzione
     *
     * @param variableCount numero di variabili dichiarato (≥ 0)
     * @param rawClauses clausole grezze come sequenze di letterali
     * @throws IllegalArgumentException se il limite è negativo o un letterale non è valido
     */
    public CNFFormula(int variableCount, List<List<Integer>> rawClauses) {
        if (variableCount < 0) {
            throw new IllegalArgumentException("Numero variabili non può essere negativo: " + variableCount);
        }
        if (rawClauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }

        this.variableCount = variableCount;
        this.clauses = new ArrayList<>(rawClauses.size());

        int tautologies = 0;
        for (int clauseIndex = 0; clauseIndex < rawClauses.size(); clauseIndex++) {
            List<Integer> normalized = normalizeClause(rawClauses.get(clauseIndex), clauseIndex);
            if (normalized == null) {
                tautologies++;
                continue;
            }
            clauses.add(normalized);
        }

        logConstructionStatistics(rawClauses.size(), tautologies);
    }

    /**
     * Costruttore di copia: duplica ogni clausola, nessun logging.
     */
    private CNFFormula(CNFFormula source, int extraCapacity) {
        this.variableCount = source.variableCount;
        this.clauses = new ArrayList<>(source.clauses.size() + extraCapacity);
        for (List<Integer> clause : source.clauses) {
            clauses.add(new ArrayList<>(clause));
        }
    }

    /**
     * Valida e normalizza una clausola grezza.
     *
     * @param rawClause letterali della clausola
     * @param clauseIndex posizione della clausola per i messaggi di errore
     * @return clausola normalizzata, oppure null se tautologica
     */
    private List<Integer> normalizeClause(List<Integer> rawClause, int clauseIndex) {
        if (rawClause == null) {
            throw new IllegalArgumentException("Clausola " + clauseIndex + " è null");
        }

        for (Integer literal : rawClause) {
            validateLiteral(literal, clauseIndex);
        }

        // LinkedHashSet: elimina i duplicati preservando l'ordine di prima occorrenza
        Set<Integer> literals = new LinkedHashSet<>();
        for (Integer literal : rawClause) {
            if (literals.contains(-literal)) {
                LOGGER.finest("Clausola tautologica scartata: " + clauseIndex + " " + rawClause);
                return null;
            }
            literals.add(literal);
        }

        return new ArrayList<>(literals);
    }

    /**
     * Verifica che il letterale sia non nullo, diverso da zero ed entro il limite dichiarato.
     */
    private void validateLiteral(Integer literal, int clauseIndex) {
        if (literal == null || literal == 0) {
            throw new IllegalArgumentException("Letterale non valido in clausola " + clauseIndex + ": " + literal);
        }
        // Integer.MIN_VALUE non ha opposto rappresentabile
        if (literal == Integer.MIN_VALUE || Math.abs(literal) > variableCount) {
            throw new IllegalArgumentException("Letterale fuori range in clausola " + clauseIndex +
                    ": |" + literal + "| > " + variableCount);
        }
    }

    //endregion

    //region COPIA PER I RAMI DELLA RICERCA

    /**
     * @return copia strutturale indipendente della formula
     */
    public CNFFormula copy() {
        return new CNFFormula(this, 0);
    }

    /**
     * Crea una copia indipendente con in coda la clausola unitaria [literal].
     * Usata dalla ricerca per fissare la polarità della variabile di branching.
     *
     * @param literal letterale da asserire
     * @return nuova formula, la formula corrente resta invariata
     */
    public CNFFormula withUnitClause(int literal) {
        CNFFormula branch = new CNFFormula(this, 1);
        List<Integer> unit = new ArrayList<>(1);
        unit.add(literal);
        branch.clauses.add(unit);
        return branch;
    }

    //endregion

    //region INTERROGAZIONI

    /**
     * @return true se la formula non ha clausole (vera per vacuità)
     */
    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * @return true se almeno una clausola è vuota (formula insoddisfacibile)
     */
    public boolean hasEmptyClause() {
        for (List<Integer> clause : clauses) {
            if (clause.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Cerca la prima clausola unitaria in ordine di inserimento.
     *
     * @return unico letterale della prima clausola unitaria, null se non ce ne sono
     */
    public Integer findUnitLiteral() {
        for (List<Integer> clause : clauses) {
            if (clause.size() == 1) {
                return clause.get(0);
            }
        }
        return null;
    }

    /**
     * @return insieme di tutti i letterali presenti in almeno una clausola
     */
    public Set<Integer> collectLiterals() {
        Set<Integer> literals = new HashSet<>();
        for (List<Integer> clause : clauses) {
            literals.addAll(clause);
        }
        return literals;
    }

    /**
     * @param variable variabile (positiva) da cercare
     * @return true se la variabile compare con almeno una polarità
     */
    public boolean containsVariable(int variable) {
        for (List<Integer> clause : clauses) {
            if (clause.contains(variable) || clause.contains(-variable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return numero totale di occorrenze di letterali
     */
    public int getLiteralCount() {
        int total = 0;
        for (List<Integer> clause : clauses) {
            total += clause.size();
        }
        return total;
    }

    //endregion

    //region MODIFICHE USATE DALLE SEMPLIFICAZIONI

    /**
     * Rimuove tutte le clausole che contengono il letterale (ormai soddisfatte).
     *
     * @param literal letterale reso vero
     * @return numero di clausole rimosse
     */
    public int removeClausesContaining(int literal) {
        int before = clauses.size();
        clauses.removeIf(clause -> clause.contains(literal));
        return before - clauses.size();
    }

    /**
     * Rimuove ogni occorrenza del letterale dalle clausole (ormai falso).
     * Le clausole possono diventare unitarie o vuote.
     *
     * @param literal letterale reso falso
     * @return numero di occorrenze rimosse
     */
    public int removeLiteral(int literal) {
        int removed = 0;
        Integer boxed = literal;
        for (List<Integer> clause : clauses) {
            while (clause.remove(boxed)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Rimuove le clausole che contengono almeno uno dei letterali indicati.
     *
     * @param literals letterali resi veri
     * @return numero di clausole rimosse
     */
    public int removeClausesContainingAny(Set<Integer> literals) {
        int before = clauses.size();
        clauses.removeIf(clause -> {
            for (Integer literal : clause) {
                if (literals.contains(literal)) {
                    return true;
                }
            }
            return false;
        });
        return before - clauses.size();
    }

    //endregion

    //region STATISTICHE E LOGGING

    /**
     * Registra le statistiche di costruzione della formula.
     */
    private void logConstructionStatistics(int rawClauseCount, int tautologies) {
        int totalLiterals = getLiteralCount();
        double avgClauseLength = clauses.isEmpty() ? 0.0 : (double) totalLiterals / clauses.size();

        LOGGER.info(String.format("Formula CNF costruita: %d clausole, %d variabili, %.1f letterali/clausola",
                clauses.size(), variableCount, avgClauseLength));

        if (tautologies > 0) {
            LOGGER.fine("Clausole tautologiche scartate: " + tautologies + "/" + rawClauseCount);
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            Map<Integer, Long> lengthDistribution = clauses.stream()
                    .collect(Collectors.groupingBy(List::size, TreeMap::new, Collectors.counting()));
            LOGGER.fine("Distribuzione lunghezza clausole: " + lengthDistribution);
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return vista in sola lettura delle clausole
     */
    public List<List<Integer>> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    /**
     * @return limite dichiarato sul numero di variabili
     */
    public int getVariableCount() {
        return variableCount;
    }

    /**
     * @return numero di clausole nella formula
     */
    public int getClausesCount() {
        return clauses.size();
    }

    /**
     * Serializza la formula in formato DIMACS CNF.
     *
     * @return header "p cnf" seguito da una riga per clausola terminata da 0
     */
    public String toDimacs() {
        StringBuilder dimacs = new StringBuilder();
        dimacs.append("p cnf ").append(variableCount).append(' ').append(clauses.size()).append('\n');
        for (List<Integer> clause : clauses) {
            for (Integer literal : clause) {
                dimacs.append(literal).append(' ');
            }
            dimacs.append("0\n");
        }
        return dimacs.toString();
    }

    /**
     * Rappresentazione testuale per debugging con informazioni essenziali.
     */
    @Override
    public String toString() {
        return String.format("CNFFormula{clausole=%d, variabili=%d, %s}",
                clauses.size(), variableCount, clauses);
    }

    //endregion
}
