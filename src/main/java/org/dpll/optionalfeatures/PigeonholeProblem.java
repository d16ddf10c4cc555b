package org.dpll.optionalfeatures;

import org.dpll.support.CNFFormula;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GENERATORE PIGEONHOLE PROBLEM - Istanze UNSAT in formato DIMACS
 *
 * Codifica l'impossibilità di inserire n+1 piccioni in n buche con al più un piccione
 * per buca. Le istanze sono tutte insoddisfacibili e la loro difficoltà per un solutore
 * DPLL cresce rapidamente con n, quindi sono adatte come benchmark.
 *
 * FORMULAZIONE LOGICA:
 * - Variabili: p(i,j) = "piccione i è nella buca j", numerata (i-1)·n + j
 * - Vincoli positivi: ∀i ∈ [1,n+1]: (p(i,1) ∨ ... ∨ p(i,n))
 * - Vincoli negativi: ∀j ∈ [1,n], ∀i < h ∈ [1,n+1]: (¬p(i,j) ∨ ¬p(h,j))
 */
public class PigeonholeProblem {

    private static final Logger LOGGER = Logger.getLogger(PigeonholeProblem.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Nome directory contenitore per istanze generate */
    public static final String PIGEONHOLE_DIR = "PIGEONHOLE";

    /** Prefisso nome file per istanze generate */
    private static final String FILE_PREFIX = "pigeonhole_";

    /** Estensione file per istanze generate */
    private static final String FILE_EXTENSION = ".cnf";

    /** Limiti sul numero di istanze generabili in una sessione */
    public static final int MIN_INSTANCES = 1;
    public static final int MAX_INSTANCES = 100;

    //endregion

    //region STATO GENERAZIONE

    /** Directory base di output, null finché non configurata */
    private String outputDirectory;

    /** Istanze scritte con successo nella sessione corrente */
    private int generatedInstances;

    //endregion

    //region CONFIGURAZIONE

    /**
     * Configura directory di output per salvataggio istanze generate.
     *
     * @param outputPath percorso directory base dove creare la sottodirectory PIGEONHOLE
     * @throws IllegalArgumentException se outputPath null o vuoto
     */
    public void setOutputDirectory(String outputPath) {
        if (outputPath == null || outputPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Directory output non può essere null o vuota");
        }
        this.outputDirectory = outputPath.trim();
        LOGGER.fine("Directory output configurata: " + outputDirectory);
    }

    //endregion

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Costruisce l'istanza PHP(n+1, n).
     *
     * @param n numero di buche (≥ 1)
     * @return formula con (n+1)·n variabili e (n+1) + n·C(n+1, 2) clausole
     * @throws IllegalArgumentException se n < 1
     */
    public CNFFormula buildFormula(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Numero buche deve essere almeno 1, ricevuto: " + n);
        }

        List<List<Integer>> clauses = new ArrayList<>();
        generatePositiveConstraints(clauses, n);
        generateNegativeConstraints(clauses, n);

        return new CNFFormula((n + 1) * n, clauses);
    }

    /**
     * Genera le istanze n = 1..numberOfProblems in PIGEONHOLE/pigeonhole_n.cnf.
     *
     * @param numberOfProblems numero istanze da generare (1 ≤ n ≤ 100)
     * @throws IllegalArgumentException se numberOfProblems fuori range
     * @throws IllegalStateException se la directory di output non è configurata
     * @throws IOException se la scrittura di un file fallisce
     */
    public void generateInstances(int numberOfProblems) throws IOException {
        if (numberOfProblems < MIN_INSTANCES || numberOfProblems > MAX_INSTANCES) {
            throw new IllegalArgumentException("Numero problemi deve essere tra " + MIN_INSTANCES + " e "
                    + MAX_INSTANCES + ", ricevuto: " + numberOfProblems);
        }
        if (outputDirectory == null) {
            throw new IllegalStateException("Directory output non configurata - chiamare setOutputDirectory() prima");
        }

        generatedInstances = 0;
        Path pigeonholePath = Paths.get(outputDirectory).resolve(PIGEONHOLE_DIR);
        Files.createDirectories(pigeonholePath);
        LOGGER.info("Inizio generazione " + numberOfProblems + " istanze Pigeonhole Problem in " + pigeonholePath);

        try {
            for (int n = 1; n <= numberOfProblems; n++) {
                savePigeonholeInstance(pigeonholePath, n);
                generatedInstances++;

                // Progresso ogni 10 istanze
                if (n % 10 == 0) {
                    System.out.println("[I] Progresso generazione: " + n + "/" + numberOfProblems + " istanze completate");
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante generazione istanze Pigeonhole", e);
            System.out.println("[E] Generazione fallita dopo " + generatedInstances + "/" + numberOfProblems + " istanze");
            throw e;
        }

        LOGGER.info("Generazione completata: " + generatedInstances + " istanze");
    }

    //endregion

    //region COSTRUZIONE VINCOLI

    /**
     * Ogni piccione deve essere in almeno una buca.
     */
    private void generatePositiveConstraints(List<List<Integer>> clauses, int n) {
        for (int pigeon = 1; pigeon <= n + 1; pigeon++) {
            List<Integer> clause = new ArrayList<>(n);
            for (int hole = 1; hole <= n; hole++) {
                clause.add(variable(pigeon, hole, n));
            }
            clauses.add(clause);
        }
    }

    /**
     * Ogni buca può contenere al più un piccione.
     */
    private void generateNegativeConstraints(List<List<Integer>> clauses, int n) {
        for (int hole = 1; hole <= n; hole++) {
            for (int pigeon1 = 1; pigeon1 <= n + 1; pigeon1++) {
                for (int pigeon2 = pigeon1 + 1; pigeon2 <= n + 1; pigeon2++) {
                    clauses.add(List.of(-variable(pigeon1, hole, n), -variable(pigeon2, hole, n)));
                }
            }
        }
    }

    /**
     * @return indice DIMACS della variabile "piccione pigeon nella buca hole"
     */
    static int variable(int pigeon, int hole, int n) {
        return (pigeon - 1) * n + hole;
    }

    //endregion

    //region SALVATAGGIO FILE

    private void savePigeonholeInstance(Path pigeonholePath, int n) throws IOException {
        Path filePath = pigeonholePath.resolve(FILE_PREFIX + n + FILE_EXTENSION);
        CNFFormula formula = buildFormula(n);

        try (Writer writer = Files.newBufferedWriter(filePath, StandardCharsets.UTF_8)) {
            writer.write("c Pigeonhole Problem: " + (n + 1) + " piccioni, " + n + " buche (UNSAT)\n");
            writer.write("c variabile (i-1)*" + n + "+j = piccione i nella buca j\n");
            writer.write(formula.toDimacs());
        }

        LOGGER.finest("Istanza n=" + n + " salvata: " + filePath);
    }

    //endregion

    //region INTERFACCIA PUBBLICA INFORMAZIONI

    public int getGeneratedInstancesCount() {
        return generatedInstances;
    }

    /**
     * @return directory in cui vengono scritte le istanze
     */
    public String getOutputDirectory() {
        return outputDirectory == null ? null : Paths.get(outputDirectory).resolve(PIGEONHOLE_DIR).toString();
    }

    //endregion
}
