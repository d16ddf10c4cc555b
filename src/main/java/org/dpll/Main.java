package org.dpll;

import org.dpll.cnf.DimacsFormatException;
import org.dpll.cnf.DimacsReader;
import org.dpll.optionalfeatures.PigeonholeProblem;
import org.dpll.search.DPLLSolver;
import org.dpll.search.SATResult;
import org.dpll.search.SATStatistics;
import org.dpll.support.CNFFormula;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SOLUTORE SAT DPLL (Davis-Putnam-Logemann-Loveland)
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file CNF in formato DIMACS
 * 2. PARSING: lexer e parser ANTLR, validazione di header e letterali
 * 3. RISOLUZIONE: ricerca DPLL con propagazione unitaria e letterali puri
 * 4. OUTPUT: verdetto SATISFIABLE / UNSATISFIABLE / UNKNOWN e report in RESULT/
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): risoluzione di un file .cnf
 * - Directory batch (-d): risoluzione di tutti i file .cnf di una cartella
 * - Timeout configurabile per formula (-t secondi)
 * - Limite sui nodi di ricerca per formula (-n nodi)
 * - Output directory personalizzabile (-o directory)
 * - Generazione istanze Pigeonhole Problem (-gen=pigeonhole numero)
 *
 * Il verdetto UNKNOWN indica una ricerca interrotta (timeout o limite di nodi):
 * non è né SAT né UNSAT.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String NODES_PARAM = "-n";
    private static final String GEN_PARAM = "-gen=";

    /**
     * Flag generazione problemi disponibili
     * */
    private static final String GEN_PIGEONHOLE = "pigeonhole";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Stack del thread di risoluzione: la ricorsione può arrivare a una profondità
     * pari al numero di variabili
     * */
    private static final long SOLVER_STACK_SIZE = 512L * 1024 * 1024;

    /**
     * Estensione dei file accettati in input
     * */
    private static final String CNF_EXTENSION = ".cnf";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO SOLUTORE SAT DPLL <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SolverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE SAT <---");
        }
    }

    /**
     * Delega alla modalità operativa scelta.
     *
     * @param config configurazione validata
     */
    private static void executeMainPipeline(SolverConfiguration config) throws IOException {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione istanze " + config.generationType);
            processInstanceGeneration(config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            processSingleFile(config);
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    /**
     * Registra l'errore critico e termina con codice 1.
     *
     * @param e eccezione critica che ha causato il fallimento
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @param args array di parametri da processare
     * @return configurazione validata o null se help/errore
     */
    private static SolverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SOLUTORE SAT <<--");

        if (config.isGenerationMode) {
            System.out.println("Modalità: Generazione istanze " + config.generationType);
            System.out.println("Numero istanze: " + config.generationCount);
        } else {
            System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
            System.out.println("Input: " + config.inputPath);
            System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
            System.out.println("Limite nodi: " + (config.nodeLimit == DPLLSolver.UNLIMITED_NODES
                    ? "Nessuno" : String.valueOf(config.nodeLimit)));
        }

        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    //endregion

    //region GENERAZIONE ISTANZE

    private static void processInstanceGeneration(SolverConfiguration config) throws IOException {
        System.out.println("-->> GENERAZIONE ISTANZE <<--");

        if (!GEN_PIGEONHOLE.equals(config.generationType)) {
            throw new IllegalArgumentException("Tipo generazione non supportato: " + config.generationType);
        }

        PigeonholeProblem generator = new PigeonholeProblem();
        generator.setOutputDirectory(config.outputPath);
        generator.generateInstances(config.generationCount);

        System.out.println("\n[I] Report generazione:");
        System.out.println("Istanze create: " + generator.getGeneratedInstancesCount());
        System.out.println("Directory output: " + generator.getOutputDirectory());
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Lettura → risoluzione con timeout → verdetto e report.
     * Gli errori del file vengono riportati senza propagarsi.
     *
     * @param config configurazione contenente path file e limiti
     * @return true se il file è stato letto e risolto (anche con esito UNKNOWN)
     */
    private static boolean processSingleFile(SolverConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        try {
            // FASE 1: lettura DIMACS
            System.out.println("Lettura formula DIMACS...");
            CNFFormula formula = DimacsReader.read(Paths.get(config.inputPath));
            System.out.printf("[I] Formula: %d clausole, %d variabili%n",
                    formula.getClausesCount(), formula.getVariableCount());

            // FASE 2: risoluzione con timeout
            SATResult result = executeSATSolvingWithTimeout(formula, config);

            // FASE 3: verdetto e report
            System.out.println(result.getVerdict());
            displayFinalStatistics(result);
            saveResult(result, formula, config);
            return true;

        } catch (DimacsFormatException e) {
            System.out.println("[E] Formato DIMACS non valido in '" + config.inputPath + "': " + e.getMessage());
        } catch (IOException e) {
            System.out.println("[E] Errore di accesso al file '" + config.inputPath + "': " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore durante la risoluzione di " + config.inputPath, e);
            System.out.println("[E] Errore elaborazione del file '" + config.inputPath + "': " + e.getMessage());
        }
        return false;
    }

    /**
     * Esegue la ricerca su un thread dedicato con timeout.
     *
     * Allo scadere del timeout il thread viene interrotto: la ricerca se ne accorge al
     * nodo successivo e il risultato è UNKNOWN.
     *
     * @param formula formula da risolvere
     * @param config configurazione con timeout e limite nodi
     * @return risultato della ricerca, UNKNOWN in caso di timeout
     */
    private static SATResult executeSATSolvingWithTimeout(CNFFormula formula, SolverConfiguration config) {
        System.out.println("Risoluzione SAT con DPLL (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(null, runnable, "dpll-solver", SOLVER_STACK_SIZE);
            thread.setDaemon(true);
            return thread;
        });
        DPLLSolver solver = new DPLLSolver(formula, config.nodeLimit);

        try {
            Future<SATResult> future = executor.submit(solver::solve);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            SATStatistics partial = solver.getStatistics();
            partial.stopTimer();
            return SATResult.unknown("Timeout di " + config.timeoutSeconds + " secondi", partial);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore nella risoluzione SAT: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Risoluzione SAT interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void displayFinalStatistics(SATResult result) {
        System.out.println("Elaborazione completata!\n");
        System.out.println(">>> RISULTATO FINALE <<<");
        System.out.println(result.getExecutionSummary());
        if (result.isUnknown()) {
            System.out.println("Motivo: " + result.getAbortReason());
        }
        System.out.println("========================\n");
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Risolve in sequenza tutti i file .cnf della directory, in ordine di nome.
     * Un errore su un file non interrompe gli altri.
     */
    private static void processDirectoryBatch(SolverConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<File> cnfFiles = findAllCnfFiles(config.inputPath);
        if (cnfFiles.isEmpty()) {
            System.out.println("[W] Nessun file .cnf trovato nella directory specificata.");
            return;
        }

        BatchResult result = new BatchResult(cnfFiles.size());
        for (File file : cnfFiles) {
            System.out.println("Elaborazione: " + file.getName());
            if (processSingleFile(config.forFile(file))) {
                result.incrementSuccess();
            } else {
                result.incrementError();
            }
            System.out.println(); // Separatore visivo
        }

        displayBatchSummary(result);
    }

    /**
     * @param dirPath directory da scansionare
     * @return lista ordinata di file .cnf trovati
     * @throws IOException se errori di accesso alla directory
     */
    private static List<File> findAllCnfFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .cnf nella directory...");

        List<File> cnfFiles;
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            cnfFiles = paths
                    .filter(path -> path.toString().toLowerCase().endsWith(CNF_EXTENSION))
                    .filter(Files::isRegularFile)
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .collect(Collectors.toList());
        }

        System.out.println("Trovati " + cnfFiles.size() + " file .cnf da elaborare.");
        return cnfFiles;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    /**
     * Scrive RESULT/&lt;nome&gt;.result con verdetto, dimensioni della formula e statistiche.
     */
    private static void saveResult(SATResult result, CNFFormula formula, SolverConfiguration config) throws IOException {
        Path resultDir = getOutputDirectory(config, "RESULT");
        Files.createDirectories(resultDir);

        Path resultFilePath = resultDir.resolve(getBaseFileName(config.inputPath) + ".result");

        try (Writer writer = Files.newBufferedWriter(resultFilePath, StandardCharsets.UTF_8)) {
            writer.write("=== RISOLUZIONE SAT DPLL ===\n");
            writer.write("File originale: " + Paths.get(config.inputPath).getFileName() + "\n");
            writer.write("Variabili: " + formula.getVariableCount() + "\n");
            writer.write("Clausole: " + formula.getClausesCount() + "\n");
            writer.write("Timeout: " + config.timeoutSeconds + " secondi\n");
            if (config.nodeLimit != DPLLSolver.UNLIMITED_NODES) {
                writer.write("Limite nodi: " + config.nodeLimit + "\n");
            }
            writer.write("\n" + "=".repeat(50) + "\n\n");

            writer.write("RISULTATO: " + result.getVerdict() + "\n");
            if (result.isUnknown()) {
                writer.write("Motivo: " + result.getAbortReason() + "\n");
                writer.write("Aumentare il timeout (-t) o il limite di nodi (-n) per problemi complessi.\n");
            }
            writer.write("\n");
            writer.write(result.getStatistics().toString());
        }

        System.out.println("[I] Risultati salvati: " + resultFilePath);
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    /**
     * @param config configurazione con percorsi
     * @param subdirName nome sottodirectory (RESULT, ...)
     * @return directory di output: -o se presente, altrimenti accanto al file di input
     */
    private static Path getOutputDirectory(SolverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = Paths.get(config.inputPath).toAbsolutePath().getParent();
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    /**
     * @return nome file senza estensione
     */
    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE SAT DPLL <<::");
        System.out.println("Solutore per problemi di soddisfacibilità booleana (SAT) in formato DIMACS");
        System.out.println("con algoritmo DPLL: propagazione unitaria, letterali puri e branching\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore-dpll.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. RISOLUZIONE SAT:");
        System.out.println("     -f <file.cnf>   Elabora un singolo file .cnf");
        System.out.println("     -d <directory>  Elabora tutti i file .cnf in una directory");
        System.out.println("     -o <directory>  Directory di output (default: stessa di input)");
        System.out.println("     -t <secondi>    Timeout per formula (min: 1, default: 10)");
        System.out.println("     -n <nodi>       Limite nodi di ricerca per formula (default: 0 = nessuno)");
        System.out.println();
        System.out.println("  2. GENERAZIONE ISTANZE:");
        System.out.println("     -gen=pigeonhole <numero>  Genera istanze Pigeonhole Problem (1-100)");
        System.out.println("     -o <directory>            Directory output per istanze generate");
        System.out.println();
        System.out.println("  3. AIUTO:");
        System.out.println("     -h              Mostra questa guida\n");

        System.out.println("FORMATO DIMACS:");
        System.out.println("  Header: p cnf <variabili> <clausole>");
        System.out.println("  Commenti: righe che iniziano con c");
        System.out.println("  Clausole: letterali separati da spazi terminati da 0 (1 -2 3 0)\n");

        System.out.println("ESITI:");
        System.out.println("  SATISFIABLE     esiste un assegnamento che soddisfa la formula");
        System.out.println("  UNSATISFIABLE   nessun assegnamento soddisfa la formula");
        System.out.println("  UNKNOWN         ricerca interrotta da timeout o limite di nodi\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore-dpll.jar -f problema.cnf");
        System.out.println("  java -jar solutore-dpll.jar -d ./cnf_files/ -o ./output/ -t 60");
        System.out.println("  java -jar solutore-dpll.jar -gen=pigeonhole 8 -o ./output/\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata e immutabile dell'applicazione.
     */
    private static class SolverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final long nodeLimit;
        final boolean isGenerationMode;
        final String generationType;
        final int generationCount;

        SolverConfiguration(String inputPath, String outputPath, boolean isFileMode,
                            int timeoutSeconds, long nodeLimit,
                            boolean isGenerationMode, String generationType, int generationCount) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.nodeLimit = nodeLimit;
            this.isGenerationMode = isGenerationMode;
            this.generationType = generationType;
            this.generationCount = generationCount;
        }

        /**
         * @return configurazione per un singolo file del batch
         */
        SolverConfiguration forFile(File file) {
            return new SolverConfiguration(file.getAbsolutePath(), outputPath, true,
                    timeoutSeconds, nodeLimit, false, null, 0);
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        public SolverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean isGenerationMode = false;
            String generationType = null;
            int generationCount = 0;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            long nodeLimit = DPLLSolver.UNLIMITED_NODES;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, isGenerationMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, isGenerationMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    case NODES_PARAM -> nodeLimit = parseAndValidateNodeLimit(args, ++i);
                    default -> {
                        if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(isFileMode, isDirectoryMode, "generazione");
                            generationType = args[i].substring(GEN_PARAM.length());
                            generationCount = parseGenerationCount(args, i, generationType);
                            isGenerationMode = true;
                            i++; // Salta il numero istanze
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (isGenerationMode) {
                if (outputPath == null) {
                    throw new IllegalArgumentException("Modalità generazione richiede directory output (-o)");
                }
                return new SolverConfiguration(null, outputPath, false, 0, DPLLSolver.UNLIMITED_NODES,
                        true, generationType, generationCount);
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }

            return new SolverConfiguration(inputPath, outputPath, isFileMode, timeoutSeconds, nodeLimit,
                    false, null, 0);
        }

        private void validateExclusiveMode(boolean mode1, boolean mode2, String currentMode) {
            if (mode1 || mode2) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (file/directory/generazione sono mutualmente esclusive)");
            }
        }

        private int parseGenerationCount(String[] args, int currentIndex, String genType) {
            if (!GEN_PIGEONHOLE.equals(genType)) {
                throw new IllegalArgumentException("Tipo generazione non supportato: " + genType +
                        ". Supportati: " + GEN_PIGEONHOLE);
            }

            String countStr = getNextArgument(args, currentIndex + 1, "numero istanze");
            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero istanze non valido: " + countStr);
            }

            if (count < PigeonholeProblem.MIN_INSTANCES || count > PigeonholeProblem.MAX_INSTANCES) {
                throw new IllegalArgumentException("Numero istanze deve essere tra " +
                        PigeonholeProblem.MIN_INSTANCES + " e " + PigeonholeProblem.MAX_INSTANCES + ", ricevuto: " + count);
            }
            return count;
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");
            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }

        private long parseAndValidateNodeLimit(String[] args, int currentIndex) {
            String nodesStr = getNextArgument(args, currentIndex, "numero nodi");
            long nodes;
            try {
                nodes = Long.parseLong(nodesStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore limite nodi non valido: " + nodesStr);
            }
            if (nodes < 0) {
                throw new IllegalArgumentException("Limite nodi non può essere negativo: " + nodes);
            }
            return nodes;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
