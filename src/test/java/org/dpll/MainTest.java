package org.dpll;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main - pipeline da linea di comando")
class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    private Path writeCnf(Path directory, String name, String content) throws IOException {
        Path file = directory.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Risolve un file e salva il risultato in RESULT")
    void shouldSolveSingleFile() throws IOException {
        // Given
        Path input = writeCnf(tempDir, "contraddizione.cnf", "c esempio\np cnf 2 3\n1 2 0\n-1 0\n-2 0\n");
        Path output = tempDir.resolve("out");

        // When
        Main.main(new String[]{"-f", input.toString(), "-o", output.toString()});

        // Then
        Path result = output.resolve("RESULT").resolve("contraddizione.result");
        assertTrue(Files.isRegularFile(result));
        String report = Files.readString(result, StandardCharsets.UTF_8);
        assertTrue(report.contains("RISULTATO: UNSATISFIABLE"));
        assertTrue(report.contains("Variabili: 2"));
        assertTrue(output().lines().anyMatch("UNSATISFIABLE"::equals));
    }

    @Test
    @DisplayName("Senza -o il risultato finisce accanto al file di input")
    void shouldDefaultToInputDirectory() throws IOException {
        Path input = writeCnf(tempDir, "semplice.cnf", "p cnf 2 1\n1 2 0\n");

        Main.main(new String[]{"-f", input.toString()});

        Path result = tempDir.resolve("RESULT").resolve("semplice.result");
        assertTrue(Files.readString(result, StandardCharsets.UTF_8).contains("RISULTATO: SATISFIABLE"));
        assertTrue(output().lines().anyMatch("SATISFIABLE"::equals));
    }

    @Test
    @DisplayName("Il limite di nodi produce il verdetto UNKNOWN")
    void shouldReportUnknownOnNodeLimit() throws IOException {
        // Given: PHP(4, 3) non si decide in un solo nodo
        StringBuilder dimacs = new StringBuilder("p cnf 12 22\n");
        for (int pigeon = 0; pigeon < 4; pigeon++) {
            dimacs.append(pigeon * 3 + 1).append(' ').append(pigeon * 3 + 2).append(' ')
                    .append(pigeon * 3 + 3).append(" 0\n");
        }
        for (int hole = 1; hole <= 3; hole++) {
            for (int p1 = 0; p1 < 4; p1++) {
                for (int p2 = p1 + 1; p2 < 4; p2++) {
                    dimacs.append(-(p1 * 3 + hole)).append(' ').append(-(p2 * 3 + hole)).append(" 0\n");
                }
            }
        }
        Path input = writeCnf(tempDir, "php3.cnf", dimacs.toString());

        // When
        Main.main(new String[]{"-f", input.toString(), "-n", "1"});

        // Then
        String report = Files.readString(tempDir.resolve("RESULT").resolve("php3.result"), StandardCharsets.UTF_8);
        assertTrue(report.contains("RISULTATO: UNKNOWN"));
        assertTrue(output().lines().anyMatch("UNKNOWN"::equals));
    }

    @Test
    @DisplayName("Elabora una directory senza fermarsi sui file non validi")
    void shouldProcessDirectory() throws IOException {
        // Given
        Path inputDir = Files.createDirectory(tempDir.resolve("input"));
        writeCnf(inputDir, "a.cnf", "p cnf 1 1\n1 0\n");
        writeCnf(inputDir, "b.cnf", "p cnf 1 1\n2 0\n");
        writeCnf(inputDir, "c.cnf", "p cnf 1 2\n1 0\n-1 0\n");
        writeCnf(inputDir, "note.txt", "non un file cnf");
        Path output = tempDir.resolve("out");

        // When
        Main.main(new String[]{"-d", inputDir.toString(), "-o", output.toString(), "-t", "5"});

        // Then
        Path resultDir = output.resolve("RESULT");
        assertTrue(Files.readString(resultDir.resolve("a.result"), StandardCharsets.UTF_8).contains("SATISFIABLE"));
        assertFalse(Files.exists(resultDir.resolve("b.result")));
        assertTrue(Files.readString(resultDir.resolve("c.result"), StandardCharsets.UTF_8).contains("UNSATISFIABLE"));
        assertFalse(Files.exists(resultDir.resolve("note.result")));
        assertTrue(output().contains("File con errori: 1"));
    }

    @Test
    @DisplayName("Genera le istanze Pigeonhole nella directory di output")
    void shouldGeneratePigeonholeInstances() {
        Path output = tempDir.resolve("gen");

        Main.main(new String[]{"-gen=pigeonhole", "4", "-o", output.toString()});

        for (int n = 1; n <= 4; n++) {
            assertTrue(Files.isRegularFile(output.resolve("PIGEONHOLE").resolve("pigeonhole_" + n + ".cnf")));
        }
    }

    @Test
    @DisplayName("Parametri non validi non avviano la risoluzione")
    void shouldRejectInvalidArguments() throws IOException {
        Path input = writeCnf(tempDir, "x.cnf", "p cnf 1 1\n1 0\n");

        Main.main(new String[]{"-f", input.toString(), "-t", "0"});
        Main.main(new String[]{"-f", input.toString(), "-d", tempDir.toString()});
        Main.main(new String[]{"-gen=pigeonhole", "3"});
        Main.main(new String[]{"-x"});

        assertFalse(Files.exists(tempDir.resolve("RESULT")));
        assertTrue(output().contains("Errore nella validazione dei parametri"));
    }

    @Test
    @DisplayName("-h mostra la guida")
    void shouldPrintHelp() {
        Main.main(new String[]{"-h"});

        assertTrue(output().contains("UTILIZZO:"));
        assertTrue(output().contains("-gen=pigeonhole"));
    }
}
