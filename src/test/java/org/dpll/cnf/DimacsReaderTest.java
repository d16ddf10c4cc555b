package org.dpll.cnf;

import org.dpll.support.CNFFormula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DimacsReader")
class DimacsReaderTest {

    @Nested
    @DisplayName("Input validi")
    class ValidInput {

        @Test
        @DisplayName("Legge header e clausole")
        void shouldReadSimpleFormula() {
            CNFFormula formula = DimacsReader.read("p cnf 3 2\n1 -3 0\n2 3 -1 0\n");

            assertEquals(3, formula.getVariableCount());
            assertEquals(List.of(List.of(1, -3), List.of(2, 3, -1)), formula.getClauses());
        }

        @Test
        @DisplayName("Ignora i commenti prima e dopo l'header")
        void shouldSkipComments() {
            String dimacs = "c primo commento\nc\np cnf 2 1\nc commento tra le clausole\n1 2 0\n";

            CNFFormula formula = DimacsReader.read(dimacs);

            assertEquals(List.of(List.of(1, 2)), formula.getClauses());
        }

        @Test
        @DisplayName("Una clausola può estendersi su più righe")
        void shouldReadMultiLineClause() {
            CNFFormula formula = DimacsReader.read("p cnf 3 2\n1 2\n3 0 -1\n-2 0\n");

            assertEquals(List.of(List.of(1, 2, 3), List.of(-1, -2)), formula.getClauses());
        }

        @Test
        @DisplayName("Accetta l'ultima clausola senza 0 finale")
        void shouldAcceptMissingFinalTerminator() {
            CNFFormula formula = DimacsReader.read("p cnf 2 2\n1 0\n-2");

            assertEquals(List.of(List.of(1), List.of(-2)), formula.getClauses());
        }

        @Test
        @DisplayName("Ignora il trailer SATLIB dopo %")
        void shouldIgnoreSatlibTrailer() {
            CNFFormula formula = DimacsReader.read("p cnf 2 1\n1 2 0\n%\n0\n\n");

            assertEquals(1, formula.getClausesCount());
        }

        @Test
        @DisplayName("Un terminatore isolato è una clausola vuota")
        void loneZeroShouldBeEmptyClause() {
            CNFFormula formula = DimacsReader.read("p cnf 1 2\n1 0\n0\n");

            assertEquals(2, formula.getClausesCount());
            assertTrue(formula.hasEmptyClause());
        }

        @Test
        @DisplayName("Tollera un numero di clausole diverso dall'header")
        void shouldTolerateClauseCountMismatch() {
            CNFFormula formula = DimacsReader.read("p cnf 2 5\n1 2 0\n");

            assertEquals(1, formula.getClausesCount());
        }

        @Test
        @DisplayName("Scarta le tautologie lette dal file")
        void shouldDropTautologies() {
            CNFFormula formula = DimacsReader.read("p cnf 2 2\n1 -1 0\n2 0\n");

            assertEquals(List.of(List.of(2)), formula.getClauses());
        }

        @Test
        @DisplayName("Accetta formule senza variabili e senza clausole")
        void shouldAcceptEmptyFormula() {
            CNFFormula formula = DimacsReader.read("p cnf 0 0\n");

            assertTrue(formula.isEmpty());
            assertEquals(0, formula.getVariableCount());
        }

        @Test
        @DisplayName("Legge da un Reader")
        void shouldReadFromReader() throws IOException {
            CNFFormula formula = DimacsReader.read(new StringReader("p cnf 1 1\n-1 0\n"));

            assertEquals(List.of(List.of(-1)), formula.getClauses());
        }

        @Test
        @DisplayName("Rilegge l'output di toDimacs")
        void shouldReadSerializedFormula() {
            CNFFormula original = new CNFFormula(4, List.of(List.of(1, -4), List.of(), List.of(2, 3)));

            CNFFormula reread = DimacsReader.read(original.toDimacs());

            assertEquals(original.getClauses(), reread.getClauses());
        }
    }

    @Nested
    @DisplayName("Input non validi")
    class InvalidInput {

        @Test
        @DisplayName("Rifiuta letterali oltre le variabili dichiarate, indicando la riga")
        void shouldRejectOutOfRangeLiteral() {
            DimacsFormatException e = assertThrows(DimacsFormatException.class,
                    () -> DimacsReader.read("p cnf 2 1\n1 3 0\n"));

            assertEquals(2, e.getLine());
            assertEquals(2, e.getColumn());
        }

        @ParameterizedTest(name = "rifiuta: {0}")
        @ValueSource(strings = {
                "1 2 0\n",
                "p cnf 2\n",
                "p dnf 2 1\n1 2 0\n",
                "p cnf -1 0\n",
                "p cnf 2 1\n1 x 0\n",
                "p cnf 2 1\np cnf 2 1\n",
                "p cnf 2 1\n1 --2 0\n",
                "p cnf 99999999999 1\n1 0\n",
                ""
        })
        void shouldRejectMalformedInput(String dimacs) {
            assertThrows(DimacsFormatException.class, () -> DimacsReader.read(dimacs));
        }
    }

    @Nested
    @DisplayName("Lettura da file")
    class FileInput {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Legge un file .cnf")
        void shouldReadFile() throws IOException {
            // Given
            Path file = tempDir.resolve("formula.cnf");
            Files.writeString(file, "c esempio\np cnf 2 2\n1 2 0\n-1 0\n", StandardCharsets.UTF_8);

            // When
            CNFFormula formula = DimacsReader.read(file);

            // Then
            assertEquals(List.of(List.of(1, 2), List.of(-1)), formula.getClauses());
        }

        @Test
        @DisplayName("Segnala un file inesistente")
        void shouldFailOnMissingFile() {
            assertThrows(IOException.class, () -> DimacsReader.read(tempDir.resolve("assente.cnf")));
        }

        @Test
        @DisplayName("Segnala una directory al posto del file")
        void shouldFailOnDirectory() {
            assertThrows(IOException.class, () -> DimacsReader.read(tempDir));
        }
    }
}
