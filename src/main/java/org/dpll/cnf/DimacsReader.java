package org.dpll.cnf;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.dpll.antlr.DimacsLexer;
import org.dpll.antlr.DimacsParser;
import org.dpll.support.CNFFormula;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * LETTORE DIMACS - Pipeline ANTLR per file CNF in formato DIMACS
 *
 * Lexing → Parsing → Visitor → CNFFormula validata.
 *
 * Gli errori lessicali e sintattici non vengono recuperati: il primo errore interrompe
 * la lettura con una DimacsFormatException che riporta riga e colonna.
 */
public final class DimacsReader {

    private static final Logger LOGGER = Logger.getLogger(DimacsReader.class.getName());

    private DimacsReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Legge un file DIMACS CNF.
     *
     * @param path percorso del file .cnf
     * @return formula validata
     * @throws IOException se il file non esiste o non è leggibile
     * @throws DimacsFormatException se il contenuto non è DIMACS valido
     */
    public static CNFFormula read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("File non esistente: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File non leggibile: " + path);
        }

        LOGGER.fine("Lettura file DIMACS: " + path);
        return parse(CharStreams.fromPath(path, StandardCharsets.UTF_8));
    }

    /**
     * Legge una formula DIMACS da stringa.
     *
     * @param content testo DIMACS
     * @return formula validata
     * @throws DimacsFormatException se il contenuto non è DIMACS valido
     */
    public static CNFFormula read(String content) {
        return parse(CharStreams.fromString(content, "<stringa>"));
    }

    /**
     * Legge una formula DIMACS da un Reader, che non viene chiuso.
     *
     * @param reader sorgente del testo DIMACS
     * @return formula validata
     * @throws IOException se la lettura fallisce
     * @throws DimacsFormatException se il contenuto non è DIMACS valido
     */
    public static CNFFormula read(Reader reader) throws IOException {
        return parse(CharStreams.fromReader(reader));
    }

    //endregion

    //region PIPELINE ANTLR

    private static CNFFormula parse(CharStream input) {
        DimacsLexer lexer = new DimacsLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        DimacsParser parser = new DimacsParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.dimacs();
        CNFFormula formula = new DimacsFormulaBuilder().visit(tree);

        LOGGER.info("Formula DIMACS letta da " + input.getSourceName() + ": "
                + formula.getClausesCount() + " clausole, " + formula.getVariableCount() + " variabili");
        return formula;
    }

    /**
     * Trasforma il primo errore di lexer o parser in DimacsFormatException.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new DimacsFormatException(msg, line, charPositionInLine, e);
        }
    }

    //endregion
}
