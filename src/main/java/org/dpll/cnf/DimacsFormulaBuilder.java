package org.dpll.cnf;

import org.antlr.v4.runtime.Token;
import org.dpll.antlr.DimacsBaseVisitor;
import org.dpll.antlr.DimacsParser.ClauseContext;
import org.dpll.antlr.DimacsParser.CountContext;
import org.dpll.antlr.DimacsParser.DimacsContext;
import org.dpll.antlr.DimacsParser.HeaderContext;
import org.dpll.antlr.DimacsParser.LiteralContext;
import org.dpll.support.CNFFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * COSTRUTTORE FORMULA DIMACS - Visitor dall'albero sintattico ANTLR a CNFFormula
 *
 * Traduce l'albero prodotto dalla grammatica Dimacs nella formula validata usata dal
 * solutore. La sintassi è già garantita dal parser: qui si controllano i vincoli
 * semantici che la grammatica non esprime.
 *
 * VALIDAZIONI SEMANTICHE:
 * - Conteggi dell'header rappresentabili come int
 * - Ogni letterale rappresentabile come int e con |l| ≤ variabili dichiarate
 * - Numero di clausole diverso dall'header: tollerato con un warning
 *
 * Le tautologie e i letterali duplicati sono gestiti da CNFFormula. Una clausola
 * composta dal solo terminatore 0 è una clausola vuota e resta nella formula.
 */
public class DimacsFormulaBuilder extends DimacsBaseVisitor<CNFFormula> {

    private static final Logger LOGGER = Logger.getLogger(DimacsFormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Costruisce la formula dall'intero file DIMACS.
     *
     * @param ctx contesto radice della grammatica
     * @return formula validata
     * @throws DimacsFormatException se header o letterali violano i vincoli semantici
     */
    @Override
    public CNFFormula visitDimacs(DimacsContext ctx) {
        HeaderContext header = ctx.header();
        int variableCount = parseCount(header.variables, "numero variabili");
        int declaredClauses = parseCount(header.clauses, "numero clausole");
        LOGGER.fine("Header DIMACS: " + variableCount + " variabili, " + declaredClauses + " clausole dichiarate");

        List<List<Integer>> clauses = new ArrayList<>();
        for (ClauseContext clause : ctx.clause()) {
            clauses.add(convertLiterals(clause.literal(), variableCount));
        }
        if (ctx.trailingClause() != null) {
            LOGGER.fine("Ultima clausola senza terminatore 0");
            clauses.add(convertLiterals(ctx.trailingClause().literal(), variableCount));
        }

        if (clauses.size() != declaredClauses) {
            LOGGER.warning("Numero clausole diverso dall'header: dichiarate " + declaredClauses
                    + ", trovate " + clauses.size());
        }

        return new CNFFormula(variableCount, clauses);
    }

    //endregion

    //region CONVERSIONE HEADER E LETTERALI

    /**
     * Converte un conteggio dell'header, che deve essere non negativo.
     */
    private int parseCount(CountContext count, String description) {
        Token token = count.getStart();
        int value = parseInt(token, description);
        if (value < 0) {
            throw new DimacsFormatException(description + " negativo nell'header: " + value,
                    token.getLine(), token.getCharPositionInLine());
        }
        return value;
    }

    /**
     * Converte i letterali di una clausola verificandone il range.
     */
    private List<Integer> convertLiterals(List<LiteralContext> literals, int variableCount) {
        List<Integer> clause = new ArrayList<>(literals.size());
        for (LiteralContext literalContext : literals) {
            Token token = literalContext.getStart();
            int literal = parseInt(token, "letterale");

            if (literal == Integer.MIN_VALUE || Math.abs(literal) > variableCount) {
                throw new DimacsFormatException("letterale " + literal + " oltre il numero di variabili dichiarato ("
                        + variableCount + ")", token.getLine(), token.getCharPositionInLine());
            }
            clause.add(literal);
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Clausola letta: " + clause);
        }
        return clause;
    }

    private int parseInt(Token token, String description) {
        try {
            return Integer.parseInt(token.getText());
        } catch (NumberFormatException e) {
            throw new DimacsFormatException(description + " non rappresentabile: " + token.getText(),
                    token.getLine(), token.getCharPositionInLine(), e);
        }
    }

    //endregion
}
