package org.pcnf.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.pcnf.antlr.PrenexFormulaBaseVisitor;
import org.pcnf.antlr.PrenexFormulaLexer;
import org.pcnf.antlr.PrenexFormulaParser;
import org.pcnf.antlr.PrenexFormulaParser.AtomExprContext;
import org.pcnf.antlr.PrenexFormulaParser.BinaryExprContext;
import org.pcnf.antlr.PrenexFormulaParser.FormulaContext;
import org.pcnf.antlr.PrenexFormulaParser.NotExprContext;
import org.pcnf.antlr.PrenexFormulaParser.QuantifiedExprContext;
import org.pcnf.formula.Atom;
import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Connective;
import org.pcnf.formula.Formula;
import org.pcnf.formula.Not;
import org.pcnf.formula.Quantifier;
import org.pcnf.formula.QuantifierKind;

import java.util.logging.Logger;

/**
 * PARSER STRETTO - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Valida la formula contro la grammatica completamente parentesizzata
 * (PrenexFormula.g4) e costruisce l'albero tramite visitor. Rispetto a
 * {@link FormulaParser} non accetta connettivi o quantificatori privi della
 * propria coppia di parentesi, e segnala gli errori con riga e colonna.
 *
 * Su input completamente parentesizzati i due parser producono alberi uguali.
 */
public class StrictFormulaParser extends PrenexFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(StrictFormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza la formula con la pipeline ANTLR: Lexing -> Parsing -> Visitor.
     *
     * @param text formula in notazione testuale
     * @return albero della formula
     * @throws FormulaSyntaxException al primo errore lessicale o sintattico
     */
    public Formula parse(String text) {
        if (text == null) {
            throw new FormulaSyntaxException("Formula assente", "");
        }

        ThrowingErrorListener errorListener = new ThrowingErrorListener();

        CharStream input = CharStreams.fromString(text);
        PrenexFormulaLexer lexer = new PrenexFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        PrenexFormulaParser parser = new PrenexFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Formula formula = visit(tree);
        LOGGER.fine("Formula validata dalla grammatica: " + formula);
        return formula;
    }

    //endregion

    //region VISITA DEI NODI

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.expr());
    }

    @Override
    public Formula visitAtomExpr(AtomExprContext ctx) {
        return new Atom(ctx.atom().getText());
    }

    @Override
    public Formula visitNotExpr(NotExprContext ctx) {
        return new Not(visit(ctx.expr()));
    }

    @Override
    public Formula visitBinaryExpr(BinaryExprContext ctx) {
        Connective connective = Connective.fromSymbol(ctx.connective().getText());
        return new BinaryOp(connective, visit(ctx.expr(0)), visit(ctx.expr(1)));
    }

    /**
     * Il token QUANTIFIER contiene tipo e variabile: "Ax", "Ey".
     */
    @Override
    public Formula visitQuantifiedExpr(QuantifiedExprContext ctx) {
        String token = ctx.QUANTIFIER().getText();
        QuantifierKind kind = QuantifierKind.fromSymbol(token.charAt(0));
        return new Quantifier(kind, token.substring(1), visit(ctx.expr()));
    }

    //endregion

    /**
     * Trasforma il primo errore di lexer o parser in {@link FormulaSyntaxException}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            String fragment = offendingSymbol instanceof Token
                    ? ((Token) offendingSymbol).getText()
                    : "";
            throw new FormulaSyntaxException(
                    String.format("Errore di sintassi a riga %d, colonna %d: %s", line, charPositionInLine, msg),
                    fragment);
        }
    }
}
