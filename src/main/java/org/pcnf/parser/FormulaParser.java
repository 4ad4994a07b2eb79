package org.pcnf.parser;

import org.pcnf.formula.Atom;
import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Connective;
import org.pcnf.formula.Formula;
import org.pcnf.formula.Not;
import org.pcnf.formula.Quantifier;
import org.pcnf.formula.QuantifierKind;

import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PARSER A DISCESA RICORSIVA - Da stringa ad albero {@link Formula}
 *
 * Riconosce formule del primo ordine in notazione completamente parentesizzata:
 * <pre>
 * F ::= atomo | (- F) | (F &amp; F) | (F v F) | (F -&gt; F) | (F &lt;-&gt; F) | (Ax F) | (Ex F)
 * </pre>
 * Atomi e variabili sono singole lettere minuscole.
 *
 * STRATEGIA DI RICONOSCIMENTO (in ordine):
 * 1. Rimozione spazi esterni
 * 2. Rimozione di una coppia di parentesi che racchiude l'intera stringa
 * 3. Prefisso di quantificatore [AE][a-z] seguito dal corpo
 * 4. Connettivo binario al livello 0, per precedenza crescente (&lt;-&gt;, -&gt;, v, &amp;),
 *    cercato da destra verso sinistra: la prima occorrenza trovata divide gli operandi
 * 5. Negazione "- F"
 * 6. Atomo
 *
 * La divisione sull'occorrenza più a destra rende associative a sinistra le catene
 * dello stesso operatore: "p v q v r" diventa ((p v q) v r).
 *
 * Il parser non ha stato: un'istanza può essere riutilizzata e condivisa.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /** Prefisso di quantificatore seguito da almeno uno spazio e dal corpo */
    private static final Pattern QUANTIFIER_PATTERN = Pattern.compile("([AE])([a-z])\\s+(.+)");

    /** Atomo: esattamente una lettera minuscola */
    private static final Pattern ATOM_PATTERN = Pattern.compile("[a-z]");

    /** Marcatore di negazione unaria */
    private static final String NEGATION_PREFIX = "- ";

    /** Connettivi in ordine di precedenza crescente */
    private static final Connective[] PRECEDENCE = {
            Connective.IFF, Connective.IMPLIES, Connective.OR, Connective.AND
    };

    //region PUNTO DI INGRESSO

    /**
     * Costruisce l'albero sintattico di una formula.
     *
     * @param text formula in notazione testuale
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non rispetta la grammatica
     */
    public Formula parse(String text) {
        if (text == null) {
            throw new FormulaSyntaxException("Formula assente", "");
        }

        Formula formula = parseExpression(text);
        LOGGER.fine("Formula riconosciuta: " + formula);
        return formula;
    }

    //endregion

    //region RICONOSCIMENTO RICORSIVO

    private Formula parseExpression(String text) {
        String expression = text.trim();

        // Parentesi esterne che racchiudono tutta l'espressione
        if (isWrappedByParentheses(expression)) {
            return parseExpression(expression.substring(1, expression.length() - 1));
        }

        // Quantificatore: Ax F, Ex F
        Matcher quantifier = QUANTIFIER_PATTERN.matcher(expression);
        if (quantifier.matches()) {
            QuantifierKind kind = QuantifierKind.fromSymbol(quantifier.group(1).charAt(0));
            String variable = quantifier.group(2);
            LOGGER.finest("Quantificatore " + kind + " su " + variable);
            return new Quantifier(kind, variable, parseExpression(quantifier.group(3)));
        }

        // Connettivo binario al livello 0
        Formula binary = parseBinary(expression);
        if (binary != null) {
            return binary;
        }

        // Negazione: - F
        if (expression.startsWith(NEGATION_PREFIX)) {
            return new Not(parseExpression(expression.substring(NEGATION_PREFIX.length())));
        }

        if (ATOM_PATTERN.matcher(expression).matches()) {
            return new Atom(expression);
        }

        throw new FormulaSyntaxException(expression);
    }

    /**
     * Vero se la prima e l'ultima parentesi formano una coppia che racchiude
     * tutta la stringa: la profondità all'interno non diventa mai negativa e
     * torna a zero alla fine.
     */
    private boolean isWrappedByParentheses(String expression) {
        if (expression.length() < 2 || !expression.startsWith("(") || !expression.endsWith(")")) {
            return false;
        }

        int depth = 0;
        for (int i = 1; i < expression.length() - 1; i++) {
            char c = expression.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * Cerca il connettivo di precedenza più bassa al livello 0, scandendo da
     * destra verso sinistra.
     *
     * @return nodo binario oppure null se nessun connettivo è al livello 0
     */
    private Formula parseBinary(String expression) {
        for (Connective connective : PRECEDENCE) {
            String symbol = connective.getSymbol();
            int depth = 0;

            for (int i = expression.length() - 1; i >= 0; i--) {
                char c = expression.charAt(i);
                if (c == ')') {
                    depth++;
                } else if (c == '(') {
                    depth--;
                }

                if (depth == 0 && expression.startsWith(symbol, i)) {
                    LOGGER.finest("Divisione su '" + symbol + "' in posizione " + i);
                    Formula left = parseExpression(expression.substring(0, i));
                    Formula right = parseExpression(expression.substring(i + symbol.length()));
                    return new BinaryOp(connective, left, right);
                }
            }
        }
        return null;
    }

    //endregion
}
