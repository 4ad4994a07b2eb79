package org.pcnf.support;

import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Connective;
import org.pcnf.formula.Formula;
import org.pcnf.formula.Quantifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * ANALISI STRUTTURALE - Predicati di forma sugli alberi {@link Formula}
 *
 * Verifiche usate dalla pipeline per il logging di controllo e dai test:
 * - CNF: nessuna disgiunzione con una congiunzione come figlio diretto
 * - Forma normale negativa: negazioni solo su atomi, niente -&gt; e &lt;-&gt;
 * - Forma prenessa: quantificatori solo in testa, matrice in CNF
 *
 * Offre inoltre la valutazione di una formula priva di quantificatori rispetto
 * a un assegnamento di verità.
 */
public final class FormulaInspector {

    private FormulaInspector() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PREDICATI DI FORMA

    /**
     * @return true se nessun nodo v ha un nodo &amp; come figlio diretto
     */
    public static boolean isCnf(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> true;
            case NOT -> isCnf(formula.asNot().getOperand());
            case QUANTIFIER -> isCnf(formula.asQuantifier().getBody());
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                if (op.getConnective() == Connective.OR
                        && (op.getLeft().isBinary(Connective.AND) || op.getRight().isBinary(Connective.AND))) {
                    yield false;
                }
                yield isCnf(op.getLeft()) && isCnf(op.getRight());
            }
        };
    }

    /**
     * @return true se ogni negazione è applicata a un atomo e non restano -&gt; o &lt;-&gt;
     */
    public static boolean isNegationNormal(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> true;
            case NOT -> formula.asNot().getOperand().getType() == Formula.Type.ATOM;
            case QUANTIFIER -> isNegationNormal(formula.asQuantifier().getBody());
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                yield (op.getConnective() == Connective.AND || op.getConnective() == Connective.OR)
                        && isNegationNormal(op.getLeft())
                        && isNegationNormal(op.getRight());
            }
        };
    }

    /**
     * @return true se la formula non contiene quantificatori
     */
    public static boolean isQuantifierFree(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> true;
            case NOT -> isQuantifierFree(formula.asNot().getOperand());
            case QUANTIFIER -> false;
            case BINARY -> isQuantifierFree(formula.asBinary().getLeft())
                    && isQuantifierFree(formula.asBinary().getRight());
        };
    }

    /**
     * @return true se i quantificatori formano un prefisso e la matrice è in CNF
     */
    public static boolean isPrenex(Formula formula) {
        Formula matrix = formula;
        while (matrix.getType() == Formula.Type.QUANTIFIER) {
            matrix = matrix.asQuantifier().getBody();
        }
        return isQuantifierFree(matrix) && isCnf(matrix);
    }

    //endregion

    //region RACCOLTA SIMBOLI

    /**
     * @return variabili legate nell'ordine di visita (con eventuali ripetizioni)
     */
    public static List<String> boundVariables(Formula formula) {
        List<String> variables = new ArrayList<>();
        collectBoundVariables(formula, variables);
        return variables;
    }

    private static void collectBoundVariables(Formula formula, List<String> variables) {
        switch (formula.getType()) {
            case ATOM -> { /* Nessun legame */ }
            case NOT -> collectBoundVariables(formula.asNot().getOperand(), variables);
            case BINARY -> {
                collectBoundVariables(formula.asBinary().getLeft(), variables);
                collectBoundVariables(formula.asBinary().getRight(), variables);
            }
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                variables.add(quantifier.getVariable());
                collectBoundVariables(quantifier.getBody(), variables);
            }
        }
    }

    /**
     * @return tutti i nomi di atomo presenti, in ordine alfabetico
     */
    public static Set<String> atoms(Formula formula) {
        Set<String> atoms = new TreeSet<>();
        collectAtoms(formula, atoms);
        return atoms;
    }

    private static void collectAtoms(Formula formula, Set<String> atoms) {
        switch (formula.getType()) {
            case ATOM -> atoms.add(formula.asAtom().getSymbol());
            case NOT -> collectAtoms(formula.asNot().getOperand(), atoms);
            case BINARY -> {
                collectAtoms(formula.asBinary().getLeft(), atoms);
                collectAtoms(formula.asBinary().getRight(), atoms);
            }
            case QUANTIFIER -> collectAtoms(formula.asQuantifier().getBody(), atoms);
        }
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta una formula priva di quantificatori.
     *
     * @param formula formula senza quantificatori
     * @param assignment valore di verità di ogni atomo
     * @return valore della formula
     * @throws IllegalArgumentException se compare un quantificatore o un atomo non assegnato
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> assignment) {
        return switch (formula.getType()) {
            case ATOM -> {
                Boolean value = assignment.get(formula.asAtom().getSymbol());
                if (value == null) {
                    throw new IllegalArgumentException("Atomo senza valore: " + formula);
                }
                yield value;
            }
            case NOT -> !evaluate(formula.asNot().getOperand(), assignment);
            case QUANTIFIER -> throw new IllegalArgumentException("Valutazione non definita con quantificatori: " + formula);
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                boolean left = evaluate(op.getLeft(), assignment);
                boolean right = evaluate(op.getRight(), assignment);
                yield switch (op.getConnective()) {
                    case AND -> left && right;
                    case OR -> left || right;
                    case IMPLIES -> !left || right;
                    case IFF -> left == right;
                };
            }
        };
    }

    //endregion
}
