package org.pcnf.cnf;

import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Connective;
import org.pcnf.formula.Formula;
import org.pcnf.formula.Not;
import org.pcnf.formula.Quantifier;

import java.util.logging.Logger;

/**
 * NORMALIZZAZIONE PROPOSIZIONALE - Eliminazione connettivi, De Morgan, distribuzione
 *
 * Trasformazioni applicate dalla pipeline PCNF, ognuna totale e senza modifiche
 * in place (ogni passo restituisce un nuovo albero):
 *
 * 1. {@link #eliminateBiconditionals}: (P <-> Q) -> ((P -> Q) & (Q -> P))
 * 2. {@link #eliminateImplications}: (P -> Q) -> ((- P) v Q)
 * 3. {@link #pushNegations}: doppia negazione, De Morgan, dualità dei quantificatori
 * 4. {@link #toCnf}: distribuzione OR su AND ripetuta fino al punto fisso
 *
 * I passi 1-3 attraversano i corpi dei quantificatori lasciando invariato il
 * quantificatore stesso. Il passo 4 va applicato solo alla matrice priva di
 * quantificatori.
 */
public class PropositionalNormalizer {

    private static final Logger LOGGER = Logger.getLogger(PropositionalNormalizer.class.getName());

    /** Limite di sicurezza per la distribuzione a punto fisso */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final int maxIterations;

    /** Passate di distribuzione eseguite dall'ultima chiamata a toCnf */
    private int lastIterationCount;

    public PropositionalNormalizer() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param maxIterations numero massimo di passate di distribuzione (almeno 1)
     */
    public PropositionalNormalizer(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Il limite di iterazioni deve essere positivo: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getLastIterationCount() {
        return lastIterationCount;
    }

    //region ELIMINAZIONE BIIMPLICAZIONI E IMPLICAZIONI

    /**
     * Sostituisce ogni biimplicazione con la congiunzione delle due implicazioni.
     * P e Q compaiono due volte nel risultato: la seconda occorrenza è una copia.
     *
     * @param formula formula qualsiasi
     * @return formula equivalente senza &lt;-&gt;
     */
    public Formula eliminateBiconditionals(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> formula;
            case NOT -> new Not(eliminateBiconditionals(formula.asNot().getOperand()));
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                yield quantifier.withBody(eliminateBiconditionals(quantifier.getBody()));
            }
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                Formula left = eliminateBiconditionals(op.getLeft());
                Formula right = eliminateBiconditionals(op.getRight());

                if (op.getConnective() == Connective.IFF) {
                    yield BinaryOp.and(
                            BinaryOp.implies(left, right),
                            BinaryOp.implies(right.copy(), left.copy()));
                }
                yield op.with(left, right);
            }
        };
    }

    /**
     * Sostituisce ogni implicazione (P -&gt; Q) con ((- P) v Q).
     *
     * @param formula formula senza biimplicazioni
     * @return formula equivalente senza -&gt;
     */
    public Formula eliminateImplications(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> formula;
            case NOT -> new Not(eliminateImplications(formula.asNot().getOperand()));
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                yield quantifier.withBody(eliminateImplications(quantifier.getBody()));
            }
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                Formula left = eliminateImplications(op.getLeft());
                Formula right = eliminateImplications(op.getRight());

                if (op.getConnective() == Connective.IMPLIES) {
                    yield BinaryOp.or(new Not(left), right);
                }
                yield op.with(left, right);
            }
        };
    }

    //endregion

    //region NEGAZIONI (DE MORGAN E DUALITÀ)

    /**
     * Spinge le negazioni verso le foglie.
     *
     * TRASFORMAZIONI APPLICATE:
     * - (- (- P)) -> P
     * - (- (P &amp; Q)) -> ((- P) v (- Q))
     * - (- (P v Q)) -> ((- P) &amp; (- Q))
     * - (- (Ax P)) -> (Ex (- P))
     * - (- (Ex P)) -> (Ax (- P))
     * - altre negazioni restano, con l'operando normalizzato
     *
     * Una sola passata ricorsiva è sufficiente: ogni regola sposta la negazione
     * strettamente verso il basso.
     *
     * @param formula formula senza -&gt; e &lt;-&gt;
     * @return formula in forma normale negativa
     */
    public Formula pushNegations(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> formula;
            case NOT -> applyNegationTransformation(formula.asNot().getOperand());
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                yield quantifier.withBody(pushNegations(quantifier.getBody()));
            }
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                yield op.with(pushNegations(op.getLeft()), pushNegations(op.getRight()));
            }
        };
    }

    /**
     * Riscrive (- inner) in base alla forma di inner.
     */
    private Formula applyNegationTransformation(Formula inner) {
        return switch (inner.getType()) {
            case ATOM -> new Not(inner);

            // Doppia negazione
            case NOT -> pushNegations(inner.asNot().getOperand());

            case QUANTIFIER -> {
                Quantifier quantifier = inner.asQuantifier();
                yield new Quantifier(
                        quantifier.getKind().dual(),
                        quantifier.getVariable(),
                        pushNegations(new Not(quantifier.getBody())));
            }

            case BINARY -> {
                BinaryOp op = inner.asBinary();
                if (op.getConnective() != Connective.AND && op.getConnective() != Connective.OR) {
                    // -> e <-> devono essere già eliminati: negazione lasciata sul posto
                    yield new Not(pushNegations(inner));
                }
                Connective dual = op.getConnective() == Connective.AND ? Connective.OR : Connective.AND;
                yield new BinaryOp(dual,
                        pushNegations(new Not(op.getLeft())),
                        pushNegations(new Not(op.getRight())));
            }
        };
    }

    //endregion

    //region DISTRIBUZIONE OR SU AND

    /**
     * Converte una matrice priva di quantificatori in CNF ripetendo
     * {@link #distributeOrOverAnd} finché una passata lascia l'albero invariato.
     *
     * @param matrix formula in forma normale negativa senza quantificatori
     * @return formula equivalente in CNF
     * @throws NormalizationException se il punto fisso non è raggiunto entro il limite
     */
    public Formula toCnf(Formula matrix) {
        Formula current = matrix;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Formula next = distributeOrOverAnd(current);
            if (next.equals(current)) {
                lastIterationCount = iteration;
                LOGGER.finest("Punto fisso CNF raggiunto dopo " + iteration + " passate");
                return current;
            }
            current = next;
        }

        lastIterationCount = maxIterations;
        throw new NormalizationException("Distribuzione OR su AND senza punto fisso dopo "
                + maxIterations + " passate: " + current);
    }

    /**
     * Una passata bottom-up della proprietà distributiva.
     *
     * - P v (Q &amp; R) -> (P v Q) &amp; (P v R)
     * - (Q &amp; R) v P -> (Q v P) &amp; (R v P)
     *
     * Se entrambi gli operandi sono congiunzioni si distribuisce prima sul destro.
     * L'operando replicato nei due rami è copiato.
     *
     * @param formula matrice priva di quantificatori
     * @return formula dopo una passata di distribuzione
     */
    public Formula distributeOrOverAnd(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> formula;
            case NOT -> new Not(distributeOrOverAnd(formula.asNot().getOperand()));
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                yield quantifier.withBody(distributeOrOverAnd(quantifier.getBody()));
            }
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                Formula left = distributeOrOverAnd(op.getLeft());
                Formula right = distributeOrOverAnd(op.getRight());

                if (op.getConnective() == Connective.OR) {
                    yield executeDistributionForOrNode(left, right);
                }
                yield op.with(left, right);
            }
        };
    }

    private Formula executeDistributionForOrNode(Formula left, Formula right) {
        if (right.isBinary(Connective.AND)) {
            BinaryOp conjunction = right.asBinary();
            return BinaryOp.and(
                    distributeOrOverAnd(BinaryOp.or(left, conjunction.getLeft())),
                    distributeOrOverAnd(BinaryOp.or(left.copy(), conjunction.getRight())));
        }

        if (left.isBinary(Connective.AND)) {
            BinaryOp conjunction = left.asBinary();
            return BinaryOp.and(
                    distributeOrOverAnd(BinaryOp.or(conjunction.getLeft(), right)),
                    distributeOrOverAnd(BinaryOp.or(conjunction.getRight(), right.copy())));
        }

        return BinaryOp.or(left, right);
    }

    //endregion
}
