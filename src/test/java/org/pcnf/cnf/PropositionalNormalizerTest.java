package org.pcnf.cnf;

import org.junit.Test;
import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Formula;
import org.pcnf.parser.FormulaParser;
import org.pcnf.support.FormulaInspector;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PropositionalNormalizerTest {

    private final FormulaParser parser = new FormulaParser();
    private final PropositionalNormalizer normalizer = new PropositionalNormalizer();

    private Formula f(String text) {
        return parser.parse(text);
    }

    private Formula toNegationNormalForm(Formula formula) {
        return normalizer.pushNegations(normalizer.eliminateImplications(normalizer.eliminateBiconditionals(formula)));
    }

    /**
     * Confronta due formule prive di quantificatori su tutti gli assegnamenti.
     */
    private static void assertEquivalent(Formula expected, Formula actual) {
        List<String> atoms = List.copyOf(FormulaInspector.atoms(BinaryOp.and(expected, actual)));
        for (int mask = 0; mask < (1 << atoms.size()); mask++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < atoms.size(); i++) {
                assignment.put(atoms.get(i), (mask & (1 << i)) != 0);
            }
            assertEquals("Assegnamento " + assignment,
                    FormulaInspector.evaluate(expected, assignment),
                    FormulaInspector.evaluate(actual, assignment));
        }
    }

    //region ELIMINAZIONI

    @Test
    public void eliminatesBiconditional() {
        assertEquals(f("((p -> q) & (q -> p))"), normalizer.eliminateBiconditionals(f("(p <-> q)")));
        assertEquals(f("(Ax ((p -> q) & (q -> p)))"), normalizer.eliminateBiconditionals(f("(Ax (p <-> q))")));
    }

    @Test
    public void biconditionalOperandsAreCopiedNotShared() {
        BinaryOp result = normalizer.eliminateBiconditionals(f("((a & b) <-> c)")).asBinary();
        BinaryOp forward = result.getLeft().asBinary();
        BinaryOp backward = result.getRight().asBinary();

        assertEquals(forward.getLeft(), backward.getRight());
        assertNotSame(forward.getLeft(), backward.getRight());
        assertNotSame(forward.getRight(), backward.getLeft());
    }

    @Test
    public void eliminatesImplication() {
        assertEquals(f("((- p) v q)"), normalizer.eliminateImplications(f("(p -> q)")));
        assertEquals(f("(Ey ((- (Ax ((- p) v q))) v r))"),
                normalizer.eliminateImplications(f("(Ey ((Ax (p -> q)) -> r))")));
    }

    @Test
    public void eliminationsPreserveMeaning() {
        Formula original = f("((p <-> q) -> (r -> (- s)))");
        Formula rewritten = normalizer.eliminateImplications(normalizer.eliminateBiconditionals(original));
        assertEquivalent(original, rewritten);
    }

    //endregion

    //region NEGAZIONI

    @Test
    public void doubleNegation() {
        assertEquals(f("p"), normalizer.pushNegations(f("(- (- p))")));
        assertEquals(f("(- p)"), normalizer.pushNegations(f("(- (- (- p)))")));
    }

    @Test
    public void deMorgan() {
        assertEquals(f("((- a) v (- b))"), normalizer.pushNegations(f("(- (a & b))")));
        assertEquals(f("((- c) & (- d))"), normalizer.pushNegations(f("(- (c v d))")));
        assertEquals(f("((- a) v (b & (- c)))"), normalizer.pushNegations(f("(- (a & ((- b) v c)))")));
    }

    @Test
    public void quantifierDuality() {
        assertEquals(f("(Ex (- p))"), normalizer.pushNegations(f("(- (Ax p))")));
        assertEquals(f("(Ax (- p))"), normalizer.pushNegations(f("(- (Ex p))")));
        assertEquals(f("(Ax (p & q))"), normalizer.pushNegations(f("(- (Ex (- (p & q))))")));
        assertEquals(f("(Ex (Ay ((- p) & (- q))))"), normalizer.pushNegations(f("(- (Ax (Ey (p v q))))")));
    }

    @Test
    public void noResidualNegationPatterns() {
        List<String> inputs = List.of(
                "(- (p <-> (q & (- r))))",
                "(- (Ax ((p -> q) v (- (Ey (r <-> s))))))",
                "(- (- (- (a v (b & (- (- c)))))))",
                "((- (Ax p)) -> (- (Ey (q & r))))"
        );

        for (String input : inputs) {
            Formula result = toNegationNormalForm(f(input));
            assertTrue(input + " -> " + result, FormulaInspector.isNegationNormal(result));
        }
    }

    //endregion

    //region DISTRIBUZIONE

    @Test
    public void distributesOverRightConjunction() {
        assertEquals(f("((p v q) & (p v r))"), normalizer.distributeOrOverAnd(f("(p v (q & r))")));
    }

    @Test
    public void distributesOverLeftConjunction() {
        assertEquals(f("((q v p) & (r v p))"), normalizer.distributeOrOverAnd(f("((q & r) v p)")));
    }

    @Test
    public void distributesRightSideFirst() {
        assertEquals(f("(((a v c) & (b v c)) & ((a v d) & (b v d)))"),
                normalizer.distributeOrOverAnd(f("((a & b) v (c & d))")));
    }

    @Test
    public void distributedCopiesAreNotShared() {
        BinaryOp result = normalizer.distributeOrOverAnd(f("((a & b) v (q & r))")).asBinary();
        BinaryOp first = result.getLeft().asBinary().getLeft().asBinary();
        BinaryOp second = result.getRight().asBinary().getLeft().asBinary();

        assertEquals(first.getLeft(), second.getLeft());
        assertNotSame(first.getLeft(), second.getLeft());
    }

    @Test
    public void cnfIsIdempotent() {
        List<String> inputs = List.of("p", "(- p)", "((p v q) & (- r))", "(a & (b v (c v (- d))))", "(p v q)");

        for (String input : inputs) {
            Formula formula = f(input);
            assertEquals(input, formula, normalizer.toCnf(formula));
            assertEquals(1, normalizer.getLastIterationCount());
        }
    }

    @Test
    public void nestedDistributionReachesCnf() {
        List<String> inputs = List.of(
                "(p v (q & (r v (s & t))))",
                "((a & b) v ((c & d) v (e & g)))",
                "(((- a) & b) v (c & ((- d) v (e & g))))"
        );

        for (String input : inputs) {
            Formula formula = f(input);
            Formula cnf = normalizer.toCnf(formula);
            assertTrue(input + " -> " + cnf, FormulaInspector.isCnf(cnf));
            assertEquivalent(formula, cnf);
            assertTrue(normalizer.getLastIterationCount() <= normalizer.getMaxIterations());
        }
    }

    @Test
    public void iterationCapIsNeverSilentlyExceeded() {
        PropositionalNormalizer oneShot = new PropositionalNormalizer(1);

        assertEquals(f("(p v q)"), oneShot.toCnf(f("(p v q)")));
        try {
            oneShot.toCnf(f("(p v (q & r))"));
            fail("Limite di iterazioni superato senza errore");
        } catch (NormalizationException e) {
            assertTrue(e.getMessage().contains("1 passate"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveCap() {
        new PropositionalNormalizer(0);
    }

    //endregion
}
