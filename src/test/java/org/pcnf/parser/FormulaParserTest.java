package org.pcnf.parser;

import org.junit.Test;
import org.pcnf.formula.Atom;
import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Formula;
import org.pcnf.formula.Not;
import org.pcnf.formula.Quantifier;

import java.util.List;

import static org.junit.Assert.*;

public class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser();

    private static Atom atom(String symbol) {
        return new Atom(symbol);
    }

    @Test
    public void atomAndQuantifier() {
        assertEquals(atom("p"), parser.parse("p"));
        assertEquals(Quantifier.forall("x", BinaryOp.implies(atom("p"), atom("q"))),
                parser.parse("(Ax (p -> q))"));
        assertEquals(Quantifier.exists("x", atom("p")), parser.parse("  (Ex   p)  "));
    }

    @Test
    public void negation() {
        assertEquals(new Not(new Not(atom("p"))), parser.parse("(- (- p))"));
        assertEquals(BinaryOp.and(new Not(atom("p")), atom("q")), parser.parse("((- p) & q)"));
        assertEquals(new Not(BinaryOp.and(atom("a"), atom("b"))), parser.parse("(- (a & b))"));
    }

    @Test
    public void precedenceLowestFirst() {
        assertEquals(BinaryOp.or(atom("p"), BinaryOp.and(atom("q"), atom("r"))),
                parser.parse("(p v q & r)"));
        assertEquals(BinaryOp.implies(atom("p"), BinaryOp.or(atom("q"), atom("r"))),
                parser.parse("p -> q v r"));
        assertEquals(BinaryOp.iff(atom("p"), BinaryOp.implies(atom("q"), atom("r"))),
                parser.parse("(p <-> q -> r)"));
    }

    @Test
    public void sameOperatorChainsGroupToTheLeft() {
        assertEquals(BinaryOp.or(BinaryOp.or(atom("p"), atom("q")), atom("r")),
                parser.parse("(p v q v r)"));
        assertEquals(BinaryOp.implies(BinaryOp.implies(atom("p"), atom("q")), atom("r")),
                parser.parse("(p -> q -> r)"));
    }

    @Test
    public void explicitParenthesesOverrideGrouping() {
        assertEquals(BinaryOp.or(atom("p"), BinaryOp.or(atom("q"), atom("r"))),
                parser.parse("(p v (q v r))"));
        assertEquals(BinaryOp.or(Quantifier.forall("z", atom("p")), Quantifier.exists("w", atom("q"))),
                parser.parse("((Az p) v (Ew q))"));
    }

    @Test
    public void roundTripOfBuiltTrees() {
        List<Formula> trees = List.of(
                atom("p"),
                new Not(new Not(atom("q"))),
                BinaryOp.or(atom("p"), BinaryOp.or(atom("q"), atom("r"))),
                BinaryOp.and(BinaryOp.and(atom("p"), atom("q")), atom("r")),
                BinaryOp.iff(BinaryOp.implies(atom("a"), atom("b")), new Not(atom("c"))),
                Quantifier.forall("x", Quantifier.exists("y", BinaryOp.and(atom("x"), new Not(atom("y"))))),
                BinaryOp.or(Quantifier.forall("z", atom("p")), new Not(Quantifier.exists("w", atom("w")))),
                BinaryOp.implies(BinaryOp.iff(atom("p"), atom("q")), BinaryOp.implies(atom("r"), atom("s")))
        );

        for (Formula tree : trees) {
            assertEquals(tree.toString(), tree, parser.parse(tree.toString()));
        }
    }

    @Test
    public void quantifierWithoutBody() {
        try {
            parser.parse("(Ax)");
            fail("Quantificatore senza corpo accettato");
        } catch (FormulaSyntaxException e) {
            assertEquals("Ax", e.getFragment());
        }
    }

    @Test
    public void malformedInputs() {
        List<String> inputs = List.of("", "   ", "()", "(p & q", "p & q)", "pq", "P", "(p & )", "(- )", "(p # q)", "(Ax )");

        for (String input : inputs) {
            try {
                parser.parse(input);
                fail("Formula non valida accettata: '" + input + "'");
            } catch (FormulaSyntaxException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    @Test
    public void offendingFragmentIsReported() {
        try {
            parser.parse("(p & qr)");
            fail();
        } catch (FormulaSyntaxException e) {
            assertEquals("qr", e.getFragment());
        }
    }

    @Test(expected = FormulaSyntaxException.class)
    public void nullInput() {
        parser.parse(null);
    }
}
