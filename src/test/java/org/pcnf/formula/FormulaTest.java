package org.pcnf.formula;

import org.junit.Test;

import static org.junit.Assert.*;

public class FormulaTest {

    private static final Atom P = new Atom("p");
    private static final Atom Q = new Atom("q");

    @Test
    public void rendersCanonicalForm() {
        assertEquals("p", P.toString());
        assertEquals("(- p)", new Not(P).toString());
        assertEquals("(p & q)", BinaryOp.and(P, Q).toString());
        assertEquals("(p v q)", BinaryOp.or(P, Q).toString());
        assertEquals("(p -> q)", BinaryOp.implies(P, Q).toString());
        assertEquals("(p <-> q)", BinaryOp.iff(P, Q).toString());
        assertEquals("(Ax (p -> q))", Quantifier.forall("x", BinaryOp.implies(P, Q)).toString());
        assertEquals("(Ey0 (- y0))", Quantifier.exists("y0", new Not(new Atom("y0"))).toString());
    }

    @Test
    public void structuralEquality() {
        Formula a = Quantifier.forall("x", BinaryOp.or(new Not(P), Q));
        Formula b = Quantifier.forall("x", BinaryOp.or(new Not(new Atom("p")), new Atom("q")));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        assertNotEquals(a, Quantifier.exists("x", BinaryOp.or(new Not(P), Q)));
        assertNotEquals(a, Quantifier.forall("y", BinaryOp.or(new Not(P), Q)));
        assertNotEquals(BinaryOp.or(P, Q), BinaryOp.or(Q, P));
        assertNotEquals(BinaryOp.or(P, Q), BinaryOp.and(P, Q));
    }

    @Test
    public void copySharesNoNodes() {
        BinaryOp original = BinaryOp.and(new Not(P), Quantifier.forall("x", Q));
        BinaryOp copy = original.copy();

        assertEquals(original, copy);
        assertNotSame(original, copy);
        assertNotSame(original.getLeft(), copy.getLeft());
        assertNotSame(original.getLeft().asNot().getOperand(), copy.getLeft().asNot().getOperand());
        assertNotSame(original.getRight().asQuantifier().getBody(), copy.getRight().asQuantifier().getBody());
    }

    @Test
    public void symbolValidation() {
        assertTrue(Formula.isValidSymbol("x"));
        assertTrue(Formula.isValidSymbol("x12"));
        assertFalse(Formula.isValidSymbol("pq"));
        assertFalse(Formula.isValidSymbol("P"));
        assertFalse(Formula.isValidSymbol(""));
        assertFalse(Formula.isValidSymbol(null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMultiLetterAtom() {
        new Atom("pq");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsInvalidBoundVariable() {
        Quantifier.forall("X", P);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsQuantifierWithoutBody() {
        Quantifier.exists("x", null);
    }

    @Test
    public void typeDispatch() {
        assertEquals(Formula.Type.ATOM, P.getType());
        assertEquals(Formula.Type.NOT, new Not(P).getType());
        assertEquals(Formula.Type.BINARY, BinaryOp.or(P, Q).getType());
        assertEquals(Formula.Type.QUANTIFIER, Quantifier.exists("x", P).getType());
        assertTrue(BinaryOp.or(P, Q).isBinary(Connective.OR));
        assertFalse(BinaryOp.or(P, Q).isBinary(Connective.AND));
        assertFalse(P.isBinary(Connective.OR));
    }

    @Test
    public void symbolLookups() {
        assertEquals(Connective.IFF, Connective.fromSymbol("<->"));
        assertEquals(Connective.OR, Connective.fromSymbol("v"));
        assertEquals(QuantifierKind.EXISTS, QuantifierKind.fromSymbol('E'));
        assertEquals(QuantifierKind.EXISTS, QuantifierKind.FORALL.dual());
        assertEquals(QuantifierKind.FORALL, QuantifierKind.EXISTS.dual());
    }
}
