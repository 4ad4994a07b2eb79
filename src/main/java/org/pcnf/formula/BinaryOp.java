package org.pcnf.formula;

import java.util.Objects;

/**
 * Connettivo binario: (left op right)
 */
public final class BinaryOp extends Formula {

    private final Connective connective;
    private final Formula left;
    private final Formula right;

    /**
     * @param connective connettivo (non null)
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     */
    public BinaryOp(Connective connective, Formula left, Formula right) {
        this.connective = Objects.requireNonNull(connective, "Connettivo non può essere null");
        this.left = requireOperand(left, "sinistro");
        this.right = requireOperand(right, "destro");
    }

    public static BinaryOp and(Formula left, Formula right) {
        return new BinaryOp(Connective.AND, left, right);
    }

    public static BinaryOp or(Formula left, Formula right) {
        return new BinaryOp(Connective.OR, left, right);
    }

    public static BinaryOp implies(Formula left, Formula right) {
        return new BinaryOp(Connective.IMPLIES, left, right);
    }

    public static BinaryOp iff(Formula left, Formula right) {
        return new BinaryOp(Connective.IFF, left, right);
    }

    public Connective getConnective() {
        return connective;
    }

    public Formula getLeft() {
        return left;
    }

    public Formula getRight() {
        return right;
    }

    /**
     * Ricostruisce il nodo con lo stesso connettivo su nuovi operandi.
     */
    public BinaryOp with(Formula newLeft, Formula newRight) {
        return new BinaryOp(connective, newLeft, newRight);
    }

    @Override
    public Type getType() {
        return Type.BINARY;
    }

    @Override
    public BinaryOp copy() {
        return new BinaryOp(connective, left.copy(), right.copy());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        BinaryOp other = (BinaryOp) obj;
        return connective == other.connective
                && left.equals(other.left)
                && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        int result = connective.hashCode();
        result = 31 * result + left.hashCode();
        result = 31 * result + right.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "(" + left + " " + connective.getSymbol() + " " + right + ")";
    }
}
