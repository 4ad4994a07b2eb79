package org.pcnf.formula;

/**
 * Negazione unaria: (- F)
 */
public final class Not extends Formula {

    private final Formula operand;

    /**
     * @param operand sottoformula da negare (non null)
     */
    public Not(Formula operand) {
        this.operand = requireOperand(operand, "della negazione");
    }

    public Formula getOperand() {
        return operand;
    }

    @Override
    public Type getType() {
        return Type.NOT;
    }

    @Override
    public Not copy() {
        return new Not(operand.copy());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return operand.equals(((Not) obj).operand);
    }

    @Override
    public int hashCode() {
        return 31 * Type.NOT.hashCode() + operand.hashCode();
    }

    @Override
    public String toString() {
        return "(- " + operand + ")";
    }
}
