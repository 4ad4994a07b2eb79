package org.pcnf.formula;

import java.util.Objects;

/**
 * Quantificatore con variabile legata: (Ax F) oppure (Ex F)
 */
public final class Quantifier extends Formula {

    private final QuantifierKind kind;
    private final String variable;
    private final Formula body;

    /**
     * @param kind universale o esistenziale (non null)
     * @param variable nome della variabile legata
     * @param body corpo del quantificatore (non null)
     * @throws IllegalArgumentException se variabile o corpo non validi
     */
    public Quantifier(QuantifierKind kind, String variable, Formula body) {
        this.kind = Objects.requireNonNull(kind, "Tipo quantificatore non può essere null");
        this.variable = requireSymbol(variable, "variabile quantificata");
        this.body = requireOperand(body, "del quantificatore");
    }

    public static Quantifier forall(String variable, Formula body) {
        return new Quantifier(QuantifierKind.FORALL, variable, body);
    }

    public static Quantifier exists(String variable, Formula body) {
        return new Quantifier(QuantifierKind.EXISTS, variable, body);
    }

    public QuantifierKind getKind() {
        return kind;
    }

    public String getVariable() {
        return variable;
    }

    public Formula getBody() {
        return body;
    }

    /**
     * Stesso quantificatore e variabile su un nuovo corpo.
     */
    public Quantifier withBody(Formula newBody) {
        return new Quantifier(kind, variable, newBody);
    }

    @Override
    public Type getType() {
        return Type.QUANTIFIER;
    }

    @Override
    public Quantifier copy() {
        return new Quantifier(kind, variable, body.copy());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Quantifier other = (Quantifier) obj;
        return kind == other.kind
                && variable.equals(other.variable)
                && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        int result = kind.hashCode();
        result = 31 * result + variable.hashCode();
        result = 31 * result + body.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "(" + kind.getSymbol() + variable + " " + body + ")";
    }
}
