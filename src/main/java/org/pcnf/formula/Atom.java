package org.pcnf.formula;

/**
 * Foglia dell'albero: costante o variabile.
 * Il significato dipende solo dall'eventuale quantificatore che la lega.
 */
public final class Atom extends Formula {

    /** Nome dell'atomo (lettera minuscola, eventuale suffisso numerico) */
    private final String symbol;

    /**
     * @param symbol nome dell'atomo
     * @throws IllegalArgumentException se il nome non è valido
     */
    public Atom(String symbol) {
        this.symbol = requireSymbol(symbol, "atomo");
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public Type getType() {
        return Type.ATOM;
    }

    @Override
    public Atom copy() {
        return new Atom(symbol);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return symbol.equals(((Atom) obj).symbol);
    }

    @Override
    public int hashCode() {
        return 31 * Type.ATOM.hashCode() + symbol.hashCode();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
