package org.pcnf.formula;

/**
 * Tipi di quantificatore e relativo prefisso testuale.
 */
public enum QuantifierKind {
    FORALL('A'),
    EXISTS('E');

    private final char symbol;

    QuantifierKind(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Duale usato nel passaggio della negazione: -A diventa E, -E diventa A.
     */
    public QuantifierKind dual() {
        return this == FORALL ? EXISTS : FORALL;
    }

    /**
     * @param symbol 'A' oppure 'E'
     * @return quantificatore corrispondente
     * @throws IllegalArgumentException per altri caratteri
     */
    public static QuantifierKind fromSymbol(char symbol) {
        return switch (symbol) {
            case 'A' -> FORALL;
            case 'E' -> EXISTS;
            default -> throw new IllegalArgumentException("Quantificatore sconosciuto: " + symbol);
        };
    }
}
