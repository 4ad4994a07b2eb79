package org.pcnf.formula;

/**
 * Connettivi binari con il rispettivo simbolo testuale.
 */
public enum Connective {
    AND("&"),       // Congiunzione
    OR("v"),        // Disgiunzione
    IMPLIES("->"),  // Implicazione
    IFF("<->");     // Biimplicazione

    private final String symbol;

    Connective(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @param symbol simbolo testuale
     * @return connettivo corrispondente
     * @throws IllegalArgumentException se il simbolo non è un connettivo
     */
    public static Connective fromSymbol(String symbol) {
        for (Connective connective : values()) {
            if (connective.symbol.equals(symbol)) {
                return connective;
            }
        }
        throw new IllegalArgumentException("Connettivo sconosciuto: " + symbol);
    }
}
