package org.pcnf.prenex;

import org.pcnf.formula.QuantifierKind;

/**
 * Quantificatore estratto dalla formula: tipo e variabile legata.
 */
public record QuantifierBinding(QuantifierKind kind, String variable) {

    @Override
    public String toString() {
        return kind.getSymbol() + variable;
    }
}
