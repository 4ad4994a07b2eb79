package org.pcnf.prenex;

import org.pcnf.formula.Formula;

import java.util.List;

/**
 * Risultato dell'estrazione: quantificatori in ordine di incontro (dal più
 * esterno, da sinistra a destra) e matrice priva di quantificatori.
 */
public record PrenexExtraction(List<QuantifierBinding> quantifiers, Formula matrix) {

    public PrenexExtraction {
        quantifiers = List.copyOf(quantifiers);
    }
}
