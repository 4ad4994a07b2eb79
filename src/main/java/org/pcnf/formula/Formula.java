package org.pcnf.formula;

import java.util.regex.Pattern;

/**
 * ALBERO SINTATTICO - Nodo base delle formule del primo ordine
 *
 * Rappresenta una formula come albero immutabile con quattro varianti concrete,
 * ognuna con i soli campi necessari:
 * - {@link Atom}: foglia, costante o variabile (distinte solo dal contesto di legame)
 * - {@link Not}: negazione unaria
 * - {@link BinaryOp}: connettivo binario (&, v, ->, <->)
 * - {@link Quantifier}: quantificatore universale o esistenziale con variabile legata
 *
 * INVARIANTI MANTENUTE:
 * - I nodi non vengono mai modificati dopo la costruzione
 * - Ogni trasformazione costruisce nuovi nodi
 * - Un sottoalbero duplicato in due rami viene copiato con {@link #copy()}
 * - Uguaglianza strutturale e sensibile all'ordine degli operandi
 *
 * La rappresentazione testuale ({@link #toString()}) e la forma canonica
 * completamente parentesizzata accettata dal parser.
 */
public abstract class Formula {

    /**
     * Nomi ammessi per atomi e variabili legate: una lettera minuscola,
     * eventualmente seguita dal suffisso numerico introdotto dalla rinomina.
     */
    private static final Pattern SYMBOL_PATTERN = Pattern.compile("[a-z][0-9]*");

    /**
     * Varianti supportate, usate per il dispatch con switch.
     */
    public enum Type {
        ATOM,        // Lettera: p, q, x
        NOT,         // Negazione: (- F)
        BINARY,      // Connettivo: (F & F), (F v F), (F -> F), (F <-> F)
        QUANTIFIER   // Quantificatore: (Ax F), (Ex F)
    }

    Formula() {
        // Solo le varianti del package possono estendere
    }

    /**
     * @return variante del nodo corrente
     */
    public abstract Type getType();

    /**
     * Copia profonda del sottoalbero.
     *
     * @return nuovo albero strutturalmente uguale, senza nodi condivisi
     */
    public abstract Formula copy();

    /**
     * Verifica che un nome sia valido per atomo o variabile legata.
     *
     * @param symbol nome da verificare
     * @return true se lettera minuscola con eventuale suffisso numerico
     */
    public static boolean isValidSymbol(String symbol) {
        return symbol != null && SYMBOL_PATTERN.matcher(symbol).matches();
    }

    static String requireSymbol(String symbol, String role) {
        if (!isValidSymbol(symbol)) {
            throw new IllegalArgumentException("Nome non valido per " + role + ": '" + symbol + "'");
        }
        return symbol;
    }

    static Formula requireOperand(Formula operand, String role) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando " + role + " non può essere null");
        }
        return operand;
    }

    //region CAST TIPIZZATI

    public Atom asAtom() {
        return (Atom) this;
    }

    public Not asNot() {
        return (Not) this;
    }

    public BinaryOp asBinary() {
        return (BinaryOp) this;
    }

    public Quantifier asQuantifier() {
        return (Quantifier) this;
    }

    /**
     * @param connective connettivo atteso
     * @return true se il nodo e un BinaryOp con quel connettivo
     */
    public boolean isBinary(Connective connective) {
        return getType() == Type.BINARY && asBinary().getConnective() == connective;
    }

    //endregion
}
