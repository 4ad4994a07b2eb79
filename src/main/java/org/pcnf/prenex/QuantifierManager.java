package org.pcnf.prenex;

import org.pcnf.formula.Atom;
import org.pcnf.formula.BinaryOp;
import org.pcnf.formula.Connective;
import org.pcnf.formula.Formula;
import org.pcnf.formula.Not;
import org.pcnf.formula.Quantifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * GESTIONE QUANTIFICATORI - Standardizzazione, variabili libere, forma prenessa
 *
 * OPERAZIONI:
 * - {@link #standardizeVariables}: rinomina alfa, ogni quantificatore lega un nome unico
 * - {@link #renameVariable}: sostituzione rispettosa dei legami
 * - {@link #collectFreeVariables}: atomi non legati da alcun quantificatore
 * - {@link #extractQuantifiers}: separa lista di quantificatori e matrice
 * - {@link #rebuildPrenex}: ricompone quantificatori e matrice in forma prenessa
 *
 * I nomi nuovi sono generati in modo deterministico aggiungendo al nome
 * originale un contatore crescente da 0: x, x0, x1, ...
 */
public class QuantifierManager {

    private static final Logger LOGGER = Logger.getLogger(QuantifierManager.class.getName());

    /** Quantificatori rinominati dall'ultima standardizzazione */
    private int renamedCount;

    public int getRenamedCount() {
        return renamedCount;
    }

    //region STANDARDIZZAZIONE DELLE VARIABILI

    /**
     * Standardizza i nomi delle variabili legate. I nomi delle variabili libere
     * della formula sono riservati, così nessun quantificatore può catturarle
     * quando viene portato in testa.
     *
     * @param formula formula da standardizzare
     * @return formula equivalente con variabili legate tutte distinte
     */
    public Formula standardizeVariables(Formula formula) {
        return standardizeVariables(formula, collectFreeVariables(formula));
    }

    /**
     * Standardizza i nomi delle variabili legate evitando i nomi riservati.
     *
     * Visita top-down con un unico insieme di nomi usati condiviso tra fratelli
     * e discendenti: un quantificatore il cui nome è già usato riceve il primo
     * candidato libero tra nome+0, nome+1, ... e tutte le occorrenze che lega
     * vengono rinominate.
     *
     * @param formula formula da standardizzare
     * @param reserved nomi da non assegnare a nessun quantificatore
     * @return formula equivalente con variabili legate tutte distinte
     */
    public Formula standardizeVariables(Formula formula, Set<String> reserved) {
        renamedCount = 0;
        Set<String> used = new HashSet<>(reserved);
        return standardize(formula, used);
    }

    private Formula standardize(Formula formula, Set<String> used) {
        return switch (formula.getType()) {
            case ATOM -> formula;
            case NOT -> new Not(standardize(formula.asNot().getOperand(), used));
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                Formula left = standardize(op.getLeft(), used);
                Formula right = standardize(op.getRight(), used);
                yield op.with(left, right);
            }
            case QUANTIFIER -> standardizeQuantifier(formula.asQuantifier(), used);
        };
    }

    private Formula standardizeQuantifier(Quantifier quantifier, Set<String> used) {
        String variable = quantifier.getVariable();
        String freshName = generateFreshName(variable, used);
        used.add(freshName);

        Formula body = standardize(quantifier.getBody(), used);

        if (!freshName.equals(variable)) {
            body = renameVariable(body, variable, freshName);
            renamedCount++;
            LOGGER.finest("Variabile " + variable + " rinominata in " + freshName);
        }

        return new Quantifier(quantifier.getKind(), freshName, body);
    }

    private String generateFreshName(String variable, Set<String> used) {
        String candidate = variable;
        int counter = 0;
        while (used.contains(candidate)) {
            candidate = variable + counter;
            counter++;
        }
        return candidate;
    }

    /**
     * Sostituisce le occorrenze libere di oldName con newName. Un quantificatore
     * interno che lega di nuovo oldName oscura il nome: il suo sottoalbero
     * resta invariato.
     *
     * @param formula formula in cui rinominare
     * @param oldName nome da sostituire
     * @param newName nome sostitutivo
     * @return nuova formula con le occorrenze rinominate
     */
    public Formula renameVariable(Formula formula, String oldName, String newName) {
        return switch (formula.getType()) {
            case ATOM -> formula.asAtom().getSymbol().equals(oldName) ? new Atom(newName) : formula;
            case NOT -> new Not(renameVariable(formula.asNot().getOperand(), oldName, newName));
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                yield op.with(
                        renameVariable(op.getLeft(), oldName, newName),
                        renameVariable(op.getRight(), oldName, newName));
            }
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                if (quantifier.getVariable().equals(oldName)) {
                    yield quantifier;
                }
                yield quantifier.withBody(renameVariable(quantifier.getBody(), oldName, newName));
            }
        };
    }

    //endregion

    //region VARIABILI LIBERE

    /**
     * @param formula formula da analizzare
     * @return atomi liberi in ordine alfabetico
     */
    public Set<String> collectFreeVariables(Formula formula) {
        return collectFreeVariables(formula, Collections.emptySet());
    }

    /**
     * Un atomo è libero se non compare tra i nomi legati dai quantificatori
     * che lo racchiudono.
     *
     * @param formula formula da analizzare
     * @param bound nomi già legati dal contesto
     * @return atomi liberi in ordine alfabetico
     */
    public Set<String> collectFreeVariables(Formula formula, Set<String> bound) {
        Set<String> free = new TreeSet<>();
        collectFreeVariables(formula, bound, free);
        return free;
    }

    private void collectFreeVariables(Formula formula, Set<String> bound, Set<String> free) {
        switch (formula.getType()) {
            case ATOM -> {
                String symbol = formula.asAtom().getSymbol();
                if (!bound.contains(symbol)) {
                    free.add(symbol);
                }
            }
            case NOT -> collectFreeVariables(formula.asNot().getOperand(), bound, free);
            case BINARY -> {
                collectFreeVariables(formula.asBinary().getLeft(), bound, free);
                collectFreeVariables(formula.asBinary().getRight(), bound, free);
            }
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                Set<String> innerBound = new HashSet<>(bound);
                innerBound.add(quantifier.getVariable());
                collectFreeVariables(quantifier.getBody(), innerBound, free);
            }
        }
    }

    //endregion

    //region ESTRAZIONE E RICOSTRUZIONE PRENESSA

    /**
     * Rimuove i quantificatori sostituendo ogni nodo quantificatore con il suo
     * corpo. L'ordine della lista segue la visita: dall'esterno verso l'interno,
     * operando sinistro prima del destro.
     *
     * Va applicata a formule standardizzate in forma normale negativa; un
     * connettivo -&gt; o &lt;-&gt; è trattato come foglia opaca.
     *
     * @param formula formula standardizzata
     * @return lista dei quantificatori e matrice
     */
    public PrenexExtraction extractQuantifiers(Formula formula) {
        List<QuantifierBinding> quantifiers = new ArrayList<>();
        Formula matrix = extract(formula, quantifiers);
        return new PrenexExtraction(quantifiers, matrix);
    }

    private Formula extract(Formula formula, List<QuantifierBinding> quantifiers) {
        return switch (formula.getType()) {
            case ATOM -> formula;
            case NOT -> new Not(extract(formula.asNot().getOperand(), quantifiers));
            case QUANTIFIER -> {
                Quantifier quantifier = formula.asQuantifier();
                quantifiers.add(new QuantifierBinding(quantifier.getKind(), quantifier.getVariable()));
                yield extract(quantifier.getBody(), quantifiers);
            }
            case BINARY -> {
                BinaryOp op = formula.asBinary();
                if (op.getConnective() != Connective.AND && op.getConnective() != Connective.OR) {
                    LOGGER.warning("Connettivo " + op.getConnective() + " non eliminato, estrazione interrotta: " + op);
                    yield op;
                }
                Formula left = extract(op.getLeft(), quantifiers);
                Formula right = extract(op.getRight(), quantifiers);
                yield op.with(left, right);
            }
        };
    }

    /**
     * Avvolge la matrice con i quantificatori in ordine inverso: il primo
     * quantificatore della lista diventa il più esterno.
     *
     * @param quantifiers quantificatori in ordine di estrazione
     * @param matrix matrice priva di quantificatori
     * @return formula in forma prenessa
     */
    public Formula rebuildPrenex(List<QuantifierBinding> quantifiers, Formula matrix) {
        Formula result = matrix;
        for (int i = quantifiers.size() - 1; i >= 0; i--) {
            QuantifierBinding binding = quantifiers.get(i);
            result = new Quantifier(binding.kind(), binding.variable(), result);
        }
        return result;
    }

    //endregion
}
