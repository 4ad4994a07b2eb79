package org.pcnf.prenex;

import org.pcnf.cnf.NormalizationException;
import org.pcnf.cnf.PropositionalNormalizer;
import org.pcnf.formula.Atom;
import org.pcnf.formula.Formula;
import org.pcnf.parser.FormulaParser;
import org.pcnf.parser.StrictFormulaParser;
import org.pcnf.support.FormulaInspector;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONVERSIONE PCNF - Pipeline completa verso la Forma Normale Prenessa Congiuntiva
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Eliminazione biimplicazioni
 * 2. Eliminazione implicazioni
 * 3. Negazioni spinte verso le foglie (De Morgan, dualità dei quantificatori)
 * 4. Standardizzazione delle variabili legate
 * 5. Estrazione dei quantificatori: lista ordinata + matrice
 * 6. Distribuzione OR su AND sulla sola matrice
 * 7. Ricostruzione: quantificatori in testa, matrice CNF in coda
 *
 * Le trasformazioni sono pure; l'istanza conserva solo le statistiche
 * dell'ultima conversione, quindi va usata da un thread alla volta.
 */
public class PCNFConverter {

    private static final Logger LOGGER = Logger.getLogger(PCNFConverter.class.getName());

    /** Atomo usato come matrice quando l'estrazione non ne produce una */
    public static final String DEFAULT_MATRIX_ATOM = "a";

    private final Function<String, Formula> parser;
    private final PropositionalNormalizer normalizer;
    private final QuantifierManager quantifierManager;

    //region STATO ULTIMA CONVERSIONE

    private List<QuantifierBinding> lastQuantifiers = new ArrayList<>();
    private Set<String> lastFreeVariables = new TreeSet<>();
    private int lastRenamedCount;
    private int lastDistributionPasses;

    //endregion

    //region COSTRUTTORI

    public PCNFConverter() {
        this(false);
    }

    /**
     * @param strictGrammar true per validare l'input con la grammatica ANTLR
     *                      completamente parentesizzata
     */
    public PCNFConverter(boolean strictGrammar) {
        this(selectParser(strictGrammar), new PropositionalNormalizer(), new QuantifierManager());
    }

    public PCNFConverter(Function<String, Formula> parser, PropositionalNormalizer normalizer,
                         QuantifierManager quantifierManager) {
        this.parser = parser;
        this.normalizer = normalizer;
        this.quantifierManager = quantifierManager;
    }

    private static Function<String, Formula> selectParser(boolean strictGrammar) {
        if (strictGrammar) {
            return new StrictFormulaParser()::parse;
        }
        return new FormulaParser()::parse;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Analizza e converte una formula testuale.
     *
     * @param text formula in notazione testuale
     * @return formula in PCNF
     * @throws org.pcnf.parser.FormulaSyntaxException se il testo non è una formula valida
     */
    public Formula convert(String text) {
        return convert(parser.apply(text));
    }

    /**
     * METODO PRINCIPALE - Converte un albero in Forma Normale Prenessa Congiuntiva.
     *
     * @param formula albero ben formato
     * @return nuovo albero in PCNF
     * @throws NormalizationException se la distribuzione non converge (difetto interno)
     */
    public Formula convert(Formula formula) {
        try {
            LOGGER.fine("Inizio conversione PCNF per: " + formula);
            lastFreeVariables = quantifierManager.collectFreeVariables(formula);

            // Fase 1: eliminazione connettivi derivati
            Formula result = normalizer.eliminateBiconditionals(formula);
            LOGGER.finest("Dopo eliminazione biimplicazioni: " + result);

            result = normalizer.eliminateImplications(result);
            LOGGER.finest("Dopo eliminazione implicazioni: " + result);

            // Fase 2: forma normale negativa
            result = normalizer.pushNegations(result);
            LOGGER.finest("Dopo normalizzazione negazioni: " + result);

            // Fase 3: nomi unici per le variabili legate
            result = quantifierManager.standardizeVariables(result);
            lastRenamedCount = quantifierManager.getRenamedCount();
            LOGGER.finest("Dopo standardizzazione variabili: " + result);

            // Fase 4: separazione quantificatori e matrice
            PrenexExtraction extraction = quantifierManager.extractQuantifiers(result);
            lastQuantifiers = extraction.quantifiers();
            Formula matrix = extraction.matrix();
            if (matrix == null) {
                LOGGER.warning("Matrice assente, uso l'atomo di default '" + DEFAULT_MATRIX_ATOM + "'");
                matrix = new Atom(DEFAULT_MATRIX_ATOM);
            }
            LOGGER.finest("Quantificatori estratti " + lastQuantifiers + ", matrice: " + matrix);

            // Fase 5: CNF della matrice
            Formula cnfMatrix = normalizer.toCnf(matrix);
            lastDistributionPasses = normalizer.getLastIterationCount();
            LOGGER.finest("Matrice in CNF: " + cnfMatrix);

            // Fase 6: ricostruzione prenessa
            Formula pcnf = quantifierManager.rebuildPrenex(lastQuantifiers, cnfMatrix);
            if (!FormulaInspector.isPrenex(pcnf)) {
                LOGGER.warning("Risultato non in forma prenessa: " + pcnf);
            }

            LOGGER.fine("Conversione PCNF completata: " + pcnf);
            return pcnf;

        } catch (NormalizationException e) {
            LOGGER.log(Level.SEVERE, "Errore durante conversione PCNF", e);
            throw e;
        }
    }

    //endregion

    //region REPORT

    /**
     * @return report testuale dell'ultima conversione
     */
    public String getConversionInfo() {
        StringBuilder report = new StringBuilder();

        report.append("=== REPORT CONVERSIONE PCNF ===\n");
        report.append("Quantificatori estratti: ").append(lastQuantifiers.size())
                .append(" ").append(lastQuantifiers).append("\n");
        report.append("Variabili rinominate: ").append(lastRenamedCount).append("\n");
        report.append("Variabili libere: ").append(lastFreeVariables).append("\n");
        report.append("Passate di distribuzione: ").append(lastDistributionPasses)
                .append(" (limite ").append(normalizer.getMaxIterations()).append(")\n");
        report.append("===============================\n");

        return report.toString();
    }

    public List<QuantifierBinding> getLastQuantifiers() {
        return lastQuantifiers;
    }

    public int getLastRenamedCount() {
        return lastRenamedCount;
    }

    //endregion
}
