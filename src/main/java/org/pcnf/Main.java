package org.pcnf;

import org.pcnf.cnf.NormalizationException;
import org.pcnf.formula.Formula;
import org.pcnf.parser.FormulaSyntaxException;
import org.pcnf.prenex.PCNFConverter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * CONVERTITORE PCNF (Forma Normale Prenessa Congiuntiva)
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formule dalla lista dimostrativa, da riga di comando o da file di testo
 * 2. PARSING: discesa ricorsiva (default) oppure grammatica ANTLR stretta (-strict)
 * 3. CONVERSIONE: eliminazione connettivi, De Morgan, standardizzazione, estrazione
 *    quantificatori, CNF della matrice, ricostruzione prenessa
 * 4. OUTPUT: formula originale e PCNF, oppure l'errore rilevato per quella formula
 *
 * MODALITÀ OPERATIVE:
 * - Nessun parametro: lista di formule dimostrative
 * - Formula singola (-e)
 * - File (-f): una formula per riga, righe vuote e commenti '#' ignorati
 * - Report su file (-o), log dettagliato (-v)
 *
 * Un errore su una formula non interrompe l'elaborazione delle successive.
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String OUTPUT_PARAM = "-o";
    private static final String STRICT_PARAM = "-strict";
    private static final String VERBOSE_PARAM = "-v";

    /** Prefisso delle righe di commento nei file di formule */
    private static final String COMMENT_PREFIX = "#";

    /** Configurazione di logging caricata dal classpath */
    private static final String LOGGING_CONFIG = "/logging.properties";

    private static final String SEPARATOR = "===========================================================";

    /**
     * Formule dimostrative usate quando non viene fornito alcun input
     * */
    static final List<String> DEMO_EXPRESSIONS = List.of(
            "(Ay (a v b))",           // Variabile y, costanti a, b
            "(Ex (p v q))",           // Variabile x, costanti p, q
            "(Ax (Ey (r & (- s))))",  // Variabili x, y; costanti r, s
            "((Az p) v (Ew q))",      // Variabili z, w; costanti p, q
            "(Ax (p -> q))",          // Implicazione
            "(Ay ((p v q) <-> r))",   // Biimplicazione
            "(Ex (- (a & b)))",       // De Morgan su congiunzione
            "(Ay (- (c v d)))",       // De Morgan su disgiunzione
            "(Ax)"                    // Quantificatore senza corpo: errore di sintassi
    );

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();

        ConverterConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            System.exit(1);
            return;
        }
        if (config == null) return; // Help mostrato

        if (config.verbose) {
            Logger.getLogger("org.pcnf").setLevel(Level.FINE);
        }

        try {
            List<String> expressions = loadExpressions(config);
            BatchResult result = processBatch(expressions, new PCNFConverter(config.strictGrammar));
            System.out.print(result.report());
            displayBatchSummary(result);

            if (config.outputPath != null) {
                Files.writeString(Paths.get(config.outputPath), result.report(), StandardCharsets.UTF_8);
                System.out.println("[I] Report salvato in: " + config.outputPath);
            }
        } catch (IOException e) {
            System.out.println("[E] Errore di I/O: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Carica logging.properties dal classpath; in assenza resta la configurazione JVM.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE FORMULE

    /**
     * Determina le formule da elaborare in base alla modalità.
     */
    private static List<String> loadExpressions(ConverterConfiguration config) throws IOException {
        if (config.expression != null) {
            return List.of(config.expression);
        }
        if (config.inputPath != null) {
            return readFormulasFromFile(Paths.get(config.inputPath));
        }
        return DEMO_EXPRESSIONS;
    }

    /**
     * Legge una formula per riga, ignorando righe vuote e commenti.
     *
     * @param path file di formule
     * @return formule in ordine di apparizione
     * @throws IOException se il file non è leggibile
     */
    static List<String> readFormulasFromFile(Path path) throws IOException {
        List<String> expressions = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                expressions.add(trimmed);
            }
        }
        return expressions;
    }

    /**
     * Converte ogni formula, raccogliendo l'esito senza interrompere la sequenza.
     *
     * @param expressions formule testuali
     * @param converter convertitore da usare
     * @return report testuale e conteggi
     */
    static BatchResult processBatch(List<String> expressions, PCNFConverter converter) {
        StringBuilder report = new StringBuilder();
        int converted = 0;
        int failed = 0;

        for (String expression : expressions) {
            report.append(SEPARATOR).append("\n");
            report.append("Original Expression: ").append(expression).append("\n\n");

            try {
                Formula pcnf = converter.convert(expression);
                report.append("PCNF: ").append(pcnf).append("\n\n");
                converted++;
            } catch (FormulaSyntaxException | NormalizationException e) {
                report.append("Error processing '").append(expression).append("': ")
                        .append(e.getMessage()).append("\n\n");
                failed++;
            }
        }

        return new BatchResult(report.toString(), converted, failed);
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("-->> RIEPILOGO <<--");
        System.out.println("Formule convertite: " + result.converted());
        System.out.println("Formule con errori: " + result.failed());
    }

    private static void printApplicationHelp() {
        System.out.println("Uso: java -jar convertitore-pcnf.jar [opzioni]");
        System.out.println();
        System.out.println("Senza parametri elabora la lista di formule dimostrative.");
        System.out.println();
        System.out.println("  -h              Mostra questo help");
        System.out.println("  -e <formula>    Converte una singola formula");
        System.out.println("  -f <file>       Converte le formule del file, una per riga");
        System.out.println("  -o <file>       Salva il report nel file indicato");
        System.out.println("  -strict         Valida con la grammatica completamente parentesizzata");
        System.out.println("  -v              Log dettagliato della pipeline");
        System.out.println();
        System.out.println("Grammatica: F ::= x | (- F) | (F & F) | (F v F) | (F -> F) | (F <-> F) | (Ax F) | (Ex F)");
    }

    //endregion

    //region STRUTTURE DI SUPPORTO

    /**
     * Configurazione immutabile dell'esecuzione.
     */
    static final class ConverterConfiguration {
        final String expression;
        final String inputPath;
        final String outputPath;
        final boolean strictGrammar;
        final boolean verbose;

        ConverterConfiguration(String expression, String inputPath, String outputPath,
                               boolean strictGrammar, boolean verbose) {
            this.expression = expression;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.strictGrammar = strictGrammar;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ConverterConfiguration parse(String[] args) {
            String expression = null;
            String inputPath = null;
            String outputPath = null;
            boolean strictGrammar = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case EXPRESSION_PARAM -> {
                        if (inputPath != null) {
                            throw new IllegalArgumentException("-e e -f sono alternativi");
                        }
                        expression = getNextArgument(args, ++i, "formula");
                    }
                    case FILE_PARAM -> {
                        if (expression != null) {
                            throw new IllegalArgumentException("-e e -f sono alternativi");
                        }
                        inputPath = getNextArgument(args, ++i, "file");
                        if (!Files.isRegularFile(Paths.get(inputPath))) {
                            throw new IllegalArgumentException("File non esistente: " + inputPath);
                        }
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "file output");
                    case STRICT_PARAM -> strictGrammar = true;
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            return new ConverterConfiguration(expression, inputPath, outputPath, strictGrammar, verbose);
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + description);
            }
            return args[index];
        }
    }

    /**
     * Esito di un'elaborazione in sequenza.
     */
    record BatchResult(String report, int converted, int failed) {}

    //endregion
}
