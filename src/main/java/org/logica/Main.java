package org.logica;

import org.logica.cnf.Dimacs;
import org.logica.cnf.Normalizer;
import org.logica.cnf.TseytinEncoding;
import org.logica.cnf.TseytinTransformer;
import org.logica.evaluation.Evaluator;
import org.logica.operators.Operator;
import org.logica.parser.FormulaSyntaxException;
import org.logica.parser.PropositionParser;
import org.logica.propositions.Normal;
import org.logica.propositions.Proposition;
import org.logica.semantics.Models;
import org.logica.semantics.Semantics;
import org.logica.semantics.TruthClass;
import org.logica.semantics.Valuation;
import org.logica.solver.CdclEngine;
import org.logica.support.LogicException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * MOTORE DI LOGICA PROPOSIZIONALE - Interfaccia a riga di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da file di testo (-f), file DIMACS .cnf (-f) o riga di comando (-e)
 * 2. PARSING: notazione infissa -> proposizione (ANTLR), oppure lettura DIMACS diretta
 * 3. OPZIONI FACOLTATIVE (-opt=):
 *    - c: Forma Normale Congiuntiva
 *    - d: Forma Normale Disgiuntiva
 *    - t: codifica di Tseytin in formato DIMACS
 *    - r: motore CDCL con restart
 * 4. ANALISI: classificazione (tautologia, contingenza, contraddizione) ed
 *    enumerazione dei modelli con timeout
 * 5. OUTPUT: console e, con -o, file nelle cartelle CNF/, DNF/, DIMACS/, RESULT/
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String SOLUTIONS_PARAM = "-n";
    private static final String OPT_PARAM = "-opt=";

    private static final String OPT_CNF = "c";
    private static final String OPT_DNF = "d";
    private static final String OPT_TSEYTIN = "t";
    private static final String OPT_RESTART = "r";
    private static final String OPT_ALL = "all";

    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int MIN_TIMEOUT_SECONDS = 1;
    static final int DEFAULT_MAX_SOLUTIONS = 10;

    /** Attesa massima per l'arresto del thread di analisi dopo l'interruzione. */
    private static final int SOLVER_STOP_SECONDS = 5;

    /** Codici di uscita */
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_TIMEOUT = 2;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        loadLoggingConfiguration();
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intera pipeline scrivendo su {@code out}.
     *
     * @return codice di uscita: 0 successo, 1 errore, 2 timeout
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_ERROR;
        }

        SolverConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return EXIT_ERROR;
        }
        if (config.showHelp) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        try {
            return executePipeline(config, out);
        } catch (FormulaSyntaxException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di I/O", e);
            out.println("[E] Errore di I/O: " + e.getMessage());
            return EXIT_ERROR;
        } catch (LogicException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Errore durante l'elaborazione", e);
            out.println("[E] Errore durante l'elaborazione: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static void loadLoggingConfiguration() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("[W] Configurazione di logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PIPELINE

    private static int executePipeline(SolverConfiguration config, PrintStream out) throws IOException {
        Evaluator evaluator = Evaluator.standard();
        Proposition formula = readFormula(config, evaluator, out);
        out.println("[I] Formula: " + formula);

        if (config.cnf) {
            Normal cnf = new Normalizer(evaluator).normalize(Operator.AND, formula);
            out.println("[I] CNF: " + cnf);
            saveToFile(config, "CNF", ".txt", cnf + System.lineSeparator(), out);
        }
        if (config.dnf) {
            Normal dnf = new Normalizer(evaluator).normalize(Operator.OR, formula);
            out.println("[I] DNF: " + dnf);
            saveToFile(config, "DNF", ".txt", dnf + System.lineSeparator(), out);
        }
        if (config.tseytin) {
            TseytinEncoding encoding = new TseytinTransformer(evaluator).transform(formula);
            String dimacs = encoding.toDimacs();
            out.println("[I] Codifica di Tseytin: " + encoding.getVariableCount() + " variabili, "
                    + encoding.getClauseCount() + " clausole");
            out.print(dimacs);
            saveToFile(config, "DIMACS", ".cnf", dimacs, out);
        }

        CdclEngine engine = config.restart ? CdclEngine.withRestarts() : new CdclEngine();
        Semantics semantics = new Semantics(evaluator, engine);
        AnalysisResult result = analyzeWithTimeout(semantics, formula, config, out);
        if (result == null) {
            saveToFile(config, "RESULT", ".res", "TIMEOUT dopo " + config.timeoutSeconds + " secondi"
                    + System.lineSeparator(), out);
            return EXIT_TIMEOUT;
        }

        String report = formatResult(result, config);
        out.print(report);
        saveToFile(config, "RESULT", ".res", report, out);
        return EXIT_OK;
    }

    private static Proposition readFormula(SolverConfiguration config, Evaluator evaluator, PrintStream out)
            throws IOException {
        if (config.expression != null) {
            return new PropositionParser(evaluator).parse(config.expression);
        }
        Path path = Path.of(config.inputPath);
        if (config.inputPath.endsWith(".cnf")) {
            out.println("[I] Lettura file DIMACS: " + path);
            return Dimacs.toNormal(Dimacs.read(path));
        }
        String content = Files.readString(path, StandardCharsets.UTF_8).trim();
        out.println("[I] Formula letta da " + path);
        return new PropositionParser(evaluator).parse(content);
    }

    /**
     * Classificazione ed enumerazione su un thread dedicato. Allo scadere del timeout il
     * thread viene interrotto: la ricerca CDCL si ferma e rilascia il solutore.
     *
     * @return risultato, o null se il timeout scade
     */
    private static AnalysisResult analyzeWithTimeout(Semantics semantics, Proposition formula,
                                                     SolverConfiguration config, PrintStream out) {
        out.println("Analisi con CDCL" + (config.restart ? " con restart" : "")
                + " (timeout: " + config.timeoutSeconds + "s)...");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Callable<AnalysisResult> task = () -> analyze(semantics, formula, config.maxSolutions);
        Future<AnalysisResult> future = executor.submit(task);
        try {
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            future.cancel(true);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogicException("Analisi interrotta", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new LogicException("Errore durante l'analisi", cause);
        } finally {
            executor.shutdownNow();
            awaitSolverStop(executor);
        }
    }

    private static void awaitSolverStop(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(SOLVER_STOP_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Il thread di analisi non si è fermato entro " + SOLVER_STOP_SECONDS + " secondi");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static AnalysisResult analyze(Semantics semantics, Proposition formula, int maxSolutions) {
        TruthClass truthClass = semantics.classify(formula);
        List<Valuation> models = new ArrayList<>();
        boolean more;
        try (Models iterator = semantics.solutions(formula)) {
            while (models.size() < maxSolutions && iterator.hasNext()) {
                models.add(iterator.next());
            }
            more = iterator.hasNext();
        }
        LOGGER.info("Analisi completata: " + truthClass + ", " + models.size() + " modelli");
        return new AnalysisResult(truthClass, models, more);
    }

    /** Esito dell'analisi di una formula. */
    private record AnalysisResult(TruthClass truthClass, List<Valuation> models, boolean more) {
    }

    //endregion

    //region OUTPUT

    private static String formatResult(AnalysisResult result, SolverConfiguration config) {
        String newline = System.lineSeparator();
        StringBuilder report = new StringBuilder();
        report.append("Classificazione: ").append(describe(result.truthClass())).append(newline);
        report.append(result.truthClass() == TruthClass.CONTRADICTION ? "UNSAT" : "SAT").append(newline);
        for (int i = 0; i < result.models().size(); i++) {
            report.append("Modello ").append(i + 1).append(": ").append(result.models().get(i)).append(newline);
        }
        if (result.more()) {
            report.append("... altri modelli oltre il limite di ").append(config.maxSolutions).append(newline);
        }
        return report.toString();
    }

    private static String describe(TruthClass truthClass) {
        return switch (truthClass) {
            case TAUTOLOGY -> "tautologia";
            case CONTINGENCY -> "contingenza";
            case CONTRADICTION -> "contraddizione";
        };
    }

    /** Scrive {@code <output>/<cartella>/<nome base><estensione>} se è stata indicata una directory di output. */
    private static void saveToFile(SolverConfiguration config, String folder, String extension,
                                   String content, PrintStream out) throws IOException {
        if (config.outputPath == null) {
            return;
        }
        Path directory = Path.of(config.outputPath, folder);
        Files.createDirectories(directory);
        Path file = directory.resolve(config.baseName() + extension);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        out.println("[I] Salvato: " + file);
    }

    private static void printApplicationHelp(PrintStream out) {
        out.println("""
                UTILIZZO: java -jar logica-proposizionale.jar [opzioni]

                INPUT (uno obbligatorio):
                  -f <file>        formula da file di testo, o problema DIMACS se l'estensione è .cnf
                  -e <formula>     formula passata direttamente, es. -e "p -> (q & r)"

                OPZIONI:
                  -o <directory>   salva i risultati in CNF/, DNF/, DIMACS/, RESULT/
                  -t <secondi>     timeout dell'analisi (minimo 1, default 10)
                  -n <numero>      numero massimo di modelli mostrati (default 10)
                  -opt=<flag>      c (CNF), d (DNF), t (Tseytin DIMACS), r (restart), all
                  -h               mostra questo messaggio

                SINTASSI:
                  ¬ ! ~   ∧ & &&   ∨ | ||   ⊼   ⊽   → ->   ← <-   ↛   ↚   ↔ <->   ↮ ^ ⊻
                  ⊤ true TRUE   ⊥ false FALSE   "testo" e interi come costanti
                """);
    }

    //endregion

    //region CONFIGURAZIONE

    /** Configurazione immutabile prodotta da {@link ArgumentParser}. */
    static final class SolverConfiguration {
        final boolean showHelp;
        final String inputPath;
        final String expression;
        final String outputPath;
        final int timeoutSeconds;
        final int maxSolutions;
        final boolean cnf;
        final boolean dnf;
        final boolean tseytin;
        final boolean restart;

        SolverConfiguration(boolean showHelp, String inputPath, String expression, String outputPath,
                            int timeoutSeconds, int maxSolutions, Set<String> options) {
            this.showHelp = showHelp;
            this.inputPath = inputPath;
            this.expression = expression;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.maxSolutions = maxSolutions;
            this.cnf = options.contains(OPT_CNF);
            this.dnf = options.contains(OPT_DNF);
            this.tseytin = options.contains(OPT_TSEYTIN);
            this.restart = options.contains(OPT_RESTART);
        }

        String baseName() {
            if (inputPath == null) {
                return "formula";
            }
            String name = Path.of(inputPath).getFileName().toString();
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }
    }

    /** Analisi sequenziale degli argomenti con validazione di ogni parametro. */
    static final class ArgumentParser {

        private String inputPath;
        private String expression;
        private String outputPath;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int maxSolutions = DEFAULT_MAX_SOLUTIONS;
        private final Set<String> options = new LinkedHashSet<>();

        /**
         * @throws IllegalArgumentException per parametri sconosciuti, valori mancanti o non validi
         */
        SolverConfiguration parse(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals(HELP_PARAM)) {
                    return new SolverConfiguration(true, null, null, null, timeoutSeconds, maxSolutions, options);
                } else if (arg.equals(FILE_PARAM)) {
                    inputPath = requireValue(args, ++i, FILE_PARAM);
                } else if (arg.equals(EXPRESSION_PARAM)) {
                    expression = requireValue(args, ++i, EXPRESSION_PARAM);
                } else if (arg.equals(OUTPUT_PARAM)) {
                    outputPath = requireValue(args, ++i, OUTPUT_PARAM);
                } else if (arg.equals(TIMEOUT_PARAM)) {
                    timeoutSeconds = parsePositive(requireValue(args, ++i, TIMEOUT_PARAM), TIMEOUT_PARAM);
                    if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
                        throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                    }
                } else if (arg.equals(SOLUTIONS_PARAM)) {
                    maxSolutions = parsePositive(requireValue(args, ++i, SOLUTIONS_PARAM), SOLUTIONS_PARAM);
                } else if (arg.startsWith(OPT_PARAM)) {
                    parseOptions(arg.substring(OPT_PARAM.length()));
                } else {
                    throw new IllegalArgumentException("Parametro sconosciuto: " + arg);
                }
            }

            if (inputPath == null && expression == null) {
                throw new IllegalArgumentException("Specificare un input con " + FILE_PARAM + " o " + EXPRESSION_PARAM);
            }
            if (inputPath != null && expression != null) {
                throw new IllegalArgumentException("Parametri " + FILE_PARAM + " e " + EXPRESSION_PARAM
                        + " mutuamente esclusivi");
            }
            if (inputPath != null && !Files.isRegularFile(Path.of(inputPath))) {
                throw new IllegalArgumentException("File non trovato: " + inputPath);
            }
            return new SolverConfiguration(false, inputPath, expression, outputPath,
                    timeoutSeconds, maxSolutions, options);
        }

        private void parseOptions(String flags) {
            if (flags.isEmpty()) {
                throw new IllegalArgumentException("Nessuna opzione indicata dopo " + OPT_PARAM);
            }
            if (flags.equals(OPT_ALL)) {
                options.addAll(List.of(OPT_CNF, OPT_DNF, OPT_TSEYTIN, OPT_RESTART));
                return;
            }
            for (char flag : flags.toCharArray()) {
                String option = String.valueOf(flag);
                switch (option) {
                    case OPT_CNF, OPT_DNF, OPT_TSEYTIN, OPT_RESTART -> options.add(option);
                    default -> throw new IllegalArgumentException("Opzione sconosciuta: " + option);
                }
            }
        }

        private static String requireValue(String[] args, int index, String param) {
            if (index >= args.length || args[index].startsWith("-") && !param.equals(EXPRESSION_PARAM)) {
                throw new IllegalArgumentException("Valore mancante per " + param);
            }
            return args[index];
        }

        private static int parsePositive(String value, String param) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new IllegalArgumentException("Valore non positivo per " + param + ": " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero non valido per " + param + ": " + value, e);
            }
        }
    }

    //endregion
}
