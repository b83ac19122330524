package org.truthtable;

import org.truthtable.formula.Formula;
import org.truthtable.formula.FormulaEvaluationException;
import org.truthtable.formula.Variable;
import org.truthtable.kmap.KarnaughMap;
import org.truthtable.parser.FormulaSyntaxException;
import org.truthtable.table.TruthTable;
import org.truthtable.table.TruthTableRow;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * GENERATORE DI TABELLE DI VERITÀ - Interfaccia a riga di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula inline (-e), da file di testo (-f) o da tutti i file .txt di una directory (-d)
 * 2. PARSING: Normalizzazione, estrazione variabili e albero sintattico (ANTLR)
 * 3. TABELLA: Enumerazione dei 2^n assegnamenti e valutazione della formula
 * 4. ANALISI: Tautologia / contraddizione
 * 5. OPZIONI FACOLTATIVE:
 *    - DNF: Forma Normale Disgiuntiva canonica
 *    - CNF: Forma Normale Congiuntiva canonica
 *    - K-MAP: Mappa di Karnaugh (2-4 variabili)
 * 6. OUTPUT: Riepilogo a console e file strutturati
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - TABLE/: Tabella di verità in formato CSV
 * - DNF/: Forma Normale Disgiuntiva (se si attiva -opt=d)
 * - CNF/: Forma Normale Congiuntiva (se si attiva -opt=c)
 * - KMAP/: Mappa di Karnaugh a griglia (se si attiva -opt=k)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String OPT_PARAM = "-opt=";

    /**
     * Flag opzioni disponibili
     * */
    private static final String OPT_DNF = "d";
    private static final String OPT_CNF = "c";
    private static final String OPT_KMAP = "k";
    private static final String OPT_ALL = "all";

    /** Nome base dei file prodotti per una formula inline */
    private static final String INLINE_FORMULA_NAME = "formula";

    /** Configurazione di logging caricata dal classpath */
    private static final String LOGGING_CONFIG = "/logging.properties";

    /** Codici di uscita */
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

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

        int exitCode = run(args);
        if (exitCode != EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intero flusso dall'analisi dei parametri alla scrittura dei risultati.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Utilizzo della modalità appropriata (inline, file singolo, directory)
     * 3. Riepilogo finale e codice di uscita
     *
     * @param args parametri linea di comando
     * @return 0 se tutte le formule sono state elaborate, 1 altrimenti
     */
    static int run(String[] args) {
        System.out.println("---> AVVIO GENERATORE TABELLE DI VERITÀ <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_FAILURE;
            }

            Configuration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                System.out.println("Usa -h per visualizzare l'help completo.");
                return EXIT_FAILURE;
            }

            if (config == null) {
                return EXIT_SUCCESS; // Help mostrato
            }

            displayConfigurationSummary(config);
            return executeMainPipeline(config) ? EXIT_SUCCESS : EXIT_FAILURE;

        } catch (Exception e) {
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
            return EXIT_FAILURE;
        } finally {
            System.out.println("---> FINE ESECUZIONE <---");
        }
    }

    /**
     * Delega all'handler della modalità operativa configurata.
     *
     * @return true se tutte le formule sono state elaborate con successo
     */
    private static boolean executeMainPipeline(Configuration config) throws IOException {
        TruthTableEngine engine = new TruthTableEngine();

        return switch (config.mode) {
            case EXPRESSION -> {
                System.out.println("[I] Modalità: Formula inline");
                Path outputDir = config.outputPath != null ? Paths.get(config.outputPath) : null;
                yield processFormula(engine, config.expression, INLINE_FORMULA_NAME, outputDir, config);
            }
            case FILE -> {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                yield processSingleFile(engine, Paths.get(config.inputPath), config);
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Elaborazione della directory");
                yield processDirectoryBatch(engine, config);
            }
        };
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath, a meno che
     * non ne sia già stata indicata una con -Djava.util.logging.config.file.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }

        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Impossibile caricare " + LOGGING_CONFIG + ": " + e.getMessage());
        }
    }

    //endregion

    //region RIEPILOGO CONFIGURAZIONE

    private static void displayConfigurationSummary(Configuration config) {
        System.out.println("\n-->> CONFIGURAZIONE <<--");

        switch (config.mode) {
            case EXPRESSION -> System.out.println("Formula: " + config.expression);
            case FILE -> System.out.println("File: " + config.inputPath);
            case DIRECTORY -> System.out.println("Directory: " + config.inputPath);
        }

        List<String> activeOpts = buildActiveOptionsList(config);
        System.out.println("Opzioni aggiuntive: " + (activeOpts.isEmpty() ? "Nessuna" : String.join(", ", activeOpts)));
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : describeDefaultOutput(config)));
        System.out.println("========================\n");
    }

    private static String describeDefaultOutput(Configuration config) {
        return config.mode == InputMode.EXPRESSION ? "Solo console" : "Directory input";
    }

    private static List<String> buildActiveOptionsList(Configuration config) {
        List<String> activeOpts = new ArrayList<>();
        if (config.showDnf) activeOpts.add("DNF");
        if (config.showCnf) activeOpts.add("CNF");
        if (config.showKarnaughMap) activeOpts.add("K-Map");
        return activeOpts;
    }

    //endregion

    //region ELABORAZIONE FORMULA

    /**
     * Elabora un singolo file contenente una formula.
     */
    private static boolean processSingleFile(TruthTableEngine engine, Path file, Configuration config) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + file.getFileName());
        System.out.println("==========================\n");

        String formulaText = readFormulaFromFile(file);
        return processFormula(engine, formulaText, getBaseFileName(file), getOutputDirectory(config, file), config);
    }

    /**
     * Elabora una formula: parsing, tabella, analisi, opzioni e salvataggio.
     *
     * Gli errori di sintassi e di valutazione vengono riportati all'utente e
     * non interrompono l'esecuzione: la formula risulta semplicemente fallita.
     *
     * @param name nome base dei file di output
     * @param outputDir directory radice degli output (null = solo console)
     * @return true se la formula è stata elaborata
     */
    private static boolean processFormula(TruthTableEngine engine, String formulaText, String name,
                                          Path outputDir, Configuration config) throws IOException {
        TruthTable table;
        List<Variable> variables;

        try {
            // FASE 1: Parsing
            Formula formula = engine.parse(formulaText);
            variables = formula.getVariableList();
            System.out.println("[I] Formula analizzata: " + formula.getRoot());
            System.out.println("[I] Variabili: " + (variables.isEmpty() ? "Nessuna" : variables));

            // FASE 2: Generazione tabella
            table = engine.generateTable(variables, formula);

        } catch (FormulaSyntaxException | FormulaEvaluationException e) {
            System.out.println("[E] Formula '" + formulaText + "' non valida: " + e.getMessage());
            LOGGER.warning("Elaborazione fallita per " + name + ": " + e.getMessage());
            return false;
        }

        // FASE 3: Analisi e opzioni
        displayTable(table);
        displayClassification(engine, table);

        String csv = engine.exportCsv(table);
        String dnf = config.showDnf ? engine.buildDnf(variables, table) : null;
        String cnf = config.showCnf ? engine.buildCnf(variables, table) : null;
        KarnaughMap kmap = config.showKarnaughMap ? engine.buildKarnaughMap(variables, table) : null;

        if (dnf != null) System.out.println("DNF: " + dnf);
        if (cnf != null) System.out.println("CNF: " + cnf);
        if (kmap != null) displayKarnaughMap(kmap);

        // FASE 4: Salvataggio
        if (outputDir != null) {
            saveToFile(csv, outputDir, "TABLE", name + ".csv");
            if (dnf != null) saveToFile(dnf + "\n", outputDir, "DNF", name + ".dnf");
            if (cnf != null) saveToFile(cnf + "\n", outputDir, "CNF", name + ".cnf");
            if (kmap != null && kmap.isSupported()) saveToFile(kmap.render(), outputDir, "KMAP", name + ".kmap");
        }

        LOGGER.info("Formula " + name + " elaborata: " + table);
        return true;
    }

    private static String readFormulaFromFile(Path file) throws IOException {
        System.out.println("Lettura formula logica...");
        String content = Files.readString(file).trim();
        System.out.println("[I] Formula letta: " + content);
        return content;
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .txt di una directory, isolando gli errori di ciascun file.
     */
    private static boolean processDirectoryBatch(TruthTableEngine engine, Configuration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<Path> txtFiles = findAllTxtFiles(Paths.get(config.inputPath));
        if (txtFiles.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return true;
        }

        BatchResult result = new BatchResult(txtFiles.size());
        for (Path file : txtFiles) {
            try {
                if (processSingleFile(engine, file, config)) {
                    result.incrementSuccess();
                } else {
                    result.incrementError();
                }
            } catch (IOException e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                LOGGER.log(Level.WARNING, "Errore di I/O su " + file, e);
                result.incrementError();
            }
            System.out.println(); // Separatore visivo
        }

        displayBatchSummary(result);
        return result.errorCount == 0;
    }

    private static List<Path> findAllTxtFiles(Path directory) throws IOException {
        System.out.println("Ricerca file .txt nella directory...");

        List<Path> txtFiles;
        try (Stream<Path> entries = Files.list(directory)) {
            txtFiles = entries
                    .filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        System.out.println("Trovati " + txtFiles.size() + " file .txt da elaborare.");
        return txtFiles;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("-->> RIEPILOGO BATCH <<--");
        System.out.println("File totali: " + result.totalFiles);
        System.out.println("Elaborati con successo: " + result.successCount);
        System.out.println("Falliti: " + result.errorCount);
        System.out.println("=========================");
    }

    //endregion

    //region VISUALIZZAZIONE RISULTATI

    private static void displayTable(TruthTable table) {
        StringBuilder header = new StringBuilder();
        for (Variable variable : table.getVariables()) {
            header.append(variable).append(' ');
        }
        header.append("| Result");
        System.out.println(header);

        for (TruthTableRow row : table.getRows()) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < row.width(); i++) {
                line.append(row.getValue(i) ? '1' : '0').append(' ');
            }
            line.append("| ").append(row.getResult() ? '1' : '0');
            System.out.println(line);
        }
        System.out.println("[I] Generate " + table.getRowCount() + " righe.");
    }

    private static void displayClassification(TruthTableEngine engine, TruthTable table) {
        System.out.println("Tautologia: " + (engine.isTautology(table) ? "SI" : "NO"));
        System.out.println("Contraddizione: " + (engine.isContradiction(table) ? "SI" : "NO"));
    }

    private static void displayKarnaughMap(KarnaughMap kmap) {
        if (!kmap.isSupported()) {
            System.out.println("[W] Mappa di Karnaugh disponibile solo per " + KarnaughMap.MIN_VARIABLES +
                    "-" + KarnaughMap.MAX_VARIABLES + " variabili (presenti: " + kmap.getVariables().size() + ")");
            return;
        }
        System.out.println("Mappa di Karnaugh:");
        System.out.print(kmap.render());
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E DEI PERCORSI

    /**
     * Salva il contenuto nella sottodirectory indicata della directory di output.
     */
    private static void saveToFile(String content, Path outputDir, String subdirName, String fileName) throws IOException {
        Path targetDir = outputDir.resolve(subdirName);
        Files.createDirectories(targetDir);

        Path outputFilePath = targetDir.resolve(fileName);
        try (FileWriter writer = new FileWriter(outputFilePath.toFile())) {
            writer.write(content);
        }

        System.out.println("[I] " + subdirName + " salvato: " + outputFilePath);
    }

    /**
     * Directory di output: quella configurata, altrimenti la directory del file di input.
     */
    private static Path getOutputDirectory(Configuration config, Path inputFile) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath);
        }
        Path parentDir = inputFile.toAbsolutePath().getParent();
        return parentDir != null ? parentDir : Paths.get(".");
    }

    private static String getBaseFileName(Path file) {
        String fileName = file.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> GENERATORE TABELLE DI VERITÀ <<::");
        System.out.println("Tabelle di verità, tautologie, forme normali canoniche e mappe di Karnaugh\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar tabelle_verita.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE (mutualmente esclusive):");
        System.out.println("  -e <formula>    Elabora la formula indicata");
        System.out.println("  -f <file>       Elabora la formula contenuta in un file .txt");
        System.out.println("  -d <directory>  Elabora tutti i file .txt in una directory");
        System.out.println();
        System.out.println("ALTRE OPZIONI:");
        System.out.println("  -o <directory>  Directory di output (default: stessa di input, solo console con -e)");
        System.out.println("  -opt=<flags>    Output aggiuntivi (d=DNF, c=CNF, k=mappa di Karnaugh, all=tutti)");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("OPERATORI (precedenza crescente, maiuscole o minuscole):");
        System.out.println("  A <-> B, A EQUIV B      Equivalenza");
        System.out.println("  A -> B, A IMPLIES B     Implicazione (NOT A OR B)");
        System.out.println("  A XOR B, A ^ B          Disgiunzione esclusiva");
        System.out.println("  A OR B, A | B           Disgiunzione");
        System.out.println("  A AND B, A & B          Congiunzione");
        System.out.println("  NOT A, !A, ~A           Negazione");
        System.out.println("  NAND(A, B), NOR(A, B), XOR(A, B)   Funzioni a due argomenti");
        System.out.println("  TRUE, FALSE             Costanti");
        System.out.println("  Variabili: singole lettere A-Z. Usare le parentesi per raggruppare.\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar tabelle_verita.jar -e \"A AND B -> C\" -opt=all");
        System.out.println("  java -jar tabelle_verita.jar -f formula.txt -opt=dk");
        System.out.println("  java -jar tabelle_verita.jar -d ./formule/ -o ./output/\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  TABLE/   Tabella di verità CSV (intestazione variabili + Result, valori 0/1)");
        System.out.println("  DNF/     Forma Normale Disgiuntiva (con -opt=d)");
        System.out.println("  CNF/     Forma Normale Congiuntiva (con -opt=c)");
        System.out.println("  KMAP/    Mappa di Karnaugh, solo 2-4 variabili (con -opt=k)\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Modalità di acquisizione della formula.
     */
    enum InputMode {
        EXPRESSION,
        FILE,
        DIRECTORY
    }

    /**
     * Configurazione validata dell'applicazione.
     *
     * Contiene tutti i parametri di esecuzione in forma immutabile.
     */
    static class Configuration {
        final InputMode mode;
        final String expression;
        final String inputPath;
        final String outputPath;
        final boolean showDnf;
        final boolean showCnf;
        final boolean showKarnaughMap;

        Configuration(InputMode mode, String expression, String inputPath, String outputPath,
                      boolean showDnf, boolean showCnf, boolean showKarnaughMap) {
            this.mode = mode;
            this.expression = expression;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.showDnf = showDnf;
            this.showCnf = showCnf;
            this.showKarnaughMap = showKarnaughMap;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    static class ArgumentParser {

        /**
         * Processa sequenzialmente tutti i parametri e costruisce la configurazione.
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        Configuration parse(String[] args) {
            InputMode mode = null;
            String expression = null;
            String inputPath = null;
            String outputPath = null;
            boolean showDnf = false;
            boolean showCnf = false;
            boolean showKarnaughMap = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(mode, InputMode.EXPRESSION);
                        expression = getNextArgument(args, ++i, "formula");
                        mode = InputMode.EXPRESSION;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(mode, InputMode.FILE);
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        mode = InputMode.FILE;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(mode, InputMode.DIRECTORY);
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        mode = InputMode.DIRECTORY;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    default -> {
                        if (!args[i].startsWith(OPT_PARAM)) {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                        String flags = args[i].substring(OPT_PARAM.length());
                        if (flags.isBlank()) {
                            throw new IllegalArgumentException("Valore -opt vuoto");
                        }
                        boolean all = flags.equals(OPT_ALL);
                        if (!all && !flags.matches("[dck]+")) {
                            throw new IllegalArgumentException("Flag -opt non valide: " + flags +
                                    " (ammesse: d, c, k, all)");
                        }
                        showDnf = all || flags.contains(OPT_DNF);
                        showCnf = all || flags.contains(OPT_CNF);
                        showKarnaughMap = all || flags.contains(OPT_KMAP);
                    }
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una formula con -e, un file con -f o una directory con -d");
            }

            return new Configuration(mode, expression, inputPath, outputPath, showDnf, showCnf, showKarnaughMap);
        }

        private void validateExclusiveMode(InputMode current, InputMode requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested + " non può essere combinata con " +
                        current + " (-e, -f e -d sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
