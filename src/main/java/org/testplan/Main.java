package org.testplan;

import org.testplan.loader.QuestionnaireFormatException;
import org.testplan.loader.QuestionnaireLoader;
import org.testplan.model.Questionnaire;
import org.testplan.output.FormStructureIndexWriter;
import org.testplan.output.TestPlan;
import org.testplan.output.TestPlanReportWriter;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * GENERATORE DI PIANI DI TEST PER QUESTIONARI
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: documento JSON del questionario (file singolo o directory)
 * 2. CARICAMENTO: domande numerate, condizioni di visibilità come alberi
 * 3. MODELLO DEI VINCOLI: variabili intere one-hot, visibilità, vincoli in CNF
 * 4. ENUMERAZIONE: combinazioni valide in tre fasi, validate dal solutore CDCL
 * 5. COPERTURA: selezione greedy dei casi di test
 * 6. OUTPUT: report testuale e, su richiesta, indice della struttura in CSV
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f) oppure tutti i .json di una directory (-d)
 * - Directory di output personalizzabile (-o)
 * - Tetto di campionamento (-cap), seme (-seed), budget di conflitti (-conflicts)
 * - Indice della struttura (-index)
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String CAP_PARAM = "-cap";
    private static final String SEED_PARAM = "-seed";
    private static final String CONFLICTS_PARAM = "-conflicts";
    private static final String INDEX_PARAM = "-index";

    private static final String FORM_EXTENSION = ".json";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO GENERATORE PIANO DI TEST <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            CliConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            if (config.isFileMode) {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(Paths.get(config.inputPath), config);
            } else {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }

        } catch (Exception e) {
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        } finally {
            System.out.println("---> FINE ESECUZIONE GENERATORE <---");
        }
    }

    private static CliConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(CliConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE GENERATORE <<--");
        System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
        System.out.println("Input: " + config.inputPath);
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("Tetto campionamento: " + config.generator.getSamplingCap());
        System.out.println("Seme: " + (config.generator.getSeed() != null ? config.generator.getSeed() : "casuale"));
        System.out.println("Budget conflitti: " + config.generator.getConflictBudget());
        System.out.println("Indice struttura: " + (config.writeIndex ? "Sì" : "No"));
        System.out.println("====================================\n");
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Carica il questionario, genera il piano e salva i file di output.
     *
     * @throws QuestionnaireFormatException se il documento non è valido
     * @throws IOException se la scrittura dei risultati fallisce
     */
    private static void processSingleFile(Path file, CliConfiguration config) throws IOException {
        System.out.println("[I] Caricamento questionario: " + file);
        Questionnaire questionnaire = new QuestionnaireLoader().load(file);
        System.out.println("[I] Domande caricate: " + questionnaire.size());

        TestPlan plan = new TestPlanGenerator(config.generator).generate(questionnaire);
        if (plan.hasTestCases()) {
            System.out.println("[I] Casi di test generati: " + plan.getTestCases().size()
                    + " (copertura " + plan.getCovered().size() + "/" + plan.getCoverageTarget().size() + ")");
        } else {
            System.out.println("[W] Nessun caso di test: " + plan.getStatusMessage());
        }
        if (!plan.getUncovered().isEmpty()) {
            System.out.println("[W] Domande non coperte: " + formatNumbers(plan.getUncovered()));
        }
        if (!plan.getUnreachable().isEmpty()) {
            System.out.println("[W] Domande irraggiungibili: " + formatNumbers(plan.getUnreachable()));
        }

        Path outputDir = resolveOutputDirectory(file, config);
        Path report = new TestPlanReportWriter().write(plan, outputDir);
        System.out.println("[I] Piano di test salvato: " + report);

        if (config.writeIndex) {
            for (Path written : new FormStructureIndexWriter().write(questionnaire, outputDir)) {
                System.out.println("[I] Indice struttura salvato: " + written);
            }
        }
    }

    private static Path resolveOutputDirectory(Path file, CliConfiguration config) throws IOException {
        Path outputDir = config.outputPath != null
                ? Paths.get(config.outputPath)
                : file.toAbsolutePath().getParent();
        Files.createDirectories(outputDir);
        return outputDir;
    }

    private static String formatNumbers(Iterable<Integer> numbers) {
        StringBuilder builder = new StringBuilder();
        for (Integer number : numbers) {
            if (builder.length() > 0) builder.append(", ");
            builder.append('Q').append(number);
        }
        return builder.toString();
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .json della directory; un questionario malformato viene segnalato
     * e non interrompe gli altri.
     */
    private static void processDirectoryBatch(CliConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<Path> forms;
        try {
            forms = findAllForms(Paths.get(config.inputPath));
        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
            return;
        }
        if (forms.isEmpty()) {
            System.out.println("[W] Nessun file .json trovato nella directory specificata.");
            return;
        }

        BatchResult result = new BatchResult(forms.size());
        for (Path form : forms) {
            try {
                System.out.println("Elaborazione: " + form.getFileName());
                processSingleFile(form, config);
                result.incrementSuccess();
            } catch (QuestionnaireFormatException e) {
                System.out.println("[E] Questionario non valido " + form.getFileName() + ": " + e.getMessage());
                result.incrementError();
            } catch (Exception e) {
                System.out.println("[E] Errore nel file " + form.getFileName() + ": " + e);
                result.incrementError();
            }
            System.out.println(); // Separatore visivo
        }

        displayBatchSummary(result);
    }

    private static List<Path> findAllForms(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> forms = entries
                    .filter(path -> path.toString().toLowerCase().endsWith(FORM_EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
            System.out.println("Trovati " + forms.size() + " questionari da elaborare.");
            return forms;
        }
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("Questionari trovati: " + result.totalFiles);
        System.out.println("Elaborati con successo: " + result.successCount);
        System.out.println("Con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%%n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n===== GENERATORE PIANO DI TEST - GUIDA =====\n");
        System.out.println("UTILIZZO:");
        System.out.println("  -f <file.json>      Elabora un singolo questionario");
        System.out.println("  -d <directory>      Elabora tutti i questionari .json di una directory");
        System.out.println("  -o <directory>      Directory di output (default: stessa di input)");
        System.out.println("  -cap <n>            Tetto di campionamento delle combinazioni (default: "
                + GeneratorConfiguration.DEFAULT_SAMPLING_CAP + ")");
        System.out.println("  -seed <n>           Seme del campionamento per risultati riproducibili");
        System.out.println("  -conflicts <n>      Budget di conflitti del solutore per verifica");
        System.out.println("  -index              Scrive anche l'indice della struttura (CSV)");
        System.out.println("  -h                  Mostra questa guida\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar generatore-piano-test.jar -f modulo.json");
        System.out.println("  java -jar generatore-piano-test.jar -d ./moduli/ -o ./piani/ -index -seed 42\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  <nome>_test_plan.txt              Piano di test per i tester");
        System.out.println("  <nome>_gating_relationships.csv   Relazioni padre/figlio (con -index)");
        System.out.println("  <nome>_question_index.csv         Indice delle domande (con -index)\n");
        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata della linea di comando.
     */
    private static class CliConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final boolean writeIndex;
        final GeneratorConfiguration generator;

        CliConfiguration(String inputPath, String outputPath, boolean isFileMode, boolean writeIndex,
                         GeneratorConfiguration generator) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.writeIndex = writeIndex;
            this.generator = generator;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        public CliConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean writeIndex = false;
            GeneratorConfiguration.Builder generator = GeneratorConfiguration.builder();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case CAP_PARAM -> generator.samplingCap(parseInteger(args, ++i, "tetto di campionamento"));
                    case SEED_PARAM -> generator.seed(parseLong(args, ++i));
                    case CONFLICTS_PARAM -> generator.conflictBudget(parseInteger(args, ++i, "budget di conflitti"));
                    case INDEX_PARAM -> writeIndex = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new CliConfiguration(inputPath, outputPath, isFileMode, writeIndex, generator.build());
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con l'altra (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseInteger(String[] args, int currentIndex, String argumentType) {
            String text = getNextArgument(args, currentIndex, argumentType);
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + argumentType + ": " + text);
            }
        }

        private Long parseLong(String[] args, int currentIndex) {
            String text = getNextArgument(args, currentIndex, "seme");
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + text);
            }
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
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
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
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
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
