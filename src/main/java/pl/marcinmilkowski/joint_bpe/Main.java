package pl.marcinmilkowski.joint_bpe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.joint_bpe.bpe.Codebook;
import pl.marcinmilkowski.joint_bpe.bpe.MergeApplier;
import pl.marcinmilkowski.joint_bpe.bpe.MergeDirection;
import pl.marcinmilkowski.joint_bpe.config.PipelineConfig;
import pl.marcinmilkowski.joint_bpe.config.PipelineConfigLoader;
import pl.marcinmilkowski.joint_bpe.pipeline.JointBpePipeline;
import pl.marcinmilkowski.joint_bpe.pipeline.PipelineReport;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Commands:
 * <ul>
 *   <li>{@code learn-joint} (default when the first argument is an option):
 *       learn one codebook over several corpora and write a vocabulary per corpus</li>
 *   <li>{@code apply}: segment text with an existing codebook</li>
 *   <li>{@code help}</li>
 * </ul>
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run a command and return the process exit status.
     */
    static int run(String[] args) {
        if (args.length == 0) {
            showUsage();
            return 1;
        }

        String command = args[0].startsWith("-") ? "learn-joint" : args[0].toLowerCase();
        int first = args[0].startsWith("-") ? 0 : 1;

        try {
            switch (command) {
                case "learn-joint":
                    handleLearnJointCommand(args, first);
                    return 0;
                case "apply":
                    handleApplyCommand(args, first);
                    return 0;
                case "help":
                    showUsage();
                    return 0;
                default:
                    System.err.println("Error: Unknown command: " + command);
                    System.err.println("Use 'help' command for usage information.");
                    return 1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Error: interrupted");
            return 1;
        } catch (Exception e) {
            logger.debug("Command {} failed", command, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void handleLearnJointCommand(String[] args, int first) throws IOException, InterruptedException {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        List<Path> inputs = null;
        List<Path> vocabularies = null;

        // --config is read first so that every other option overrides it
        for (int i = first; i < args.length; i++) {
            if (args[i].equals("--config")) {
                builder = new PipelineConfigLoader(Paths.get(requireValue(args, i))).load();
            }
        }

        for (int i = first; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    inputs = new ArrayList<>();
                    i = collectPaths(args, i, inputs);
                    break;
                case "--write-vocabulary":
                    vocabularies = new ArrayList<>();
                    i = collectPaths(args, i, vocabularies);
                    break;
                case "--output":
                case "-o":
                    builder.withCodes(Paths.get(requireValue(args, i++)));
                    break;
                case "--symbols":
                case "-s":
                    builder.withSymbols(parseInt(args[i], requireValue(args, i++)));
                    break;
                case "--min-frequency":
                    builder.withMinFrequency(parseInt(args[i], requireValue(args, i++)));
                    break;
                case "--special-vocab":
                    builder.withSpecialVocab(Paths.get(requireValue(args, i++)));
                    break;
                case "--separator":
                    builder.withSeparator(requireValue(args, i++));
                    break;
                case "--threads":
                    builder.withThreads(parseInt(args[i], requireValue(args, i++)));
                    break;
                case "--report":
                    builder.withReport(Paths.get(requireValue(args, i++)));
                    break;
                case "--scratch-dir":
                    builder.withScratchDirectory(Paths.get(requireValue(args, i++)));
                    break;
                case "--config":
                    i++;
                    break;
                case "--dict-input":
                    builder.withDictInput(true);
                    break;
                case "--postpend":
                    builder.withPostpend(true);
                    break;
                case "--total-symbols":
                case "-t":
                    builder.withTotalSymbols(true);
                    break;
                case "--character-vocab":
                case "-c":
                    builder.withCharacterVocab(true);
                    break;
                case "--verbose":
                case "-v":
                    builder.withVerbose(true);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (inputs != null) {
            builder.withInputs(inputs);
        }
        if (vocabularies != null) {
            builder.withVocabularies(vocabularies);
        }

        PipelineConfig config = builder.build();
        PipelineReport report = new JointBpePipeline(config).run();

        System.err.println("Learned " + report.mergeCount() + " merges into " + config.codes());
        for (PipelineReport.CorpusReport corpus : report.corpora()) {
            System.err.println("  " + corpus.input() + " -> " + corpus.vocabulary()
                + " (" + corpus.uniqueItems() + " unique items)");
        }
    }

    private static void handleApplyCommand(String[] args, int first) throws IOException {
        Path codes = null;
        Path input = null;
        Path output = null;
        String separator = PipelineConfig.DEFAULT_SEPARATOR;
        boolean postpend = false;

        for (int i = first; i < args.length; i++) {
            switch (args[i]) {
                case "--codes":
                case "-c":
                    codes = Paths.get(requireValue(args, i++));
                    break;
                case "--input":
                case "-i":
                    input = Paths.get(requireValue(args, i++));
                    break;
                case "--output":
                case "-o":
                    output = Paths.get(requireValue(args, i++));
                    break;
                case "--separator":
                    separator = requireValue(args, i++);
                    break;
                case "--postpend":
                    postpend = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (codes == null) {
            throw new IllegalArgumentException("--codes is required");
        }

        MergeApplier applier = new MergeApplier(Codebook.read(codes), separator, MergeDirection.of(postpend));

        long lines;
        try (BufferedReader reader = input != null
                ? Files.newBufferedReader(input, StandardCharsets.UTF_8)
                : new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            if (output != null) {
                try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                    lines = segmentLines(applier, reader, writer);
                }
            } else {
                // stdout stays open
                Writer writer = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
                lines = segmentLines(applier, reader, writer);
                writer.flush();
            }
        }
        logger.info("Segmented {} lines", lines);
    }

    private static long segmentLines(MergeApplier applier, BufferedReader reader, Writer writer) throws IOException {
        long lines = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            writer.write(applier.segmentLine(line));
            writer.write('\n');
            lines++;
        }
        return lines;
    }

    private static int collectPaths(String[] args, int optionIndex, List<Path> target) {
        int i = optionIndex + 1;
        while (i < args.length && !args[i].startsWith("-")) {
            target.add(Paths.get(args[i]));
            i++;
        }
        if (target.isEmpty()) {
            throw new IllegalArgumentException(args[optionIndex] + " requires at least one path");
        }
        return i - 1;
    }

    private static String requireValue(String[] args, int optionIndex) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(args[optionIndex] + " requires a value");
        }
        return args[optionIndex + 1];
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'");
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar joint-bpe-vocab.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  learn-joint   Learn a joint BPE codebook and per-corpus vocabularies (default)");
        System.out.println("  apply         Segment text with an existing codebook");
        System.out.println("  help          Show this help message");
        System.out.println();
        System.out.println("learn-joint options:");
        System.out.println("  -i, --input <file>...            Input corpora (required)");
        System.out.println("  --write-vocabulary <file>...     One vocabulary output per input (required)");
        System.out.println("  -o, --output <file>              Codebook output (required)");
        System.out.println("  -s, --symbols <n>                Merge operations to learn (default: 10000)");
        System.out.println("  --min-frequency <n>              Stop when no pair occurs this often (default: 2)");
        System.out.println("  --special-vocab <file>           Words that must stay whole, one per line");
        System.out.println("  --separator <str>                Subword separator (default: @@)");
        System.out.println("  --postpend                       Put the separator before pieces instead of after");
        System.out.println("  --dict-input                     Inputs are 'word count' dictionaries");
        System.out.println("  -t, --total-symbols              Count unique characters against the symbol budget");
        System.out.println("  -c, --character-vocab            Add every character to the vocabularies");
        System.out.println("  --threads <n>                    Corpora processed in parallel (default: 1)");
        System.out.println("  --report <file>                  Write a JSON run report");
        System.out.println("  --scratch-dir <dir>              Directory for temporary files");
        System.out.println("  --config <file>                  Read settings from a JSON file");
        System.out.println("  -v, --verbose                    Log every learned merge");
        System.out.println();
        System.out.println("apply options:");
        System.out.println("  -c, --codes <file>               Codebook (required)");
        System.out.println("  -i, --input <file>               Text to segment (default: stdin)");
        System.out.println("  -o, --output <file>              Segmented text (default: stdout)");
        System.out.println("  --separator <str>                Subword separator (default: @@)");
        System.out.println("  --postpend                       Separator before pieces");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar joint-bpe-vocab.jar -i train.en train.de --write-vocabulary vocab.en vocab.de -o codes.bpe -s 32000");
        System.out.println("  java -jar joint-bpe-vocab.jar apply -c codes.bpe -i test.en -o test.bpe.en");
    }
}
