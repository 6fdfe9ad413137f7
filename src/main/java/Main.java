import datagenerators.TextGenerator;
import it.unimi.dsi.fastutil.ints.IntList;
import tree.ukkonen.SuffixTree;
import tree.ukkonen.SuffixTreeConfiguration;
import tree.ukkonen.SuffixTreePrinter;
import utilities.FootprintReport;
import utilities.SuffixTreeLogger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Small driver around the suffix tree. Builds a tree either for a literal text ({@code --text})
 * or for a seeded Zipf string ({@code --random <length>}), then prints the tree and the
 * occurrences of every {@code --find} pattern.
 */
public final class Main {

    private static final int DEFAULT_ALPHABET = 4;
    private static final double DEFAULT_EXPONENT = 1.0;
    private static final long DEFAULT_SEED = 42L;
    // trees larger than this are not printed
    private static final int MAX_PRINTED_LENGTH = 64;

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);
        run(options, System.out);
    }

    static void run(CliOptions options, PrintStream out) {
        String text = options.text != null
                ? options.text
                : TextGenerator.generateZipf(options.randomLength, 'a', options.alphabet, DEFAULT_EXPONENT, options.seed);

        SuffixTreeConfiguration config = SuffixTreeConfiguration.builder()
                .terminator(options.terminator)
                .traceConstruction(options.trace)
                .build();

        long t0 = System.nanoTime();
        SuffixTree tree = SuffixTree.build(text, config)
                .makeExplicit()
                .assignSuffixIndices();
        double buildMs = (System.nanoTime() - t0) / 1_000_000.0;

        SuffixTreeLogger.info(String.format(Locale.ROOT,
                "Built suffix tree: length=%d nodes=%d leaves=%d in %.3f ms",
                tree.length(), tree.nodeCount(), tree.leafCount(), buildMs));

        if (tree.length() <= MAX_PRINTED_LENGTH) {
            out.println("Suffix tree for \"" + text + "\" (terminator '" + (char) options.terminator + "'):");
            out.print(SuffixTreePrinter.render(tree));
        }

        for (String pattern : options.patterns) {
            IntList hits = tree.findAll(pattern);
            out.printf(Locale.ROOT, "%s -> %d occurrence(s) %s%n", pattern, hits.size(), hits);
        }

        if (options.footprint) {
            FootprintReport report = tree.footprint(false);
            out.print(report.report());
        }
    }

    static final class CliOptions {
        final String text;
        final int randomLength;
        final int alphabet;
        final long seed;
        final int terminator;
        final boolean trace;
        final boolean footprint;
        final List<String> patterns;

        private CliOptions(String text,
                           int randomLength,
                           int alphabet,
                           long seed,
                           int terminator,
                           boolean trace,
                           boolean footprint,
                           List<String> patterns) {
            this.text = text;
            this.randomLength = randomLength;
            this.alphabet = alphabet;
            this.seed = seed;
            this.terminator = terminator;
            this.trace = trace;
            this.footprint = footprint;
            this.patterns = patterns;
        }

        static CliOptions parse(String[] args) {
            String text = null;
            int randomLength = -1;
            int alphabet = DEFAULT_ALPHABET;
            long seed = DEFAULT_SEED;
            int terminator = SuffixTreeConfiguration.DEFAULT_TERMINATOR;
            boolean trace = false;
            boolean footprint = false;
            List<String> patterns = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key = arg.substring(2);
                if (key.equals("trace")) {
                    trace = true;
                    continue;
                }
                if (key.equals("footprint")) {
                    footprint = true;
                    continue;
                }
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for option --" + key);
                }
                String value = args[++i];
                switch (key) {
                    case "text" -> text = value;
                    case "random" -> randomLength = Integer.parseInt(value);
                    case "alphabet" -> alphabet = Integer.parseInt(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "terminator" -> {
                        if (value.length() != 1) {
                            throw new IllegalArgumentException("--terminator takes a single character");
                        }
                        terminator = value.charAt(0);
                    }
                    case "find" -> patterns.add(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            if ((text == null) == (randomLength < 0)) {
                throw new IllegalArgumentException("Exactly one of --text or --random is required");
            }
            return new CliOptions(text, randomLength, alphabet, seed, terminator, trace, footprint, patterns);
        }
    }
}
