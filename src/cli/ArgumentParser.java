package cli;

import application.OrchestratorConfiguration;
import application.ProgressListener;
import application.SearchConfiguration;
import domain.model.Operator;
import infrastructure.util.ValidationUtils;

import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parses and validates all command-line arguments of the number combination search.
 *
 * <h3>Syntax</h3>
 * <pre>
 *   &lt;target&gt;
 *       [--help | -h]
 *       [--max-int N] [--min-int N] [--exclude a,b,c]
 *       [--ops "+-*&#47;^"]
 *       [--max-numbers N] [--top N] [--cap N]
 *       [--exhaustive] [--no-parallel] [--quiet] [--debug]
 *       [--output &lt;file&gt; | -o &lt;file&gt;]
 * </pre>
 *
 * <h3>Required positional argument</h3>
 * <ol>
 *   <li>{@code target}: the integer every expression must equal (may be negative)</li>
 * </ol>
 *
 * <h3>Optional flags</h3>
 * <ul>
 *   <li>{@code --max-int N}     : largest pool integer (default: 25)</li>
 *   <li>{@code --min-int N}     : smallest pool integer (default: 1)</li>
 *   <li>{@code --exclude LIST}  : comma-separated integers removed from the pool (default: 10)</li>
 *   <li>{@code --ops SYMBOLS}   : enabled operators out of {@code + - * / ^} (default: {@code +-*&#47;})</li>
 *   <li>{@code --max-numbers N} : largest number of integers per expression (default: 6)</li>
 *   <li>{@code --top N}         : number of solutions to print (default: 5)</li>
 *   <li>{@code --cap N}         : expressions kept per value in subexpression tables (default: 3)</li>
 *   <li>{@code --exhaustive}    : no cap, no early termination</li>
 *   <li>{@code --no-parallel}   : run on the calling thread only</li>
 *   <li>{@code --quiet}         : suppress progress lines</li>
 *   <li>{@code --debug}         : per-size timing on stderr</li>
 *   <li>{@code --output, -o FILE}: write results to FILE instead of stdout</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   java cli.CommandLineInterface 2275 --ops "*-/" --max-numbers 4
 * </pre>
 *
 * @see SearchConfiguration
 */
public final class ArgumentParser {

    // =========================================================================
    // Defaults
    // =========================================================================

    static final int DEFAULT_MAX_INTEGER = 25;
    static final String DEFAULT_OPERATORS = "+-*/";
    static final int DEFAULT_EXCLUDED_INTEGER = 10;

    // =========================================================================
    // Error Messages
    // =========================================================================

    private static final String USAGE_MESSAGE =
        "Usage: <target> [OPTIONS]\n" +
        "Options:\n" +
        "  --help, -h              Show this help message and exit\n" +
        "  --max-int <n>           Largest pool integer (default: 25)\n" +
        "  --min-int <n>           Smallest pool integer (default: 1)\n" +
        "  --exclude <a,b,c>       Integers removed from the pool (default: 10)\n" +
        "  --ops <symbols>         Enabled operators from + - * / ^ (default: +-*/)\n" +
        "  --max-numbers <n>       Largest number of integers per expression (default: 6)\n" +
        "  --top <n>               Number of solutions to show (default: 5)\n" +
        "  --cap <n>               Expressions kept per value while searching (default: 3)\n" +
        "  --exhaustive            Disable the per-value cap and early termination\n" +
        "  --no-parallel           Disable all parallelization\n" +
        "  --quiet                 Do not print progress\n" +
        "  --debug                 Enable debug output with per-size timing\n" +
        "  --output, -o <file>     Write results to file instead of stdout";

    private static final String MISSING_ARGS_ERROR =
        "Missing required target. " + USAGE_MESSAGE;

    private static final String INVALID_TARGET_FORMAT =
        "Invalid target: %s. Must be an integer";

    private static final String INVALID_INTEGER_FORMAT =
        "Invalid value for %s: %s. Must be an integer";

    private static final String MISSING_VALUE_FORMAT =
        "%s requires a value";

    private static final String UNKNOWN_OPERATOR_FORMAT =
        "Unknown operator: '%c'. Valid operators: + - * / ^";

    private static final String UNKNOWN_ARG_FORMAT =
        "Unknown argument: %s. Use --help for usage information.";

    // =========================================================================
    // Parsed Fields
    // =========================================================================

    private long target;
    private int maxInteger = DEFAULT_MAX_INTEGER;
    private int minInteger = OrchestratorConfiguration.DEFAULT_MIN_INTEGER;
    private Set<Integer> excludedIntegers = new TreeSet<>(Set.of(DEFAULT_EXCLUDED_INTEGER));
    private Set<Operator> operators = parseOperators(DEFAULT_OPERATORS);
    private int maxIntegerCount = OrchestratorConfiguration.DEFAULT_MAX_INTEGER_COUNT;
    private int resultCount = OrchestratorConfiguration.DEFAULT_RESULT_COUNT;
    private int maxResultsPerValue = OrchestratorConfiguration.DEFAULT_MAX_RESULTS_PER_VALUE;
    private boolean exhaustive = false;
    private boolean noParallel = false;
    private boolean quiet = false;
    private boolean helpRequested = false;
    private boolean debugMode = false;
    private String outputFile = null;

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Parses command-line arguments.
     *
     * @param args command-line arguments from {@code main()}
     * @throws IllegalArgumentException if arguments are invalid or missing
     */
    public void parse(String[] args) {
        // Check for help flag first (allow --help even without the target)
        if (args.length > 0 && (args[0].equals("--help") || args[0].equals("-h"))) {
            helpRequested = true;
            return;
        }

        if (args.length < 1) {
            throw new IllegalArgumentException(MISSING_ARGS_ERROR);
        }

        target = parseTarget(args[0]);
        parseOptionalFlags(args);
    }

    /**
     * Builds a {@link SearchConfiguration} from parsed arguments.
     *
     * <p>Must be called after {@link #parse(String[])}.
     *
     * @param progressListener progress sink, or {@code null}
     * @return immutable search configuration
     * @throws IllegalArgumentException if the values are out of range
     * @throws IllegalStateException    if no operator is enabled and the target is not in the pool
     */
    public SearchConfiguration buildConfiguration(ProgressListener progressListener) {
        return new SearchConfiguration.Builder()
            .setTarget(target)
            .setMinInteger(minInteger)
            .setMaxInteger(maxInteger)
            .setExcludedIntegers(excludedIntegers)
            .setOperators(operators)
            .setMaxIntegerCount(maxIntegerCount)
            .setResultCount(resultCount)
            .setMaxResultsPerValue(maxResultsPerValue)
            .setExhaustive(exhaustive)
            .setUseParallelSearch(!noParallel)
            .setProgressListener(quiet ? ProgressListener.NONE : progressListener)
            .build();
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public long getTarget() { return target; }
    public int getMaxInteger() { return maxInteger; }
    public int getMinInteger() { return minInteger; }
    public Set<Integer> getExcludedIntegers() { return excludedIntegers; }
    public Set<Operator> getOperators() { return operators; }
    public int getMaxIntegerCount() { return maxIntegerCount; }
    public int getResultCount() { return resultCount; }
    public int getMaxResultsPerValue() { return maxResultsPerValue; }
    public boolean isExhaustive() { return exhaustive; }
    public boolean isNoParallel() { return noParallel; }
    public boolean isQuiet() { return quiet; }
    public boolean isHelpRequested() { return helpRequested; }
    public boolean isDebugMode() { return debugMode; }
    public String getOutputFile() { return outputFile; }

    /**
     * Prints help message to stderr.
     */
    public void printHelp() {
        System.err.println("Number Combinations: find arithmetic expressions equal to a target");
        System.err.println();
        System.err.println(USAGE_MESSAGE);
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java cli.CommandLineInterface 2275 --ops \"*-/\" --max-numbers 4");
    }

    // =========================================================================
    // Private Parsing Methods
    // =========================================================================

    private long parseTarget(String arg) {
        try {
            return Long.parseLong(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_TARGET_FORMAT, arg));
        }
    }

    /**
     * Parses optional flags starting from index 1.
     *
     * <p>Simple flags set a boolean and let the loop advance. Flags with a value
     * delegate to a helper that consumes the value and returns the index of the
     * last consumed argument.
     *
     * @param args command-line arguments
     * @throws IllegalArgumentException if flags are invalid
     */
    private void parseOptionalFlags(String[] args) {
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "--help":
                case "-h":
                    helpRequested = true;
                    break;

                case "--debug":
                    debugMode = true;
                    break;

                case "--exhaustive":
                    exhaustive = true;
                    break;

                case "--no-parallel":
                    noParallel = true;
                    break;

                case "--quiet":
                    quiet = true;
                    break;

                case "--output":
                case "-o":
                    outputFile = requireValue(args, i, arg);
                    i++;
                    break;

                case "--max-int":
                    maxInteger = parseIntegerValue(requireValue(args, i, arg), arg);
                    i++;
                    break;

                case "--min-int":
                    minInteger = parseIntegerValue(requireValue(args, i, arg), arg);
                    ValidationUtils.validateNonNegative(minInteger, "min-int");
                    i++;
                    break;

                case "--exclude":
                    i = parseExcludeFlag(args, i);
                    break;

                case "--ops":
                    operators = parseOperators(requireValue(args, i, arg));
                    i++;
                    break;

                case "--max-numbers":
                    maxIntegerCount = parseIntegerValue(requireValue(args, i, arg), arg);
                    i++;
                    break;

                case "--top":
                    resultCount = parseIntegerValue(requireValue(args, i, arg), arg);
                    ValidationUtils.validatePositive(resultCount, "top");
                    i++;
                    break;

                case "--cap":
                    maxResultsPerValue = parseIntegerValue(requireValue(args, i, arg), arg);
                    ValidationUtils.validatePositive(maxResultsPerValue, "cap");
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException(String.format(UNKNOWN_ARG_FORMAT, arg));
            }
        }
    }

    /**
     * Parses --exclude flag. An empty list clears the default exclusion.
     *
     * @param args command-line arguments
     * @param i    current index (at --exclude)
     * @return index of the consumed value
     */
    private int parseExcludeFlag(String[] args, int i) {
        String list = requireValue(args, i, args[i]);
        Set<Integer> parsed = new TreeSet<>();
        for (String part : list.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parsed.add(parseIntegerValue(trimmed, "--exclude"));
            }
        }
        excludedIntegers = parsed;
        return i + 1;
    }

    private static String requireValue(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(String.format(MISSING_VALUE_FORMAT, flag));
        }
        return args[i + 1];
    }

    private static int parseIntegerValue(String value, String flag) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_INTEGER_FORMAT, flag, value));
        }
    }

    /**
     * Parses an operator string such as {@code "+-*&#47;"}. Whitespace and commas
     * are ignored; {@code x} is accepted for multiplication.
     *
     * @param symbols operator symbols
     * @return the enabled operators, possibly empty
     * @throws IllegalArgumentException on an unknown symbol
     */
    static Set<Operator> parseOperators(String symbols) {
        Set<Operator> parsed = EnumSet.noneOf(Operator.class);
        for (char c : symbols.toCharArray()) {
            if (Character.isWhitespace(c) || c == ',') continue;
            try {
                parsed.add(Operator.fromSymbol(c));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(String.format(UNKNOWN_OPERATOR_FORMAT, c));
            }
        }
        return parsed;
    }
}
