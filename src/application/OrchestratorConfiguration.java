package application;

/**
 * Configuration constants for the search orchestrator.
 *
 * <p>Centralizes the defaults of {@link SearchConfiguration}, the integer
 * counts at which the search switches algorithm, and the ForkJoin task
 * granularity.
 *
 * <h3>Tuning guidelines</h3>
 * <ul>
 *   <li><b>DIRECT_SEARCH_MAX_COUNT</b>: direct enumeration costs
 *       {@code |pool|^c × |ops|^(c-1)} evaluations. Past four integers the
 *       meet-in-the-middle search is far cheaper.</li>
 *   <li><b>DEFAULT_MAX_RESULTS_PER_VALUE</b>: larger caps find more variants
 *       of each value at a proportional memory cost.</li>
 *   <li><b>FINE_GRAIN_THRESHOLD</b>: controls when direct search switches from
 *       binary splitting of the leading-integer range to one task per integer.</li>
 * </ul>
 */
public final class OrchestratorConfiguration {

    // =========================================================================
    // Parallelism Configuration
    // =========================================================================

    /**
     * Default ForkJoin parallelism level: the number of available processors.
     */
    public static final int DEFAULT_PARALLELISM = Runtime.getRuntime().availableProcessors();

    /**
     * Range size of leading integers at which direct search creates one task
     * per leading integer instead of bisecting further.
     */
    public static final int FINE_GRAIN_THRESHOLD = 16;

    // =========================================================================
    // Algorithm Selection
    // =========================================================================

    /**
     * Largest integer count searched by direct enumeration. Larger counts use
     * meet-in-the-middle.
     */
    public static final int DIRECT_SEARCH_MAX_COUNT = 4;

    /**
     * Largest integer count whose subexpression table is built by direct
     * enumeration. Larger counts are split into two recursively generated halves.
     */
    public static final int DIRECT_GENERATION_MAX_COUNT = 3;

    /**
     * Largest exponent considered when matching {@code base ^ exponent = target}.
     * Any base with magnitude of at least 2 overflows a {@code long} beyond it.
     */
    public static final int MAX_EXPONENT = 63;

    // =========================================================================
    // Search Defaults
    // =========================================================================

    /** Default smallest pool integer. */
    public static final int DEFAULT_MIN_INTEGER = 1;

    /** Default maximum number of integers in an expression. */
    public static final int DEFAULT_MAX_INTEGER_COUNT = 6;

    /** Default number of solutions returned. */
    public static final int DEFAULT_RESULT_COUNT = 5;

    /** Default per-value cap of subexpression tables outside exhaustive mode. */
    public static final int DEFAULT_MAX_RESULTS_PER_VALUE = 3;

    /**
     * Largest accepted pool range. Even two-integer enumeration is quadratic in
     * the pool size, so anything wider is rejected at configuration time.
     */
    public static final int MAX_POOL_RANGE = 100_000;

    // =========================================================================
    // Reporting Constants
    // =========================================================================

    /**
     * Bytes per megabyte for memory reporting.
     */
    public static final double BYTES_PER_MB = 1024.0 * 1024.0;

    /**
     * Milliseconds per second for time reporting.
     */
    public static final double MS_PER_SECOND = 1000.0;

    /**
     * Private constructor to prevent instantiation.
     */
    private OrchestratorConfiguration() {
        throw new AssertionError("Utility class, do not instantiate");
    }
}
