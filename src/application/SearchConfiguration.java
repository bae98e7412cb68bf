package application;

import domain.model.Operator;
import infrastructure.util.ValidationUtils;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import static application.OrchestratorConfiguration.*;

/**
 * Immutable value object encapsulating all parameters of one search.
 *
 * <p>Constructed exclusively via the nested {@link Builder}, which validates each
 * parameter before allowing {@link Builder#build()} to succeed.
 *
 * <h3>Key parameters</h3>
 * <ul>
 *   <li><b>target</b>: the value every returned expression must equal.</li>
 *   <li><b>minInteger / maxInteger / excludedIntegers</b>: the pool of integers
 *       expressions are built from (the inclusive range minus the exclusions).</li>
 *   <li><b>operators</b>: the enabled subset of {@link Operator}.</li>
 *   <li><b>maxIntegerCount</b>: the largest number of integers in one expression.</li>
 *   <li><b>resultCount</b>: number of solutions to return.</li>
 *   <li><b>exhaustive</b>: disables the per-value cap and early termination.</li>
 * </ul>
 *
 * <h3>Empty versus rejected</h3>
 * <ul>
 *   <li>A {@code maxIntegerCount} of zero or less, or an empty pool, is accepted
 *       and the search returns no solutions.</li>
 *   <li>An empty operator set is accepted only when the target itself is in the
 *       pool; otherwise nothing could ever be found and {@link Builder#build()}
 *       rejects the configuration.</li>
 * </ul>
 *
 * <p>All fields are final and collections are copied and wrapped unmodifiable,
 * so sharing a {@code SearchConfiguration} across threads is safe.
 */
public final class SearchConfiguration {

    /**
     * Algorithm used to search one integer count.
     *
     * <p>Both are exact for the expressions they reach. The orchestrator picks
     * per count, see {@link SearchEngineFactory#selectStrategy(int)}.
     */
    public enum SearchStrategy {
        /** Enumerate every integer/operator assignment. */
        DIRECT,
        /** Generate half tables and match them against the target. */
        MEET_IN_THE_MIDDLE
    }

    private final long target;
    private final int minInteger;
    private final int maxInteger;
    private final Set<Integer> excludedIntegers;
    private final Set<Operator> operators;
    private final int maxIntegerCount;
    private final int resultCount;
    private final boolean exhaustive;
    private final int maxResultsPerValue;
    private final ProgressListener progressListener;

    /**
     * Controls ForkJoin execution of direct search ranges, half-table generation
     * and per-operator combination passes.
     *
     * <p>When {@code true} (default), independent pieces run as ForkJoin tasks.
     * When {@code false}, the same algorithm runs on the calling thread. Results
     * are identical in both modes.
     */
    private final boolean useParallelSearch;

    /** Ascending pool integers, derived once. */
    private final int[] availableIntegers;

    private SearchConfiguration(Builder builder) {
        this.target = builder.target;
        this.minInteger = builder.minInteger;
        this.maxInteger = builder.maxInteger;
        this.excludedIntegers = Collections.unmodifiableSet(new TreeSet<>(builder.excludedIntegers));
        this.operators = Collections.unmodifiableSet(EnumSet.copyOf(builder.operators));
        this.maxIntegerCount = builder.maxIntegerCount;
        this.resultCount = builder.resultCount;
        this.exhaustive = builder.exhaustive;
        this.maxResultsPerValue = builder.maxResultsPerValue;
        this.progressListener = builder.progressListener;
        this.useParallelSearch = builder.useParallelSearch;
        this.availableIntegers = derivePool(minInteger, maxInteger, excludedIntegers);
    }

    public long getTarget() { return target; }
    public int getMinInteger() { return minInteger; }
    public int getMaxInteger() { return maxInteger; }
    public Set<Integer> getExcludedIntegers() { return excludedIntegers; }
    public Set<Operator> getOperators() { return operators; }
    public int getMaxIntegerCount() { return maxIntegerCount; }
    public int getResultCount() { return resultCount; }
    public boolean isExhaustive() { return exhaustive; }
    public int getMaxResultsPerValue() { return maxResultsPerValue; }
    public ProgressListener getProgressListener() { return progressListener; }
    public boolean useParallelSearch() { return useParallelSearch; }

    /**
     * Returns the pool of integers, ascending.
     *
     * @return a copy of the pool
     */
    public int[] getAvailableIntegers() {
        return availableIntegers.clone();
    }

    /**
     * Returns the enabled operators in declaration order.
     *
     * @return a new array
     */
    public Operator[] getOperatorArray() {
        return operators.toArray(new Operator[0]);
    }

    /**
     * Returns the per-value cap subexpression tables use for this search:
     * unlimited in exhaustive mode, {@link #getMaxResultsPerValue()} otherwise.
     *
     * @return the effective cap; {@code 0} means unlimited
     */
    public int getEffectiveResultsPerValue() {
        return exhaustive ? 0 : maxResultsPerValue;
    }

    private static int[] derivePool(int min, int max, Set<Integer> excluded) {
        if (max < min) return new int[0];
        int[] pool = new int[max - min + 1];
        int size = 0;
        for (int n = min; n <= max; n++) {
            if (!excluded.contains(n)) pool[size++] = n;
        }
        int[] trimmed = new int[size];
        System.arraycopy(pool, 0, trimmed, 0, size);
        return trimmed;
    }

    @Override
    public String toString() {
        return String.format("SearchConfiguration{target=%d, pool=[%d..%d] excluding %s, operators=%s, "
                + "maxIntegerCount=%d, resultCount=%d, exhaustive=%b, cap=%d, parallel=%b}",
            target, minInteger, maxInteger, excludedIntegers, operators,
            maxIntegerCount, resultCount, exhaustive, maxResultsPerValue, useParallelSearch);
    }

    /**
     * Fluent builder for {@link SearchConfiguration}.
     *
     * <p>{@code target} and {@code maxInteger} must be set. Defaults:
     * <ul>
     *   <li>{@code minInteger}: {@link OrchestratorConfiguration#DEFAULT_MIN_INTEGER}</li>
     *   <li>{@code operators}: {@link Operator#ADD} only</li>
     *   <li>{@code excludedIntegers}: none</li>
     *   <li>{@code maxIntegerCount}: {@link OrchestratorConfiguration#DEFAULT_MAX_INTEGER_COUNT}</li>
     *   <li>{@code resultCount}: {@link OrchestratorConfiguration#DEFAULT_RESULT_COUNT}</li>
     *   <li>{@code exhaustive}: {@code false}</li>
     *   <li>{@code maxResultsPerValue}: {@link OrchestratorConfiguration#DEFAULT_MAX_RESULTS_PER_VALUE}</li>
     *   <li>{@code useParallelSearch}: {@code true}</li>
     *   <li>{@code progressListener}: {@link ProgressListener#NONE}</li>
     * </ul>
     */
    public static class Builder {
        private long target;
        private boolean targetSet = false;
        private int minInteger = DEFAULT_MIN_INTEGER;
        private int maxInteger;
        private boolean maxIntegerSet = false;
        private Set<Integer> excludedIntegers = new HashSet<>();
        private Set<Operator> operators = EnumSet.of(Operator.ADD);
        private int maxIntegerCount = DEFAULT_MAX_INTEGER_COUNT;
        private int resultCount = DEFAULT_RESULT_COUNT;
        private boolean exhaustive = false;
        private int maxResultsPerValue = DEFAULT_MAX_RESULTS_PER_VALUE;
        private boolean useParallelSearch = true;
        private ProgressListener progressListener = ProgressListener.NONE;

        public Builder setTarget(long target) {
            this.target = target;
            this.targetSet = true;
            return this;
        }

        public Builder setMinInteger(int minInteger) {
            ValidationUtils.validateNonNegative(minInteger, "minInteger");
            this.minInteger = minInteger;
            return this;
        }

        /**
         * Sets the largest pool integer. A value below {@code minInteger}
         * is accepted and yields an empty pool.
         *
         * @param maxInteger inclusive upper bound of the pool
         * @return this builder
         */
        public Builder setMaxInteger(int maxInteger) {
            this.maxInteger = maxInteger;
            this.maxIntegerSet = true;
            return this;
        }

        public Builder setExcludedIntegers(Set<Integer> excluded) {
            ValidationUtils.validateNotNull(excluded, "excludedIntegers");
            this.excludedIntegers = new HashSet<>(excluded);
            return this;
        }

        /**
         * Sets the enabled operators.
         *
         * @param operators any subset of {@link Operator}, possibly empty
         * @return this builder
         */
        public Builder setOperators(Set<Operator> operators) {
            ValidationUtils.validateNotNull(operators, "operators");
            this.operators = operators.isEmpty() ? EnumSet.noneOf(Operator.class) : EnumSet.copyOf(operators);
            return this;
        }

        /**
         * Sets the largest number of integers per expression. Zero or negative
         * values are accepted and make the search return nothing.
         *
         * @param maxIntegerCount maximum integer count
         * @return this builder
         */
        public Builder setMaxIntegerCount(int maxIntegerCount) {
            this.maxIntegerCount = maxIntegerCount;
            return this;
        }

        public Builder setResultCount(int resultCount) {
            ValidationUtils.validatePositive(resultCount, "resultCount");
            this.resultCount = resultCount;
            return this;
        }

        public Builder setExhaustive(boolean exhaustive) {
            this.exhaustive = exhaustive;
            return this;
        }

        /**
         * Sets the per-value cap of subexpression tables. Ignored in exhaustive mode.
         *
         * @param maxResultsPerValue positive cap
         * @return this builder
         */
        public Builder setMaxResultsPerValue(int maxResultsPerValue) {
            ValidationUtils.validatePositive(maxResultsPerValue, "maxResultsPerValue");
            this.maxResultsPerValue = maxResultsPerValue;
            return this;
        }

        /**
         * Sets whether independent parts of the search run as ForkJoin tasks.
         *
         * <p><b>Default</b>: {@code true}
         * <p><b>Debugging/Benchmarking</b>: Set to {@code false} for sequential mode
         *
         * @param useParallel {@code true} for ForkJoin execution,
         *                    {@code false} for the calling thread only
         * @return this builder
         */
        public Builder setUseParallelSearch(boolean useParallel) {
            this.useParallelSearch = useParallel;
            return this;
        }

        /**
         * Sets the progress listener; {@code null} restores the no-op listener.
         *
         * @param listener progress sink
         * @return this builder
         */
        public Builder setProgressListener(ProgressListener listener) {
            this.progressListener = listener == null ? ProgressListener.NONE : listener;
            return this;
        }

        public SearchConfiguration build() {
            if (!targetSet) {
                throw new IllegalStateException("target must be set");
            }
            if (!maxIntegerSet) {
                throw new IllegalStateException("maxInteger must be set");
            }
            if ((long) maxInteger - minInteger >= MAX_POOL_RANGE) {
                throw new IllegalArgumentException(
                    "Pool range [" + minInteger + ", " + maxInteger + "] exceeds " + MAX_POOL_RANGE + " integers");
            }
            if (operators.isEmpty() && !targetInPool()) {
                throw new IllegalStateException(
                    "No operators enabled and target " + target + " is not in the pool");
            }
            return new SearchConfiguration(this);
        }

        private boolean targetInPool() {
            return target >= minInteger && target <= maxInteger && !excludedIntegers.contains((int) target);
        }
    }
}
