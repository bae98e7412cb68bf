package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapping from achievable value to a bounded, insertion-ordered list of the
 * {@link PartialResult}s that reach it.
 *
 * <p>A capped table keeps at most {@code maxPerValue} partial results per
 * value; later insertions for a full value are rejected. Rejection never
 * removes a value from the table, so the set of reachable values is the same
 * with or without a cap. An uncapped table (exhaustive mode) keeps everything.
 *
 * <h3>Memory bound</h3>
 * For a capped table: {@code size() ≤ distinctValueCount() × maxPerValue}.
 *
 * <p>Tables are built by a single owner and are not thread-safe. Parallel
 * generation builds separate tables and hands them over when complete.
 */
public final class SubexpressionTable {

    /** Marker for an uncapped table. */
    public static final int UNLIMITED = 0;

    private final Map<Long, List<PartialResult>> entries = new HashMap<>();
    private final int maxPerValue;
    private int size;

    /**
     * Constructs an empty table.
     *
     * @param maxPerValue per-value cap, or {@link #UNLIMITED}
     * @throws IllegalArgumentException if {@code maxPerValue < 0}
     */
    public SubexpressionTable(int maxPerValue) {
        if (maxPerValue < 0) {
            throw new IllegalArgumentException("maxPerValue must be non-negative, got: " + maxPerValue);
        }
        this.maxPerValue = maxPerValue;
    }

    /**
     * Returns whether another partial result for {@code value} would be kept.
     *
     * <p>Callers check this before formatting an expression, which is the
     * expensive part of building a partial result.
     *
     * @param value candidate value
     * @return {@code true} if the value is below its cap
     */
    public boolean accepts(long value) {
        if (maxPerValue == UNLIMITED) return true;
        List<PartialResult> existing = entries.get(value);
        return existing == null || existing.size() < maxPerValue;
    }

    /**
     * Inserts a partial result unless its value is already at the cap.
     *
     * @param partial the partial result
     * @return {@code true} if inserted
     */
    public boolean add(PartialResult partial) {
        List<PartialResult> list = entries.computeIfAbsent(partial.value, v -> new ArrayList<>(2));
        if (maxPerValue != UNLIMITED && list.size() >= maxPerValue) {
            return false;
        }
        list.add(partial);
        size++;
        return true;
    }

    /**
     * Returns the partial results for {@code value}.
     *
     * @param value the value
     * @return an unmodifiable list, empty if the value is unreachable
     */
    public List<PartialResult> get(long value) {
        List<PartialResult> list = entries.get(value);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public boolean contains(long value) {
        return entries.containsKey(value);
    }

    /**
     * Returns a read-only view of all entries.
     *
     * @return value → partial results
     */
    public Set<Map.Entry<Long, List<PartialResult>>> entries() {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    /** Number of distinct reachable values. */
    public int distinctValueCount() {
        return entries.size();
    }

    /** Total number of partial results held. */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isCapped() {
        return maxPerValue != UNLIMITED;
    }

    public int getMaxPerValue() {
        return maxPerValue;
    }

    @Override
    public String toString() {
        return String.format("SubexpressionTable{values=%d, partials=%d, cap=%s}",
            entries.size(), size, isCapped() ? Integer.toString(maxPerValue) : "none");
    }
}
