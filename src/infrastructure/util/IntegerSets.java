package infrastructure.util;

import java.util.Arrays;

/**
 * Helpers for small sets of integers stored as sorted, duplicate-free
 * {@code int[]} arrays.
 *
 * <p>The search tracks which pool integers an expression consumes. These sets
 * are tiny (at most the maximum integer count) and created in bulk, so a
 * sorted array is used instead of a boxed {@link java.util.Set}.
 */
public final class IntegerSets {

    private static final int[] EMPTY = new int[0];

    private IntegerSets() {
        // Prevent instantiation: static methods only
    }

    /**
     * Returns the sorted distinct values of {@code values}.
     *
     * @param values any integers, in any order, possibly repeated
     * @return a new sorted, duplicate-free array
     */
    public static int[] distinctSorted(int... values) {
        if (values.length == 0) return EMPTY;
        int[] sorted = values.clone();
        Arrays.sort(sorted);
        int size = 1;
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] != sorted[size - 1]) {
                sorted[size++] = sorted[i];
            }
        }
        return size == sorted.length ? sorted : Arrays.copyOf(sorted, size);
    }

    /**
     * Merges two sorted, duplicate-free arrays.
     *
     * @param left  sorted distinct values
     * @param right sorted distinct values
     * @return their sorted union; may return one of the inputs when the other adds nothing
     */
    public static int[] union(int[] left, int[] right) {
        if (right.length == 0) return left;
        if (left.length == 0) return right;

        int[] merged = new int[left.length + right.length];
        int i = 0;
        int j = 0;
        int size = 0;
        while (i < left.length && j < right.length) {
            int a = left[i];
            int b = right[j];
            if (a < b) {
                merged[size++] = a;
                i++;
            } else if (b < a) {
                merged[size++] = b;
                j++;
            } else {
                merged[size++] = a;
                i++;
                j++;
            }
        }
        while (i < left.length) merged[size++] = left[i++];
        while (j < right.length) merged[size++] = right[j++];

        if (size == left.length) return left;
        if (size == right.length) return right;
        return Arrays.copyOf(merged, size);
    }
}
