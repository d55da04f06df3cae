package io.minterm.kernel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable set of UTF-16 code units stored as sorted, disjoint inclusive ranges.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@link #of(CharRange...)} accepts ranges that are already sorted and
 *       disjoint, and rejects anything else.</li>
 *   <li>{@link #builder()} accepts codes and ranges in any order and merges
 *       overlapping or adjacent input, so its ranges never touch.</li>
 *   <li>{@link #last()} holds the highest code, so {@link #maxCode()} is O(1).</li>
 * </ul>
 */
public final class CharRangeSet {
    private static final CharRange[] NO_RANGES = new CharRange[0];
    private static final CharRangeSet EMPTY = new CharRangeSet(NO_RANGES);

    private final CharRange[] ranges;

    private CharRangeSet(CharRange[] ranges) {
        this.ranges = ranges;
    }

    public static CharRangeSet empty() {
        return EMPTY;
    }

    /**
     * Create a set from ranges in ascending order that do not overlap.
     *
     * @param ranges sorted disjoint ranges
     * @return the range set
     * @throws IllegalArgumentException if a range is null, out of order or overlaps its predecessor
     */
    public static CharRangeSet of(CharRange... ranges) {
        Objects.requireNonNull(ranges, "ranges");
        if (ranges.length == 0) {
            return EMPTY;
        }
        CharRange[] copy = ranges.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] == null) {
                throw new IllegalArgumentException("range required at index " + i);
            }
            if (i > 0 && copy[i].start() <= copy[i - 1].end()) {
                throw new IllegalArgumentException("ranges not sorted and disjoint: "
                        + copy[i - 1] + " then " + copy[i]);
            }
        }
        return new CharRangeSet(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return ranges.length;
    }

    public boolean isEmpty() {
        return ranges.length == 0;
    }

    public CharRange get(int index) {
        return ranges[index];
    }

    public CharRange first() {
        requireNonEmpty();
        return ranges[0];
    }

    public CharRange last() {
        requireNonEmpty();
        return ranges[ranges.length - 1];
    }

    /**
     * Highest code in the set, or -1 when the set is empty.
     */
    public int maxCode() {
        return ranges.length == 0 ? -1 : ranges[ranges.length - 1].end();
    }

    /**
     * Number of codes in the set.
     */
    public int cardinality() {
        int total = 0;
        for (CharRange range : ranges) {
            total += range.length();
        }
        return total;
    }

    public boolean contains(int code) {
        int low = 0;
        int high = ranges.length - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            CharRange range = ranges[mid];
            if (code < range.start()) {
                high = mid - 1;
            } else if (code > range.end()) {
                low = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    public List<CharRange> ranges() {
        return Collections.unmodifiableList(Arrays.asList(ranges));
    }

    private void requireNonEmpty() {
        if (ranges.length == 0) {
            throw new IllegalStateException("range set is empty");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(ranges, ((CharRangeSet) obj).ranges);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ranges);
    }

    @Override
    public String toString() {
        return Arrays.toString(ranges);
    }

    /**
     * Collects codes and ranges in any order and normalizes them on {@link #build()}.
     */
    public static final class Builder {
        private final List<CharRange> pending = new ArrayList<>();

        private Builder() {
        }

        public Builder add(int code) {
            pending.add(CharRange.single(code));
            return this;
        }

        public Builder add(int start, int end) {
            pending.add(CharRange.of(start, end));
            return this;
        }

        public Builder add(CharRange range) {
            if (range == null) {
                throw new IllegalArgumentException("range required");
            }
            pending.add(range);
            return this;
        }

        public Builder addAll(CharRangeSet set) {
            Objects.requireNonNull(set, "set");
            Collections.addAll(pending, set.ranges);
            return this;
        }

        public CharRangeSet build() {
            if (pending.isEmpty()) {
                return EMPTY;
            }
            CharRange[] sorted = pending.toArray(NO_RANGES);
            Arrays.sort(sorted);

            List<CharRange> merged = new ArrayList<>(sorted.length);
            CharRange current = sorted[0];
            for (int i = 1; i < sorted.length; i++) {
                CharRange next = sorted[i];
                if (current.connects(next)) {
                    if (next.end() > current.end()) {
                        current = CharRange.of(current.start(), next.end());
                    }
                } else {
                    merged.add(current);
                    current = next;
                }
            }
            merged.add(current);
            return new CharRangeSet(merged.toArray(NO_RANGES));
        }
    }
}
