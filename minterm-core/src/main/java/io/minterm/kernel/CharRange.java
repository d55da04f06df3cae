package io.minterm.kernel;

/**
 * Inclusive range of UTF-16 code units.
 * Both bounds lie in [0, 0xFFFF] and {@code start <= end}.
 */
public final class CharRange implements Comparable<CharRange> {
    public static final int MIN_CODE = 0;
    public static final int MAX_CODE = 0xFFFF;

    private final int start;
    private final int end;

    public CharRange(int start, int end) {
        if (start < MIN_CODE || start > MAX_CODE) {
            throw new IllegalArgumentException("start out of range: " + start);
        }
        if (end < MIN_CODE || end > MAX_CODE) {
            throw new IllegalArgumentException("end out of range: " + end);
        }
        if (start > end) {
            throw new IllegalArgumentException("start exceeds end: " + start + " > " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static CharRange of(int start, int end) {
        return new CharRange(start, end);
    }

    public static CharRange single(int code) {
        return new CharRange(code, code);
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    /**
     * Number of codes covered, always at least 1.
     */
    public int length() {
        return end - start + 1;
    }

    public boolean contains(int code) {
        return code >= start && code <= end;
    }

    public boolean overlaps(CharRange other) {
        return start <= other.end && other.start <= end;
    }

    /**
     * True when the two ranges overlap or touch, so that their union is a single range.
     */
    public boolean connects(CharRange other) {
        return start <= other.end + 1 && other.start <= end + 1;
    }

    @Override
    public int compareTo(CharRange other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        CharRange range = (CharRange) obj;
        return start == range.start && end == range.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return String.format("[0x%04X-0x%04X]", start, end);
    }
}
