package io.minterm.classifier;

import io.minterm.core.ClassifierConfiguration;
import io.minterm.core.MintermException;
import io.minterm.kernel.CharRange;
import io.minterm.kernel.CharRangeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Maps every UTF-16 code unit to the ID of its minterm.
 * <p>
 * Minterms compress the input alphabet: characters an automaton treats alike
 * share one equivalence class. For {@code [0-9]*} there are two minterms, the
 * ten digits and everything else. Minterm 0 is the implicit default class;
 * minterms 1..K-1 carry explicit ranges that never overlap.
 * <p>
 * The lookup is a direct-indexed {@code int[]}:
 * <ul>
 *   <li>one minterm only: a process-wide zero table is shared, nothing is allocated;</li>
 *   <li>no explicit range reaches 128: a 128-entry table, higher codes map to 0;</li>
 *   <li>otherwise: a 65536-entry table.</li>
 * </ul>
 * <p>
 * <b>Thread-safety:</b> immutable after construction. {@link #classify(int)}
 * may be called from any number of threads without synchronization.
 */
public final class MintermClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(MintermClassifier.class);

    static final int ASCII_TABLE_LENGTH = 128;
    static final int FULL_TABLE_LENGTH = CharRange.MAX_CODE + 1;

    // Never written after class initialization.
    private static final int[] EMPTY_LOOKUP = new int[FULL_TABLE_LENGTH];

    private final int[] lookup;
    private final boolean asciiOnly;
    private final int mintermCount;

    private MintermClassifier(int[] lookup, boolean asciiOnly, int mintermCount) {
        this.lookup = lookup;
        this.asciiOnly = asciiOnly;
        this.mintermCount = mintermCount;
    }

    /**
     * Build a classifier with the default configuration.
     *
     * @param minterms  descriptors indexed by minterm ID; index 0 is the default minterm and is not converted
     * @param converter turns each explicit descriptor into its ranges
     * @return the classifier
     */
    public static <T> MintermClassifier build(List<T> minterms, RangeConverter<? super T> converter) {
        return build(minterms, converter, ClassifierConfiguration.defaults());
    }

    /**
     * Build a classifier.
     *
     * @param minterms      descriptors indexed by minterm ID; index 0 is the default minterm and is not converted
     * @param converter     turns each explicit descriptor into its ranges
     * @param configuration table and validation options
     * @return the classifier
     * @throws IllegalArgumentException if {@code minterms} is empty or the converted ranges break the contract
     * @throws MintermException         if the converter fails
     */
    public static <T> MintermClassifier build(List<T> minterms,
                                              RangeConverter<? super T> converter,
                                              ClassifierConfiguration configuration) {
        Objects.requireNonNull(minterms, "minterms");
        Objects.requireNonNull(converter, "converter");
        if (minterms.isEmpty()) {
            throw new IllegalArgumentException("at least one minterm required");
        }
        List<List<CharRange>> rangesById = new ArrayList<>(minterms.size());
        rangesById.add(List.of());
        for (int mintermId = 1; mintermId < minterms.size(); mintermId++) {
            rangesById.add(convert(mintermId, minterms.get(mintermId), converter));
        }
        return fromRanges(rangesById, configuration);
    }

    /**
     * Build a classifier for explicit minterms 1..K-1; minterm 0 is implicit.
     *
     * @param explicitMinterms range sets for minterm IDs 1, 2, ...
     * @return the classifier
     */
    public static MintermClassifier of(CharRangeSet... explicitMinterms) {
        Objects.requireNonNull(explicitMinterms, "explicitMinterms");
        List<CharRangeSet> minterms = new ArrayList<>(explicitMinterms.length + 1);
        minterms.add(CharRangeSet.empty());
        for (int i = 0; i < explicitMinterms.length; i++) {
            if (explicitMinterms[i] == null) {
                throw new IllegalArgumentException("range set required for minterm " + (i + 1));
            }
            minterms.add(explicitMinterms[i]);
        }
        return build(minterms, RangeConverter.ofRangeSets());
    }

    /**
     * Build a classifier from ranges that are already converted, with the default configuration.
     *
     * @param rangesById ranges indexed by minterm ID; entry 0 must be null or empty
     * @return the classifier
     */
    public static MintermClassifier fromRanges(List<? extends List<CharRange>> rangesById) {
        return fromRanges(rangesById, ClassifierConfiguration.defaults());
    }

    /**
     * Build a classifier from ranges that are already converted.
     *
     * @param rangesById    ranges indexed by minterm ID; entry 0 must be null or empty
     * @param configuration table and validation options
     * @return the classifier
     * @throws IllegalArgumentException if the list is empty, minterm 0 carries ranges,
     *                                  or ranges are unsorted or overlap
     */
    public static MintermClassifier fromRanges(List<? extends List<CharRange>> rangesById,
                                               ClassifierConfiguration configuration) {
        Objects.requireNonNull(rangesById, "rangesById");
        Objects.requireNonNull(configuration, "configuration");
        if (rangesById.isEmpty()) {
            throw new IllegalArgumentException("at least one minterm required");
        }
        List<CharRange> defaultRanges = rangesById.get(0);
        if (defaultRanges != null && !defaultRanges.isEmpty()) {
            throw new IllegalArgumentException("minterm 0 is implicit and must not carry ranges: " + defaultRanges);
        }

        int mintermCount = rangesById.size();
        if (mintermCount == 1) {
            LOG.trace("Single minterm, sharing the empty lookup table");
            return new MintermClassifier(EMPTY_LOOKUP, false, 1);
        }

        boolean validate = configuration.validateRanges();
        boolean asciiOnly = configuration.asciiTableEnabled();
        for (int mintermId = 1; mintermId < mintermCount; mintermId++) {
            List<CharRange> ranges = rangesById.get(mintermId);
            if (ranges == null) {
                throw new IllegalArgumentException("ranges required for minterm " + mintermId);
            }
            if (validate) {
                checkSorted(mintermId, ranges);
            }
            if (highestCode(ranges, validate) >= ASCII_TABLE_LENGTH) {
                asciiOnly = false;
            }
        }

        // Codes left unassigned stay in minterm 0.
        int[] lookup = new int[asciiOnly ? ASCII_TABLE_LENGTH : FULL_TABLE_LENGTH];
        for (int mintermId = 1; mintermId < mintermCount; mintermId++) {
            for (CharRange range : rangesById.get(mintermId)) {
                if (validate) {
                    checkUnclaimed(lookup, mintermId, range);
                }
                Arrays.fill(lookup, range.start(), range.end() + 1, mintermId);
            }
        }

        LOG.debug("Built minterm classifier: {} minterms, {} lookup entries", mintermCount, lookup.length);
        return new MintermClassifier(lookup, asciiOnly, mintermCount);
    }

    /**
     * Get the ID of the minterm that contains the given code unit.
     *
     * @param code a UTF-16 code unit in [0, 0xFFFF]
     * @return the minterm ID, 0 for codes no explicit minterm claims
     */
    public int classify(int code) {
        if (asciiOnly && code >= ASCII_TABLE_LENGTH) {
            return 0;
        }
        return lookup[code];
    }

    /**
     * Classify every code unit of {@code text} into {@code destination}.
     *
     * @return the number of entries written, equal to {@code text.length()}
     */
    public int classify(CharSequence text, int[] destination) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(destination, "destination");
        int length = text.length();
        if (destination.length < length) {
            throw new IllegalArgumentException("destination too small: " + destination.length + " < " + length);
        }
        for (int i = 0; i < length; i++) {
            destination[i] = classify(text.charAt(i));
        }
        return length;
    }

    /**
     * Number of minterms, the implicit minterm 0 included.
     */
    public int mintermCount() {
        return mintermCount;
    }

    public boolean isAsciiOnly() {
        return asciiOnly;
    }

    public int tableLength() {
        return lookup.length;
    }

    boolean sharesEmptyLookup() {
        return lookup == EMPTY_LOOKUP;
    }

    @Override
    public String toString() {
        return "MintermClassifier{minterms=" + mintermCount
                + ", table=" + (asciiOnly ? "ascii" : "full") + "}";
    }

    private static <T> List<CharRange> convert(int mintermId, T minterm, RangeConverter<? super T> converter) {
        List<CharRange> ranges;
        try {
            ranges = converter.toRanges(minterm);
        } catch (RuntimeException e) {
            throw new MintermException("range conversion failed for minterm " + mintermId, e);
        }
        if (ranges == null) {
            throw new IllegalArgumentException("converter returned no ranges for minterm " + mintermId);
        }
        return ranges;
    }

    /**
     * Highest code covered by {@code ranges}, or -1 when there are none. Checked ranges are
     * ascending, so only the last one is read; unchecked ranges are scanned in full.
     */
    private static int highestCode(List<CharRange> ranges, boolean sorted) {
        if (ranges.isEmpty()) {
            return -1;
        }
        if (sorted) {
            return ranges.get(ranges.size() - 1).end();
        }
        int highest = -1;
        for (CharRange range : ranges) {
            highest = Math.max(highest, range.end());
        }
        return highest;
    }

    private static void checkSorted(int mintermId, List<CharRange> ranges) {
        CharRange previous = null;
        for (CharRange range : ranges) {
            if (range == null) {
                throw new IllegalArgumentException("null range in minterm " + mintermId);
            }
            if (previous != null && range.start() <= previous.end()) {
                throw new IllegalArgumentException("ranges of minterm " + mintermId
                        + " not sorted and disjoint: " + previous + " then " + range);
            }
            previous = range;
        }
    }

    private static void checkUnclaimed(int[] lookup, int mintermId, CharRange range) {
        for (int code = range.start(); code <= range.end(); code++) {
            if (lookup[code] != 0) {
                throw new IllegalArgumentException(String.format(
                        "minterm %d range %s overlaps minterm %d at code 0x%04X",
                        mintermId, range, lookup[code], code));
            }
        }
    }
}
