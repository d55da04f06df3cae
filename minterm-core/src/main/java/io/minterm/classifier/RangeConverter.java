package io.minterm.classifier;

import io.minterm.kernel.CharRange;
import io.minterm.kernel.CharRangeSet;

import java.util.List;

/**
 * Turns a minterm descriptor into the code-unit ranges it covers.
 * <p>
 * Implementations return ranges in ascending order that do not overlap each
 * other. The classifier calls the converter once per explicit minterm, during
 * construction only.
 *
 * @param <T> the descriptor type produced by the partitioning stage
 */
@FunctionalInterface
public interface RangeConverter<T> {

    List<CharRange> toRanges(T minterm);

    /**
     * Converter for descriptors that are already {@link CharRangeSet}s.
     */
    static RangeConverter<CharRangeSet> ofRangeSets() {
        return CharRangeSet::ranges;
    }
}
