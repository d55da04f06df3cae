package io.minterm.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CharRangeSetTest {

    @Test
    void shouldShareEmptyInstance() {
        assertThat(CharRangeSet.of()).isSameAs(CharRangeSet.empty());
        assertThat(CharRangeSet.builder().build()).isSameAs(CharRangeSet.empty());
    }

    @Test
    void shouldReportEmptySet() {
        var set = CharRangeSet.empty();
        assertThat(set.isEmpty()).isTrue();
        assertThat(set.size()).isZero();
        assertThat(set.maxCode()).isEqualTo(-1);
        assertThat(set.cardinality()).isZero();
        assertThat(set.contains(0)).isFalse();
    }

    @Test
    void shouldRejectLastOfEmptySet() {
        assertThatThrownBy(() -> CharRangeSet.empty().last())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAcceptSortedDisjointRanges() {
        var set = CharRangeSet.of(CharRange.of('0', '9'), CharRange.of('A', 'Z'), CharRange.of('a', 'z'));
        assertThat(set.size()).isEqualTo(3);
        assertThat(set.first()).isEqualTo(CharRange.of('0', '9'));
        assertThat(set.last()).isEqualTo(CharRange.of('a', 'z'));
        assertThat(set.maxCode()).isEqualTo('z');
        assertThat(set.cardinality()).isEqualTo(62);
    }

    @Test
    void shouldAcceptAdjacentRanges() {
        var set = CharRangeSet.of(CharRange.of(0, 5), CharRange.of(6, 9));
        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    void shouldRejectOverlappingRanges() {
        assertThatThrownBy(() -> CharRangeSet.of(CharRange.of(0, 10), CharRange.of(10, 20)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not sorted and disjoint");
    }

    @Test
    void shouldRejectUnsortedRanges() {
        assertThatThrownBy(() -> CharRangeSet.of(CharRange.of(20, 30), CharRange.of(0, 10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNullRange() {
        assertThatThrownBy(() -> CharRangeSet.of(CharRange.of(0, 10), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void shouldNotBeAffectedByCallerArrayMutation() {
        CharRange[] ranges = {CharRange.of(0, 10)};
        var set = CharRangeSet.of(ranges);
        ranges[0] = CharRange.of(100, 200);
        assertThat(set.get(0)).isEqualTo(CharRange.of(0, 10));
    }

    @Test
    void shouldExposeUnmodifiableRanges() {
        var set = CharRangeSet.of(CharRange.of(0, 10));
        assertThatThrownBy(() -> set.ranges().add(CharRange.of(20, 30)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldFindCodesByBinarySearch() {
        var set = CharRangeSet.of(CharRange.of(10, 20), CharRange.of(30, 40), CharRange.of(50, 60));
        assertThat(set.contains(10)).isTrue();
        assertThat(set.contains(40)).isTrue();
        assertThat(set.contains(60)).isTrue();
        assertThat(set.contains(9)).isFalse();
        assertThat(set.contains(25)).isFalse();
        assertThat(set.contains(61)).isFalse();
    }

    @Test
    void builderShouldSortInput() {
        var set = CharRangeSet.builder()
                .add('a', 'z')
                .add('0', '9')
                .build();
        assertThat(set.ranges()).containsExactly(CharRange.of('0', '9'), CharRange.of('a', 'z'));
    }

    @Test
    void builderShouldMergeOverlappingRanges() {
        var set = CharRangeSet.builder()
                .add(10, 20)
                .add(15, 30)
                .add(12, 14)
                .build();
        assertThat(set.ranges()).containsExactly(CharRange.of(10, 30));
    }

    @Test
    void builderShouldMergeAdjacentRangesAndSingles() {
        var set = CharRangeSet.builder()
                .add('b')
                .add('a')
                .add('c', 'f')
                .add('h')
                .build();
        assertThat(set.ranges()).containsExactly(CharRange.of('a', 'f'), CharRange.single('h'));
    }

    @Test
    void builderShouldCombineExistingSets() {
        var digits = CharRangeSet.of(CharRange.of('0', '9'));
        var upper = CharRangeSet.of(CharRange.of('A', 'Z'));
        var set = CharRangeSet.builder().addAll(upper).addAll(digits).build();
        assertThat(set.ranges()).containsExactly(CharRange.of('0', '9'), CharRange.of('A', 'Z'));
    }

    @Test
    void builderShouldRejectNullRange() {
        assertThatThrownBy(() -> CharRangeSet.builder().add((CharRange) null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldUseValueEquality() {
        var built = CharRangeSet.builder().add(5, 9).add(0, 4).build();
        assertThat(built).isEqualTo(CharRangeSet.of(CharRange.of(0, 9)));
        assertThat(built.hashCode()).isEqualTo(CharRangeSet.of(CharRange.of(0, 9)).hashCode());
    }
}
