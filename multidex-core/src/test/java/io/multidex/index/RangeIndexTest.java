package io.multidex.index;

import org.junit.jupiter.api.Test;

import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RangeIndexTest {

    @Test
    void addStoresEntries() {
        RangeIndex<Integer, String> index = RangeIndex.natural();

        index.add(10, "a");
        index.add(10, "b");

        assertThat(index.lookup(10)).containsExactly("a", "b");
    }

    @Test
    void removeRemovesLastEntry() {
        RangeIndex<Integer, String> index = RangeIndex.natural();
        String entry = "x";

        index.add(11, entry);
        index.remove(11, entry);

        assertThat(index.lookup(11)).isEmpty();
        assertThat(index.size()).isZero();
    }

    @Test
    void betweenReturnsInclusiveRange() {
        RangeIndex<Integer, String> index = populated();

        assertThat(index.between(1, 2)).containsExactly("one", "two");
    }

    @Test
    void betweenWithInvertedBoundsIsEmpty() {
        RangeIndex<Integer, String> index = populated();

        assertThat(index.between(3, 1)).isEmpty();
    }

    @Test
    void greaterThanExcludesBoundary() {
        assertThat(populated().greaterThan(2)).containsExactly("three");
    }

    @Test
    void greaterThanOrEqualIncludesBoundary() {
        assertThat(populated().greaterThanOrEqual(2)).containsExactly("two", "three");
    }

    @Test
    void lessThanExcludesBoundary() {
        assertThat(populated().lessThan(2)).containsExactly("one");
    }

    @Test
    void lessThanOrEqualIncludesBoundary() {
        assertThat(populated().lessThanOrEqual(2)).containsExactly("one", "two");
    }

    @Test
    void ascendingAndDescendingFollowComparator() {
        RangeIndex<String, Integer> index = new RangeIndex<>(Comparator.comparing(String::length));
        index.add("ccc", 3);
        index.add("a", 1);
        index.add("bb", 2);

        assertThat(index.ascending()).containsExactly(1, 2, 3);
        assertThat(index.descending()).containsExactly(3, 2, 1);
    }

    @Test
    void addRejectsNullKey() {
        RangeIndex<Integer, String> index = RangeIndex.natural();

        assertThatThrownBy(() -> index.add(null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RangeIndex<Integer, String> populated() {
        RangeIndex<Integer, String> index = RangeIndex.natural();
        index.add(3, "three");
        index.add(1, "one");
        index.add(2, "two");
        return index;
    }
}
