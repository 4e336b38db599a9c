package io.multidex.index;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashIndexTest {

    @Test
    void addStoresEntriesPerKey() {
        HashIndex<String, Entry> index = new HashIndex<>();
        Entry first = new Entry("first");
        Entry second = new Entry("second");

        index.add("key", first);
        index.add("key", second);

        assertThat(index.lookup("key")).containsExactly(first, second);
        assertThat(index.first("key")).containsSame(first);
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void removeMatchesByIdentity() {
        HashIndex<String, Entry> index = new HashIndex<>();
        Entry stored = new Entry("same");
        Entry equalButOther = new Entry("same");
        index.add("key", stored);

        assertThat(index.remove("key", equalButOther)).isFalse();
        assertThat(index.remove("key", stored)).isTrue();
        assertThat(index.lookup("key")).isEmpty();
        assertThat(index.size()).isZero();
    }

    @Test
    void removeLeavesOtherEntriesOfBucket() {
        HashIndex<Integer, Entry> index = new HashIndex<>();
        Entry kept = new Entry("kept");
        Entry removed = new Entry("removed");
        index.add(0, kept);
        index.add(0, removed);

        index.remove(0, removed);

        assertThat(index.lookup(0)).containsExactly(kept);
    }

    @Test
    void clearEmptiesIndex() {
        HashIndex<String, Entry> index = new HashIndex<>();
        index.add("alpha", new Entry("a"));
        index.add("beta", new Entry("b"));

        index.clear();

        assertThat(index.size()).isZero();
    }

    @Test
    void lookupReturnsSnapshot() {
        HashIndex<String, Entry> index = new HashIndex<>();
        index.add("key", new Entry("a"));

        var snapshot = index.lookup("key");
        index.add("key", new Entry("b"));

        assertThat(snapshot).hasSize(1);
        assertThat(index.lookup("key")).hasSize(2);
    }

    @Test
    void addRejectsNullKey() {
        HashIndex<String, Entry> index = new HashIndex<>();

        assertThatThrownBy(() -> index.add(null, new Entry("a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullLookupsAreEmpty() {
        HashIndex<String, Entry> index = new HashIndex<>();

        assertThat(index.lookup(null)).isEmpty();
        assertThat(index.first(null)).isEmpty();
        assertThat(index.remove(null, new Entry("a"))).isFalse();
    }

    record Entry(String name) {
    }
}
