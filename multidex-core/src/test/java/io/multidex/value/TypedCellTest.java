package io.multidex.value;

import io.multidex.core.MultidexException;
import io.multidex.logging.CapturingSlf4jServiceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypedCellTest {

    @BeforeEach
    void resetLog() {
        CapturingSlf4jServiceProvider.reset();
    }

    @Test
    void getReturnsStoredValueForSameType() {
        TypedCell cell = TypedCell.of(String.class, "mrognor");

        assertThat(cell.get(String.class)).contains("mrognor");
        assertThat(cell.type()).isEqualTo(String.class);
    }

    @Test
    void getWithOtherTypeFailsAndLogsDiagnostic() {
        TypedCell cell = TypedCell.of(Integer.class, 42);

        assertThat(cell.get(Long.class)).isEmpty();
        assertThat(CapturingSlf4jServiceProvider.warnings())
                .anyMatch(message -> message.contains("java.lang.Integer") && message.contains("java.lang.Long"));
    }

    @Test
    void supertypeDoesNotMatchStoredType() {
        TypedCell cell = TypedCell.of(Integer.class, 42);

        assertThat(cell.get(Number.class)).isEmpty();
        assertThat(cell.matches(Integer.class)).isTrue();
        assertThat(cell.matches(Number.class)).isFalse();
    }

    @Test
    void emptyCellHasNoValueOrType() {
        TypedCell cell = new TypedCell();

        assertThat(cell.isEmpty()).isTrue();
        assertThat(cell.type()).isNull();
        assertThat(cell.get(String.class)).isEmpty();
        assertThat(CapturingSlf4jServiceProvider.warnings()).isEmpty();
    }

    @Test
    void setStoresCopyMadeByCopier() {
        List<String> original = new ArrayList<>(List.of("a"));
        TypedCell cell = new TypedCell();
        @SuppressWarnings({"unchecked", "rawtypes"})
        Class<List<String>> type = (Class) ArrayList.class;

        cell.set(type, original, ArrayList::new, null);
        original.add("b");

        assertThat(cell.get(type)).contains(List.of("a"));
    }

    @Test
    void copyIsIndependentOfSource() {
        @SuppressWarnings({"unchecked", "rawtypes"})
        Class<List<String>> type = (Class) ArrayList.class;
        TypedCell source = new TypedCell();
        source.set(type, new ArrayList<>(List.of("x")), ArrayList::new, null);

        TypedCell copy = source.copy();
        source.set(type, new ArrayList<>(List.of("y")), ArrayList::new, null);

        assertThat(copy.get(type)).contains(List.of("x"));
        assertThat(copy.type()).isEqualTo(ArrayList.class);
    }

    @Test
    void mutableTypeNeedsExplicitCopier() {
        TypedCell cell = new TypedCell();

        assertThatThrownBy(() -> cell.set(Date.class, new Date(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java.util.Date");
        assertThat(cell.isEmpty()).isTrue();

        Date written = new Date(1);
        cell.set(Date.class, written, date -> new Date(date.getTime()), null);
        written.setTime(2);
        cell.get(Date.class).orElseThrow().setTime(3);

        assertThat(cell.get(Date.class)).contains(new Date(1));
    }

    @Test
    void immutableTypesAreSharedWithoutCopier() {
        assertThat(ValueCopier.isImmutable(String.class)).isTrue();
        assertThat(ValueCopier.isImmutable(Long.class)).isTrue();
        assertThat(ValueCopier.isImmutable(LocalDate.class)).isTrue();
        assertThat(ValueCopier.isImmutable(Thread.State.class)).isTrue();
        assertThat(ValueCopier.isImmutable(Date.class)).isFalse();
        assertThat(ValueCopier.isImmutable(ArrayList.class)).isFalse();
    }

    @Test
    void copyOfEmptyCellIsEmpty() {
        assertThat(new TypedCell().copy().isEmpty()).isTrue();
    }

    @Test
    void releaseHookRunsOnlyOnExplicitRelease() {
        AtomicInteger released = new AtomicInteger();
        TypedCell cell = TypedCell.of(String.class, "resource", value -> released.incrementAndGet());

        cell.set(String.class, "other");
        cell.clear();

        assertThat(released).hasValue(0);
    }

    @Test
    void releaseCustomRunsHookAtMostOnce() {
        AtomicInteger released = new AtomicInteger();
        TypedCell cell = TypedCell.of(String.class, "resource", value -> released.incrementAndGet());

        cell.releaseCustom();
        cell.releaseCustom();

        assertThat(released).hasValue(1);
        assertThat(cell.hasReleaseHook()).isFalse();
    }

    @Test
    void releaseHookReceivesStoredValue() {
        List<String> seen = new ArrayList<>();
        TypedCell cell = TypedCell.of(String.class, "handle", seen::add);

        cell.releaseCustom();

        assertThat(seen).containsExactly("handle");
    }

    @Test
    void updateKeepsHookWhenNoneGiven() {
        AtomicInteger released = new AtomicInteger();
        TypedCell cell = TypedCell.of(String.class, "first", value -> released.incrementAndGet());

        cell.update(String.class, "second", ValueCopier.identity(), null);
        cell.releaseCustom();

        assertThat(cell.get(String.class)).contains("second");
        assertThat(released).hasValue(1);
    }

    @Test
    void failingHookIsWrapped() {
        TypedCell cell = TypedCell.of(String.class, "x", value -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(cell::releaseCustom)
                .isInstanceOf(MultidexException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsArrayTypes() {
        TypedCell cell = new TypedCell();

        assertThatThrownBy(() -> cell.set(int[].class, new int[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("array");
    }

    @Test
    void rejectsNullValueAndWrongInstance() {
        TypedCell cell = new TypedCell();

        assertThatThrownBy(() -> cell.set(String.class, null))
                .isInstanceOf(IllegalArgumentException.class);
        @SuppressWarnings({"unchecked", "rawtypes"})
        Class<Object> lying = (Class) String.class;
        assertThatThrownBy(() -> cell.set(lying, 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cell.isEmpty()).isTrue();
    }
}
