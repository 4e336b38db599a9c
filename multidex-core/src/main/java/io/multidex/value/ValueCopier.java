package io.multidex.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * Type-specific copy routine captured when a value is stored, so a cell can be
 * copied later without knowing its type statically.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface ValueCopier<T> {

    T copy(T value);

    /**
     * Copier that returns its argument. Values stored through it are shared
     * with the caller.
     */
    @SuppressWarnings("unchecked")
    static <T> ValueCopier<T> identity() {
        return (ValueCopier<T>) (ValueCopier<?>) Identity.INSTANCE;
    }

    /**
     * Default copier of {@code type}: identity for the immutable value types
     * listed by {@link #isImmutable(Class)}.
     *
     * @throws IllegalArgumentException for any other type, whose values need an
     *                                  explicit copier
     */
    static <T> ValueCopier<T> immutable(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (!isImmutable(type)) {
            throw new IllegalArgumentException("values of " + type.getName()
                    + " may be mutable; a ValueCopier is required");
        }
        return identity();
    }

    /**
     * Whether values of exactly {@code type} can be shared without copying:
     * strings, boxed primitives, enums, {@link BigInteger}, {@link BigDecimal},
     * {@link UUID} and the {@code java.time} value types.
     */
    static boolean isImmutable(Class<?> type) {
        return type != null && (Identity.IMMUTABLE_TYPES.contains(type) || Enum.class.isAssignableFrom(type));
    }

    enum Identity implements ValueCopier<Object> {
        INSTANCE;

        private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
                String.class, Boolean.class, Character.class, Byte.class, Short.class,
                Integer.class, Long.class, Float.class, Double.class,
                BigInteger.class, BigDecimal.class, UUID.class,
                Instant.class, LocalDate.class, LocalTime.class, LocalDateTime.class,
                OffsetTime.class, OffsetDateTime.class, ZonedDateTime.class, ZoneOffset.class,
                Duration.class, Period.class, Year.class, YearMonth.class, MonthDay.class);

        @Override
        public Object copy(Object value) {
            return value;
        }
    }
}
