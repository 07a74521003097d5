package dk.eventchain.components.common.types;

import java.util.Objects;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Base class for single value types that wrap a non-null {@link Long}, e.g. versions and positions.<br>
 * Two instances are equal when they're of the same concrete type and wrap the same value
 *
 * @param <CONCRETE_TYPE> the concrete sub type
 */
public abstract class LongType<CONCRETE_TYPE extends LongType<CONCRETE_TYPE>> extends Number implements Comparable<CONCRETE_TYPE> {
    private final Long value;

    protected LongType(Long value) {
        this.value = requireNonNull(value, "You must provide a value");
    }

    public long value() {
        return value;
    }

    @Override
    public int intValue() {
        return value.intValue();
    }

    @Override
    public long longValue() {
        return value;
    }

    @Override
    public float floatValue() {
        return value.floatValue();
    }

    @Override
    public double doubleValue() {
        return value.doubleValue();
    }

    @Override
    public int compareTo(CONCRETE_TYPE other) {
        return Long.compare(value, other.longValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((LongType<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
