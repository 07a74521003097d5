package dk.eventchain.components.common.types;

import java.util.Objects;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Base class for single value types that wrap a non-null {@link CharSequence}, e.g. hashes and type names.<br>
 * Two instances are equal when they're of the same concrete type and wrap the same characters
 *
 * @param <CONCRETE_TYPE> the concrete sub type
 */
public abstract class CharSequenceType<CONCRETE_TYPE extends CharSequenceType<CONCRETE_TYPE>> implements CharSequence, Comparable<CONCRETE_TYPE> {
    private final String value;

    protected CharSequenceType(CharSequence value) {
        this.value = requireNonNull(value, "You must provide a value").toString();
    }

    public String value() {
        return value;
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public char charAt(int index) {
        return value.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return value.subSequence(start, end);
    }

    @Override
    public int compareTo(CONCRETE_TYPE other) {
        return value.compareTo(other.value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((CharSequenceType<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value;
    }
}
