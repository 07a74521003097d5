package dk.eventchain.components.common.types;

import java.util.Objects;

import static dk.eventchain.components.common.FailFast.requireTrue;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * A range of long values. A closed range has both a <code>fromInclusive</code> and a <code>toInclusive</code> value, an open range
 * only has a <code>fromInclusive</code> value and covers every value from there on
 */
public final class LongRange {
    public final long fromInclusive;
    /**
     * <code>null</code> for an open range
     */
    public final Long toInclusive;

    private LongRange(long fromInclusive, Long toInclusive) {
        if (toInclusive != null) {
            requireTrue(toInclusive >= fromInclusive, msg("toInclusive {} must be >= fromInclusive {}", toInclusive, fromInclusive));
        }
        this.fromInclusive = fromInclusive;
        this.toInclusive = toInclusive;
    }

    /**
     * Open range covering <code>fromInclusive</code> and every value above it
     */
    public static LongRange from(long fromInclusive) {
        return new LongRange(fromInclusive, null);
    }

    /**
     * Closed range <code>[fromInclusive, toInclusive]</code>
     */
    public static LongRange between(long fromInclusive, long toInclusive) {
        return new LongRange(fromInclusive, toInclusive);
    }

    /**
     * Closed range covering only <code>value</code>
     */
    public static LongRange only(long value) {
        return new LongRange(value, value);
    }

    public boolean isClosedRange() {
        return toInclusive != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LongRange)) return false;
        var that = (LongRange) o;
        return fromInclusive == that.fromInclusive && Objects.equals(toInclusive, that.toInclusive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromInclusive, toInclusive);
    }

    @Override
    public String toString() {
        return "LongRange{" + fromInclusive + ".." + (toInclusive == null ? "" : toInclusive) + "}";
    }
}
