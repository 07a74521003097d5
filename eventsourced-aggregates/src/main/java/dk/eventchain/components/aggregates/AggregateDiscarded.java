package dk.eventchain.components.aggregates;

import java.util.Objects;

/**
 * The terminal event of every {@link AggregateRoot}. After it has been applied the aggregate doesn't accept new events
 * and the {@link AggregateRepository} treats the aggregate as not found
 *
 * @see AggregateRoot#discard()
 */
public final class AggregateDiscarded {
    private String reason;

    public AggregateDiscarded() {
    }

    public AggregateDiscarded(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(reason, ((AggregateDiscarded) o).reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason);
    }

    @Override
    public String toString() {
        return "AggregateDiscarded{" +
                "reason='" + reason + '\'' +
                '}';
    }
}
