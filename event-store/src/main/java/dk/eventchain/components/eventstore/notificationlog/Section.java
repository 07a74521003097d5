package dk.eventchain.components.eventstore.notificationlog;

import dk.eventchain.components.eventstore.persistence.Notification;

import java.util.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * A page of the {@link NotificationLog}. Sections are linked through {@link #previousId()} and {@link #nextId()}
 */
public final class Section {
    private final String             sectionId;
    private final List<Notification> items;
    private final String             previousId;
    private final String             nextId;

    public Section(String sectionId, List<Notification> items, Optional<String> previousId, Optional<String> nextId) {
        this.sectionId = requireNonNull(sectionId, "No sectionId provided");
        this.items = List.copyOf(requireNonNull(items, "No items provided"));
        this.previousId = requireNonNull(previousId, "No previousId option provided").orElse(null);
        this.nextId = requireNonNull(nextId, "No nextId option provided").orElse(null);
    }

    /**
     * The normalized id of this section, e.g. <code>21,40</code>
     */
    public String sectionId() {
        return sectionId;
    }

    public List<Notification> items() {
        return items;
    }

    /**
     * The id of the preceding section. Absent for the first section
     */
    public Optional<String> previousId() {
        return Optional.ofNullable(previousId);
    }

    /**
     * The id of the following section. Only present when this section is full
     */
    public Optional<String> nextId() {
        return Optional.ofNullable(nextId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Section)) return false;
        Section section = (Section) o;
        return sectionId.equals(section.sectionId) &&
                items.equals(section.items) &&
                Objects.equals(previousId, section.previousId) &&
                Objects.equals(nextId, section.nextId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionId, items, previousId, nextId);
    }

    @Override
    public String toString() {
        return "Section{" +
                "sectionId='" + sectionId + '\'' +
                ", items=" + items.size() +
                ", previousId=" + previousId +
                ", nextId=" + nextId +
                '}';
    }
}
