package dk.eventchain.components.eventstore.test_data;

import dk.eventchain.components.eventstore.eventstream.DomainEvent;
import dk.eventchain.components.eventstore.hashchain.HashChain;
import dk.eventchain.components.eventstore.types.*;

import java.time.*;
import java.util.*;

/**
 * Creates sealed event chains for tests
 */
public final class TestEvents {
    private TestEvents() {
    }

    public static List<DomainEvent> chain(UUID originatorId, Object... payloads) {
        return continueChain(originatorId, OriginatorVersion.NO_EVENTS_PERSISTED, EventHash.GENESIS, payloads);
    }

    public static List<DomainEvent> continueChain(UUID originatorId, OriginatorVersion lastVersion, EventHash head, Object... payloads) {
        var events  = new ArrayList<DomainEvent>();
        var version = lastVersion;
        var previous = head;
        for (var payload : payloads) {
            version = version.increment();
            var event = HashChain.defaultHashChain().seal(originatorId,
                                                          version,
                                                          payload,
                                                          OffsetDateTime.now(ZoneOffset.UTC),
                                                          previous);
            events.add(event);
            previous = event.eventHash();
        }
        return events;
    }

    public static List<DomainEvent> continueChain(List<DomainEvent> existing, Object... payloads) {
        var last = existing.get(existing.size() - 1);
        return continueChain(last.originatorId(), last.originatorVersion(), last.eventHash(), payloads);
    }
}
