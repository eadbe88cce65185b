package io.iamcore.writemodel;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.Event;
import io.iamcore.EventType;
import io.iamcore.IamAggregates;
import io.iamcore.PendingEvent;
import io.iamcore.log.InMemoryEventLog;
import io.iamcore.user.UserEvents;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WriteModelTest {
    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T11:00:00Z");

    private final InMemoryEventLog log = new InMemoryEventLog();
    private final CommandContext context = CommandContext.of("admin", "instance-1");

    @Test
    void freshModelHasNoState() {
        NameHistory model = new NameHistory("u1");

        assertEquals(0, model.processedSequence());
        assertNull(model.creationDate());
        assertNull(model.changeDate());
        assertTrue(model.query().isFullStream());
    }

    @Test
    void applyFoldsInOrderAndTracksDates() {
        NameHistory model = new NameHistory("u1");

        model.apply(List.of(event("u1", 1, "a", T1), event("u1", 2, "b", T2)));

        assertEquals(List.of("a", "b"), model.names);
        assertEquals(2, model.processedSequence());
        assertEquals(T1, model.creationDate());
        assertEquals(T2, model.changeDate());
        assertEquals("org-1", model.resourceOwner());
    }

    @Test
    void applySkipsOtherAggregates() {
        NameHistory model = new NameHistory("u1");

        model.apply(List.of(event("u1", 1, "a", T1), event("u2", 1, "x", T1), event("u1", 2, "b", T2)));

        assertEquals(List.of("a", "b"), model.names);
        assertEquals(2, model.foldedEvents());
    }

    @Test
    void applyRejectsOutOfOrderEvents() {
        NameHistory model = new NameHistory("u1");
        model.apply(List.of(event("u1", 2, "b", T2)));

        assertThrows(IllegalStateException.class, () -> model.apply(List.of(event("u1", 1, "a", T1))));
        assertThrows(IllegalStateException.class, () -> model.apply(List.of(event("u1", 2, "b", T2))));
    }

    @Test
    void ignoredEventTypesStillAdvanceSequence() {
        NameHistory model = new NameHistory("u1");

        model.apply(List.of(
                event("u1", 1, "a", T1),
                new Event("e2", AggregateRef.of(IamAggregates.USER, "u1", "org-1"), 2,
                        UserEvents.USER_DEACTIVATED, new UserEvents.Deactivated(), "admin", T2)));

        assertEquals(List.of("a"), model.names);
        assertEquals(2, model.processedSequence());
    }

    @Test
    void hydrationOfNEventsEndsAtSequenceN() {
        int n = 5;
        for (int i = 0; i < n; i++) {
            log.append(context, List.of(renamed("u1", "name-" + i)));
        }

        NameHistory model = WriteModels.hydrate(context, log, new NameHistory("u1"));

        assertEquals(n, model.processedSequence());
        assertEquals(n, model.names.size());
    }

    @Test
    void pointInTimeReplayMatchesPrefix() {
        for (int i = 0; i < 5; i++) {
            log.append(context, List.of(renamed("u1", "name-" + i)));
        }

        for (int k = 1; k <= 5; k++) {
            NameHistory model = WriteModels.hydrateAt(context, log, new NameHistory("u1"), k);

            assertEquals(k, model.processedSequence());
            assertEquals("name-" + (k - 1), model.names.get(model.names.size() - 1));
        }
    }

    @Test
    void filteredModelIsNotFullStream() {
        NameHistory model = new NameHistory("u1", List.of(UserEvents.USERNAME_CHANGED));

        assertFalse(model.query().isFullStream());
        assertEquals(1, model.query().eventTypes().size());
    }

    private static Event event(String userId, long sequence, String name, Instant createdAt) {
        return new Event("e" + userId + sequence, AggregateRef.of(IamAggregates.USER, userId, "org-1"), sequence,
                UserEvents.USERNAME_CHANGED, new UserEvents.UsernameChanged(name), "admin", createdAt);
    }

    private PendingEvent renamed(String userId, String name) {
        return PendingEvent.builder(UserEvents.USERNAME_CHANGED)
                .aggregate(AggregateRef.of(IamAggregates.USER, userId, "org-1"))
                .payload(new UserEvents.UsernameChanged(name))
                .context(context)
                .build();
    }

    private static final class NameHistory extends WriteModel {
        private final List<String> names = new ArrayList<>();
        private final List<EventType> eventTypes;

        NameHistory(String userId) {
            this(userId, List.of());
        }

        NameHistory(String userId, List<EventType> eventTypes) {
            super(AggregateRef.of(IamAggregates.USER, userId, null));
            this.eventTypes = eventTypes;
        }

        @Override
        protected List<EventType> eventTypes() {
            return eventTypes;
        }

        @Override
        protected void reduce(Event event) {
            if (event.type() == UserEvents.USERNAME_CHANGED) {
                names.add(event.payload(UserEvents.UsernameChanged.class).userName());
            }
        }
    }
}
